package nl.bytesoflife.takeoff.material;

import nl.bytesoflife.takeoff.material.model.FormulaTable;
import nl.bytesoflife.takeoff.material.parser.FormulaTableParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Provides built-in formula tables bundled as classpath resources.
 */
public class BuiltinFormulaTables {

    private static final Logger log = LoggerFactory.getLogger(BuiltinFormulaTables.class);

    static final String LITERATURE_RESOURCE = "/formula-tables/literature.formulas";

    private static volatile FormulaTable cachedLiterature;

    private BuiltinFormulaTables() {
    }

    /**
     * Literature formulas and waste rates for common building categories.
     */
    public static FormulaTable literature() {
        if (cachedLiterature == null) {
            synchronized (BuiltinFormulaTables.class) {
                if (cachedLiterature == null) {
                    cachedLiterature = load(LITERATURE_RESOURCE);
                }
            }
        }
        return cachedLiterature;
    }

    static FormulaTable load(String resource) {
        try (InputStream is = BuiltinFormulaTables.class.getResourceAsStream(resource)) {
            if (is == null) throw new IllegalStateException("Resource not found: " + resource);
            FormulaTable table = new FormulaTableParser().parse(is);
            log.info("Loaded formula table {}: {} categories, {} entries",
                    resource, table.getCategories().size(), table.size());
            return table;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load formula table " + resource, e);
        }
    }
}
