package nl.bytesoflife.takeoff.material.parser;

import java.util.List;

public sealed interface SNode permits SNode.SAtom, SNode.SList {

    /** Line (1-based) where the node starts. */
    int line();

    record SAtom(String value, int line) implements SNode {
        @Override
        public String toString() {
            return value;
        }
    }

    record SList(List<SNode> children, int line) implements SNode {

        /** Leading atom of the list, or "" when the list is empty or starts with a list. */
        public String tag() {
            if (!children.isEmpty() && children.get(0) instanceof SAtom atom) {
                return atom.value();
            }
            return "";
        }

        /** Atom value at {@code index}, or null when absent or not an atom. */
        public String atom(int index) {
            if (index < children.size() && children.get(index) instanceof SAtom atom) {
                return atom.value();
            }
            return null;
        }

        /** Nested lists from {@code fromIndex} onwards. */
        public List<SList> lists(int fromIndex) {
            return children.stream()
                    .skip(fromIndex)
                    .filter(SList.class::isInstance)
                    .map(SList.class::cast)
                    .toList();
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder("(");
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) sb.append(' ');
                sb.append(children.get(i));
            }
            sb.append(')');
            return sb.toString();
        }
    }
}
