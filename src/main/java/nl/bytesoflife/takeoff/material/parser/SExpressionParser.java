package nl.bytesoflife.takeoff.material.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads the parenthesized formula table syntax into {@link SNode} trees.
 * Supports quoted strings with backslash escapes and {@code #} or {@code ;} line comments.
 */
public class SExpressionParser {

    private String input;
    private int pos;
    private int line;

    public List<SNode> parse(String text) {
        this.input = text == null ? "" : text;
        this.pos = 0;
        this.line = 1;

        List<SNode> nodes = new ArrayList<>();
        skipBlanks();
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c != '(') {
                throw new ParseException("Expected '(' at top level but found '" + c + "'", pos, line);
            }
            nodes.add(readList());
            skipBlanks();
        }
        return nodes;
    }

    private SNode.SList readList() {
        int startLine = line;
        int startPos = pos;
        pos++; // '('
        List<SNode> children = new ArrayList<>();
        while (true) {
            skipBlanks();
            if (pos >= input.length()) {
                throw new ParseException("List opened on line " + startLine + " is never closed", startPos, startLine);
            }
            char c = input.charAt(pos);
            switch (c) {
                case ')' -> {
                    pos++;
                    return new SNode.SList(List.copyOf(children), startLine);
                }
                case '(' -> children.add(readList());
                case '"' -> children.add(readQuoted());
                default -> children.add(readBareAtom());
            }
        }
    }

    private SNode.SAtom readQuoted() {
        int startLine = line;
        int startPos = pos;
        pos++; // opening quote
        StringBuilder sb = new StringBuilder();
        while (pos < input.length()) {
            char c = input.charAt(pos++);
            if (c == '"') {
                return new SNode.SAtom(sb.toString(), startLine);
            }
            if (c == '\\' && pos < input.length()) {
                c = input.charAt(pos++);
            }
            if (c == '\n') line++;
            sb.append(c);
        }
        throw new ParseException("Unterminated string", startPos, startLine);
    }

    private SNode.SAtom readBareAtom() {
        int start = pos;
        while (pos < input.length() && !isDelimiter(input.charAt(pos))) {
            pos++;
        }
        return new SNode.SAtom(input.substring(start, pos), line);
    }

    private static boolean isDelimiter(char c) {
        return c == '(' || c == ')' || c == '"' || c == '#' || c == ';' || Character.isWhitespace(c);
    }

    private void skipBlanks() {
        while (pos < input.length()) {
            char c = input.charAt(pos);
            if (c == '#' || c == ';') {
                while (pos < input.length() && input.charAt(pos) != '\n') pos++;
            } else if (Character.isWhitespace(c)) {
                if (c == '\n') line++;
                pos++;
            } else {
                return;
            }
        }
    }

    public static class ParseException extends RuntimeException {
        private final int position;
        private final int line;

        public ParseException(String message, int position, int line) {
            super(message + " (line " + line + ")");
            this.position = position;
            this.line = line;
        }

        public int getPosition() {
            return position;
        }

        public int getLine() {
            return line;
        }
    }
}
