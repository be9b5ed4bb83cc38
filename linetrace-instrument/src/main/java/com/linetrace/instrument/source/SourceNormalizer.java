package com.linetrace.instrument.source;

/**
 * Removes the indentation a method carries inside its class so the text parses on its own.
 */
public final class SourceNormalizer {

    private SourceNormalizer() {}

    /**
     * Column of the first non-whitespace character of the first line.
     * A first line made only of whitespace yields its length; empty text yields 0.
     */
    public static int findIndentLevel(String text) {
        int eol = text.indexOf('\n');
        String firstLine = eol < 0 ? text : text.substring(0, eol);
        for (int i = 0; i < firstLine.length(); i++) {
            if (!Character.isWhitespace(firstLine.charAt(i))) {
                return i;
            }
        }
        return firstLine.length();
    }

    /**
     * Drops {@link #findIndentLevel(String)} leading columns from every line.
     *
     * Only whitespace is ever removed. A blank line shorter than the indent becomes empty, but a
     * non-blank line indented less than the first one keeps its text and loses just its leading
     * whitespace; a plain column cut would truncate it to nothing and change the method.
     */
    public static String stripIndent(String text) {
        int indent = findIndentLevel(text);
        if (indent == 0) {
            return text;
        }
        String[] lines = text.split("\n", -1);
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) out.append('\n');
            out.append(strip(lines[i], indent));
        }
        return out.toString();
    }

    private static String strip(String line, int indent) {
        if (line.length() <= indent) {
            return line.isBlank() ? "" : line.stripLeading();
        }
        int cut = 0;
        while (cut < indent && Character.isWhitespace(line.charAt(cut))) {
            cut++;
        }
        return line.substring(cut);
    }
}
