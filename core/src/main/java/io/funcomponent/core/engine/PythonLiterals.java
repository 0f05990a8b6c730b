package io.funcomponent.core.engine;

/**
 * Renders Java strings as Python literals the way Python's {@code repr()} does, so that generated
 * code and shell fragments match what a Python toolchain would emit.
 */
public final class PythonLiterals {

    private PythonLiterals() {
        // utility class
    }

    /**
     * Returns the Python {@code repr()} of a string: single-quoted unless the text contains a
     * single quote and no double quote.
     *
     * @param text the string, null renders as {@code None}
     * @return a Python string literal
     */
    public static String repr(String text) {
        if (text == null) {
            return "None";
        }
        char quote = text.indexOf('\'') >= 0 && text.indexOf('"') < 0 ? '"' : '\'';
        StringBuilder sb = new StringBuilder(text.length() + 2);
        sb.append(quote);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c == quote) {
                        sb.append('\\').append(c);
                    } else if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append(quote).toString();
    }

    /**
     * Returns a Python bytes literal for ASCII text such as base64, e.g. {@code b'AAEC'}.
     *
     * @param ascii printable ASCII text without quotes or backslashes
     * @return a Python bytes literal
     */
    public static String bytes(String ascii) {
        return "b'" + ascii + "'";
    }

    /** Returns the Python boolean literal. */
    public static String bool(boolean value) {
        return value ? "True" : "False";
    }
}
