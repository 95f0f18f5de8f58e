package org.rbtyper.core.errors;

/**
 * Utility class for rendering diagnostics as plain text.
 */
public class ErrorMessageUtil {

    /**
     * Replaces each {@code {}} in {@code format} with the next argument.
     * Doubled braces produce literal braces.
     *
     * @param format the message template
     * @param args   the values to substitute
     * @return the formatted message
     */
    public static String substitute(String format, Object... args) {
        StringBuilder sb = new StringBuilder();
        int argIndex = 0;
        int i = 0;
        while (i < format.length()) {
            char c = format.charAt(i);
            if (c == '{' && i + 1 < format.length() && format.charAt(i + 1) == '{') {
                sb.append('{');
                i += 2;
            } else if (c == '}' && i + 1 < format.length() && format.charAt(i + 1) == '}') {
                sb.append('}');
                i += 2;
            } else if (c == '{' && i + 1 < format.length() && format.charAt(i + 1) == '}') {
                sb.append(argIndex < args.length ? args[argIndex] : "{}");
                argIndex++;
                i += 2;
            } else {
                sb.append(c);
                i++;
            }
        }
        return sb.toString();
    }

    /**
     * Formats a diagnostic as {@code path:line: header [code]}, followed by
     * one indented line per suggested replacement.
     */
    public static String format(Diagnostic diagnostic) {
        StringBuilder sb = new StringBuilder();
        sb.append(diagnostic.loc).append(": ").append(diagnostic.header)
                .append(" [").append(diagnostic.errorClass.code).append("]");
        for (AutocorrectSuggestion suggestion : diagnostic.suggestions) {
            sb.append("\n    ").append(suggestion.title).append(": ")
                    .append(suggestion.replacement);
        }
        return sb.toString();
    }
}
