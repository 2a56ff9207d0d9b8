package org.dxworks.mathframe.latex;

import java.util.function.UnaryOperator;

/**
 * Brace-aware scanning helpers for LaTeX source.
 * <p>
 * All scans count brace depth explicitly; escaped braces ({@code \{}, {@code \}}) are never counted.
 */
public final class LatexTextUtils {

    private LatexTextUtils() {
        // utility class
    }

    /**
     * Returns the index of the brace closing the group opened at {@code openIdx}, or -1 when
     * {@code openIdx} is not an opening brace or the group never closes.
     */
    public static int findMatchingBrace(String text, int openIdx) {
        if (text == null || openIdx < 0 || openIdx >= text.length() || text.charAt(openIdx) != '{') {
            return -1;
        }
        int depth = 0;
        for (int i = openIdx; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\') {
                i++;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    /** True when the character at {@code idx} is preceded by an odd number of backslashes. */
    public static boolean isEscaped(String text, int idx) {
        int backslashes = 0;
        for (int i = idx - 1; i >= 0 && text.charAt(i) == '\\'; i--) {
            backslashes++;
        }
        return backslashes % 2 == 1;
    }

    public static int skipSpaces(String text, int from) {
        int i = from;
        while (i < text.length() && Character.isWhitespace(text.charAt(i))) {
            i++;
        }
        return i;
    }

    /**
     * True when {@code command} (including its backslash) starts at {@code idx} and is not
     * merely the prefix of a longer command name.
     */
    public static boolean isCommandAt(String text, int idx, String command) {
        if (!text.startsWith(command, idx) || isEscaped(text, idx)) {
            return false;
        }
        int end = idx + command.length();
        return end >= text.length() || !Character.isLetter(text.charAt(end));
    }

    /**
     * Rewrites every {@code command{content}} occurrence with {@code replacement.apply(content)}.
     * A group that never closes extends to the end of the text. When the command is not followed
     * by a brace group it is replaced with {@code noGroupReplacement}, or kept as-is when that is null.
     */
    public static String replaceCommandGroup(String text, String command,
                                             UnaryOperator<String> replacement,
                                             String noGroupReplacement) {
        if (text == null || !text.contains(command)) {
            return text;
        }
        StringBuilder sb = new StringBuilder(text.length());
        int i = 0;
        while (i < text.length()) {
            if (isCommandAt(text, i, command)) {
                int afterCommand = i + command.length();
                int open = skipSpaces(text, afterCommand);
                if (open < text.length() && text.charAt(open) == '{') {
                    int close = findMatchingBrace(text, open);
                    int contentEnd = close < 0 ? text.length() : close;
                    sb.append(replacement.apply(text.substring(open + 1, contentEnd)));
                    i = close < 0 ? text.length() : close + 1;
                } else {
                    sb.append(noGroupReplacement != null ? noGroupReplacement : command);
                    i = afterCommand;
                }
            } else {
                sb.append(text.charAt(i));
                i++;
            }
        }
        return sb.toString();
    }

    /**
     * Removes brace pairs whose only content is another brace group, so {@code {{x}}} and
     * {@code {{{x}}}} both become {@code {x}}. Repeats until nothing changes.
     */
    public static String collapseRedundantBraces(String text) {
        String current = text;
        while (true) {
            boolean[] drop = new boolean[current.length()];
            boolean changed = false;
            for (int i = 0; i + 1 < current.length(); i++) {
                if (current.charAt(i) != '{' || current.charAt(i + 1) != '{' || isEscaped(current, i)) {
                    continue;
                }
                int outerClose = findMatchingBrace(current, i);
                int innerClose = findMatchingBrace(current, i + 1);
                if (outerClose > 0 && innerClose == outerClose - 1) {
                    drop[i] = true;
                    drop[outerClose] = true;
                    changed = true;
                }
            }
            if (!changed) {
                return current;
            }
            StringBuilder sb = new StringBuilder(current.length());
            for (int i = 0; i < current.length(); i++) {
                if (!drop[i]) {
                    sb.append(current.charAt(i));
                }
            }
            current = sb.toString();
        }
    }
}
