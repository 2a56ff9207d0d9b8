package org.dxworks.mathframe.mathml;

/**
 * Merges {@code <msup><msub>B S</msub> P</msup>} into {@code <msubsup>B S P</msubsup>} on the MathML text.
 * <p>
 * Matching tags are located by counting nesting depth, so nested sub/superscripts inside
 * the base or the scripts are handled. Only an {@code msub} that is the first child of the
 * {@code msup} is merged; repeated until the text no longer changes.
 */
public final class SubSupFixer {

    private SubSupFixer() {
        // utility class
    }

    public static String fix(String mathml) {
        if (mathml == null || !mathml.contains("<msup") || !mathml.contains("<msub")) {
            return mathml;
        }
        String current = mathml;
        int from = 0;
        while (true) {
            int msupStart = findOpenTag(current, "msup", from);
            if (msupStart < 0) {
                return current;
            }
            String rewritten = rewriteAt(current, msupStart);
            if (rewritten == null) {
                from = msupStart + 1;
            } else {
                current = rewritten;
                from = 0;
            }
        }
    }

    /** Returns the text with the msup starting at {@code msupStart} merged, or null when it does not qualify. */
    private static String rewriteAt(String xml, int msupStart) {
        int msupContent = xml.indexOf('>', msupStart) + 1;
        if (msupContent <= 0 || xml.charAt(msupContent - 2) == '/') {
            return null;
        }
        int msubStart = skipWhitespace(xml, msupContent);
        if (!isOpenTagAt(xml, "msub", msubStart)) {
            return null;
        }
        int msubContent = xml.indexOf('>', msubStart) + 1;
        if (msubContent <= 0 || xml.charAt(msubContent - 2) == '/') {
            return null;
        }
        int msubClose = findClosingTag(xml, "msub", msubContent);
        int msupClose = findClosingTag(xml, "msup", msupContent);
        if (msubClose < 0 || msupClose < 0 || msubClose > msupClose) {
            return null;
        }
        String baseAndSub = xml.substring(msubContent, msubClose);
        String sup = xml.substring(msubClose + "</msub>".length(), msupClose);
        return xml.substring(0, msupStart)
                + "<msubsup>" + baseAndSub + sup + "</msubsup>"
                + xml.substring(msupClose + "</msup>".length());
    }

    /** Index of the {@code </name>} closing the element whose content starts at {@code from}; -1 if none. */
    static int findClosingTag(String xml, String name, int from) {
        int depth = 1;
        int i = from;
        while (i < xml.length()) {
            int lt = xml.indexOf('<', i);
            if (lt < 0) {
                return -1;
            }
            if (xml.startsWith("</" + name, lt) && isNameEnd(xml, lt + 2 + name.length())) {
                depth--;
                if (depth == 0) {
                    return lt;
                }
            } else if (isOpenTagAt(xml, name, lt)) {
                int gt = xml.indexOf('>', lt);
                if (gt < 0) {
                    return -1;
                }
                if (xml.charAt(gt - 1) != '/') {
                    depth++;
                }
            }
            i = lt + 1;
        }
        return -1;
    }

    private static int findOpenTag(String xml, String name, int from) {
        int i = xml.indexOf("<" + name, from);
        while (i >= 0) {
            if (isOpenTagAt(xml, name, i)) {
                return i;
            }
            i = xml.indexOf("<" + name, i + 1);
        }
        return -1;
    }

    private static boolean isOpenTagAt(String xml, String name, int idx) {
        return idx >= 0 && xml.startsWith("<" + name, idx) && isNameEnd(xml, idx + 1 + name.length());
    }

    private static boolean isNameEnd(String xml, int idx) {
        if (idx >= xml.length()) {
            return false;
        }
        char c = xml.charAt(idx);
        return c == '>' || c == '/' || Character.isWhitespace(c);
    }

    private static int skipWhitespace(String xml, int from) {
        int i = from;
        while (i < xml.length() && Character.isWhitespace(xml.charAt(i))) {
            i++;
        }
        return i;
    }
}
