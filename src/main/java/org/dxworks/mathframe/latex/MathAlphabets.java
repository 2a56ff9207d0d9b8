package org.dxworks.mathframe.latex;

import java.util.Map;

/**
 * Mapping of ASCII letters onto the Unicode Mathematical Alphanumeric Symbols block.
 * <p>
 * Several letters were encoded in the Letterlike Symbols block before the math block existed;
 * those code points are holes in the math block and must be taken from the legacy table.
 */
public final class MathAlphabets {

    private static final Map<Character, Integer> SCRIPT_HOLES = Map.ofEntries(
            Map.entry('B', 0x212C), Map.entry('E', 0x2130), Map.entry('F', 0x2131),
            Map.entry('H', 0x210B), Map.entry('I', 0x2110), Map.entry('L', 0x2112),
            Map.entry('M', 0x2133), Map.entry('R', 0x211B),
            Map.entry('e', 0x212F), Map.entry('g', 0x210A), Map.entry('o', 0x2134));

    private static final Map<Character, Integer> DOUBLE_STRUCK_HOLES = Map.of(
            'C', 0x2102, 'H', 0x210D, 'N', 0x2115, 'P', 0x2119,
            'Q', 0x211A, 'R', 0x211D, 'Z', 0x2124);

    private static final Map<Character, Integer> FRAKTUR_HOLES = Map.of(
            'C', 0x212D, 'H', 0x210C, 'I', 0x2111, 'R', 0x211C, 'Z', 0x2128);

    private MathAlphabets() {
        // utility class
    }

    public static int script(int c) {
        return map(c, 0x1D49C, 0x1D4B6, -1, SCRIPT_HOLES);
    }

    public static int doubleStruck(int c) {
        return map(c, 0x1D538, 0x1D552, 0x1D7D8, DOUBLE_STRUCK_HOLES);
    }

    public static int fraktur(int c) {
        return map(c, 0x1D504, 0x1D51E, -1, FRAKTUR_HOLES);
    }

    /**
     * Rewrites every ASCII letter of {@code text} into the script alphabet. Command names
     * (a backslash followed by letters) are copied unchanged.
     */
    public static String toScript(String text) {
        StringBuilder sb = new StringBuilder(text.length() * 2);
        int i = 0;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                int end = i + 1;
                while (end < text.length() && Character.isLetter(text.charAt(end))) {
                    end++;
                }
                if (end == i + 1 && end < text.length()) {
                    end++;
                }
                sb.append(text, i, end);
                i = end;
            } else {
                sb.appendCodePoint(script(c));
                i++;
            }
        }
        return sb.toString();
    }

    private static int map(int c, int capitalBase, int smallBase, int digitBase, Map<Character, Integer> holes) {
        if (c > 0xFFFF) {
            return c;
        }
        Integer hole = holes.get((char) c);
        if (hole != null) {
            return hole;
        }
        if (c >= 'A' && c <= 'Z') {
            return capitalBase + (c - 'A');
        }
        if (c >= 'a' && c <= 'z') {
            return smallBase + (c - 'a');
        }
        if (digitBase > 0 && c >= '0' && c <= '9') {
            return digitBase + (c - '0');
        }
        return c;
    }
}
