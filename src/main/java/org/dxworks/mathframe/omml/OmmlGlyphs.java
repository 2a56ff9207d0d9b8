package org.dxworks.mathframe.omml;

import java.util.Set;

/**
 * Glyph sets that decide which OMML construct a stacked MathML node becomes.
 */
public final class OmmlGlyphs {

    /** Operators rendered as {@code m:nary} when they carry limits. */
    public static final Set<String> LARGE_OPERATORS = Set.of(
            "∫", "∬", "∭", "∮", "∑", "∏", "∐",
            "⋃", "⋂", "⋁", "⋀", "⨁", "⨂", "⨀", "⨄");

    /** Over-marks rendered as {@code m:acc} rather than an upper limit. */
    public static final Set<String> ACCENTS = Set.of(
            "^", "~", "¯", "˙", "¨", "˘", "ˇ", "ˆ", "˜", "´", "`",
            // combining forms
            "\u0302", "\u0303", "\u0304", "\u0307", "\u0308", "\u030C",
            "\u0301", "\u0300", "\u20D7");

    private OmmlGlyphs() {
        // utility class
    }

    public static boolean isLargeOperator(String text) {
        return LARGE_OPERATORS.contains(text);
    }

    public static boolean isAccent(String text) {
        return ACCENTS.contains(text);
    }
}
