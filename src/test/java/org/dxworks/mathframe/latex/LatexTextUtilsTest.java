package org.dxworks.mathframe.latex;

import org.junit.jupiter.api.Test;

import java.util.function.UnaryOperator;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LatexTextUtilsTest {

    @Test
    void findMatchingBrace_countsNestedGroups() {
        assertEquals(6, LatexTextUtils.findMatchingBrace("{a{b}c}", 0));
        assertEquals(4, LatexTextUtils.findMatchingBrace("{a{b}c}", 2));
    }

    @Test
    void findMatchingBrace_skipsEscapedBraces() {
        assertEquals(5, LatexTextUtils.findMatchingBrace("{a\\}b}", 0));
    }

    @Test
    void findMatchingBrace_returnsMinusOneWhenUnclosedOrNotABrace() {
        assertEquals(-1, LatexTextUtils.findMatchingBrace("{abc", 0));
        assertEquals(-1, LatexTextUtils.findMatchingBrace("abc", 0));
        assertEquals(-1, LatexTextUtils.findMatchingBrace("abc", 10));
    }

    @Test
    void isEscaped_looksAtOddBackslashRuns() {
        assertTrue(LatexTextUtils.isEscaped("a\\$", 2));
        assertFalse(LatexTextUtils.isEscaped("a\\\\$", 3));
        assertFalse(LatexTextUtils.isEscaped("$", 0));
    }

    @Test
    void isCommandAt_rejectsLongerCommandNames() {
        assertTrue(LatexTextUtils.isCommandAt("\\left(", 0, "\\left"));
        assertTrue(LatexTextUtils.isCommandAt("x\\left", 1, "\\left"));
        assertFalse(LatexTextUtils.isCommandAt("\\leftarrow", 0, "\\left"));
    }

    @Test
    void replaceCommandGroup_rewritesEveryOccurrence() {
        String result = LatexTextUtils.replaceCommandGroup("\\rlap{x} + \\rlap{y}", "\\rlap",
                UnaryOperator.identity(), null);
        assertEquals("x + y", result);
    }

    @Test
    void replaceCommandGroup_unclosedGroupRunsToEnd() {
        String result = LatexTextUtils.replaceCommandGroup("\\rlap{x + y", "\\rlap",
                content -> "[" + content + "]", null);
        assertEquals("[x + y]", result);
    }

    @Test
    void replaceCommandGroup_withoutGroupUsesFallback() {
        assertEquals("\\mathrm x", LatexTextUtils.replaceCommandGroup("\\operatorname x", "\\operatorname",
                content -> "[" + content + "]", "\\mathrm"));
        assertEquals("\\rlap x", LatexTextUtils.replaceCommandGroup("\\rlap x", "\\rlap",
                content -> "[" + content + "]", null));
    }

    @Test
    void collapseRedundantBraces_removesDoubledPairs() {
        assertEquals("{x}", LatexTextUtils.collapseRedundantBraces("{{x}}"));
        assertEquals("{x}", LatexTextUtils.collapseRedundantBraces("{{{x}}}"));
        assertEquals("\\frac{a}{b}", LatexTextUtils.collapseRedundantBraces("\\frac{{a}}{b}"));
    }

    @Test
    void collapseRedundantBraces_keepsSiblingGroups() {
        assertEquals("{{a}{b}}", LatexTextUtils.collapseRedundantBraces("{{a}{b}}"));
    }
}
