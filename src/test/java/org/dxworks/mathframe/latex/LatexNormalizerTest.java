package org.dxworks.mathframe.latex;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LatexNormalizerTest {

    @Test
    void normalize_nullIsEmpty() {
        assertEquals("", LatexNormalizer.normalize(null));
    }

    @Test
    void normalize_plainFormulaIsUntouched() {
        assertEquals("\\frac{a}{b}", LatexNormalizer.normalize("\\frac{a}{b}"));
    }

    @Test
    void stripMathDelimiters_removesDollarsAndBrackets() {
        assertEquals("x+1", LatexNormalizer.stripMathDelimiters("$x+1$"));
        assertEquals("x", LatexNormalizer.stripMathDelimiters("  $$x$$ "));
        assertEquals("a", LatexNormalizer.stripMathDelimiters("\\(a\\)"));
        assertEquals("a", LatexNormalizer.stripMathDelimiters("\\[a\\]"));
    }

    @Test
    void stripMathDelimiters_keepsEscapedDollar() {
        assertEquals("x\\$", LatexNormalizer.stripMathDelimiters("x\\$"));
    }

    @Test
    void healBraces_bracesBareStyleArgument() {
        assertEquals("\\mathbf{x}+1", LatexNormalizer.healBraces("\\mathbf x+1"));
        assertEquals("{x}", LatexNormalizer.healBraces("{{x}}"));
    }

    @Test
    void healSpacedWords_joinsKnownWords() {
        assertEquals("sin x", LatexNormalizer.healSpacedWords("s i n x"));
        assertEquals("log (x)", LatexNormalizer.healSpacedWords("l o g (x)"));
        assertEquals("Enc(k)", LatexNormalizer.healSpacedWords("E n c(k)"));
    }

    @Test
    void healSpacedWords_ignoresLettersInsideWords() {
        assertEquals("as i n", LatexNormalizer.healSpacedWords("as i n"));
    }

    @Test
    void collapseSpacing_shortensRunsAndDropsTrailingSpacing() {
        assertEquals("a\\quad b", LatexNormalizer.collapseSpacing("a\\quad\\quad\\quad b"));
        assertEquals("a\\; b", LatexNormalizer.collapseSpacing("a\\;\\;\\;\\; b"));
        assertEquals("x+1", LatexNormalizer.collapseSpacing("x+1\\;\\,"));
        assertEquals("x_1", LatexNormalizer.collapseSpacing("x\\_1"));
    }

    @Test
    void replaceLegacyFonts_mapsGroupSwitches() {
        assertEquals("\\mathbf{x}", LatexNormalizer.replaceLegacyFonts("{\\bf x}"));
        assertEquals("\\mathrm{d}", LatexNormalizer.replaceLegacyFonts("{\\rm d}"));
        assertEquals("\\mathtt{f} + \\mathtt x", LatexNormalizer.replaceLegacyFonts("\\tt{f} + \\tt x"));
    }

    @Test
    void replaceOperatorName_becomesUprightText() {
        assertEquals("\\mathrm{rank}(A)", LatexNormalizer.replaceOperatorName("\\operatorname{rank}(A)"));
        assertEquals("\\mathrm{arg\\,max}", LatexNormalizer.replaceOperatorName("\\operatorname*{arg\\,max}"));
    }

    @Test
    void replaceCalligraphic_mapsToScriptLetters() {
        assertEquals("ℒ", LatexNormalizer.replaceCalligraphic("\\mathcal{L}"));
        String scriptA = new String(Character.toChars(0x1D49C));
        assertEquals("{" + scriptA + "ℬ}", LatexNormalizer.replaceCalligraphic("\\mathcal{AB}"));
    }

    @Test
    void removeSizingAndBreaks_dropsSizingCommands() {
        assertEquals("( x )", LatexNormalizer.removeSizingAndBreaks("\\left( x \\right)"));
        assertEquals("x", LatexNormalizer.removeSizingAndBreaks("\\displaystyle x"));
        assertEquals("x", LatexNormalizer.removeSizingAndBreaks("\\rlap{x}"));
    }

    @Test
    void normalize_dropsNullDelimiters() {
        assertEquals("x |", LatexNormalizer.normalize("\\left. x \\right|"));
    }

    @Test
    void normalize_rowSeparatorOutsideEnvironmentBecomesSpace() {
        assertEquals("a b", LatexNormalizer.normalize("a \\\\ b"));
    }

    @Test
    void normalize_rowSeparatorInsideEnvironmentIsKept() {
        String matrix = "\\begin{matrix} a \\\\ b \\end{matrix}";
        assertEquals(matrix, LatexNormalizer.normalize(matrix));
    }

    @Test
    void convertTablesToMatrix_dropsColumnSpec() {
        assertEquals("\\begin{matrix} a & b \\end{matrix}",
                LatexNormalizer.convertTablesToMatrix("\\begin{array}{cc} a & b \\end{array}"));
        assertEquals("\\begin{matrix}x\\end{matrix}",
                LatexNormalizer.convertTablesToMatrix("\\begin{tabular}[t]{ll}x\\end{tabular}"));
    }

    @Test
    void rebracketSubSup_groupsBaseWithSubscript() {
        assertEquals("{X_{a}}^{b}", LatexNormalizer.rebracketSubSup("X_{a}^{b}"));
        assertEquals("{x_1}^{2}", LatexNormalizer.rebracketSubSup("x_1^{2}"));
        assertEquals("{\\hat{x}_{i}}^{2}", LatexNormalizer.rebracketSubSup("\\hat{x}_{i}^{2}"));
    }

    @Test
    void rebracketSubSup_leavesOtherOrdersAlone() {
        assertEquals("x^{2}_{i}", LatexNormalizer.rebracketSubSup("x^{2}_{i}"));
        assertEquals("\\alpha_{i}^{2}", LatexNormalizer.rebracketSubSup("\\alpha_{i}^{2}"));
    }

    @Test
    void cleanup_removesEmptyGroupsAndExtraSpaces() {
        assertEquals("x+y", LatexNormalizer.cleanup("x{}+{{}}y"));
        assertEquals("a b", LatexNormalizer.cleanup(" a   b "));
    }

    @Test
    void cleanup_keepsEscapedOpeningBrace() {
        assertEquals("\\{}", LatexNormalizer.cleanup("\\{}"));
        assertEquals("\\{x\\}", LatexNormalizer.cleanup("\\{{}x\\}"));
    }

    @Test
    void normalize_isIdempotentOnItsOutput() {
        String once = LatexNormalizer.normalize("$X_{a}^{b} + {\\bf v}\\;\\;\\;\\;$");
        assertEquals(once, LatexNormalizer.normalize(once));
    }
}
