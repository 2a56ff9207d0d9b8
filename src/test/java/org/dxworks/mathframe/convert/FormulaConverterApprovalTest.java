package org.dxworks.mathframe.convert;

import org.approvaltests.Approvals;
import org.junit.jupiter.api.Test;

public class FormulaConverterApprovalTest {

    private final FormulaConverter converter = new FormulaConverter();

    @Test
    void convert_Fraction() throws ConvertException {
        verify("\\frac{a}{b}");
    }

    @Test
    void convert_SquareRoot() throws ConvertException {
        verify("\\sqrt{x}");
    }

    @Test
    void convert_SumWithLimits() throws ConvertException {
        verify("\\sum_{i=1}^{n} i");
    }

    @Test
    void convert_SubSuperscript() throws ConvertException {
        verify("X_{a}^{b}");
    }

    @Test
    void convert_Matrix() throws ConvertException {
        verify("\\begin{pmatrix} a & b \\\\ c & d \\end{pmatrix}");
    }

    private void verify(String latex) throws ConvertException {
        String omml = converter.prettyPrintOmml(converter.latexToOmml(latex));
        Approvals.verify(omml + "\n");
    }
}
