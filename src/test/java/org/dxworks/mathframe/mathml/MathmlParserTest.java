package org.dxworks.mathframe.mathml;

import org.dxworks.mathframe.convert.ConvertException;
import org.dxworks.mathframe.model.Fenced;
import org.dxworks.mathframe.model.Fraction;
import org.dxworks.mathframe.model.Identifier;
import org.dxworks.mathframe.model.MathNode;
import org.dxworks.mathframe.model.NumberLiteral;
import org.dxworks.mathframe.model.Operator;
import org.dxworks.mathframe.model.RawText;
import org.dxworks.mathframe.model.Row;
import org.dxworks.mathframe.model.Space;
import org.dxworks.mathframe.model.SubSuperscript;
import org.dxworks.mathframe.model.Superscript;
import org.dxworks.mathframe.model.Table;
import org.dxworks.mathframe.model.TextRun;
import org.dxworks.mathframe.model.UnderOver;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MathmlParserTest {

    private static MathNode mi(String text) {
        return new Identifier(text);
    }

    private static MathNode mn(String text) {
        return new NumberLiteral(text);
    }

    @Test
    void blankInputGivesNoNodes() throws ConvertException {
        assertTrue(MathmlParser.parse("").isEmpty());
        assertTrue(MathmlParser.parse("   ").isEmpty());
        assertTrue(MathmlParser.parse(null).isEmpty());
    }

    @Test
    void mathRootBecomesRow() throws ConvertException {
        assertEquals(List.of(new Row(List.of(mi("x")))),
                MathmlParser.parse("<math xmlns=\"http://www.w3.org/1998/Math/MathML\"><mi>x</mi></math>"));
    }

    @Test
    void prefixedTagsAreRecognized() throws ConvertException {
        String mathml = "<m:math xmlns:m=\"http://www.w3.org/1998/Math/MathML\">"
                + "<m:mfrac><m:mn>1</m:mn><m:mn>2</m:mn></m:mfrac></m:math>";
        assertEquals(List.of(new Row(List.of(new Fraction(mn("1"), mn("2"))))), MathmlParser.parse(mathml));
    }

    @Test
    void missingChildrenArePaddedWithEmptyRows() throws ConvertException {
        assertEquals(List.of(new Fraction(mn("1"), Row.empty())), MathmlParser.parse("<mfrac><mn>1</mn></mfrac>"));
        assertEquals(List.of(new UnderOver(new Operator("∑"), Row.empty(), Row.empty())),
                MathmlParser.parse("<munderover><mo>∑</mo></munderover>"));
    }

    @Test
    void superscriptOfSubscriptBecomesSubSuperscript() throws ConvertException {
        assertEquals(List.of(new SubSuperscript(mi("X"), mi("a"), mi("b"))),
                MathmlParser.parse("<msup><msub><mi>X</mi><mi>a</mi></msub><mi>b</mi></msup>"));
        assertEquals(List.of(new Superscript(mi("x"), mn("2"))),
                MathmlParser.parse("<msup><mi>x</mi><mn>2</mn></msup>"));
    }

    @Test
    void fencedDefaultsToParentheses() throws ConvertException {
        assertEquals(List.of(new Fenced("(", ")", List.of(mi("a")))),
                MathmlParser.parse("<mfenced><mi>a</mi></mfenced>"));
        assertEquals(List.of(new Fenced("[", "]", List.of(mi("a")))),
                MathmlParser.parse("<mfenced open=\"[\" close=\"]\"><mi>a</mi></mfenced>"));
    }

    @Test
    void tableCellsUnwrapSingleChildren() throws ConvertException {
        String mathml = "<mtable><mtr><mtd><mi>a</mi></mtd><mtd><mi>b</mi><mo>+</mo></mtd></mtr></mtable>";
        Table expected = new Table(List.of(List.of(mi("a"), new Row(List.of(mi("b"), new Operator("+"))))));
        assertEquals(List.of(expected), MathmlParser.parse(mathml));
    }

    @Test
    void labeledRowDropsItsLabel() throws ConvertException {
        String mathml = "<mtable><mlabeledtr><mtd><mtext>(1)</mtext></mtd><mtd><mi>x</mi></mtd></mlabeledtr></mtable>";
        assertEquals(List.of(new Table(List.of(List.of(mi("x"))))), MathmlParser.parse(mathml));
    }

    @Test
    void spaceAndSiblingsAtTopLevel() throws ConvertException {
        assertEquals(List.of(mi("a"), new Space(), mi("b")),
                MathmlParser.parse("<mi>a</mi><mspace width=\"1em\"/><mi>b</mi>"));
    }

    @Test
    void selfClosingElementsOtherThanSpaceAreDropped() throws ConvertException {
        assertEquals(List.of(new Row(List.of(mi("x")))), MathmlParser.parse("<math><mrow/><mi>x</mi></math>"));
    }

    @Test
    void unknownElementsDegrade() throws ConvertException {
        assertEquals(List.of(mi("a")), MathmlParser.parse("<mfoo><mi>a</mi></mfoo>"));
        assertEquals(List.of(new Row(List.of(mi("a"), mi("b")))), MathmlParser.parse("<mfoo><mi>a</mi><mi>b</mi></mfoo>"));
        assertEquals(List.of(new RawText("")), MathmlParser.parse("<mfoo></mfoo>"));
    }

    @Test
    void textIsTrimmedAndNestedTextFlattened() throws ConvertException {
        assertEquals(List.of(mi("x")), MathmlParser.parse("<mi> x </mi>"));
        assertEquals(List.of(new TextRun("ab")), MathmlParser.parse("<mtext>a<mi>b</mi></mtext>"));
        assertEquals(List.of(new Row(List.of(new RawText("abc")))), MathmlParser.parse("<mrow> abc </mrow>"));
    }

    @Test
    void namedEntitiesAreResolved() throws ConvertException {
        assertEquals(List.of(new Operator("\u2212")), MathmlParser.parse("<mo>&minus;</mo>"));
        assertEquals(List.of(new Operator("\u2062")), MathmlParser.parse("<mo>&InvisibleTimes;</mo>"));
    }

    @Test
    void greekAndSetEntitiesAreResolved() throws ConvertException {
        assertEquals(List.of(new Identifier("\u03B1"), new Operator("\u2208"), new Identifier("\u03A9")),
                MathmlParser.parse("<mi>&alpha;</mi><mo>&isin;</mo><mi>&Omega;</mi>"));
        assertEquals(List.of(new Identifier("\u03C2"), new Identifier("\u03A3")),
                MathmlParser.parse("<mi>&sigmaf;</mi><mi>&Sigma;</mi>"));
    }

    @Test
    void truncatedInputIsTreatedAsComplete() throws ConvertException {
        List<MathNode> nodes = MathmlParser.parse("<math><mi>x</mi><mfrac><mn>1</mn>");
        assertEquals(List.of(new Row(List.of(mi("x"), new Fraction(mn("1"), Row.empty())))), nodes);
    }

    @Test
    void mismatchedTagsAreStructuralErrors() {
        ConvertException e = assertThrows(ConvertException.class,
                () -> MathmlParser.parse("<math><mi>x</mo></math>"));
        assertEquals(ConvertException.Kind.STRUCTURAL, e.getKind());
        assertTrue(e.getMessage().startsWith("Malformed MathML"), e.getMessage());
    }
}
