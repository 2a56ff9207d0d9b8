package org.dxworks.mathframe.omml;

import com.ctc.wstx.stax.WstxInputFactory;
import org.dxworks.mathframe.convert.ConvertException;
import org.dxworks.mathframe.model.Fraction;
import org.dxworks.mathframe.model.Identifier;
import org.dxworks.mathframe.model.NumberLiteral;
import org.dxworks.mathframe.model.Operator;
import org.dxworks.mathframe.model.Row;
import org.dxworks.mathframe.model.SquareRoot;
import org.dxworks.mathframe.model.Under;
import org.junit.jupiter.api.Test;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class XmlPrettyPrinterTest {

    @Test
    void blankInputGivesEmptyString() throws ConvertException {
        assertEquals("", XmlPrettyPrinter.prettyPrint(""));
        assertEquals("", XmlPrettyPrinter.prettyPrint(null));
    }

    @Test
    void indentsTwoSpacesPerLevel() throws ConvertException {
        assertEquals("<a>\n  <b>x</b>\n  <c/>\n</a>", XmlPrettyPrinter.prettyPrint("<a><b>x</b><c/></a>"));
    }

    @Test
    void emptyPairStaysOnOneLine() throws ConvertException {
        assertEquals("<a></a>", XmlPrettyPrinter.prettyPrint("<a></a>"));
    }

    @Test
    void textIsTrimmedAndKeptInline() throws ConvertException {
        assertEquals("<a>x</a>", XmlPrettyPrinter.prettyPrint("<a>  x  </a>"));
    }

    @Test
    void attributesKeepTheirOrder() throws ConvertException {
        assertEquals("<a z=\"1\" y=\"2\"/>", XmlPrettyPrinter.prettyPrint("<a z=\"1\" y=\"2\"/>"));
    }

    @Test
    void commentsArePreserved() throws ConvertException {
        assertEquals("<a>\n  <!-- c -->\n  <b/>\n</a>", XmlPrettyPrinter.prettyPrint("<a><!-- c --><b/></a>"));
    }

    @Test
    void declarationIsPreserved() throws ConvertException {
        String pretty = XmlPrettyPrinter.prettyPrint("<?xml version=\"1.0\" encoding=\"UTF-8\"?><a/>");
        assertTrue(pretty.startsWith("<?xml"), pretty);
        assertTrue(pretty.endsWith("\n<a/>"), pretty);
    }

    @Test
    void prettyPrintingIsIdempotent() throws ConvertException {
        String omml = OmmlSerializer.serialize(List.of(new Row(List.of(
                new Fraction(new Identifier("a"), new SquareRoot(List.of(new NumberLiteral("2")))),
                new Under(new Operator("∑"), new Identifier("i"))))));
        String once = XmlPrettyPrinter.prettyPrint(omml);
        assertEquals(once, XmlPrettyPrinter.prettyPrint(once));
    }

    @Test
    void elementsAttributesAndTextArePreserved() throws Exception {
        String omml = OmmlSerializer.serialize(List.of(
                new Fraction(new Identifier("a"), new Identifier("b")),
                new Under(new Operator("∑"), new Row(List.of(new Identifier("i"), new Operator("=")))),
                new SquareRoot(List.of(new NumberLiteral("2")))));

        assertEquals(tokens(omml), tokens(XmlPrettyPrinter.prettyPrint(omml)));
    }

    @Test
    void malformedXmlIsStructuralError() {
        ConvertException e = assertThrows(ConvertException.class, () -> XmlPrettyPrinter.prettyPrint("<a><b></a>"));
        assertEquals(ConvertException.Kind.STRUCTURAL, e.getKind());
    }

    /** Element names, attribute counts and trimmed non-empty text, in document order. */
    public static List<String> tokens(String xml) throws XMLStreamException {
        WstxInputFactory factory = new WstxInputFactory();
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, false);
        XMLStreamReader reader = factory.createXMLStreamReader(new StringReader(xml));
        List<String> tokens = new ArrayList<>();
        while (reader.hasNext()) {
            int event = reader.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                tokens.add("<" + reader.getLocalName() + " " + reader.getAttributeCount());
            } else if (event == XMLStreamConstants.CHARACTERS && !reader.getText().trim().isEmpty()) {
                tokens.add(reader.getText().trim());
            }
        }
        reader.close();
        return tokens;
    }
}
