package org.dxworks.mathframe.omml;

import com.ctc.wstx.stax.WstxOutputFactory;
import org.codehaus.stax2.XMLOutputFactory2;
import org.codehaus.stax2.XMLStreamWriter2;
import org.dxworks.mathframe.convert.ConvertException;
import org.dxworks.mathframe.model.Fenced;
import org.dxworks.mathframe.model.Fraction;
import org.dxworks.mathframe.model.LeafNode;
import org.dxworks.mathframe.model.MathNode;
import org.dxworks.mathframe.model.Over;
import org.dxworks.mathframe.model.Root;
import org.dxworks.mathframe.model.Row;
import org.dxworks.mathframe.model.Space;
import org.dxworks.mathframe.model.SquareRoot;
import org.dxworks.mathframe.model.SubSuperscript;
import org.dxworks.mathframe.model.Subscript;
import org.dxworks.mathframe.model.Superscript;
import org.dxworks.mathframe.model.Table;
import org.dxworks.mathframe.model.Under;
import org.dxworks.mathframe.model.UnderOver;

import javax.xml.stream.XMLStreamException;
import java.io.StringWriter;
import java.util.List;

/**
 * Writes a {@link MathNode} forest as an OMML {@code m:oMathPara} document.
 * <p>
 * Stacked MathML constructs map onto different OMML constructs depending on their content:
 * an over-mark that is an accent glyph becomes {@code m:acc}, a large operator with limits
 * becomes {@code m:nary}, anything else becomes {@code m:limUpp}/{@code m:limLow}.
 */
public final class OmmlSerializer {

    public static final String OMML_NAMESPACE = "http://schemas.openxmlformats.org/officeDocument/2006/math";
    private static final String PREFIX = "m";
    private static final String THIN_SPACE = "\u2009";

    private static final WstxOutputFactory OUTPUT_FACTORY = createOutputFactory();

    private final XMLStreamWriter2 writer;

    private OmmlSerializer(XMLStreamWriter2 writer) {
        this.writer = writer;
    }

    private static WstxOutputFactory createOutputFactory() {
        WstxOutputFactory factory = new WstxOutputFactory();
        // empty blocks such as <m:deg></m:deg> must keep their end tag
        factory.setProperty(XMLOutputFactory2.P_AUTOMATIC_EMPTY_ELEMENTS, false);
        return factory;
    }

    public static String serialize(List<MathNode> nodes) throws ConvertException {
        StringWriter out = new StringWriter();
        try {
            XMLStreamWriter2 writer = (XMLStreamWriter2) OUTPUT_FACTORY.createXMLStreamWriter(out);
            OmmlSerializer serializer = new OmmlSerializer(writer);

            writer.writeStartElement(PREFIX, "oMathPara", OMML_NAMESPACE);
            writer.writeNamespace(PREFIX, OMML_NAMESPACE);
            serializer.start("oMath");
            for (MathNode node : nodes) {
                serializer.node(node);
            }
            serializer.end();
            writer.writeEndElement();

            writer.flush();
            writer.close();
        } catch (XMLStreamException e) {
            throw ConvertException.structural("Failed to write OMML: " + e.getMessage(), e);
        }
        return out.toString();
    }

    private void node(MathNode node) throws XMLStreamException {
        if (node instanceof LeafNode leaf) {
            run(leaf.text);
        } else if (node instanceof Row row) {
            for (MathNode child : row.children) {
                node(child);
            }
        } else if (node instanceof Fraction fraction) {
            fraction(fraction);
        } else if (node instanceof SquareRoot sqrt) {
            start("rad");
            start("radPr");
            valProperty("degHide", "1");
            end();
            emptyBlock("deg");
            block("e", sqrt.children);
            end();
        } else if (node instanceof Root root) {
            start("rad");
            emptyBlock("radPr");
            block("deg", root.index);
            block("e", root.base);
            end();
        } else if (node instanceof Superscript sup) {
            script("sSup", sup.base, null, sup.sup);
        } else if (node instanceof Subscript sub) {
            script("sSub", sub.base, sub.sub, null);
        } else if (node instanceof SubSuperscript subSup) {
            script("sSubSup", subSup.base, subSup.sub, subSup.sup);
        } else if (node instanceof Over over) {
            over(over);
        } else if (node instanceof Under under) {
            under(under);
        } else if (node instanceof UnderOver underOver) {
            underOver(underOver);
        } else if (node instanceof Table table) {
            table(table);
        } else if (node instanceof Fenced fenced) {
            start("d");
            start("dPr");
            valProperty("begChr", fenced.openDelim);
            valProperty("endChr", fenced.closeDelim);
            end();
            block("e", fenced.children);
            end();
        } else if (node instanceof Space) {
            run(THIN_SPACE);
        } else {
            throw new IllegalArgumentException("Unsupported node type: " + node.getClass().getSimpleName());
        }
    }

    private void fraction(Fraction fraction) throws XMLStreamException {
        start("f");
        start("fPr");
        valProperty("type", "bar");
        end();
        block("num", fraction.numerator);
        block("den", fraction.denominator);
        end();
    }

    private void script(String tag, MathNode base, MathNode sub, MathNode sup) throws XMLStreamException {
        start(tag);
        emptyBlock(tag + "Pr");
        block("e", base);
        if (sub != null) {
            block("sub", sub);
        }
        if (sup != null) {
            block("sup", sup);
        }
        end();
    }

    private void over(Over over) throws XMLStreamException {
        String mark = over.overMark.flatText();
        if (OmmlGlyphs.isAccent(mark)) {
            start("acc");
            start("accPr");
            valProperty("chr", mark);
            end();
            block("e", over.base);
            end();
        } else {
            limit("limUpp", over.base, over.overMark);
        }
    }

    private void under(Under under) throws XMLStreamException {
        String operator = under.base.flatText();
        if (OmmlGlyphs.isLargeOperator(operator)) {
            start("nary");
            start("naryPr");
            valProperty("chr", operator);
            valProperty("limLoc", "undOvr");
            valProperty("supHide", "1");
            end();
            block("sub", under.underMark);
            emptyBlock("sup");
            emptyBlock("e");
            end();
        } else {
            limit("limLow", under.base, under.underMark);
        }
    }

    private void underOver(UnderOver underOver) throws XMLStreamException {
        String operator = underOver.base.flatText();
        if (OmmlGlyphs.isLargeOperator(operator)) {
            start("nary");
            start("naryPr");
            valProperty("chr", operator);
            valProperty("limLoc", "undOvr");
            end();
            block("sub", underOver.underMark);
            block("sup", underOver.overMark);
            // the operand follows as a sibling
            emptyBlock("e");
            end();
        } else {
            start("limLow");
            emptyBlock("limLowPr");
            start("e");
            limit("limUpp", underOver.base, underOver.overMark);
            end();
            block("lim", underOver.underMark);
            end();
        }
    }

    private void limit(String tag, MathNode base, MathNode mark) throws XMLStreamException {
        start(tag);
        emptyBlock(tag + "Pr");
        block("e", base);
        block("lim", mark);
        end();
    }

    private void table(Table table) throws XMLStreamException {
        start("m");
        emptyBlock("mPr");
        for (List<MathNode> row : table.rows) {
            start("mr");
            for (MathNode cell : row) {
                block("e", cell);
            }
            end();
        }
        end();
    }

    private void run(String text) throws XMLStreamException {
        if (text == null || text.isEmpty()) {
            return;
        }
        start("r");
        start("t");
        writer.writeCharacters(text);
        end();
        end();
    }

    private void block(String tag, MathNode content) throws XMLStreamException {
        start(tag);
        node(content);
        end();
    }

    private void block(String tag, List<MathNode> content) throws XMLStreamException {
        start(tag);
        for (MathNode child : content) {
            node(child);
        }
        end();
    }

    private void emptyBlock(String tag) throws XMLStreamException {
        start(tag);
        end();
    }

    private void valProperty(String tag, String value) throws XMLStreamException {
        writer.writeEmptyElement(PREFIX, tag, OMML_NAMESPACE);
        writer.writeAttribute(PREFIX, OMML_NAMESPACE, "val", value);
    }

    private void start(String tag) throws XMLStreamException {
        writer.writeStartElement(PREFIX, tag, OMML_NAMESPACE);
    }

    private void end() throws XMLStreamException {
        writer.writeEndElement();
    }
}
