package org.dxworks.mathframe.omml;

import com.ctc.wstx.stax.WstxInputFactory;
import com.ctc.wstx.stax.WstxOutputFactory;
import org.codehaus.stax2.XMLOutputFactory2;
import org.codehaus.stax2.XMLStreamProperties;
import org.codehaus.stax2.XMLStreamReader2;
import org.codehaus.stax2.XMLStreamWriter2;
import org.dxworks.mathframe.convert.ConvertException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.Location;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import java.io.StringReader;
import java.io.StringWriter;

/**
 * Re-indents an XML document two spaces per level.
 * <p>
 * Elements, attributes (in source order) and trimmed text are kept as they are; only the
 * whitespace between tags changes. Text stays on the line of its element, so the output
 * of one pass is a fixed point of the next.
 */
public final class XmlPrettyPrinter {

    private static final Logger log = LoggerFactory.getLogger(XmlPrettyPrinter.class);

    private static final String INDENT = "  ";

    private static final WstxInputFactory INPUT_FACTORY = createInputFactory();
    private static final WstxOutputFactory OUTPUT_FACTORY = createOutputFactory();

    private enum Last { NOTHING, START, TEXT, END }

    private XmlPrettyPrinter() {
        // utility class
    }

    private static WstxInputFactory createInputFactory() {
        WstxInputFactory factory = new WstxInputFactory();
        // prefixed names and xmlns attributes pass through untouched
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, false);
        factory.getConfig().doSupportDTDs(false);
        return factory;
    }

    private static WstxOutputFactory createOutputFactory() {
        WstxOutputFactory factory = new WstxOutputFactory();
        factory.setProperty(XMLStreamProperties.XSP_NAMESPACE_AWARE, false);
        factory.setProperty(XMLOutputFactory2.P_AUTOMATIC_EMPTY_ELEMENTS, false);
        return factory;
    }

    public static String prettyPrint(String xml) throws ConvertException {
        if (xml == null || xml.isBlank()) {
            return "";
        }
        StringWriter out = new StringWriter();
        XMLStreamReader2 reader = null;
        try {
            reader = (XMLStreamReader2) INPUT_FACTORY.createXMLStreamReader(new StringReader(xml));
            XMLStreamWriter2 writer = (XMLStreamWriter2) OUTPUT_FACTORY.createXMLStreamWriter(out);
            copy(reader, writer);
            writer.flush();
            writer.close();
        } catch (XMLStreamException e) {
            throw ConvertException.structural(describe(e), e);
        } finally {
            close(reader);
        }
        return out.toString();
    }

    private static void copy(XMLStreamReader2 reader, XMLStreamWriter2 writer) throws XMLStreamException {
        int depth = 0;
        Last last = Last.NOTHING;
        boolean skipEnd = false;
        StringBuilder pendingText = new StringBuilder();

        if (reader.getVersion() != null) {
            String encoding = reader.getCharacterEncodingScheme();
            if (encoding != null) {
                writer.writeStartDocument(encoding, reader.getVersion());
            } else {
                writer.writeStartDocument(reader.getVersion());
            }
            last = Last.END;
        }

        while (reader.hasNext()) {
            int event = reader.next();
            if (event == XMLStreamConstants.CHARACTERS || event == XMLStreamConstants.SPACE) {
                pendingText.append(reader.getText());
                continue;
            }
            if (flushText(writer, pendingText)) {
                last = Last.TEXT;
            }

            switch (event) {
                case XMLStreamConstants.START_ELEMENT -> {
                    newLine(writer, depth, last);
                    String name = reader.getPrefixedName();
                    if (reader.isEmptyElement()) {
                        writer.writeEmptyElement(name);
                        skipEnd = true;
                        last = Last.END;
                    } else {
                        writer.writeStartElement(name);
                        depth++;
                        last = Last.START;
                    }
                    for (int i = 0; i < reader.getAttributeCount(); i++) {
                        writer.writeAttribute(attributeName(reader, i), reader.getAttributeValue(i));
                    }
                }
                case XMLStreamConstants.END_ELEMENT -> {
                    if (skipEnd) {
                        skipEnd = false;
                        continue;
                    }
                    depth--;
                    if (last == Last.END) {
                        newLine(writer, depth, last);
                    }
                    writer.writeEndElement();
                    last = Last.END;
                }
                case XMLStreamConstants.CDATA -> {
                    writer.writeCData(reader.getText());
                    last = Last.TEXT;
                }
                case XMLStreamConstants.COMMENT -> {
                    newLine(writer, depth, last);
                    writer.writeComment(reader.getText());
                    last = Last.END;
                }
                case XMLStreamConstants.PROCESSING_INSTRUCTION -> {
                    newLine(writer, depth, last);
                    writer.writeProcessingInstruction(reader.getPITarget(), reader.getPIData());
                    last = Last.END;
                }
                case XMLStreamConstants.DTD -> {
                    newLine(writer, depth, last);
                    writer.writeDTD(reader.getText());
                    last = Last.END;
                }
                default -> {
                    // START_DOCUMENT, END_DOCUMENT
                }
            }
        }
    }

    /** Writes buffered text trimmed; returns true when anything was written. */
    private static boolean flushText(XMLStreamWriter2 writer, StringBuilder pendingText) throws XMLStreamException {
        if (pendingText.length() == 0) {
            return false;
        }
        String text = pendingText.toString().trim();
        pendingText.setLength(0);
        if (text.isEmpty()) {
            return false;
        }
        writer.writeCharacters(text);
        return true;
    }

    private static void newLine(XMLStreamWriter2 writer, int depth, Last last) throws XMLStreamException {
        if (last == Last.NOTHING) {
            return;
        }
        writer.writeRaw("\n" + INDENT.repeat(depth));
    }

    private static String attributeName(XMLStreamReader2 reader, int index) {
        String prefix = reader.getAttributePrefix(index);
        String localName = reader.getAttributeLocalName(index);
        return prefix == null || prefix.isEmpty() ? localName : prefix + ":" + localName;
    }

    private static String describe(XMLStreamException e) {
        Location location = e.getLocation();
        if (location == null) {
            return "Malformed XML: " + e.getMessage();
        }
        return "Malformed XML at line " + location.getLineNumber() + ", column "
                + location.getColumnNumber() + ": " + e.getMessage();
    }

    private static void close(XMLStreamReader2 reader) {
        if (reader == null) {
            return;
        }
        try {
            reader.closeCompletely();
        } catch (XMLStreamException e) {
            log.debug("Failed to close XML reader", e);
        }
    }
}
