package org.dxworks.mathframe.mathml;

import com.ctc.wstx.api.WstxInputProperties;
import com.ctc.wstx.exc.WstxEOFException;
import com.ctc.wstx.stax.WstxInputFactory;
import org.codehaus.stax2.XMLStreamReader2;
import org.dxworks.mathframe.convert.ConvertException;
import org.dxworks.mathframe.model.Fenced;
import org.dxworks.mathframe.model.Fraction;
import org.dxworks.mathframe.model.Identifier;
import org.dxworks.mathframe.model.MathNode;
import org.dxworks.mathframe.model.NumberLiteral;
import org.dxworks.mathframe.model.Operator;
import org.dxworks.mathframe.model.Over;
import org.dxworks.mathframe.model.RawText;
import org.dxworks.mathframe.model.Root;
import org.dxworks.mathframe.model.Row;
import org.dxworks.mathframe.model.Space;
import org.dxworks.mathframe.model.SquareRoot;
import org.dxworks.mathframe.model.SubSuperscript;
import org.dxworks.mathframe.model.Subscript;
import org.dxworks.mathframe.model.Superscript;
import org.dxworks.mathframe.model.Table;
import org.dxworks.mathframe.model.TextRun;
import org.dxworks.mathframe.model.Under;
import org.dxworks.mathframe.model.UnderOver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.xml.stream.Location;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Streams MathML markup into a list of {@link MathNode} trees.
 * <p>
 * Tag names are matched without their namespace prefix. Missing children of fixed-arity
 * elements are padded with an empty {@link Row}. A superscript whose base is a subscript is
 * rewritten into a {@link SubSuperscript} as soon as both children are known.
 * Input that ends while elements are still open is treated as complete.
 */
public final class MathmlParser {

    private static final Logger log = LoggerFactory.getLogger(MathmlParser.class);

    /** Greek letter entity names in code point order, from alpha (U+03B1) to omega (U+03C9). */
    private static final List<String> GREEK_LETTERS = List.of(
            "alpha", "beta", "gamma", "delta", "epsilon", "zeta", "eta", "theta", "iota", "kappa",
            "lambda", "mu", "nu", "xi", "omicron", "pi", "rho", "sigmaf", "sigma", "tau", "upsilon",
            "phi", "chi", "psi", "omega");

    // Named entities MathML producers emit without declaring a DTD
    private static final Map<String, String> ENTITIES = withGreekLetters(Map.ofEntries(
            Map.entry("nbsp", "\u00A0"),
            Map.entry("thinsp", "\u2009"),
            Map.entry("ThinSpace", "\u2009"),
            Map.entry("MediumSpace", "\u205F"),
            Map.entry("ThickSpace", "\u2005"),
            Map.entry("NegativeThinSpace", "\u200B"),
            Map.entry("InvisibleTimes", "\u2062"),
            Map.entry("it", "\u2062"),
            Map.entry("ApplyFunction", "\u2061"),
            Map.entry("af", "\u2061"),
            Map.entry("InvisibleComma", "\u2063"),
            Map.entry("ic", "\u2063"),
            Map.entry("minus", "\u2212"),
            Map.entry("times", "\u00D7"),
            Map.entry("div", "\u00F7"),
            Map.entry("plusmn", "\u00B1"),
            Map.entry("PlusMinus", "\u00B1"),
            Map.entry("sdot", "\u22C5"),
            Map.entry("middot", "\u00B7"),
            Map.entry("infin", "\u221E"),
            Map.entry("le", "\u2264"),
            Map.entry("ge", "\u2265"),
            Map.entry("ne", "\u2260"),
            Map.entry("rarr", "\u2192"),
            Map.entry("larr", "\u2190"),
            Map.entry("hellip", "\u2026"),
            Map.entry("sum", "\u2211"),
            Map.entry("prod", "\u220F"),
            Map.entry("int", "\u222B"),
            Map.entry("part", "\u2202"),
            Map.entry("nabla", "\u2207"),
            Map.entry("lang", "\u27E8"),
            Map.entry("rang", "\u27E9"),
            Map.entry("thetasym", "\u03D1"),
            Map.entry("piv", "\u03D6"),
            Map.entry("phiv", "\u03D5"),
            Map.entry("forall", "\u2200"),
            Map.entry("exist", "\u2203"),
            Map.entry("empty", "\u2205"),
            Map.entry("isin", "\u2208"),
            Map.entry("notin", "\u2209"),
            Map.entry("prop", "\u221D"),
            Map.entry("radic", "\u221A"),
            Map.entry("ang", "\u2220"),
            Map.entry("and", "\u2227"),
            Map.entry("or", "\u2228"),
            Map.entry("cap", "\u2229"),
            Map.entry("cup", "\u222A"),
            Map.entry("there4", "\u2234"),
            Map.entry("sim", "\u223C"),
            Map.entry("approx", "\u2248"),
            Map.entry("equiv", "\u2261"),
            Map.entry("sub", "\u2282"),
            Map.entry("sup", "\u2283"),
            Map.entry("sube", "\u2286"),
            Map.entry("supe", "\u2287"),
            Map.entry("oplus", "\u2295"),
            Map.entry("otimes", "\u2297"),
            Map.entry("perp", "\u22A5"),
            Map.entry("lceil", "\u2308"),
            Map.entry("rceil", "\u2309"),
            Map.entry("lfloor", "\u230A"),
            Map.entry("rfloor", "\u230B"),
            Map.entry("harr", "\u2194"),
            Map.entry("uarr", "\u2191"),
            Map.entry("darr", "\u2193"),
            Map.entry("rArr", "\u21D2"),
            Map.entry("lArr", "\u21D0"),
            Map.entry("hArr", "\u21D4"),
            Map.entry("prime", "\u2032"),
            Map.entry("Prime", "\u2033"),
            Map.entry("deg", "\u00B0")));

    private static final Set<String> CONTAINERS = Set.of(
            "math", "mrow", "mstyle", "semantics", "annotation", "annotation-xml",
            "mpadded", "mphantom", "merror");

    private static final WstxInputFactory INPUT_FACTORY = createInputFactory();

    private MathmlParser() {
        // utility class
    }

    /** Adds lowercase and capitalized Greek letter names; there is no capital final sigma. */
    private static Map<String, String> withGreekLetters(Map<String, String> named) {
        Map<String, String> entities = new HashMap<>(named);
        for (int i = 0; i < GREEK_LETTERS.size(); i++) {
            String name = GREEK_LETTERS.get(i);
            entities.put(name, String.valueOf((char) (0x03B1 + i)));
            if (!"sigmaf".equals(name)) {
                String capital = Character.toUpperCase(name.charAt(0)) + name.substring(1);
                entities.put(capital, String.valueOf((char) (0x0391 + i)));
            }
        }
        return entities;
    }

    private static WstxInputFactory createInputFactory() {
        WstxInputFactory factory = new WstxInputFactory();
        factory.setProperty(XMLInputFactory.IS_NAMESPACE_AWARE, false);
        // Woodstox sometimes splits long text nodes; merge them before they reach us
        factory.getConfig().doCoalesceText(true);
        // Several top-level elements and bare text are accepted
        factory.getConfig().setInputParsingMode(WstxInputProperties.PARSING_MODE_FRAGMENT);
        // Ignore DTDs since they cause lookups to external URLs
        factory.getConfig().doSupportDTDs(false);
        factory.getConfig().setCustomInternalEntities(ENTITIES);
        return factory;
    }

    public static List<MathNode> parse(String mathml) throws ConvertException {
        List<MathNode> nodes = new ArrayList<>();
        if (mathml == null || mathml.isBlank()) {
            return nodes;
        }
        Cursor cursor = null;
        try {
            cursor = new Cursor((XMLStreamReader2) INPUT_FACTORY.createXMLStreamReader(new StringReader(mathml)));
            readContent(cursor, nodes);
            return nodes;
        } catch (XMLStreamException e) {
            throw ConvertException.structural(describe(e, cursor), e);
        } finally {
            if (cursor != null) {
                cursor.close();
            }
        }
    }

    /** Reads sibling nodes until the enclosing element ends, the input ends, or the input is cut off. */
    private static void readContent(Cursor cursor, List<MathNode> into) throws XMLStreamException {
        while (!cursor.truncated) {
            int event = cursor.next();
            switch (event) {
                case XMLStreamConstants.START_ELEMENT -> {
                    MathNode node = readElement(cursor);
                    if (node != null) {
                        into.add(node);
                    }
                }
                case XMLStreamConstants.CHARACTERS, XMLStreamConstants.CDATA -> {
                    String text = cursor.reader.getText().trim();
                    if (!text.isEmpty()) {
                        into.add(new RawText(text));
                    }
                }
                case XMLStreamConstants.END_ELEMENT, XMLStreamConstants.END_DOCUMENT -> {
                    return;
                }
                default -> {
                    // comments, processing instructions, whitespace
                }
            }
        }
    }

    /** Reads the element the cursor is positioned on, through its end tag. */
    private static MathNode readElement(Cursor cursor) throws XMLStreamException {
        XMLStreamReader2 reader = cursor.reader;
        String name = stripPrefix(reader.getLocalName());
        cursor.currentElement = name;

        switch (name) {
            case "mi":
                return new Identifier(readLeafText(cursor));
            case "mn":
                return new NumberLiteral(readLeafText(cursor));
            case "mo":
                return new Operator(readLeafText(cursor));
            case "mtext":
            case "ms":
                return new TextRun(readLeafText(cursor));
            case "mspace":
                skipElement(cursor);
                return new Space();
            default:
                break;
        }

        if (reader.isEmptyElement()) {
            skipElement(cursor);
            return null;
        }

        String open = attribute(reader, "open");
        String close = attribute(reader, "close");
        List<MathNode> children = new ArrayList<>();
        readContent(cursor, children);

        if (CONTAINERS.contains(name)) {
            return new Row(children);
        }
        switch (name) {
            case "mfrac":
                return new Fraction(child(children, 0), child(children, 1));
            case "msqrt":
                return new SquareRoot(children);
            case "mroot":
                return new Root(child(children, 0), child(children, 1));
            case "msup":
                return superscript(child(children, 0), child(children, 1));
            case "msub":
                return new Subscript(child(children, 0), child(children, 1));
            case "msubsup":
                return new SubSuperscript(child(children, 0), child(children, 1), child(children, 2));
            case "mover":
                return new Over(child(children, 0), child(children, 1));
            case "munder":
                return new Under(child(children, 0), child(children, 1));
            case "munderover":
                return new UnderOver(child(children, 0), child(children, 1), child(children, 2));
            case "mtable":
                return table(children);
            case "mtr":
                return new Row(children);
            case "mlabeledtr":
                // first cell is the equation label
                return new Row(children.isEmpty() ? children : children.subList(1, children.size()));
            case "mtd":
                return children.size() == 1 ? children.get(0) : new Row(children);
            case "mfenced":
                return new Fenced(open != null ? open : "(", close != null ? close : ")", children);
            default:
                return degrade(children);
        }
    }

    private static MathNode superscript(MathNode base, MathNode sup) {
        if (base instanceof Subscript) {
            Subscript sub = (Subscript) base;
            return new SubSuperscript(sub.base, sub.sub, sup);
        }
        return new Superscript(base, sup);
    }

    private static Table table(List<MathNode> children) {
        List<List<MathNode>> rows = new ArrayList<>();
        for (MathNode child : children) {
            if (child instanceof Row) {
                rows.add(((Row) child).children);
            } else {
                rows.add(List.of(child));
            }
        }
        return new Table(rows);
    }

    private static MathNode degrade(List<MathNode> children) {
        if (children.isEmpty()) {
            return new RawText("");
        }
        return children.size() == 1 ? children.get(0) : new Row(children);
    }

    private static MathNode child(List<MathNode> children, int index) {
        return index < children.size() ? children.get(index) : Row.empty();
    }

    /**
     * Collects the text of a token element. Nested elements are read in full and contribute
     * their flattened text.
     */
    private static String readLeafText(Cursor cursor) throws XMLStreamException {
        StringBuilder text = new StringBuilder();
        while (!cursor.truncated) {
            int event = cursor.next();
            if (event == XMLStreamConstants.CHARACTERS || event == XMLStreamConstants.CDATA
                    || event == XMLStreamConstants.SPACE) {
                text.append(cursor.reader.getText());
            } else if (event == XMLStreamConstants.START_ELEMENT) {
                MathNode nested = readElement(cursor);
                if (nested != null) {
                    text.append(nested.flatText());
                }
            } else if (event == XMLStreamConstants.END_ELEMENT || event == XMLStreamConstants.END_DOCUMENT) {
                break;
            }
        }
        return text.toString().trim();
    }

    private static void skipElement(Cursor cursor) throws XMLStreamException {
        int depth = 1;
        while (depth > 0 && !cursor.truncated) {
            int event = cursor.next();
            if (event == XMLStreamConstants.START_ELEMENT) {
                depth++;
            } else if (event == XMLStreamConstants.END_ELEMENT) {
                depth--;
            } else if (event == XMLStreamConstants.END_DOCUMENT) {
                return;
            }
        }
    }

    private static String attribute(XMLStreamReader2 reader, String name) {
        for (int i = 0; i < reader.getAttributeCount(); i++) {
            if (name.equals(stripPrefix(reader.getAttributeLocalName(i)))) {
                return reader.getAttributeValue(i);
            }
        }
        return null;
    }

    private static String stripPrefix(String name) {
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }

    private static String describe(XMLStreamException e, Cursor cursor) {
        StringBuilder sb = new StringBuilder("Malformed MathML");
        Location location = e.getLocation();
        if (location != null) {
            sb.append(" at line ").append(location.getLineNumber())
                    .append(", column ").append(location.getColumnNumber());
        }
        if (cursor != null && cursor.currentElement != null) {
            sb.append(" near <").append(cursor.currentElement).append(">");
        }
        return sb.append(": ").append(e.getMessage()).toString();
    }

    /** Reader plus the parse state shared by the recursive descent. */
    private static final class Cursor {
        private final XMLStreamReader2 reader;
        private boolean truncated;
        private String currentElement;

        private Cursor(XMLStreamReader2 reader) {
            this.reader = reader;
        }

        /** Advances the reader; input that ends inside an open element reads as END_DOCUMENT. */
        private int next() throws XMLStreamException {
            if (truncated || !reader.hasNext()) {
                return XMLStreamConstants.END_DOCUMENT;
            }
            try {
                return reader.next();
            } catch (WstxEOFException e) {
                log.warn("MathML ended inside <{}>, treating it as complete: {}", currentElement, e.getMessage());
                truncated = true;
                return XMLStreamConstants.END_DOCUMENT;
            }
        }

        private void close() {
            try {
                reader.closeCompletely();
            } catch (XMLStreamException e) {
                log.debug("Failed to close MathML reader", e);
            }
        }
    }
}
