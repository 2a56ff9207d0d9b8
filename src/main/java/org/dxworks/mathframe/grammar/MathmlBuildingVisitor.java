package org.dxworks.mathframe.grammar;

import com.ctc.wstx.stax.WstxOutputFactory;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.codehaus.stax2.XMLOutputFactory2;
import org.codehaus.stax2.XMLStreamProperties;
import org.codehaus.stax2.XMLStreamWriter2;
import org.dxworks.mathframe.DisplayStyle;
import org.dxworks.mathframe.grammar.generated.LatexMathBaseVisitor;
import org.dxworks.mathframe.grammar.generated.LatexMathParser;
import org.dxworks.mathframe.latex.MathAlphabets;

import javax.xml.stream.XMLStreamException;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntUnaryOperator;
import java.util.regex.Pattern;

/**
 * Builds MathML from a {@code LatexMath} parse tree.
 * <p>
 * Every visit method returns a {@link MathmlFragment}, or null for constructs that render
 * nothing (ignored commands, {@code \!}). {@link #write} streams the fragments through a
 * Woodstox writer. Not thread-safe; create one per conversion.
 */
public class MathmlBuildingVisitor extends LatexMathBaseVisitor<MathmlFragment> {

    public static final String MATHML_NAMESPACE = "http://www.w3.org/1998/Math/MathML";

    /** Matrix-like environments drawn with delimiters, keyed to their open and close glyphs. */
    static final Map<String, String[]> FENCED_ENVIRONMENTS = Map.of(
            "pmatrix", new String[]{"(", ")"},
            "bmatrix", new String[]{"[", "]"},
            "Bmatrix", new String[]{"{", "}"},
            "vmatrix", new String[]{"|", "|"},
            "Vmatrix", new String[]{"‖", "‖"},
            "cases", new String[]{"{", ""});
    static final Set<String> PLAIN_ENVIRONMENTS = Set.of(
            "matrix", "smallmatrix", "aligned", "align", "align*", "gathered", "gather",
            "gather*", "split", "array");

    private static final Pattern PLAIN_ARGUMENT = Pattern.compile("[A-Za-z0-9]+");
    private static final Pattern COLUMN_SPEC = Pattern.compile("\\{[lcr|@.:0-9]*\\}");
    private static final MathmlFragment EMPTY_ROW = element("mrow");

    private static final WstxOutputFactory OUTPUT_FACTORY = createOutputFactory();

    private final DisplayStyle style;

    public MathmlBuildingVisitor(DisplayStyle style) {
        this.style = style == null ? DisplayStyle.INLINE : style;
    }

    private static WstxOutputFactory createOutputFactory() {
        WstxOutputFactory factory = new WstxOutputFactory();
        factory.setProperty(XMLStreamProperties.XSP_NAMESPACE_AWARE, false);
        // empty rows and cells keep their end tag
        factory.setProperty(XMLOutputFactory2.P_AUTOMATIC_EMPTY_ELEMENTS, false);
        return factory;
    }

    public static boolean isSupportedEnvironment(String name) {
        return FENCED_ENVIRONMENTS.containsKey(name) || PLAIN_ENVIRONMENTS.contains(name);
    }

    /** Visits the tree and returns the complete {@code <math>} document. */
    public String write(LatexMathParser.MathContext tree) {
        StringWriter out = new StringWriter();
        try {
            XMLStreamWriter2 writer = (XMLStreamWriter2) OUTPUT_FACTORY.createXMLStreamWriter(out);
            visit(tree).writeTo(writer);
            writer.flush();
            writer.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Failed to write MathML", e);
        }
        return out.toString();
    }

    @Override
    public MathmlFragment visitMath(LatexMathParser.MathContext ctx) {
        List<MathmlFragment> children = elements(ctx.expression());
        String display = style.getMathmlValue();
        return writer -> {
            writer.writeStartElement("math");
            writer.writeAttribute("xmlns", MATHML_NAMESPACE);
            writer.writeAttribute("display", display);
            writeAll(writer, children);
            writer.writeEndElement();
        };
    }

    @Override
    public MathmlFragment visitExpression(LatexMathParser.ExpressionContext ctx) {
        return wrap(elements(ctx));
    }

    @Override
    public MathmlFragment visitGroup(LatexMathParser.GroupContext ctx) {
        return wrap(elements(ctx.expression()));
    }

    @Override
    public MathmlFragment visitElement(LatexMathParser.ElementContext ctx) {
        LatexMathParser.ScriptsContext scripts = ctx.scripts();
        if (scripts == null) {
            return visit(ctx.primary());
        }
        MathmlFragment base = ctx.primary() == null ? EMPTY_ROW : nonEmpty(visit(ctx.primary()));
        MathmlFragment sub = scripts.sub == null ? null : nonEmpty(visit(scripts.sub));
        MathmlFragment sup = scripts.sup == null ? null : nonEmpty(visit(scripts.sup));

        boolean stacked = isStackedOperator(ctx.primary());
        if (sub != null && sup != null) {
            return element(stacked ? "munderover" : "msubsup", base, sub, sup);
        }
        if (sub != null) {
            return element(stacked ? "munder" : "msub", base, sub);
        }
        return element(stacked ? "mover" : "msup", base, sup);
    }

    @Override
    public MathmlFragment visitPrimary(LatexMathParser.PrimaryContext ctx) {
        if (ctx.number() != null) {
            return leaf("mn", ctx.number().getText());
        }
        return visit(ctx.atom());
    }

    @Override
    public MathmlFragment visitGroupAtom(LatexMathParser.GroupAtomContext ctx) {
        return visit(ctx.group());
    }

    @Override
    public MathmlFragment visitLetterAtom(LatexMathParser.LetterAtomContext ctx) {
        return leaf("mi", ctx.getText());
    }

    @Override
    public MathmlFragment visitUnicodeAtom(LatexMathParser.UnicodeAtomContext ctx) {
        return unicode(ctx.getText());
    }

    @Override
    public MathmlFragment visitCommandAtom(LatexMathParser.CommandAtomContext ctx) {
        return command(ctx.getText().substring(1));
    }

    @Override
    public MathmlFragment visitEscapedAtom(LatexMathParser.EscapedAtomContext ctx) {
        return escaped(ctx.getText().substring(1));
    }

    @Override
    public MathmlFragment visitPunctAtom(LatexMathParser.PunctAtomContext ctx) {
        return punct(ctx.getText());
    }

    @Override
    public MathmlFragment visitTildeAtom(LatexMathParser.TildeAtomContext ctx) {
        return leaf("mtext", "\u00A0");
    }

    @Override
    public MathmlFragment visitTextAtom(LatexMathParser.TextAtomContext ctx) {
        String raw = ctx.getText();
        String command = raw.substring(1, raw.indexOf('{')).trim();
        String content = raw.substring(raw.indexOf('{') + 1, raw.length() - 1);
        return switch (command) {
            case "textbf" -> leaf("mtext", "mathvariant", "bold", content);
            case "textit" -> leaf("mtext", "mathvariant", "italic", content);
            default -> leaf("mtext", content);
        };
    }

    @Override
    public MathmlFragment visitFracAtom(LatexMathParser.FracAtomContext ctx) {
        return element("mfrac", nonEmpty(visit(ctx.numerator)), nonEmpty(visit(ctx.denominator)));
    }

    @Override
    public MathmlFragment visitBinomAtom(LatexMathParser.BinomAtomContext ctx) {
        MathmlFragment table = element("mtable",
                element("mtr", element("mtd", visit(ctx.top))),
                element("mtr", element("mtd", visit(ctx.bottom))));
        return fenced("(", ")", table);
    }

    @Override
    public MathmlFragment visitSqrtAtom(LatexMathParser.SqrtAtomContext ctx) {
        MathmlFragment base = nonEmpty(visit(ctx.arg()));
        if (ctx.index != null) {
            return element("mroot", base, nonEmpty(visit(ctx.index)));
        }
        return element("msqrt", base);
    }

    @Override
    public MathmlFragment visitFontAtom(LatexMathParser.FontAtomContext ctx) {
        String font = ctx.FONT().getText().substring(1);
        LatexMathParser.ArgContext arg = ctx.arg();
        String plain = plainArgument(arg);
        switch (font) {
            case "mathbb":
                return plain != null ? mapLetters(plain, MathAlphabets::doubleStruck) : styled("double-struck", arg);
            case "mathfrak":
                return plain != null ? mapLetters(plain, MathAlphabets::fraktur) : styled("fraktur", arg);
            case "mathcal":
            case "mathscr":
                return plain != null ? mapLetters(plain, MathAlphabets::script) : styled("script", arg);
            case "mathrm":
            case "operatorname":
                return plain != null && !plain.chars().allMatch(Character::isDigit)
                        ? leaf("mi", "mathvariant", "normal", plain)
                        : styled("normal", arg);
            case "mathbf":
                return styled("bold", arg);
            case "boldsymbol":
            case "bm":
                return styled("bold-italic", arg);
            case "mathit":
                return styled("italic", arg);
            case "mathsf":
                return styled("sans-serif", arg);
            case "mathtt":
                return styled("monospace", arg);
            case "boxed":
                return attributed("menclose", "notation", "box", nonEmpty(visit(arg)));
            default:
                // \mathop, \mathbin and friends only change spacing class
                return visit(arg);
        }
    }

    @Override
    public MathmlFragment visitAccentAtom(LatexMathParser.AccentAtomContext ctx) {
        String accent = ctx.ACCENT().getText().substring(1);
        MathmlFragment base = nonEmpty(visit(ctx.arg()));
        String under = LatexSymbols.UNDER_ACCENTS.get(accent);
        if (under != null) {
            return attributed("munder", "accentunder", "true", base, leaf("mo", under));
        }
        return attributed("mover", "accent", "true", base, leaf("mo", LatexSymbols.ACCENTS.get(accent)));
    }

    @Override
    public MathmlFragment visitOversetAtom(LatexMathParser.OversetAtomContext ctx) {
        return element("mover", nonEmpty(visit(ctx.base)), nonEmpty(visit(ctx.mark)));
    }

    @Override
    public MathmlFragment visitUndersetAtom(LatexMathParser.UndersetAtomContext ctx) {
        return element("munder", nonEmpty(visit(ctx.base)), nonEmpty(visit(ctx.mark)));
    }

    @Override
    public MathmlFragment visitEnvironmentAtom(LatexMathParser.EnvironmentAtomContext ctx) {
        return visit(ctx.environment());
    }

    @Override
    public MathmlFragment visitEnvironment(LatexMathParser.EnvironmentContext ctx) {
        String name = environmentName(ctx.BEGIN_ENV());
        if (!isSupportedEnvironment(name)) {
            throw GrammarException.unknownEnvironment(name);
        }
        String endName = environmentName(ctx.END_ENV());
        if (!name.equals(endName)) {
            throw GrammarException.mismatchedEnvironment(name, endName);
        }

        List<LatexMathParser.EnvRowContext> rows = new ArrayList<>(ctx.envRow());
        // a trailing \\ before \end leaves one empty row behind
        if (rows.size() > 0 && isEmptyRow(rows.get(rows.size() - 1))) {
            rows.remove(rows.size() - 1);
        }

        List<MathmlFragment> tableRows = new ArrayList<>();
        for (int r = 0; r < rows.size(); r++) {
            List<MathmlFragment> tableCells = new ArrayList<>();
            List<LatexMathParser.ExpressionContext> cells = rows.get(r).expression();
            for (int c = 0; c < cells.size(); c++) {
                List<MathmlFragment> content = elements(cells.get(c));
                if (r == 0 && c == 0 && "array".equals(name)) {
                    content = dropColumnSpec(cells.get(c), content);
                }
                tableCells.add(content.isEmpty() ? element("mtd") : element("mtd", wrap(content)));
            }
            tableRows.add(element("mtr", tableCells));
        }
        MathmlFragment table = element("mtable", tableRows);

        String[] fences = FENCED_ENVIRONMENTS.get(name);
        return fences == null ? table : fenced(fences[0], fences[1], table);
    }

    @Override
    public MathmlFragment visitArg(LatexMathParser.ArgContext ctx) {
        if (ctx.group() != null) {
            return visit(ctx.group());
        }
        String text = ctx.getText();
        if (ctx.LETTER() != null) return leaf("mi", text);
        if (ctx.DIGIT() != null) return leaf("mn", text);
        if (ctx.UNICODE() != null) return unicode(text);
        if (ctx.COMMAND() != null) return command(text.substring(1));
        if (ctx.ESCAPED() != null) return escaped(text.substring(1));
        return punct(text);
    }

    private List<MathmlFragment> elements(LatexMathParser.ExpressionContext ctx) {
        List<MathmlFragment> result = new ArrayList<>();
        if (ctx == null) {
            return result;
        }
        for (LatexMathParser.ElementContext element : ctx.element()) {
            MathmlFragment mathml = visit(element);
            if (mathml != null) {
                result.add(mathml);
            }
        }
        return result;
    }

    private boolean isStackedOperator(LatexMathParser.PrimaryContext primary) {
        if (primary == null || !(primary.atom() instanceof LatexMathParser.CommandAtomContext)) {
            return false;
        }
        String name = primary.atom().getText().substring(1);
        return LatexSymbols.LARGE_OPERATORS.containsKey(name) || LatexSymbols.LIMIT_FUNCTIONS.containsKey(name);
    }

    private MathmlFragment command(String name) {
        String glyph;
        if ((glyph = LatexSymbols.IDENTIFIERS.get(name)) != null) return leaf("mi", glyph);
        if ((glyph = LatexSymbols.OPERATORS.get(name)) != null) return leaf("mo", glyph);
        if ((glyph = LatexSymbols.LARGE_OPERATORS.get(name)) != null) return leaf("mo", glyph);
        if ((glyph = LatexSymbols.INTEGRALS.get(name)) != null) return leaf("mo", glyph);
        if ((glyph = LatexSymbols.LIMIT_FUNCTIONS.get(name)) != null) return leaf("mi", glyph);
        if (LatexSymbols.FUNCTIONS.contains(name)) return leaf("mi", name);
        if ((glyph = LatexSymbols.SPACES.get(name)) != null) return space(glyph);
        if (LatexSymbols.IGNORED.contains(name)) return null;
        throw GrammarException.unknownCommand("\\" + name);
    }

    private MathmlFragment escaped(String character) {
        String width = LatexSymbols.SPACES.get(character);
        if (width != null) return space(width);
        if (LatexSymbols.IGNORED.contains(character)) return null;
        String glyph = LatexSymbols.ESCAPED_OPERATORS.get(character);
        return leaf("mo", glyph != null ? glyph : character);
    }

    private MathmlFragment punct(String text) {
        return leaf("mo", "'".equals(text) ? "′" : text);
    }

    private MathmlFragment unicode(String text) {
        int cp = text.codePointAt(0);
        if (Character.isLetter(cp)) return leaf("mi", text);
        if (Character.isDigit(cp)) return leaf("mn", text);
        return leaf("mo", text);
    }

    private MathmlFragment styled(String variant, LatexMathParser.ArgContext arg) {
        return attributed("mstyle", "mathvariant", variant, nonEmpty(visit(arg)));
    }

    private MathmlFragment mapLetters(String plain, IntUnaryOperator alphabet) {
        List<MathmlFragment> parts = new ArrayList<>();
        plain.codePoints().forEach(cp -> {
            String mapped = new String(Character.toChars(alphabet.applyAsInt(cp)));
            parts.add(Character.isDigit(cp) ? leaf("mn", mapped) : leaf("mi", mapped));
        });
        return wrap(parts);
    }

    /** Text of an argument made only of ASCII letters and digits, braces removed; null otherwise. */
    private static String plainArgument(LatexMathParser.ArgContext arg) {
        String text = arg.getText();
        if (arg.group() != null) {
            text = text.substring(1, text.length() - 1);
        }
        return PLAIN_ARGUMENT.matcher(text).matches() ? text : null;
    }

    private List<MathmlFragment> dropColumnSpec(LatexMathParser.ExpressionContext cell, List<MathmlFragment> content) {
        List<LatexMathParser.ElementContext> elements = cell.element();
        if (elements.isEmpty() || content.isEmpty()) {
            return content;
        }
        LatexMathParser.ElementContext first = elements.get(0);
        if (first.scripts() == null && first.primary() != null
                && first.primary().atom() instanceof LatexMathParser.GroupAtomContext
                && COLUMN_SPEC.matcher(first.getText()).matches()) {
            return content.subList(1, content.size());
        }
        return content;
    }

    private static boolean isEmptyRow(LatexMathParser.EnvRowContext row) {
        List<LatexMathParser.ExpressionContext> cells = row.expression();
        return cells.size() == 1 && cells.get(0).element().isEmpty();
    }

    private static String environmentName(TerminalNode token) {
        String text = token.getText();
        return text.substring(text.indexOf('{') + 1, text.lastIndexOf('}'));
    }

    private static MathmlFragment fenced(String open, String close, MathmlFragment content) {
        return writer -> {
            writer.writeStartElement("mfenced");
            writer.writeAttribute("open", open);
            writer.writeAttribute("close", close);
            content.writeTo(writer);
            writer.writeEndElement();
        };
    }

    private static MathmlFragment space(String width) {
        return writer -> {
            writer.writeEmptyElement("mspace");
            writer.writeAttribute("width", width);
        };
    }

    private static MathmlFragment wrap(List<MathmlFragment> parts) {
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return element("mrow", parts);
    }

    private static MathmlFragment nonEmpty(MathmlFragment mathml) {
        return mathml == null ? EMPTY_ROW : mathml;
    }

    private static MathmlFragment element(String tag, MathmlFragment... children) {
        return element(tag, Arrays.asList(children));
    }

    private static MathmlFragment element(String tag, List<MathmlFragment> children) {
        return writer -> {
            writer.writeStartElement(tag);
            writeAll(writer, children);
            writer.writeEndElement();
        };
    }

    private static MathmlFragment attributed(String tag, String attribute, String value, MathmlFragment... children) {
        List<MathmlFragment> content = Arrays.asList(children);
        return writer -> {
            writer.writeStartElement(tag);
            writer.writeAttribute(attribute, value);
            writeAll(writer, content);
            writer.writeEndElement();
        };
    }

    private static MathmlFragment leaf(String tag, String text) {
        return writer -> {
            writer.writeStartElement(tag);
            writer.writeCharacters(text);
            writer.writeEndElement();
        };
    }

    private static MathmlFragment leaf(String tag, String attribute, String value, String text) {
        return writer -> {
            writer.writeStartElement(tag);
            writer.writeAttribute(attribute, value);
            writer.writeCharacters(text);
            writer.writeEndElement();
        };
    }

    /** Null children render nothing. */
    private static void writeAll(XMLStreamWriter2 writer, List<MathmlFragment> children) throws XMLStreamException {
        for (MathmlFragment child : children) {
            if (child != null) {
                child.writeTo(writer);
            }
        }
    }
}
