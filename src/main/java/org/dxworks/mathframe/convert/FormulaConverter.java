package org.dxworks.mathframe.convert;

import org.dxworks.mathframe.MathframeConfig;
import org.dxworks.mathframe.grammar.AntlrGrammarEngine;
import org.dxworks.mathframe.grammar.GrammarEngine;
import org.dxworks.mathframe.grammar.GrammarException;
import org.dxworks.mathframe.latex.LatexNormalizer;
import org.dxworks.mathframe.mathml.MathmlParser;
import org.dxworks.mathframe.mathml.SubSupFixer;
import org.dxworks.mathframe.model.MathNode;
import org.dxworks.mathframe.omml.OmmlSerializer;
import org.dxworks.mathframe.omml.XmlPrettyPrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Entry point of the conversion chain:
 * LaTeX → normalized LaTeX → MathML → merged sub/superscripts → MathML tree → OMML.
 * <p>
 * Instances hold no per-call state and may be shared between threads as long as the
 * grammar engine is reentrant.
 */
public class FormulaConverter {

    private static final Logger log = LoggerFactory.getLogger(FormulaConverter.class);

    private static final Pattern COMMAND_TOKEN = Pattern.compile("\\\\[A-Za-z0-9_]+");

    private final GrammarEngine grammarEngine;
    private final MathframeConfig config;

    public FormulaConverter() {
        this(new AntlrGrammarEngine(), MathframeConfig.defaults());
    }

    public FormulaConverter(GrammarEngine grammarEngine, MathframeConfig config) {
        this.grammarEngine = grammarEngine;
        this.config = config;
    }

    /**
     * Normalizes the LaTeX, runs it through the grammar engine and merges nested
     * {@code msub}/{@code msup} pairs into {@code msubsup}.
     *
     * @throws ConvertException {@code UNSUPPORTED_SYMBOL} for unknown commands or environments,
     *                          {@code CONVERSION_FAILED} for any other grammar failure
     */
    public String latexToMathml(String latex) throws ConvertException {
        String normalized = LatexNormalizer.normalize(latex);
        try {
            return SubSupFixer.fix(grammarEngine.toMathml(normalized, config.getDisplayStyle()));
        } catch (GrammarException e) {
            log.debug("Grammar engine rejected '{}': {}", normalized, e.getMessage());
            throw translate(e);
        }
    }

    /**
     * Converts a MathML document into an OMML {@code m:oMathPara}.
     *
     * @throws ConvertException {@code STRUCTURAL} when the MathML is not well-formed
     */
    public String mathmlToOmml(String mathml) throws ConvertException {
        List<MathNode> nodes = MathmlParser.parse(SubSupFixer.fix(mathml));
        return OmmlSerializer.serialize(nodes);
    }

    public String latexToOmml(String latex) throws ConvertException {
        return mathmlToOmml(latexToMathml(latex));
    }

    public String prettyPrintOmml(String xml) throws ConvertException {
        return XmlPrettyPrinter.prettyPrint(xml);
    }

    public MathframeConfig getConfig() {
        return config;
    }

    static ConvertException translate(GrammarException e) {
        switch (e.getKind()) {
            case UNKNOWN_ENVIRONMENT:
                return ConvertException.unsupportedSymbol(e.getName());
            case UNKNOWN_COMMAND:
                Matcher matcher = COMMAND_TOKEN.matcher(e.getMessage());
                if (matcher.find()) {
                    return ConvertException.unsupportedSymbol(matcher.group());
                }
                return ConvertException.conversionFailed(e.getMessage(), e);
            default:
                return ConvertException.conversionFailed(e.getMessage(), e);
        }
    }
}
