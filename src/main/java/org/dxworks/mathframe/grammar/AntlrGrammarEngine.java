package org.dxworks.mathframe.grammar;

import org.dxworks.mathframe.DisplayStyle;
import org.dxworks.mathframe.grammar.generated.LatexMathParser;
import org.dxworks.mathframe.latex.LatexTextUtils;

/**
 * Grammar engine backed by the bundled {@code LatexMath} ANTLR grammar.
 * Stateless; every call builds its own lexer, parser and visitor.
 */
public class AntlrGrammarEngine implements GrammarEngine {

    private static final String BEGIN = "\\begin";

    @Override
    public String toMathml(String normalizedLatex, DisplayStyle style) {
        String source = normalizedLatex == null ? "" : normalizedLatex;
        // Unknown environments are reported before anything inside them can fail to lex or parse.
        checkEnvironments(source);

        AntlrParserFactory.ParserWithTokens<LatexMathParser> pwt = AntlrParserFactory.createLatexMathParser(source);
        LatexMathParser.MathContext tree = pwt.getParser().math();
        return new MathmlBuildingVisitor(style).write(tree);
    }

    static void checkEnvironments(String source) {
        for (int i = source.indexOf(BEGIN); i >= 0; i = source.indexOf(BEGIN, i + 1)) {
            if (!LatexTextUtils.isCommandAt(source, i, BEGIN)) {
                continue;
            }
            int open = LatexTextUtils.skipSpaces(source, i + BEGIN.length());
            int close = LatexTextUtils.findMatchingBrace(source, open);
            if (close < 0) {
                // left to the parser
                continue;
            }
            String name = source.substring(open + 1, close).trim();
            if (!MathmlBuildingVisitor.isSupportedEnvironment(name)) {
                throw GrammarException.unknownEnvironment(name);
            }
        }
    }
}
