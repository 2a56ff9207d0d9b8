package org.dxworks.mathframe.grammar;

import org.antlr.v4.runtime.ANTLRErrorListener;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.DefaultErrorStrategy;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.Parser;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.dxworks.mathframe.grammar.generated.LatexMathLexer;
import org.dxworks.mathframe.grammar.generated.LatexMathParser;

/**
 * Factory for creating ANTLR lexers and parsers that fail fast.
 * Centralizes the boilerplate setup for LaTeX math parsing.
 */
public final class AntlrParserFactory {

    private AntlrParserFactory() {
        // utility class
    }

    /**
     * Error listener that turns the first lexer or parser error into a {@link GrammarException}.
     * A formula is either converted completely or not at all.
     */
    public static final ANTLRErrorListener THROWING_LISTENER = new BaseErrorListener() {
        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol,
                                int line, int charPositionInLine, String msg,
                                RecognitionException e) {
            throw GrammarException.syntax(line, charPositionInLine, msg);
        }
    };

    /**
     * Creates a LaTeX math parser together with its already filled token stream.
     */
    public static ParserWithTokens<LatexMathParser> createLatexMathParser(String source) {
        LatexMathLexer lexer = new LatexMathLexer(CharStreams.fromString(source));
        configureThrowingLexer(lexer);
        CommonTokenStream tokens = new CommonTokenStream(lexer);
        tokens.fill();
        LatexMathParser parser = new LatexMathParser(tokens);
        configureThrowingParser(parser);
        return new ParserWithTokens<>(parser, tokens);
    }

    private static void configureThrowingLexer(Lexer lexer) {
        lexer.removeErrorListeners();
        lexer.addErrorListener(THROWING_LISTENER);
    }

    private static void configureThrowingParser(Parser parser) {
        parser.removeErrorListeners();
        parser.addErrorListener(THROWING_LISTENER);
        parser.setErrorHandler(new DefaultErrorStrategy());
    }

    /**
     * Container for parser and its token stream.
     */
    public static class ParserWithTokens<P extends Parser> {
        private final P parser;
        private final CommonTokenStream tokens;

        public ParserWithTokens(P parser, CommonTokenStream tokens) {
            this.parser = parser;
            this.tokens = tokens;
        }

        public P getParser() {
            return parser;
        }

        public CommonTokenStream getTokens() {
            return tokens;
        }
    }
}
