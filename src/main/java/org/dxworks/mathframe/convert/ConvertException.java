package org.dxworks.mathframe.convert;

/**
 * Terminal failure of a single conversion call.
 * <p>
 * Three kinds exist:
 * <ul>
 *   <li>{@link Kind#UNSUPPORTED_SYMBOL} - the LaTeX used a command or environment the grammar engine does not know</li>
 *   <li>{@link Kind#CONVERSION_FAILED} - any other LaTeX to MathML failure</li>
 *   <li>{@link Kind#STRUCTURAL} - the XML was malformed or could not be written</li>
 * </ul>
 * The message always carries the offending symbol or the underlying diagnostic.
 */
public class ConvertException extends Exception {

    public enum Kind {
        UNSUPPORTED_SYMBOL,
        CONVERSION_FAILED,
        STRUCTURAL
    }

    private final Kind kind;
    private final String symbol;

    private ConvertException(Kind kind, String symbol, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.symbol = symbol;
    }

    public static ConvertException unsupportedSymbol(String symbol) {
        return new ConvertException(Kind.UNSUPPORTED_SYMBOL, symbol,
                "Unsupported LaTeX symbol: " + symbol, null);
    }

    public static ConvertException conversionFailed(String message, Throwable cause) {
        return new ConvertException(Kind.CONVERSION_FAILED, null,
                "LaTeX to MathML conversion failed: " + message, cause);
    }

    public static ConvertException structural(String message, Throwable cause) {
        return new ConvertException(Kind.STRUCTURAL, null, message, cause);
    }

    public Kind getKind() {
        return kind;
    }

    /** The unsupported command or environment name, only set for {@link Kind#UNSUPPORTED_SYMBOL}. */
    public String getSymbol() {
        return symbol;
    }
}
