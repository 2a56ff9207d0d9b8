package org.dxworks.mathframe.grammar;

/**
 * Failure raised by a {@link GrammarEngine} while turning LaTeX into MathML.
 */
public class GrammarException extends RuntimeException {

    public enum Kind {
        UNKNOWN_ENVIRONMENT,
        UNKNOWN_COMMAND,
        MISMATCHED_ENVIRONMENT,
        SYNTAX
    }

    private final Kind kind;
    private final String name;

    public GrammarException(Kind kind, String name, String message) {
        super(message);
        this.kind = kind;
        this.name = name;
    }

    public static GrammarException unknownEnvironment(String environment) {
        return new GrammarException(Kind.UNKNOWN_ENVIRONMENT, environment,
                "Unknown environment: " + environment);
    }

    public static GrammarException unknownCommand(String command) {
        return new GrammarException(Kind.UNKNOWN_COMMAND, command,
                command + " is not a supported command");
    }

    public static GrammarException mismatchedEnvironment(String begin, String end) {
        return new GrammarException(Kind.MISMATCHED_ENVIRONMENT, begin,
                "\\begin{" + begin + "} closed by \\end{" + end + "}");
    }

    public static GrammarException syntax(int line, int column, String message) {
        return new GrammarException(Kind.SYNTAX, null,
                "line " + line + ":" + column + " " + message);
    }

    public Kind getKind() {
        return kind;
    }

    /** Environment or command the failure is about; null for syntax errors. */
    public String getName() {
        return name;
    }
}
