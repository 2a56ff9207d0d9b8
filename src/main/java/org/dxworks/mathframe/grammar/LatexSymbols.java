package org.dxworks.mathframe.grammar;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Lookup tables mapping LaTeX command names (without the backslash) to Unicode glyphs.
 */
public final class LatexSymbols {

    /** Symbols rendered as {@code <mi>}. */
    public static final Map<String, String> IDENTIFIERS;
    /** Symbols rendered as {@code <mo>}. */
    public static final Map<String, String> OPERATORS;
    /** Summation-like operators whose scripts stack under and over. */
    public static final Map<String, String> LARGE_OPERATORS;
    /** Integral-like operators whose scripts stay at the side. */
    public static final Map<String, String> INTEGRALS;
    /** Function names rendered upright, scripts at the side. */
    public static final Set<String> FUNCTIONS = Set.of(
            "sin", "cos", "tan", "cot", "sec", "csc", "arcsin", "arccos", "arctan",
            "sinh", "cosh", "tanh", "coth", "log", "ln", "lg", "exp", "deg", "dim",
            "ker", "hom", "arg", "mod", "bmod");
    /** Function names whose scripts stack under and over, keyed to their rendered text. */
    public static final Map<String, String> LIMIT_FUNCTIONS = Map.of(
            "lim", "lim", "max", "max", "min", "min", "sup", "sup", "inf", "inf",
            "det", "det", "gcd", "gcd", "Pr", "Pr", "limsup", "lim sup", "liminf", "lim inf");
    /** Spacing commands and escapes, keyed to their width. */
    public static final Map<String, String> SPACES = Map.ofEntries(
            Map.entry(",", "0.167em"), Map.entry(":", "0.222em"), Map.entry(">", "0.222em"),
            Map.entry(";", "0.278em"), Map.entry(" ", "0.25em"), Map.entry("thinspace", "0.167em"),
            Map.entry("medspace", "0.222em"), Map.entry("thickspace", "0.278em"),
            Map.entry("enspace", "0.5em"), Map.entry("quad", "1em"), Map.entry("qquad", "2em"));
    /** Commands that produce no output. */
    public static final Set<String> IGNORED = Set.of(
            "!", "negthinspace", "hline", "nonumber", "notag", "centering", "noindent",
            "displaystyle", "textstyle", "scriptstyle", "scriptscriptstyle", "limits", "nolimits",
            "left", "right", "middle", "big", "Big", "bigg", "Bigg", "bigl", "bigr", "Bigl", "Bigr",
            "biggl", "biggr", "Biggl", "Biggr", "bigm", "Bigm", "allowbreak", "strut", "relax");

    /** Accent commands, keyed to the mark glyph. */
    public static final Map<String, String> ACCENTS = Map.ofEntries(
            Map.entry("hat", "^"), Map.entry("widehat", "^"),
            Map.entry("tilde", "~"), Map.entry("widetilde", "~"),
            Map.entry("bar", "¯"), Map.entry("overline", "¯"),
            Map.entry("dot", "˙"), Map.entry("ddot", "¨"),
            Map.entry("breve", "˘"), Map.entry("check", "ˇ"),
            Map.entry("vec", "\u20D7"), Map.entry("acute", "´"), Map.entry("grave", "`"),
            Map.entry("overrightarrow", "→"), Map.entry("overleftarrow", "←"),
            Map.entry("overbrace", "⏞"));
    /** Accent-like commands that place their mark below the base. */
    public static final Map<String, String> UNDER_ACCENTS = Map.of(
            "underline", "_", "underbrace", "⏟");

    static {
        Map<String, String> identifiers = new HashMap<>();
        String[][] greek = {
                {"alpha", "α"}, {"beta", "β"}, {"gamma", "γ"}, {"delta", "δ"},
                {"epsilon", "ϵ"}, {"varepsilon", "ε"}, {"zeta", "ζ"}, {"eta", "η"},
                {"theta", "θ"}, {"vartheta", "ϑ"}, {"iota", "ι"}, {"kappa", "κ"},
                {"varkappa", "ϰ"}, {"lambda", "λ"}, {"mu", "μ"}, {"nu", "ν"},
                {"xi", "ξ"}, {"omicron", "ο"}, {"pi", "π"}, {"varpi", "ϖ"},
                {"rho", "ρ"}, {"varrho", "ϱ"}, {"sigma", "σ"}, {"varsigma", "ς"},
                {"tau", "τ"}, {"upsilon", "υ"}, {"phi", "ϕ"}, {"varphi", "φ"},
                {"chi", "χ"}, {"psi", "ψ"}, {"omega", "ω"},
                {"Gamma", "Γ"}, {"Delta", "Δ"}, {"Theta", "Θ"}, {"Lambda", "Λ"},
                {"Xi", "Ξ"}, {"Pi", "Π"}, {"Sigma", "Σ"}, {"Upsilon", "Υ"},
                {"Phi", "Φ"}, {"Psi", "Ψ"}, {"Omega", "Ω"}
        };
        put(identifiers, greek);
        put(identifiers, new String[][]{
                {"infty", "∞"}, {"ell", "ℓ"}, {"hbar", "ℏ"}, {"hslash", "ℏ"},
                {"imath", "ı"}, {"jmath", "ȷ"}, {"aleph", "ℵ"}, {"beth", "ℶ"},
                {"wp", "℘"}, {"Re", "ℜ"}, {"Im", "ℑ"}, {"emptyset", "∅"},
                {"varnothing", "∅"}, {"top", "⊤"}, {"bot", "⊥"}, {"angle", "∠"},
                {"triangle", "△"}, {"Box", "□"}, {"diamond", "⋄"}, {"clubsuit", "♣"},
                {"heartsuit", "♡"}, {"spadesuit", "♠"}, {"diamondsuit", "♢"},
                {"flat", "♭"}, {"natural", "♮"}, {"sharp", "♯"}, {"checkmark", "✓"}
        });
        IDENTIFIERS = Collections.unmodifiableMap(identifiers);

        Map<String, String> operators = new HashMap<>();
        put(operators, new String[][]{
                // binary operators
                {"pm", "±"}, {"mp", "∓"}, {"times", "×"}, {"div", "÷"},
                {"cdot", "⋅"}, {"ast", "∗"}, {"star", "⋆"}, {"circ", "∘"},
                {"bullet", "∙"}, {"oplus", "⊕"}, {"ominus", "⊖"}, {"otimes", "⊗"},
                {"oslash", "⊘"}, {"odot", "⊙"}, {"cap", "∩"}, {"cup", "∪"},
                {"sqcap", "⊓"}, {"sqcup", "⊔"}, {"uplus", "⊎"}, {"amalg", "⨿"},
                {"setminus", "∖"}, {"backslash", "∖"}, {"wedge", "∧"}, {"land", "∧"},
                {"vee", "∨"}, {"lor", "∨"}, {"dagger", "†"}, {"ddagger", "‡"},
                {"wr", "≀"},
                // relations
                {"le", "≤"}, {"leq", "≤"}, {"ge", "≥"}, {"geq", "≥"},
                {"leqslant", "⩽"}, {"geqslant", "⩾"}, {"neq", "≠"}, {"ne", "≠"},
                {"approx", "≈"}, {"equiv", "≡"}, {"sim", "∼"}, {"simeq", "≃"},
                {"cong", "≅"}, {"propto", "∝"}, {"ll", "≪"}, {"gg", "≫"},
                {"lesssim", "≲"}, {"gtrsim", "≳"}, {"prec", "≺"}, {"succ", "≻"},
                {"preceq", "⪯"}, {"succeq", "⪰"}, {"subset", "⊂"}, {"supset", "⊃"},
                {"subseteq", "⊆"}, {"supseteq", "⊇"}, {"subsetneq", "⊊"},
                {"supsetneq", "⊋"}, {"in", "∈"}, {"notin", "∉"}, {"ni", "∋"},
                {"mid", "∣"}, {"nmid", "∤"}, {"parallel", "∥"}, {"perp", "⊥"},
                {"vdash", "⊢"}, {"dashv", "⊣"}, {"models", "⊨"}, {"asymp", "≍"},
                {"doteq", "≐"}, {"coloneqq", "≔"}, {"triangleq", "≜"}, {"not", "\u0338"},
                // arrows
                {"to", "→"}, {"rightarrow", "→"}, {"leftarrow", "←"}, {"gets", "←"},
                {"leftrightarrow", "↔"}, {"Rightarrow", "⇒"}, {"Leftarrow", "⇐"},
                {"Leftrightarrow", "⇔"}, {"implies", "⟹"}, {"impliedby", "⟸"},
                {"iff", "⟺"}, {"mapsto", "↦"}, {"longmapsto", "⟼"},
                {"longrightarrow", "⟶"}, {"longleftarrow", "⟵"},
                {"longleftrightarrow", "⟷"}, {"Longrightarrow", "⟹"},
                {"Longleftarrow", "⟸"}, {"Longleftrightarrow", "⟺"}, {"uparrow", "↑"},
                {"downarrow", "↓"}, {"updownarrow", "↕"}, {"Uparrow", "⇑"},
                {"Downarrow", "⇓"}, {"nearrow", "↗"}, {"searrow", "↘"},
                {"swarrow", "↙"}, {"nwarrow", "↖"}, {"hookrightarrow", "↪"},
                {"hookleftarrow", "↩"}, {"rightleftharpoons", "⇌"},
                // logic and misc
                {"forall", "∀"}, {"exists", "∃"}, {"nexists", "∄"}, {"neg", "¬"},
                {"lnot", "¬"}, {"partial", "∂"}, {"nabla", "∇"}, {"therefore", "∴"},
                {"because", "∵"}, {"prime", "′"}, {"colon", ":"},
                // dots
                {"cdots", "⋯"}, {"ldots", "…"}, {"dots", "…"}, {"dotsc", "…"},
                {"dotsb", "⋯"}, {"vdots", "⋮"}, {"ddots", "⋱"},
                // delimiters
                {"langle", "⟨"}, {"rangle", "⟩"}, {"lceil", "⌈"}, {"rceil", "⌉"},
                {"lfloor", "⌊"}, {"rfloor", "⌋"}, {"vert", "|"}, {"lvert", "|"},
                {"rvert", "|"}, {"Vert", "‖"}, {"lVert", "‖"}, {"rVert", "‖"},
                {"lbrace", "{"}, {"rbrace", "}"}, {"lbrack", "["}, {"rbrack", "]"}
        });
        OPERATORS = Collections.unmodifiableMap(operators);

        Map<String, String> large = new HashMap<>();
        put(large, new String[][]{
                {"sum", "∑"}, {"prod", "∏"}, {"coprod", "∐"}, {"bigcup", "⋃"},
                {"bigcap", "⋂"}, {"bigvee", "⋁"}, {"bigwedge", "⋀"},
                {"bigoplus", "⨁"}, {"bigotimes", "⨂"}, {"bigodot", "⨀"},
                {"biguplus", "⨄"}, {"bigsqcup", "⨆"}
        });
        LARGE_OPERATORS = Collections.unmodifiableMap(large);

        Map<String, String> integrals = new HashMap<>();
        put(integrals, new String[][]{
                {"int", "∫"}, {"iint", "∬"}, {"iiint", "∭"}, {"oint", "∮"},
                {"oiint", "∯"}
        });
        INTEGRALS = Collections.unmodifiableMap(integrals);
    }

    /** Escaped single characters ({@code \{}, {@code \|}, ...) rendered as {@code <mo>}. */
    public static final Map<String, String> ESCAPED_OPERATORS = Map.of(
            "{", "{", "}", "}", "|", "‖", "%", "%", "&", "&", "_", "_", "#", "#", "$", "$");

    private LatexSymbols() {
        // utility class
    }

    public static boolean isKnown(String command) {
        return IDENTIFIERS.containsKey(command) || OPERATORS.containsKey(command)
                || LARGE_OPERATORS.containsKey(command) || INTEGRALS.containsKey(command)
                || FUNCTIONS.contains(command) || LIMIT_FUNCTIONS.containsKey(command)
                || SPACES.containsKey(command) || IGNORED.contains(command);
    }

    private static void put(Map<String, String> target, String[][] entries) {
        for (String[] entry : entries) {
            target.put(entry[0], entry[1]);
        }
    }
}
