package org.dxworks.mathframe.latex;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Rewrites OCR-produced and hand-written LaTeX into the subset the grammar engine accepts.
 * Handles constructs the engine does not understand natively:
 * - Strips surrounding math delimiters
 * - Heals braces dropped or duplicated by OCR, and words OCR split into letters
 * - Collapses spacing runs and drops trailing spacing noise
 * - Maps legacy font switches, \operatorname and \mathcal onto supported forms
 * - Removes sizing, style and line-break commands outside environments
 * - Turns array/tabular into matrix
 * - Re-brackets X_{a}^{b} so the subscript binds before the superscript
 * <p>
 * Never fails; the result is always a string, possibly empty.
 */
public final class LatexNormalizer {

    private static final Logger log = LoggerFactory.getLogger(LatexNormalizer.class);

    private static final Pattern STYLE_COMMAND_BARE_LETTER = Pattern.compile(
            "\\\\(mathcal|mathbb|mathbf|mathrm|mathit|mathsf|mathtt|mathfrak|mathscr|boldsymbol)\\s+([A-Za-z])");

    private static final List<String> SPACED_WORDS = List.of(
            "log", "gen", "sin", "cos", "tan", "exp", "ln",
            "Enc", "Dec", "CLS", "SEP");
    private static final Map<Pattern, String> SPACED_WORD_PATTERNS = buildSpacedWordPatterns();

    private static final Pattern QQUAD_RUN = Pattern.compile("(\\\\qquad\\s*){3,}");
    private static final Pattern QUAD_RUN = Pattern.compile("(\\\\quad\\s*){3,}");
    private static final Pattern THIN_SPACE_RUN = Pattern.compile("(\\\\[,:;]\\s*){3,}");
    private static final Pattern TRAILING_SPACING_AND_UNDERSCORE = Pattern.compile("(\\\\[;,!]\\s*)+\\\\_\\s*$");
    private static final Pattern TRAILING_SPACING = Pattern.compile("(\\\\[;,!]\\s*)+$");

    private static final List<LegacyFont> LEGACY_FONTS = List.of(
            new LegacyFont("bf", "mathbf"),
            new LegacyFont("it", "mathit"),
            new LegacyFont("rm", "mathrm"),
            new LegacyFont("cal", "mathcal"),
            new LegacyFont("tt", "mathtt"),
            new LegacyFont("sf", "mathsf"));

    private static final Pattern STYLE_SWITCHES = Pattern.compile(
            "\\\\(displaystyle|textstyle|scriptstyle|scriptscriptstyle|limits|nolimits)(?![A-Za-z])\\s*");
    private static final String SIZING_COMMANDS =
            "\\\\(left|right|middle|bigl|bigr|bigm|Bigl|Bigr|Bigm|biggl|biggr|biggm|Biggl|Biggr|Biggm|big|Big|bigg|Bigg)(?![A-Za-z])\\s*";
    private static final Pattern SIZING_NULL_DELIMITER = Pattern.compile(SIZING_COMMANDS + "\\.");
    private static final Pattern SIZING = Pattern.compile(SIZING_COMMANDS);
    private static final Pattern BREAKS = Pattern.compile(
            "\\\\(newline|linebreak|pagebreak|nolinebreak|allowbreak|qquad|quad)(?![A-Za-z])");
    private static final List<String> OVERLAP_COMMANDS = List.of(
            "\\rlap", "\\llap", "\\mathrlap", "\\mathllap", "\\mathclap");

    private static final List<String> TABLE_ENVIRONMENTS = List.of("array", "tabular");

    private static final Pattern LETTER_SUB_GROUP_SUP = Pattern.compile(
            "(?<![A-Za-z\\\\])([A-Za-z])(_\\{[^}]*\\})(\\^\\{[^}]*\\})");
    private static final Pattern LETTER_SUB_CHAR_SUP = Pattern.compile(
            "(?<![A-Za-z\\\\])([A-Za-z])(_[A-Za-z0-9])(\\^\\{[^}]*\\})");
    private static final Pattern COMMAND_SUB_GROUP_SUP = Pattern.compile(
            "(\\\\[A-Za-z]+\\{[^}]*\\})(_\\{[^}]*\\})(\\^\\{[^}]*\\})");

    private static final Pattern MULTI_SPACE = Pattern.compile(" {2,}");

    private LatexNormalizer() {
        // utility class
    }

    public static String normalize(String latex) {
        if (latex == null) return "";

        String result = stripMathDelimiters(latex);
        result = healBraces(result);
        result = healSpacedWords(result);
        result = collapseSpacing(result);
        result = replaceLegacyFonts(result);
        result = replaceOperatorName(result);
        result = replaceCalligraphic(result);
        result = removeSizingAndBreaks(result);
        result = convertTablesToMatrix(result);
        result = rebracketSubSup(result);
        result = cleanup(result);

        if (log.isDebugEnabled() && !result.equals(latex)) {
            log.debug("Normalized '{}' to '{}'", latex, result);
        }
        return result;
    }

    static String stripMathDelimiters(String latex) {
        String s = latex.trim();
        if (s.startsWith("\\(") || s.startsWith("\\[")) {
            s = s.substring(2);
        }
        if ((s.endsWith("\\)") || s.endsWith("\\]")) && !LatexTextUtils.isEscaped(s, s.length() - 2)) {
            s = s.substring(0, s.length() - 2);
        }
        int start = 0;
        while (start < s.length() && s.charAt(start) == '$') {
            start++;
        }
        int end = s.length();
        while (end > start && s.charAt(end - 1) == '$' && !LatexTextUtils.isEscaped(s, end - 1)) {
            end--;
        }
        return s.substring(start, end).trim();
    }

    static String healBraces(String latex) {
        String s = STYLE_COMMAND_BARE_LETTER.matcher(latex).replaceAll("\\\\$1{$2}");
        return LatexTextUtils.collapseRedundantBraces(s);
    }

    static String healSpacedWords(String latex) {
        String s = latex;
        for (Map.Entry<Pattern, String> entry : SPACED_WORD_PATTERNS.entrySet()) {
            s = entry.getKey().matcher(s).replaceAll(entry.getValue());
        }
        return s;
    }

    static String collapseSpacing(String latex) {
        String s = QQUAD_RUN.matcher(latex).replaceAll(Matcher.quoteReplacement("\\quad "));
        s = QUAD_RUN.matcher(s).replaceAll(Matcher.quoteReplacement("\\quad "));
        s = THIN_SPACE_RUN.matcher(s).replaceAll(Matcher.quoteReplacement("\\; "));
        s = TRAILING_SPACING_AND_UNDERSCORE.matcher(s).replaceAll("");
        s = TRAILING_SPACING.matcher(s).replaceAll("");
        return s.replace("\\_", "_");
    }

    static String replaceLegacyFonts(String latex) {
        String s = latex;
        for (LegacyFont font : LEGACY_FONTS) {
            if (!s.contains(font.command)) continue;
            // {\bf X} switches the rest of the group
            s = font.groupSwitch.matcher(s).replaceAll(font.replacement + "{");
            s = font.withGroup.matcher(s).replaceAll(font.replacement + "{");
            s = font.bare.matcher(s).replaceAll(font.replacement + " ");
        }
        return s;
    }

    static String replaceOperatorName(String latex) {
        String s = latex.replace("\\operatorname*", "\\operatorname");
        return LatexTextUtils.replaceCommandGroup(s, "\\operatorname",
                content -> "\\mathrm{" + content + "}", "\\mathrm");
    }

    static String replaceCalligraphic(String latex) {
        String s = latex;
        for (String command : List.of("\\mathcal", "\\mathscr")) {
            s = LatexTextUtils.replaceCommandGroup(s, command, LatexNormalizer::scriptGroup, null);
        }
        return s;
    }

    private static String scriptGroup(String content) {
        String mapped = MathAlphabets.toScript(content.trim());
        return mapped.codePointCount(0, mapped.length()) == 1 ? mapped : "{" + mapped + "}";
    }

    static String removeSizingAndBreaks(String latex) {
        String s = STYLE_SWITCHES.matcher(latex).replaceAll("");
        s = SIZING_NULL_DELIMITER.matcher(s).replaceAll("");
        s = SIZING.matcher(s).replaceAll("");
        s = BREAKS.matcher(s).replaceAll(" ");
        s = replaceTopLevelRowSeparators(s);
        for (String overlap : OVERLAP_COMMANDS) {
            s = LatexTextUtils.replaceCommandGroup(s, overlap, content -> content, null);
        }
        return s;
    }

    /** Replaces {@code \\} with a space wherever it is not inside a begin/end environment. */
    private static String replaceTopLevelRowSeparators(String latex) {
        if (!latex.contains("\\\\")) return latex;
        StringBuilder sb = new StringBuilder(latex.length());
        int envDepth = 0;
        int i = 0;
        while (i < latex.length()) {
            char c = latex.charAt(i);
            if (c != '\\') {
                sb.append(c);
                i++;
                continue;
            }
            if (LatexTextUtils.isCommandAt(latex, i, "\\begin")) {
                envDepth++;
            } else if (LatexTextUtils.isCommandAt(latex, i, "\\end")) {
                envDepth = Math.max(0, envDepth - 1);
            } else if (i + 1 < latex.length() && latex.charAt(i + 1) == '\\' && envDepth == 0) {
                sb.append(' ');
                i += 2;
                continue;
            }
            sb.append(c);
            if (i + 1 < latex.length()) {
                sb.append(latex.charAt(i + 1));
            }
            i += 2;
        }
        return sb.toString();
    }

    static String convertTablesToMatrix(String latex) {
        String s = latex;
        for (String env : TABLE_ENVIRONMENTS) {
            s = convertTableToMatrix(s, env);
        }
        return s;
    }

    private static String convertTableToMatrix(String latex, String env) {
        String begin = "\\begin{" + env + "}";
        if (!latex.contains(begin)) return latex;

        StringBuilder sb = new StringBuilder(latex.length());
        int i = 0;
        while (i < latex.length()) {
            if (!latex.startsWith(begin, i)) {
                sb.append(latex.charAt(i));
                i++;
                continue;
            }
            sb.append("\\begin{matrix}");
            i += begin.length();
            int next = LatexTextUtils.skipSpaces(latex, i);
            // tabular position argument, e.g. [t]
            if (next < latex.length() && latex.charAt(next) == '[') {
                int close = latex.indexOf(']', next);
                if (close > 0) {
                    next = LatexTextUtils.skipSpaces(latex, close + 1);
                    i = next;
                }
            }
            if (next < latex.length() && latex.charAt(next) == '{') {
                int close = LatexTextUtils.findMatchingBrace(latex, next);
                if (close > 0) {
                    i = close + 1;
                }
            }
        }
        return sb.toString().replace("\\end{" + env + "}", "\\end{matrix}");
    }

    static String rebracketSubSup(String latex) {
        String s = LETTER_SUB_GROUP_SUP.matcher(latex).replaceAll("{$1$2}$3");
        s = LETTER_SUB_CHAR_SUP.matcher(s).replaceAll("{$1$2}$3");
        return COMMAND_SUB_GROUP_SUP.matcher(s).replaceAll(m ->
                Matcher.quoteReplacement("{" + m.group(1) + m.group(2) + "}" + m.group(3)));
    }

    static String cleanup(String latex) {
        String s = latex;
        String previous;
        do {
            previous = s;
            s = removeEmptyGroups(s);
        } while (!s.equals(previous));
        s = MULTI_SPACE.matcher(s).replaceAll(" ");
        return s.trim();
    }

    private static Map<Pattern, String> buildSpacedWordPatterns() {
        Map<Pattern, String> patterns = new LinkedHashMap<>();
        for (String word : SPACED_WORDS) {
            List<String> letters = new ArrayList<>();
            for (char c : word.toCharArray()) {
                letters.add(String.valueOf(c));
            }
            String regex = "(?<![A-Za-z])" + String.join(" +", letters) + "(?![A-Za-z])";
            patterns.put(Pattern.compile(regex), word);
        }
        return patterns;
    }

    /** Drops empty brace pairs unless the opening brace is escaped. */
    private static String removeEmptyGroups(String latex) {
        StringBuilder sb = new StringBuilder(latex.length());
        for (int i = 0; i < latex.length(); i++) {
            if (latex.startsWith("{}", i) && !LatexTextUtils.isEscaped(latex, i)) {
                i++;
                continue;
            }
            sb.append(latex.charAt(i));
        }
        return sb.toString();
    }

    private static final class LegacyFont {
        final String command;
        final String replacement;
        final Pattern groupSwitch;
        final Pattern withGroup;
        final Pattern bare;

        LegacyFont(String legacy, String target) {
            this.command = "\\" + legacy;
            this.replacement = Matcher.quoteReplacement("\\" + target);
            this.groupSwitch = Pattern.compile("\\{\\\\" + legacy + "(?![A-Za-z])\\s*");
            this.withGroup = Pattern.compile("\\\\" + legacy + "(?![A-Za-z])\\s*\\{");
            this.bare = Pattern.compile("\\\\" + legacy + "(?![A-Za-z])\\s*");
        }
    }
}
