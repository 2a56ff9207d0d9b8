package org.dxworks.mathframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.mathframe.convert.ConvertException;
import org.dxworks.mathframe.convert.FormulaConverter;
import org.dxworks.mathframe.grammar.AntlrGrammarEngine;
import org.dxworks.mathframe.latex.LatexNormalizer;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar mathframe.jar <input-file> <output-file>");
            System.err.println("  <input-file>:  UTF-8 text file, one LaTeX formula per line ('%' lines are skipped)");
            System.err.println("  <output-file>: Path to output JSONL file");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.isRegularFile(input)) {
            System.err.println("Error: Input file does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        // Create parent directories if they don't exist
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting formula conversion...");
        System.out.println("Input: " + input.toAbsolutePath());

        MathframeConfig config = MathframeConfig.load();
        List<Formula> formulas = readFormulas(input);
        System.out.println("Found " + formulas.size() + " formulas");

        FormulaConverter converter = new FormulaConverter(new AntlrGrammarEngine(), config);
        Summary summary;
        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            summary = convertAll(formulas, converter, input.toString(), writer);
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Conversion complete!");
        System.out.println("Successfully converted: " + summary.converted + " formulas");
        if (summary.failed > 0) {
            System.out.println("Errors: " + summary.failed);
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    /** One formula of the input file, with its 1-based line number. */
    static final class Formula {
        final int line;
        final String latex;

        Formula(int line, String latex) {
            this.line = line;
            this.latex = latex;
        }
    }

    static final class Summary {
        final int converted;
        final int failed;

        Summary(int converted, int failed) {
            this.converted = converted;
            this.failed = failed;
        }
    }

    static List<Formula> readFormulas(Path input) throws IOException {
        List<String> lines = Files.readAllLines(input, StandardCharsets.UTF_8);
        List<Formula> formulas = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            // Remove BOM if present
            if (i == 0 && line.startsWith("\uFEFF")) {
                line = line.substring(1);
            }
            String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith("%")) {
                continue;
            }
            formulas.add(new Formula(i + 1, trimmed));
        }
        return formulas;
    }

    /**
     * Converts every formula and writes the JSONL records: a run header, one formula or
     * error record per input line (in completion order) and a done footer.
     */
    static Summary convertAll(List<Formula> formulas, FormulaConverter converter, String inputName,
                              Writer writer) throws IOException {
        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);
        int maxFormulaLength = converter.getConfig().getMaxFormulaLength();

        Map<String, Object> runInfo = new LinkedHashMap<>();
        runInfo.put("kind", "run");
        runInfo.put("started_at", startTime.toString());
        runInfo.put("input_path", inputName);
        runInfo.put("total_formulas", formulas.size());
        runInfo.put("display_style", converter.getConfig().getDisplayStyle().getMathmlValue());
        writeRecord(writer, runInfo);

        formulas.parallelStream().forEach(formula -> {
            int current = progressCounter.incrementAndGet();
            synchronized (System.out) {
                System.out.println("[" + current + "/" + formulas.size() + "] Converting line " + formula.line);
            }

            try {
                if (formula.latex.length() > maxFormulaLength) {
                    throw ConvertException.conversionFailed("formula is " + formula.latex.length()
                            + " characters long, the limit is " + maxFormulaLength, null);
                }
                writeRecord(writer, convert(formula, converter));
                successCount.incrementAndGet();
            } catch (ConvertException | RuntimeException e) {
                try {
                    writeRecord(writer, errorRecord(formula, e));
                } catch (IOException ioException) {
                    System.err.println("Failed to write error for line " + formula.line + ": " + ioException.getMessage());
                }

                errorCount.incrementAndGet();
                synchronized (System.err) {
                    System.err.println("  Error converting line " + formula.line + ": " + e.getMessage());
                }
            } catch (IOException e) {
                errorCount.incrementAndGet();
                System.err.println("Failed to write result for line " + formula.line + ": " + e.getMessage());
            }
        });

        Instant endTime = Instant.now();
        Map<String, Object> doneInfo = new LinkedHashMap<>();
        doneInfo.put("kind", "done");
        doneInfo.put("ended_at", endTime.toString());
        doneInfo.put("formulas_converted", successCount.get());
        doneInfo.put("formulas_with_errors", errorCount.get());
        doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
        writeRecord(writer, doneInfo);
        writer.flush();

        return new Summary(successCount.get(), errorCount.get());
    }

    private static Map<String, Object> convert(Formula formula, FormulaConverter converter) throws ConvertException {
        String mathml = converter.latexToMathml(formula.latex);
        String omml = converter.mathmlToOmml(mathml);
        if (converter.getConfig().isPrettyPrint()) {
            omml = converter.prettyPrintOmml(omml);
        }

        Map<String, Object> record = new LinkedHashMap<>();
        record.put("kind", "formula");
        record.put("line", formula.line);
        record.put("latex", formula.latex);
        record.put("normalized", LatexNormalizer.normalize(formula.latex));
        record.put("mathml", mathml);
        record.put("omml", omml);
        return record;
    }

    private static Map<String, Object> errorRecord(Formula formula, Exception e) {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("kind", "error");
        error.put("line", formula.line);
        error.put("latex", formula.latex);
        if (e instanceof ConvertException convertException) {
            error.put("errorKind", convertException.getKind().name());
            error.put("symbol", convertException.getSymbol());
        } else {
            error.put("errorKind", e.getClass().getSimpleName());
            error.put("symbol", null);
        }
        error.put("error", e.getMessage());
        return error;
    }

    private static void writeRecord(Writer writer, Map<String, Object> record) throws IOException {
        String json = MAPPER.writeValueAsString(record);
        // Write result immediately (synchronized to avoid concurrent writes)
        synchronized (writer) {
            writer.write(json);
            writer.write("\n");
            writer.flush();
        }
    }
}
