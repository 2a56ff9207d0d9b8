package org.dxworks.mathframe;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.mathframe.convert.FormulaConverter;
import org.dxworks.mathframe.grammar.AntlrGrammarEngine;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AppTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @TempDir
    Path tempDir;

    @Test
    void readFormulas_skipsBlankAndCommentLines() throws IOException {
        Path input = tempDir.resolve("formulas.tex");
        Files.writeString(input, "\uFEFFx^2\n\n% a comment\n  \\frac{a}{b}  \n", StandardCharsets.UTF_8);

        List<App.Formula> formulas = App.readFormulas(input);

        assertEquals(2, formulas.size());
        assertEquals(1, formulas.get(0).line);
        assertEquals("x^2", formulas.get(0).latex);
        assertEquals(4, formulas.get(1).line);
        assertEquals("\\frac{a}{b}", formulas.get(1).latex);
    }

    @Test
    void convertAll_writesRunFormulaErrorAndDoneRecords() throws IOException {
        List<App.Formula> formulas = List.of(
                new App.Formula(1, "x^2"),
                new App.Formula(2, "\\foo"),
                new App.Formula(3, "a+b+c+d+e+f+g+h+i+j+k"));
        FormulaConverter converter = new FormulaConverter(new AntlrGrammarEngine(),
                MathframeConfig.with(DisplayStyle.INLINE, true, 20));
        StringWriter out = new StringWriter();

        App.Summary summary = App.convertAll(formulas, converter, "formulas.tex", out);

        assertEquals(1, summary.converted);
        assertEquals(2, summary.failed);

        List<JsonNode> records = new ArrayList<>();
        for (String line : out.toString().split("\n")) {
            records.add(MAPPER.readTree(line));
        }
        assertEquals(5, records.size());
        assertEquals("run", records.get(0).get("kind").asText());
        assertEquals(3, records.get(0).get("total_formulas").asInt());
        assertEquals("done", records.get(4).get("kind").asText());
        assertEquals(1, records.get(4).get("formulas_converted").asInt());
        assertEquals(2, records.get(4).get("formulas_with_errors").asInt());

        Map<Integer, JsonNode> byLine = new HashMap<>();
        for (JsonNode record : records.subList(1, 4)) {
            byLine.put(record.get("line").asInt(), record);
        }

        JsonNode converted = byLine.get(1);
        assertEquals("formula", converted.get("kind").asText());
        assertEquals("x^2", converted.get("normalized").asText());
        assertTrue(converted.get("mathml").asText().contains("<msup>"));
        assertTrue(converted.get("omml").asText().contains("\n  <m:oMath>"), "pretty-printed OMML expected");

        JsonNode unsupported = byLine.get(2);
        assertEquals("error", unsupported.get("kind").asText());
        assertEquals("UNSUPPORTED_SYMBOL", unsupported.get("errorKind").asText());
        assertEquals("\\foo", unsupported.get("symbol").asText());

        JsonNode tooLong = byLine.get(3);
        assertEquals("CONVERSION_FAILED", tooLong.get("errorKind").asText());
        assertTrue(tooLong.get("symbol").isNull());
    }
}
