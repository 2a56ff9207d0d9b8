package org.dxworks.mathframe;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class MathframeConfig {

    private static final Logger log = LoggerFactory.getLogger(MathframeConfig.class);

    private static final String CONFIG_FILE_NAME = "mathframe-config.yml";
    private static final DisplayStyle DEFAULT_DISPLAY_STYLE = DisplayStyle.INLINE;
    private static final boolean DEFAULT_PRETTY_PRINT = false;
    private static final int DEFAULT_MAX_FORMULA_LENGTH = 10000;

    private final DisplayStyle displayStyle;
    private final boolean prettyPrint;
    private final int maxFormulaLength;

    private MathframeConfig(DisplayStyle displayStyle, boolean prettyPrint, int maxFormulaLength) {
        this.displayStyle = displayStyle;
        this.prettyPrint = prettyPrint;
        this.maxFormulaLength = maxFormulaLength;
    }

    public DisplayStyle getDisplayStyle() {
        return displayStyle;
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    public int getMaxFormulaLength() {
        return maxFormulaLength;
    }

    public static MathframeConfig defaults() {
        return new MathframeConfig(DEFAULT_DISPLAY_STYLE, DEFAULT_PRETTY_PRINT, DEFAULT_MAX_FORMULA_LENGTH);
    }

    public static MathframeConfig load() {
        return load(Paths.get(CONFIG_FILE_NAME));
    }

    public static MathframeConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            return defaults();
        }

        try {
            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            YamlConfig yamlConfig = yamlMapper.readValue(configPath.toFile(), YamlConfig.class);
            if (yamlConfig != null) {
                DisplayStyle effectiveDisplayStyle = yamlConfig.displayStyle != null
                        ? DisplayStyle.fromName(yamlConfig.displayStyle)
                        : DEFAULT_DISPLAY_STYLE;
                boolean effectivePrettyPrint = yamlConfig.prettyPrint != null
                        ? yamlConfig.prettyPrint
                        : DEFAULT_PRETTY_PRINT;
                int effectiveMaxFormulaLength = (yamlConfig.maxFormulaLength != null && yamlConfig.maxFormulaLength > 0)
                        ? yamlConfig.maxFormulaLength
                        : DEFAULT_MAX_FORMULA_LENGTH;

                return new MathframeConfig(effectiveDisplayStyle, effectivePrettyPrint, effectiveMaxFormulaLength);
            }
        } catch (IOException e) {
            log.warn("Could not read {}, using defaults: {}", configPath, e.getMessage());
        }

        return defaults();
    }

    public static MathframeConfig with(DisplayStyle displayStyle, boolean prettyPrint, int maxFormulaLength) {
        DisplayStyle effectiveDisplayStyle = displayStyle != null ? displayStyle : DEFAULT_DISPLAY_STYLE;
        int effectiveMaxFormulaLength = maxFormulaLength > 0 ? maxFormulaLength : DEFAULT_MAX_FORMULA_LENGTH;
        return new MathframeConfig(effectiveDisplayStyle, prettyPrint, effectiveMaxFormulaLength);
    }

    private static class YamlConfig {
        public String displayStyle;
        public Boolean prettyPrint;
        public Integer maxFormulaLength;
    }
}
