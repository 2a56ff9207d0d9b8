package org.dxworks.mathframe;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MathframeConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void missingFileGivesDefaults() {
        MathframeConfig config = MathframeConfig.load(tempDir.resolve("absent.yml"));
        assertEquals(DisplayStyle.INLINE, config.getDisplayStyle());
        assertFalse(config.isPrettyPrint());
        assertEquals(10000, config.getMaxFormulaLength());
    }

    @Test
    void readsAllKeys() throws IOException {
        Path file = tempDir.resolve("mathframe-config.yml");
        Files.writeString(file, "displayStyle: display\nprettyPrint: true\nmaxFormulaLength: 50\n");

        MathframeConfig config = MathframeConfig.load(file);

        assertEquals(DisplayStyle.DISPLAY, config.getDisplayStyle());
        assertTrue(config.isPrettyPrint());
        assertEquals(50, config.getMaxFormulaLength());
    }

    @Test
    void missingKeysAndInvalidLengthFallBack() throws IOException {
        Path file = tempDir.resolve("mathframe-config.yml");
        Files.writeString(file, "maxFormulaLength: -3\n");

        MathframeConfig config = MathframeConfig.load(file);

        assertEquals(DisplayStyle.INLINE, config.getDisplayStyle());
        assertFalse(config.isPrettyPrint());
        assertEquals(10000, config.getMaxFormulaLength());
    }

    @Test
    void unreadableFileGivesDefaults() throws IOException {
        Path file = tempDir.resolve("mathframe-config.yml");
        Files.writeString(file, "unknownKey: 1\n");

        assertEquals(10000, MathframeConfig.load(file).getMaxFormulaLength());
    }

    @Test
    void withAppliesDefaultsForMissingValues() {
        MathframeConfig config = MathframeConfig.with(null, true, 0);
        assertEquals(DisplayStyle.INLINE, config.getDisplayStyle());
        assertTrue(config.isPrettyPrint());
        assertEquals(10000, config.getMaxFormulaLength());
    }

    @Test
    void displayStyleAcceptsBothSpellings() {
        assertEquals(DisplayStyle.DISPLAY, DisplayStyle.fromName("block"));
        assertEquals(DisplayStyle.DISPLAY, DisplayStyle.fromName(" Display "));
        assertEquals(DisplayStyle.INLINE, DisplayStyle.fromName("whatever"));
        assertEquals("block", DisplayStyle.DISPLAY.getMathmlValue());
    }
}
