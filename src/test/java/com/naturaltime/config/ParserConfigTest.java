package com.naturaltime.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ParserConfigTest {

    @Test
    void testDefaults() {
        ParserConfig config = ParserConfig.defaults();

        assertNotNull(config);
        assertEquals(Constants.DEFAULT_TIMESTAMP_PATTERN, config.getTimestampPattern());
        assertEquals("text", config.getOutputFormat());
        assertFalse(config.isJsonOutput());
        assertEquals(Constants.MAX_EXPRESSION_LENGTH, config.getMaxExpressionLength());
        assertTrue(config.getVocabularyFiles().isEmpty());
        assertTrue(config.getExtraAliases().isEmpty());
    }

    @Test
    void testSetters() {
        ParserConfig config = new ParserConfig();

        config.setTimestampPattern("yyyy/MM/dd");
        config.setOutputFormat("JSON");
        config.setMaxExpressionLength(64);
        config.setVocabularyFiles(List.of(Path.of("fr.json")));
        config.setExtraAliases(Map.of("heure", "Hours"));

        assertEquals("yyyy/MM/dd", config.getTimestampPattern());
        assertTrue(config.isJsonOutput());
        assertEquals(64, config.getMaxExpressionLength());
        assertEquals(List.of(Path.of("fr.json")), config.getVocabularyFiles());
        assertEquals("Hours", config.getExtraAliases().get("heure"));
    }

    @Test
    void testNullCollectionsResetToEmpty() {
        ParserConfig config = new ParserConfig();

        config.setVocabularyFiles(null);
        config.setExtraAliases(null);

        assertTrue(config.getVocabularyFiles().isEmpty());
        assertTrue(config.getExtraAliases().isEmpty());
    }
}
