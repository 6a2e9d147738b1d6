package com.sitedigest.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PipelinePropertiesTest {

    @Test
    @DisplayName("defaults are valid")
    void defaults() {
        var props = new PipelineProperties();
        assertDoesNotThrow(props::validate);
        assertEquals(50, props.getUrlLimit());
        assertEquals(10, props.getBatchLimit());
        assertEquals(3, props.getMaxRetries());
        assertEquals(2000, props.getContentCharLimit());
        assertEquals(List.of("auth", "account", "commerce", "admin", "legal", "download"),
                props.getExcludedPatterns().stream().map(PipelineProperties.Exclusion::getCategory).toList());
    }

    @Test
    @DisplayName("non-positive limits and negative retries fail validation")
    void rejectsBadLimits() {
        var props = new PipelineProperties();
        props.setUrlLimit(0);
        assertThrows(IllegalStateException.class, props::validate);

        props = new PipelineProperties();
        props.setBatchLimit(-1);
        assertThrows(IllegalStateException.class, props::validate);

        props = new PipelineProperties();
        props.setMaxRetries(-1);
        assertThrows(IllegalStateException.class, props::validate);
    }

    @Test
    @DisplayName("an unparsable exclusion pattern fails validation")
    void rejectsBadPattern() {
        var props = new PipelineProperties();
        props.setExcludedPatterns(List.of(new PipelineProperties.Exclusion("broken", "(unclosed")));

        var e = assertThrows(IllegalStateException.class, props::validate);
        assertTrue(e.getMessage().contains("broken"));
    }
}
