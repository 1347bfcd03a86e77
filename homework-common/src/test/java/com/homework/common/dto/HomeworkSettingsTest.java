package com.homework.common.dto;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class HomeworkSettingsTest {

    private final HomeworkSettings defaults = HomeworkSettings.builder()
            .remindDays(3)
            .chartDays(5)
            .build();

    @Test
    void documentValuesOverrideDefaults() {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("remind_days", 7);
        document.put("chart_days", "10");
        document.put("theme_mode", "Dark");

        HomeworkSettings merged = defaults.merge(document);

        assertEquals(7, merged.getRemindDays());
        assertEquals(10, merged.getChartDays());
        assertEquals("Dark", merged.getExtras().get("theme_mode"));
    }

    @Test
    void camelCaseKeysAreAccepted() {
        HomeworkSettings merged = defaults.merge(Map.of("remindDays", 1, "chartDays", 2));

        assertEquals(1, merged.getRemindDays());
        assertEquals(2, merged.getChartDays());
        assertTrue(merged.getExtras().isEmpty());
    }

    @Test
    void nonNumericValuesKeepTheDefault() {
        HomeworkSettings merged = defaults.merge(Map.of("remind_days", "soon"));

        assertEquals(3, merged.getRemindDays());
    }

    @Test
    void documentFormKeepsUnknownKeys() {
        HomeworkSettings merged = defaults.merge(Map.of("window_mode", "percentage"));

        Map<String, Object> document = merged.toDocument();
        assertEquals("percentage", document.get("window_mode"));
        assertEquals(3, document.get("remind_days"));
        assertEquals(5, document.get("chart_days"));
    }
}
