package com.docaudit.core.generator;

import java.util.Map;

/**
 * Options shared by report generators.
 *
 * @param title heading used in report titles
 * @param includeReadability whether readability sections are rendered
 * @param ciThreshold health score the summary compares against
 * @param customSettings generator-specific settings
 */
public record GeneratorConfig(
    String title,
    boolean includeReadability,
    int ciThreshold,
    Map<String, Object> customSettings
) {
    public static final String DEFAULT_TITLE = "Documentation Quality Report";

    public GeneratorConfig {
        if (title == null || title.isBlank()) {
            title = DEFAULT_TITLE;
        }
        if (ciThreshold < 0 || ciThreshold > 100) {
            throw new IllegalArgumentException("ciThreshold must be between 0 and 100");
        }
        if (customSettings == null) {
            customSettings = Map.of();
        }
    }

    public static GeneratorConfig defaults() {
        return new GeneratorConfig(DEFAULT_TITLE, true, 70, Map.of());
    }

    @SuppressWarnings("unchecked")
    public <T> T getSettingOrDefault(String key, T defaultValue) {
        T value = (T) customSettings.get(key);
        return value != null ? value : defaultValue;
    }
}
