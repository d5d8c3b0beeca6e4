package com.kaspaaio.core.catalog;

import java.util.List;

/**
 * Schema entry for one configuration key.
 *
 * @param key         environment key, e.g. {@code KASPA_NETWORK}
 * @param type        value type used for validation
 * @param required    whether a non-blank value must be present after defaulting
 * @param options     allowed values for {@link SettingType#ENUM}
 * @param description operator-facing help text
 */
public record SettingField(
    String key,
    SettingType type,
    boolean required,
    List<String> options,
    String description
) {

    public SettingField {
        options = options != null ? List.copyOf(options) : List.of();
    }

    public static SettingField of(String key, SettingType type, String description) {
        return new SettingField(key, type, false, List.of(), description);
    }

    public static SettingField required(String key, SettingType type, String description) {
        return new SettingField(key, type, true, List.of(), description);
    }

    public static SettingField choice(String key, List<String> options, String description) {
        return new SettingField(key, SettingType.ENUM, false, options, description);
    }

    public boolean isSecret() {
        return type == SettingType.SECRET;
    }
}
