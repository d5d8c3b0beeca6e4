package com.kaspaaio.core.config;

import com.kaspaaio.core.catalog.Profile;
import com.kaspaaio.core.catalog.ProfileCatalog;
import com.kaspaaio.core.catalog.SettingField;
import com.kaspaaio.core.catalog.SettingType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Fail-closed schema check over merged settings.
 */
@Component
public class SettingsSchema {

    public static final int MIN_PORT = 1024;
    public static final int MAX_PORT = 65535;

    private static final Pattern SHELL_META = Pattern.compile("[;&|`$<>\\\\!*?(){}\\[\\]'\"\\s#~]");
    private static final Pattern URL = Pattern.compile("^(https?|wss?)://[^\\s]+$");
    private static final Pattern KASPA_ADDRESS =
            Pattern.compile("^(kaspa|kaspatest|kaspadev|kaspasim):[qpzry9x8gf2tvdw0s3jn54khce6mua7l]{58,}$");
    private static final Pattern NUMBER = Pattern.compile("^-?\\d+(\\.\\d+)?$");

    /** Node-mode keys whose {@code remote} value needs a remote node URL. */
    static final List<String> NODE_MODE_KEYS = List.of("KASIA_NODE_MODE", "K_INDEXER_NODE_MODE", "SIMPLY_KASPA_NODE_MODE");

    private final ProfileCatalog catalog;

    public SettingsSchema(ProfileCatalog catalog) {
        this.catalog = catalog;
    }

    /** Global keys plus every key contributed by the selected profiles. */
    public Map<String, SettingField> relevantFields(Collection<String> profileIds) {
        var relevant = new LinkedHashMap<String, SettingField>();
        for (SettingField field : catalog.fields().values()) {
            if (isGlobal(field.key())) {
                relevant.put(field.key(), field);
            }
        }
        for (String id : profileIds) {
            for (SettingField field : catalog.get(id).fields()) {
                relevant.putIfAbsent(field.key(), field);
            }
        }
        return relevant;
    }

    private boolean isGlobal(String key) {
        for (Profile profile : catalog.all()) {
            for (SettingField field : profile.fields()) {
                if (field.key().equals(key)) return false;
            }
        }
        return true;
    }

    public Set<String> requiredKeys(Collection<String> profileIds) {
        var required = new LinkedHashSet<String>();
        relevantFields(profileIds).values().stream()
                .filter(SettingField::required)
                .forEach(f -> required.add(f.key()));
        for (String id : profileIds) {
            required.addAll(catalog.get(id).requiredSettings());
        }
        return required;
    }

    /**
     * Validates merged settings for the given selection.
     *
     * @return errors sorted by field; empty when the settings are acceptable
     */
    public List<FieldError> validate(Map<String, String> settings, Collection<String> profileIds) {
        var errors = new ArrayList<FieldError>();
        Map<String, SettingField> relevant = relevantFields(profileIds);

        for (var entry : settings.entrySet()) {
            String key = entry.getKey();
            String value = entry.getValue();
            if (!EnvFile.isValidKey(key)) {
                errors.add(new FieldError(key, "key must match " + EnvFile.KEY_PATTERN.pattern()));
                continue;
            }
            SettingField field = catalog.field(key).orElse(null);
            if (field == null) {
                errors.add(new FieldError(key, "unknown configuration key"));
                continue;
            }
            if (value == null || value.isEmpty()) {
                continue;
            }
            if (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
                errors.add(new FieldError(key, "value must be a single line"));
                continue;
            }
            String problem = checkType(field, value);
            if (problem != null) {
                errors.add(new FieldError(key, problem));
            }
        }

        for (String key : requiredKeys(profileIds)) {
            String value = settings.get(key);
            if (value == null || value.isBlank()) {
                errors.add(new FieldError(key, "is required"));
            }
        }

        errors.addAll(duplicatePorts(settings, relevant));
        errors.addAll(remoteNodeUrl(settings, relevant));
        errors.sort(Comparator.comparing(FieldError::field).thenComparing(FieldError::message));
        return errors;
    }

    String checkType(SettingField field, String value) {
        return switch (field.type()) {
            case PORT -> checkPort(value);
            case NUMBER -> NUMBER.matcher(value).matches() ? null : "must be a number";
            case BOOLEAN -> "true".equals(value) || "false".equals(value) ? null : "must be true or false";
            case ENUM -> field.options().contains(value) ? null
                    : "must be one of " + String.join(", ", field.options());
            case PATH -> SHELL_META.matcher(value).find()
                    ? "path must not contain shell metacharacters or spaces" : null;
            case URL -> URL.matcher(value).matches() ? null : "must be an http(s) or ws(s) URL";
            case KASPA_ADDRESS -> KASPA_ADDRESS.matcher(value).matches() ? null : "must be a valid Kaspa address";
            case SECRET -> checkSecret(value);
            case STRING -> null;
        };
    }

    private static String checkPort(String value) {
        try {
            int port = Integer.parseInt(value.trim());
            if (port < MIN_PORT || port > MAX_PORT) {
                return "port " + port + " is outside " + MIN_PORT + "-" + MAX_PORT;
            }
            return null;
        } catch (NumberFormatException e) {
            return "must be a port number";
        }
    }

    private static String checkSecret(String value) {
        if (value.length() < 12) {
            return "must be at least 12 characters";
        }
        return value.chars().anyMatch(Character::isWhitespace) ? "must not contain whitespace" : null;
    }

    private List<FieldError> duplicatePorts(Map<String, String> settings, Map<String, SettingField> relevant) {
        var errors = new ArrayList<FieldError>();
        var firstOwner = new HashMap<String, String>();
        relevant.values().stream()
                .filter(f -> f.type() == SettingType.PORT)
                .map(SettingField::key)
                .sorted()
                .forEach(key -> {
                    String value = settings.get(key);
                    if (value == null || value.isBlank()) return;
                    String owner = firstOwner.putIfAbsent(value.trim(), key);
                    if (owner != null) {
                        errors.add(new FieldError(key, "port " + value + " is already used by " + owner));
                    }
                });
        return errors;
    }

    private List<FieldError> remoteNodeUrl(Map<String, String> settings, Map<String, SettingField> relevant) {
        var errors = new ArrayList<FieldError>();
        String url = settings.get("REMOTE_KASPA_NODE_WRPC_URL");
        for (String key : NODE_MODE_KEYS) {
            if (relevant.containsKey(key) && "remote".equals(settings.get(key)) && (url == null || url.isBlank())) {
                errors.add(new FieldError("REMOTE_KASPA_NODE_WRPC_URL", "is required when " + key + " is remote"));
                break;
            }
        }
        return errors;
    }
}
