package com.kaspaaio.core.config;

import com.kaspaaio.core.catalog.KaspaProfiles;
import com.kaspaaio.core.catalog.ProfileCatalog;
import com.kaspaaio.core.catalog.ProfileIdMigration;
import com.kaspaaio.core.catalog.ServiceRef;
import com.kaspaaio.core.catalog.SettingField;
import com.kaspaaio.core.error.AioError;
import com.kaspaaio.core.error.Result;
import com.kaspaaio.core.security.SecretMaterialFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Translates a resolved profile selection plus user settings into a compose document
 * and an environment file.
 *
 * <p>Generation is deterministic: services are ordered by startup order then name,
 * environments are sorted by key and no timestamps are emitted. Given the same
 * profiles and the same settings (secrets included) the output is byte-identical.
 *
 * <p>Missing required secrets are generated before validation runs, so a
 * generatable secret never causes a validation failure.
 */
@Service
public class ConfigGenerator {

    private static final Logger log = LoggerFactory.getLogger(ConfigGenerator.class);

    public static final String NETWORK = "kaspa-network";
    public static final String RESTART_POLICY = "unless-stopped";

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Z_][A-Z0-9_]*)}");

    private final ProfileCatalog catalog;
    private final SettingsSchema schema;
    private final SecretGenerator secretGenerator;
    private final SecretMaterialFilter secretFilter;
    private final ComposeCodec composeCodec;

    public ConfigGenerator(ProfileCatalog catalog, SettingsSchema schema, SecretGenerator secretGenerator,
                           SecretMaterialFilter secretFilter, ComposeCodec composeCodec) {
        this.catalog = catalog;
        this.schema = schema;
        this.secretGenerator = secretGenerator;
        this.secretFilter = secretFilter;
        this.composeCodec = composeCodec;
    }

    public Result<GeneratedConfiguration> generate(Collection<String> resolvedProfiles, Map<String, String> userSettings) {
        List<String> profiles = ProfileIdMigration.migrate(resolvedProfiles).profileIds();
        var unknown = profiles.stream().filter(id -> !catalog.contains(id)).toList();
        if (!unknown.isEmpty()) {
            return Result.failure(unknown.stream()
                    .map(id -> AioError.validation("invalid_profile", "Unknown profile: " + id,
                            "Validate the selection before generating"))
                    .toList());
        }
        if (profiles.isEmpty()) {
            return Result.failure(AioError.validation("empty_selection", "No profiles selected",
                    "Select at least one profile"));
        }

        Map<String, SettingField> relevant = schema.relevantFields(profiles);
        TreeMap<String, String> merged = mergeSettings(profiles, userSettings);

        var generatedSecrets = new ArrayList<String>();
        for (SettingField field : relevant.values()) {
            String current = merged.get(field.key());
            if (field.isSecret() && (current == null || current.isBlank())) {
                merged.put(field.key(), secretGenerator.generate());
                generatedSecrets.add(field.key());
            }
        }

        var errors = new ArrayList<AioError>();
        Set<String> secretKeys = catalog.fields().values().stream()
                .filter(SettingField::isSecret)
                .map(SettingField::key)
                .collect(Collectors.toSet());
        secretFilter.inspect(merged, secretKeys).forEach(r -> errors.add(
                new FieldError(r.key(), "rejected: value " + r.reason()).toError()));
        schema.validate(merged, profiles).forEach(e -> errors.add(e.toError()));
        if (!errors.isEmpty()) {
            log.debug("Configuration for {} rejected with {} errors", profiles, errors.size());
            return Result.failure(errors);
        }

        var env = new TreeMap<String, String>();
        merged.forEach((key, value) -> {
            if (relevant.containsKey(key) && value != null && !value.isEmpty()) {
                env.put(key, value);
            }
        });

        ComposeDocument compose = buildCompose(profiles, env);
        var warnings = warnings(profiles, env);
        var generated = new GeneratedConfiguration(profiles, compose, env, composeCodec.write(compose),
                EnvFile.render(env), generatedSecrets, warnings);
        log.info("Generated configuration for {} ({} services, {} env keys)",
                profiles, compose.services().size(), env.size());
        return Result.success(generated);
    }

    /** Defaults for the selection without any generated secrets, for pre-filling forms. */
    public Map<String, String> defaultSettings(Collection<String> profileIds) {
        List<String> profiles = ProfileIdMigration.migrate(profileIds).profileIds().stream()
                .filter(catalog::contains)
                .toList();
        return mergeSettings(profiles, Map.of());
    }

    public String generatePassword(int length) {
        return secretGenerator.generate(length);
    }

    private TreeMap<String, String> mergeSettings(List<String> profiles, Map<String, String> userSettings) {
        var merged = new TreeMap<String, String>(catalog.globalDefaults());
        for (String id : profiles) {
            merged.putAll(catalog.get(id).defaultSettings());
        }
        if (userSettings != null) {
            userSettings.forEach((key, value) -> {
                if (value != null) {
                    merged.put(key, value.trim());
                }
            });
        }
        return merged;
    }

    private ComposeDocument buildCompose(List<String> profiles, Map<String, String> env) {
        List<ServiceRef> services = new ArrayList<>(catalog.servicesFor(profiles));
        services.sort(Comparator.comparingInt(ServiceRef::startupOrder).thenComparing(ServiceRef::name));

        var blocks = new LinkedHashMap<String, ComposeService>();
        for (ServiceRef service : services) {
            var ports = new ArrayList<String>();
            service.portBindings().forEach((key, containerPort) -> {
                String host = env.get(key);
                if (host != null) {
                    ports.add(host + ":" + containerPort);
                }
            });
            var environment = new TreeMap<String, String>();
            service.environment().forEach((variable, key) -> {
                String value = env.get(key);
                if (value != null) {
                    environment.put(variable, value);
                }
            });
            var volumes = service.volumes().stream().map(v -> substitute(v, env)).toList();
            var owners = service.ownerProfiles().stream().sorted().toList();

            blocks.put(service.name(), new ComposeService(service.name(), service.image(), service.build(),
                    RESTART_POLICY, ports, environment, volumes, List.of(NETWORK), owners));
        }
        return new ComposeDocument(blocks, Map.of(NETWORK, ComposeNetwork.bridge()));
    }

    private static String substitute(String template, Map<String, String> env) {
        Matcher matcher = PLACEHOLDER.matcher(template);
        return matcher.replaceAll(m -> Matcher.quoteReplacement(env.getOrDefault(m.group(1), "")));
    }

    private List<String> warnings(List<String> profiles, Map<String, String> env) {
        boolean hasNode = profiles.contains(KaspaProfiles.KASPA_NODE)
                || profiles.contains(KaspaProfiles.KASPA_ARCHIVE_NODE);
        var warnings = new ArrayList<String>();
        for (String key : SettingsSchema.NODE_MODE_KEYS) {
            if (!hasNode && "local".equals(env.get(key))) {
                warnings.add(key + " is local but no Kaspa node profile is selected; "
                        + "set it to remote and provide REMOTE_KASPA_NODE_WRPC_URL");
            }
        }
        return warnings;
    }
}
