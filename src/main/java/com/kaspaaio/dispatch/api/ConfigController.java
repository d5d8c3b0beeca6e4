package com.kaspaaio.dispatch.api;

import com.kaspaaio.core.catalog.ProfileCatalog;
import com.kaspaaio.core.catalog.SettingField;
import com.kaspaaio.core.config.ConfigGenerator;
import com.kaspaaio.core.config.GeneratedConfiguration;
import com.kaspaaio.core.error.Result;
import com.kaspaaio.core.store.SnapshotContents;
import com.kaspaaio.core.store.VersionStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * REST controller for configuration generation. Nothing here touches the live
 * installation; applying a configuration goes through the reconfiguration endpoints.
 */
@RestController
@RequestMapping("/api/v1/config")
public class ConfigController {

    private final ConfigGenerator generator;
    private final ProfileCatalog catalog;
    private final VersionStore versionStore;

    public ConfigController(ConfigGenerator generator, ProfileCatalog catalog, VersionStore versionStore) {
        this.generator = generator;
        this.catalog = catalog;
        this.versionStore = versionStore;
    }

    /** GET /api/v1/config/defaults?profiles=a,b */
    @GetMapping("/defaults")
    public Map<String, String> defaults(@RequestParam(defaultValue = "") List<String> profiles) {
        return generator.defaultSettings(profiles);
    }

    @GetMapping("/schema")
    public Map<String, SettingField> schema() {
        return catalog.fields();
    }

    /**
     * POST /api/v1/config/generate. Returns the rendered files, or 400 with the
     * field errors that prevented rendering.
     */
    @PostMapping("/generate")
    public ResponseEntity<?> generate(@RequestBody GenerateRequest request) {
        Result<GeneratedConfiguration> result = generator.generate(request.profiles(), request.settings());
        if (!result.isSuccess()) {
            return ResponseEntity.badRequest().body(ApiExceptionHandler.body(result.errors()));
        }
        return ResponseEntity.ok(result.orElseThrow());
    }

    @GetMapping("/password")
    public Map<String, String> password(@RequestParam(defaultValue = "32") int length) {
        return Map.of("password", generator.generatePassword(length));
    }

    /** GET /api/v1/config/current. The live environment with secret values masked. */
    @GetMapping("/current")
    public Map<String, Object> current() {
        SnapshotContents live = versionStore.readContents(VersionStore.CURRENT);
        var env = new TreeMap<String, String>();
        live.env().forEach((key, value) -> env.put(key, VersionStore.mask(key, value)));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("env", env);
        result.put("compose", live.composeYaml());
        return result;
    }

    public record GenerateRequest(List<String> profiles, Map<String, String> settings) {

        public GenerateRequest {
            profiles = profiles != null ? profiles : List.of();
            settings = settings != null ? settings : Map.of();
        }
    }
}
