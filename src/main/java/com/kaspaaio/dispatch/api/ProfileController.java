package com.kaspaaio.dispatch.api;

import com.kaspaaio.core.catalog.Profile;
import com.kaspaaio.core.catalog.ProfileCatalog;
import com.kaspaaio.core.catalog.ProfileIdMigration;
import com.kaspaaio.core.store.InstallationStateRepository;
import com.kaspaaio.core.validation.DependencyValidator;
import com.kaspaaio.core.validation.ValidationResult;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for the profile catalog and selection validation.
 */
@RestController
@RequestMapping("/api/v1/profiles")
public class ProfileController {

    private final ProfileCatalog catalog;
    private final DependencyValidator validator;
    private final InstallationStateRepository stateRepository;

    public ProfileController(ProfileCatalog catalog, DependencyValidator validator,
                             InstallationStateRepository stateRepository) {
        this.catalog = catalog;
        this.validator = validator;
        this.stateRepository = stateRepository;
    }

    @GetMapping
    public List<Profile> list() {
        return catalog.all();
    }

    /** GET /api/v1/profiles/{id}. Legacy IDs are accepted and resolve to the first canonical profile. */
    @GetMapping("/{id}")
    public ResponseEntity<Profile> get(@PathVariable String id) {
        List<String> canonical = ProfileIdMigration.canonicalIdsFor(id);
        return catalog.find(canonical.get(0))
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/migrations")
    public Map<String, Object> migrations() {
        return Map.of("version", ProfileIdMigration.VERSION, "legacyIds", ProfileIdMigration.table());
    }

    /**
     * POST /api/v1/profiles/validate. Always 200 for a well-formed request; the body
     * says whether the selection is valid.
     */
    @PostMapping("/validate")
    public ValidationResult validate(@RequestBody SelectionRequest request) {
        return validator.validateSelection(request.profiles());
    }

    /** POST /api/v1/profiles/{id}/removal-check against the installed selection. */
    @PostMapping("/{id}/removal-check")
    public ValidationResult checkRemoval(@PathVariable String id) {
        return validator.validateRemoval(id, stateRepository.loadOrEmpty().selectedProfiles());
    }

    public record SelectionRequest(List<String> profiles) {

        public SelectionRequest {
            profiles = profiles != null ? profiles : List.of();
        }
    }
}
