package com.kaspaaio.core.catalog;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static, in-memory description of every installable profile.
 * <p>
 * Pure data: lookups only. The catalog is immutable after construction and safe
 * to share between concurrent validations and a running reconciliation.
 */
@Component
public class ProfileCatalog {

    private final Map<String, Profile> profiles;
    private final Map<String, ServiceRef> services;
    private final Map<String, SettingField> fields;
    private final Map<String, String> globalDefaults;

    @Autowired
    public ProfileCatalog() {
        this(KaspaProfiles.all(), KaspaProfiles.globalFields(), KaspaProfiles.globalDefaults());
    }

    public ProfileCatalog(List<Profile> profiles) {
        this(profiles, List.of(), Map.of());
    }

    public ProfileCatalog(List<Profile> profiles, List<SettingField> globalFields, Map<String, String> globalDefaults) {
        var byId = new LinkedHashMap<String, Profile>();
        var byService = new LinkedHashMap<String, ServiceRef>();
        var byKey = new LinkedHashMap<String, SettingField>();
        for (SettingField field : globalFields) {
            byKey.put(field.key(), field);
        }
        for (Profile profile : profiles) {
            if (byId.putIfAbsent(profile.id(), profile) != null) {
                throw new IllegalArgumentException("Duplicate profile id: " + profile.id());
            }
            for (ServiceRef service : profile.services()) {
                if (!service.ownerProfiles().contains(profile.id())) {
                    throw new IllegalArgumentException("Service " + service.name()
                            + " is listed under " + profile.id() + " but does not name it as an owner");
                }
                byService.putIfAbsent(service.name(), service);
            }
            for (SettingField field : profile.fields()) {
                byKey.putIfAbsent(field.key(), field);
            }
        }
        this.profiles = Collections.unmodifiableMap(byId);
        this.services = Collections.unmodifiableMap(byService);
        this.fields = Collections.unmodifiableMap(byKey);
        this.globalDefaults = Map.copyOf(globalDefaults);
    }

    public Optional<Profile> find(String profileId) {
        return Optional.ofNullable(profiles.get(profileId));
    }

    public Profile get(String profileId) {
        Profile profile = profiles.get(profileId);
        if (profile == null) {
            throw new IllegalArgumentException("Unknown profile: " + profileId);
        }
        return profile;
    }

    public boolean contains(String profileId) {
        return profiles.containsKey(profileId);
    }

    /** All profiles in catalog order. */
    public List<Profile> all() {
        return List.copyOf(profiles.values());
    }

    public Set<String> ids() {
        return profiles.keySet();
    }

    public Optional<ServiceRef> findService(String serviceName) {
        return Optional.ofNullable(services.get(serviceName));
    }

    /** Every distinct service owned by at least one of the given profiles, in catalog order. */
    public List<ServiceRef> servicesFor(Collection<String> profileIds) {
        var result = new ArrayList<ServiceRef>();
        for (ServiceRef service : services.values()) {
            if (service.isOwnedByAny(profileIds)) {
                result.add(service);
            }
        }
        return result;
    }

    public Optional<SettingField> field(String key) {
        return Optional.ofNullable(fields.get(key));
    }

    public Map<String, SettingField> fields() {
        return fields;
    }

    public Map<String, String> globalDefaults() {
        return globalDefaults;
    }
}
