package com.kaspaaio.core.catalog;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A user-selectable bundle of services.
 *
 * @param dependencies     hard dependencies, auto-included during resolution
 * @param prerequisites    OR-group; at least one must be selected, never auto-included
 * @param recommends       OR-group; a warning is emitted when none is selected
 * @param conflicts        profiles that cannot be installed alongside this one
 * @param ports            default host ports this profile publishes
 * @param requiredSettings keys that must hold a value when the profile is selected
 * @param defaultSettings  default values merged into the configuration
 * @param fields           schema of the keys this profile contributes
 */
public record Profile(
    String id,
    String name,
    String description,
    List<ServiceRef> services,
    List<String> dependencies,
    List<String> prerequisites,
    List<String> recommends,
    List<String> conflicts,
    List<Integer> ports,
    ResourceRequirements resources,
    List<String> requiredSettings,
    Map<String, String> defaultSettings,
    List<SettingField> fields
) {

    public Profile {
        services = List.copyOf(services);
        dependencies = copy(dependencies);
        prerequisites = copy(prerequisites);
        recommends = copy(recommends);
        conflicts = copy(conflicts);
        ports = ports != null ? List.copyOf(ports) : List.of();
        resources = resources != null ? resources : ResourceRequirements.NONE;
        requiredSettings = copy(requiredSettings);
        defaultSettings = defaultSettings != null ? Map.copyOf(defaultSettings) : Map.of();
        fields = fields != null ? List.copyOf(fields) : List.of();
    }

    private static List<String> copy(List<String> values) {
        return values != null ? List.copyOf(values) : List.of();
    }

    public List<String> serviceNames() {
        return services.stream().map(ServiceRef::name).toList();
    }

    public static Builder builder(String id, String name) {
        return new Builder(id, name);
    }

    public static final class Builder {
        private final String id;
        private final String name;
        private String description = "";
        private final List<ServiceRef> services = new ArrayList<>();
        private List<String> dependencies = List.of();
        private List<String> prerequisites = List.of();
        private List<String> recommends = List.of();
        private List<String> conflicts = List.of();
        private List<Integer> ports = List.of();
        private ResourceRequirements resources = ResourceRequirements.NONE;
        private List<String> requiredSettings = List.of();
        private final Map<String, String> defaultSettings = new LinkedHashMap<>();
        private final List<SettingField> fields = new ArrayList<>();

        private Builder(String id, String name) {
            this.id = id;
            this.name = name;
        }

        public Builder description(String description) { this.description = description; return this; }
        public Builder service(ServiceRef service) { this.services.add(service); return this; }
        public Builder dependencies(String... ids) { this.dependencies = List.of(ids); return this; }
        public Builder prerequisites(String... ids) { this.prerequisites = List.of(ids); return this; }
        public Builder recommends(String... ids) { this.recommends = List.of(ids); return this; }
        public Builder conflicts(String... ids) { this.conflicts = List.of(ids); return this; }
        public Builder ports(Integer... ports) { this.ports = List.of(ports); return this; }
        public Builder resources(ResourceRequirements resources) { this.resources = resources; return this; }
        public Builder requiredSettings(String... keys) { this.requiredSettings = List.of(keys); return this; }
        public Builder defaultSetting(String key, String value) { this.defaultSettings.put(key, value); return this; }
        public Builder field(SettingField field) { this.fields.add(field); return this; }

        public Profile build() {
            return new Profile(id, name, description, services, dependencies, prerequisites, recommends,
                    conflicts, ports, resources, requiredSettings, defaultSettings, fields);
        }
    }
}
