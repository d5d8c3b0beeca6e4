package com.kaspaaio.core.catalog;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A container unit and the profiles that cause it to be materialized.
 *
 * <p>Inclusion is data: a service is part of a generated configuration if and only if
 * one of its {@code ownerProfiles} is in the resolved selection.
 *
 * @param name             container and compose service name
 * @param ownerProfiles    profile IDs that include this service
 * @param startupOrder     1 = infrastructure, 2 = databases, 3 = indexers, 4 = applications
 * @param image            image to pull, or {@code null} when {@code build} is set
 * @param build            local build directive, or {@code null} when {@code image} is set
 * @param portBindings     setting key holding the host port, mapped to the container port
 * @param environment      container variable name mapped to the setting key that supplies it
 * @param volumes          volume mounts in compose short syntax
 */
public record ServiceRef(
    String name,
    Set<String> ownerProfiles,
    int startupOrder,
    String image,
    BuildSpec build,
    Map<String, Integer> portBindings,
    Map<String, String> environment,
    List<String> volumes
) {

    public ServiceRef {
        if ((image == null) == (build == null)) {
            throw new IllegalArgumentException("service " + name + " needs exactly one of image or build");
        }
        ownerProfiles = Set.copyOf(ownerProfiles);
        portBindings = portBindings != null ? Collections.unmodifiableMap(new LinkedHashMap<>(portBindings)) : Map.of();
        environment = environment != null ? Collections.unmodifiableMap(new LinkedHashMap<>(environment)) : Map.of();
        volumes = volumes != null ? List.copyOf(volumes) : List.of();
    }

    public StartupPhase phase() {
        return StartupPhase.forStartupOrder(startupOrder);
    }

    public boolean isOwnedByAny(Collection<String> profileIds) {
        for (String id : profileIds) {
            if (ownerProfiles.contains(id)) {
                return true;
            }
        }
        return false;
    }
}
