package com.kaspaaio.core.validation;

import com.kaspaaio.core.catalog.ServiceRef;
import com.kaspaaio.core.catalog.StartupPhase;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Services of a resolved selection in the order they are started.
 *
 * @param services services sorted by startup order, then name
 */
public record StartupPlan(List<ServiceRef> services) {

    public StartupPlan {
        services = List.copyOf(services);
    }

    public static StartupPlan empty() {
        return new StartupPlan(List.of());
    }

    public List<String> serviceNames() {
        return services.stream().map(ServiceRef::name).toList();
    }

    /** Service names grouped by phase, phases in ascending order, empty phases omitted. */
    public Map<StartupPhase, List<String>> phases() {
        var grouped = new EnumMap<StartupPhase, List<String>>(StartupPhase.class);
        for (ServiceRef service : services) {
            grouped.computeIfAbsent(service.phase(), p -> new ArrayList<>()).add(service.name());
        }
        return new LinkedHashMap<>(grouped);
    }
}
