package com.kaspaaio.dispatch.api;

import com.kaspaaio.core.store.InstallationStateRepository;
import com.kaspaaio.lifecycle.ContainerStatus;
import com.kaspaaio.lifecycle.ServiceLifecycleManager;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for runtime status and start/stop/restart of installed services.
 * Unknown names are refused so the API cannot be used to drive arbitrary containers.
 */
@RestController
@RequestMapping("/api/v1/services")
public class ServiceController {

    private final ServiceLifecycleManager lifecycle;
    private final InstallationStateRepository stateRepository;

    public ServiceController(ServiceLifecycleManager lifecycle, InstallationStateRepository stateRepository) {
        this.lifecycle = lifecycle;
        this.stateRepository = stateRepository;
    }

    @GetMapping
    public Map<String, ContainerStatus> statuses() {
        return lifecycle.statusAll(stateRepository.loadOrEmpty().services());
    }

    @GetMapping("/{name}")
    public ResponseEntity<ContainerStatus> status(@PathVariable String name) {
        if (!isInstalled(name)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(lifecycle.status(name));
    }

    @PostMapping("/{name}/start")
    public ResponseEntity<ContainerStatus> start(@PathVariable String name) {
        if (!isInstalled(name)) {
            return ResponseEntity.notFound().build();
        }
        lifecycle.start(name);
        return ResponseEntity.ok(lifecycle.status(name));
    }

    @PostMapping("/{name}/stop")
    public ResponseEntity<ContainerStatus> stop(@PathVariable String name) {
        if (!isInstalled(name)) {
            return ResponseEntity.notFound().build();
        }
        lifecycle.stop(name);
        return ResponseEntity.ok(lifecycle.status(name));
    }

    @PostMapping("/{name}/restart")
    public ResponseEntity<ContainerStatus> restart(@PathVariable String name) {
        if (!isInstalled(name)) {
            return ResponseEntity.notFound().build();
        }
        lifecycle.restart(name);
        return ResponseEntity.ok(lifecycle.status(name));
    }

    private boolean isInstalled(String name) {
        return stateRepository.loadOrEmpty().services().contains(name);
    }
}
