package com.kaspaaio.dispatch.api;

import com.kaspaaio.core.events.AioEvent;
import com.kaspaaio.core.events.EventBus;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Bridges {@link EventBus} subscriptions to {@link SseEmitter} instances.
 * <p>
 * An emitter either follows a single reconciliation run or every run. Heartbeats are
 * sent as SSE comments so idle connections survive proxies with short timeouts.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Image pulls can take a long time; keep streams open for an hour. */
    private static final long DEFAULT_TIMEOUT_MS = 60 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private static final String ALL_RUNS = "*";

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
        log.info("SSE heartbeat scheduler started (interval={}s)", HEARTBEAT_INTERVAL_SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException e) {
                // onError/onCompletion callbacks remove the registration
                log.debug("Heartbeat failed for stream {}: {}", registration.scope, e.getMessage());
            } catch (IllegalStateException e) {
                log.debug("Heartbeat skipped for stream {} (emitter not active)", registration.scope);
            }
        }
    }

    /** Streams events of one reconciliation run. */
    public SseEmitter createEmitter(String reconciliationId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        return register(reconciliationId, emitter,
                eventBus.subscribe(reconciliationId, event -> sendEvent(emitter, event)));
    }

    /** Streams events of every run, including runs started after the client connected. */
    public SseEmitter createGlobalEmitter() {
        SseEmitter emitter = new SseEmitter(timeoutMs);
        return register(ALL_RUNS, emitter, eventBus.subscribeAll(event -> sendEvent(emitter, event)));
    }

    private SseEmitter register(String scope, SseEmitter emitter, EventBus.Subscription subscription) {
        var registration = new EmitterRegistration(scope, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> cleanup(registration));
        emitter.onError(ex -> {
            log.debug("SSE emitter error for stream {}: {}", scope, ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to send initial comment for stream {}: {}", scope, e.getMessage());
        }
        log.info("SSE emitter created for stream {} (timeout={}ms)", scope, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void sendEvent(SseEmitter emitter, AioEvent event) {
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("reconciliationId", event.reconciliationId());
            if (event.service() != null) {
                data.put("service", event.service());
            }
            data.putAll(event.payload());
            data.put("timestamp", event.timestamp().toString());
            emitter.send(SseEmitter.event().name(event.eventType()).data(data));
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for run {}: {}",
                    event.eventType(), event.reconciliationId(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription.unsubscribe();
        activeRegistrations.remove(registration);
        log.debug("Cleaned up SSE registration for stream {}", registration.scope);
    }

    private record EmitterRegistration(String scope, SseEmitter emitter, EventBus.Subscription subscription) {}
}
