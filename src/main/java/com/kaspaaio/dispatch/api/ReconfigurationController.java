package com.kaspaaio.dispatch.api;

import com.kaspaaio.core.engine.ReconciliationEngine;
import com.kaspaaio.core.engine.ReconciliationOutcome;
import com.kaspaaio.core.engine.ReconfigurationRequest;
import com.kaspaaio.core.error.AioError;
import com.kaspaaio.core.error.ErrorKind;
import com.kaspaaio.core.store.InstallationState;
import com.kaspaaio.core.store.InstallationStateRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

/**
 * REST controller for changing the installation.
 * <p>
 * Reconfiguration requests run on the request thread and return the final outcome.
 * Clients that want progress subscribe to {@code /events} before posting.
 */
@RestController
@RequestMapping("/api/v1/reconfigurations")
public class ReconfigurationController {

    private static final Logger log = LoggerFactory.getLogger(ReconfigurationController.class);

    private final ReconciliationEngine engine;
    private final InstallationStateRepository stateRepository;
    private final SseStreamingService sseStreamingService;

    public ReconfigurationController(ReconciliationEngine engine, InstallationStateRepository stateRepository,
                                     SseStreamingService sseStreamingService) {
        this.engine = engine;
        this.stateRepository = stateRepository;
        this.sseStreamingService = sseStreamingService;
    }

    /** POST /api/v1/reconfigurations. The body is the full desired selection. */
    @PostMapping
    public ResponseEntity<ReconciliationOutcome> reconcile(@RequestBody ReconfigurationRequest request) {
        log.info("Reconfiguration requested: {}", request.profiles());
        ReconciliationOutcome outcome = engine.reconcile(request);
        return ResponseEntity.status(statusFor(outcome)).body(outcome);
    }

    @PostMapping("/removals")
    public ResponseEntity<ReconciliationOutcome> remove(@RequestBody RemovalRequest request) {
        log.info("Profile removal requested: {}", request.profiles());
        ReconciliationOutcome outcome = engine.removeProfiles(request.profiles());
        return ResponseEntity.status(statusFor(outcome)).body(outcome);
    }

    /** GET /api/v1/reconfigurations/current. 204 when nothing is running. */
    @GetMapping("/current")
    public ResponseEntity<ReconciliationOutcome> current() {
        return engine.currentProgress()
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.noContent().build());
    }

    @PostMapping("/current/cancel")
    public ResponseEntity<Map<String, Object>> cancel() {
        boolean cancelled = engine.cancel();
        return cancelled
                ? ResponseEntity.accepted().body(Map.of("cancelled", true))
                : ResponseEntity.status(HttpStatus.CONFLICT).body(Map.of("cancelled", false,
                        "reason", "No reconfiguration is running"));
    }

    @GetMapping("/last")
    public ResponseEntity<ReconciliationOutcome> last() {
        return engine.lastOutcome()
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.noContent().build());
    }

    @GetMapping("/state")
    public InstallationState state() {
        return stateRepository.loadOrEmpty();
    }

    @GetMapping(value = "/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter events() {
        return sseStreamingService.createGlobalEmitter();
    }

    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter runEvents(@PathVariable String id) {
        return sseStreamingService.createEmitter(id);
    }

    /**
     * HTTP status for an outcome: 200 committed, 409 lock contention, 404 unknown
     * backup, 422 rejected input, 502 rolled back after an engine failure and 500
     * when the installation needs manual recovery.
     */
    static HttpStatus statusFor(ReconciliationOutcome outcome) {
        switch (outcome.status()) {
            case COMMITTED:
                return HttpStatus.OK;
            case MANUAL_RECOVERY_REQUIRED:
                return HttpStatus.INTERNAL_SERVER_ERROR;
            case ROLLED_BACK:
                return firstKind(outcome.errors()) == ErrorKind.STORAGE
                        ? HttpStatus.INTERNAL_SERVER_ERROR
                        : HttpStatus.BAD_GATEWAY;
            default:
                break;
        }
        if (outcome.errors().stream().anyMatch(e -> "backup_not_found".equals(e.code()))) {
            return HttpStatus.NOT_FOUND;
        }
        ErrorKind kind = firstKind(outcome.errors());
        if (kind == ErrorKind.VALIDATION) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        return kind != null ? ApiExceptionHandler.statusFor(kind) : HttpStatus.INTERNAL_SERVER_ERROR;
    }

    private static ErrorKind firstKind(List<AioError> errors) {
        return errors.isEmpty() ? null : errors.get(0).kind();
    }

    public record RemovalRequest(List<String> profiles) {

        public RemovalRequest {
            profiles = profiles != null ? profiles : List.of();
        }
    }
}
