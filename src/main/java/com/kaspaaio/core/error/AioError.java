package com.kaspaaio.core.error;

import java.util.Map;

/**
 * A machine-readable error with a human-readable remediation hint.
 *
 * @param kind        the error category
 * @param code        stable code (e.g. "missing_prerequisite", "port_conflict")
 * @param message     what went wrong
 * @param remediation what the operator can do about it (nullable)
 * @param details     structured context, e.g. the profiles or field involved
 */
public record AioError(
    ErrorKind kind,
    String code,
    String message,
    String remediation,
    Map<String, Object> details
) {

    public AioError {
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static AioError validation(String code, String message, String remediation) {
        return new AioError(ErrorKind.VALIDATION, code, message, remediation, Map.of());
    }

    public static AioError storage(String code, String message) {
        return new AioError(ErrorKind.STORAGE, code, message,
                "Check free disk space and permissions of the installation directory", Map.of());
    }

    public static AioError engine(String code, String message) {
        return new AioError(ErrorKind.ENGINE, code, message,
                "Check that the Docker daemon is running and inspect the service logs", Map.of());
    }

    public static AioError concurrency(String message) {
        return new AioError(ErrorKind.CONCURRENCY, "reconfiguration_in_progress", message,
                "Wait for the running reconfiguration to finish and retry", Map.of());
    }

    public AioError withDetails(Map<String, Object> extra) {
        return new AioError(kind, code, message, remediation, extra);
    }
}
