package com.kaspaaio.core.error;

/**
 * The container engine refused or failed an operation.
 */
public class EngineException extends AioException {

    private final String service;

    public EngineException(String service, String message, Throwable cause) {
        super(AioError.engine("engine_failure", message), cause);
        this.service = service;
    }

    public EngineException(String service, String message) {
        super(AioError.engine("engine_failure", message));
        this.service = service;
    }

    public String getService() {
        return service;
    }
}
