package com.kaspaaio.core.error;

/**
 * Unchecked exception carrying an {@link AioError}.
 */
public class AioException extends RuntimeException {

    private final AioError error;

    public AioException(AioError error) {
        super(error.message());
        this.error = error;
    }

    public AioException(AioError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public AioError getError() {
        return error;
    }

    public ErrorKind getKind() {
        return error.kind();
    }
}
