package com.kaspaaio.core.error;

/**
 * Backup, restore or state-file I/O failed.
 */
public class StorageException extends AioException {

    public StorageException(String code, String message, Throwable cause) {
        super(AioError.storage(code, message), cause);
    }

    public StorageException(String code, String message) {
        super(AioError.storage(code, message));
    }
}
