package com.kaspaaio.core.config;

import com.kaspaaio.core.error.AioError;
import com.kaspaaio.core.error.ErrorKind;

import java.util.Map;

/**
 * A schema violation on one configuration key.
 */
public record FieldError(String field, String message) {

    public AioError toError() {
        return new AioError(ErrorKind.VALIDATION, "invalid_setting", field + ": " + message,
                "Correct the value of " + field, Map.of("field", field));
    }
}
