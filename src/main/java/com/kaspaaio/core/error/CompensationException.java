package com.kaspaaio.core.error;

import java.util.List;
import java.util.Map;

/**
 * An operation failed and putting the removed services back failed as well. The
 * installation no longer matches its files; the original failure is the cause.
 */
public class CompensationException extends AioException {

    private final List<String> unrecovered;

    public CompensationException(List<String> unrecovered, AioException cause) {
        super(AioError.engine("compensation_failed",
                        "Could not redeploy " + unrecovered + " after: " + cause.getMessage())
                .withDetails(Map.of("services", List.copyOf(unrecovered))), cause);
        this.unrecovered = List.copyOf(unrecovered);
    }

    public List<String> getUnrecovered() {
        return unrecovered;
    }
}
