package com.kaspaaio.core.validation;

import com.kaspaaio.core.error.AioError;
import com.kaspaaio.core.error.ErrorKind;

import java.util.Map;

/**
 * One validation error or warning.
 *
 * @param code        stable code, see {@link IssueCode#code()}
 * @param message     human-readable description
 * @param remediation what to change in the selection (nullable)
 * @param details     structured context such as the profiles, port or cycle involved
 */
public record ValidationIssue(
    String code,
    String message,
    String remediation,
    Map<String, Object> details
) {

    public ValidationIssue {
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static ValidationIssue of(IssueCode code, String message, String remediation, Map<String, Object> details) {
        return new ValidationIssue(code.code(), message, remediation, details);
    }

    public boolean is(IssueCode issueCode) {
        return issueCode.code().equals(code);
    }

    public AioError toError() {
        return new AioError(ErrorKind.VALIDATION, code, message, remediation, details);
    }
}
