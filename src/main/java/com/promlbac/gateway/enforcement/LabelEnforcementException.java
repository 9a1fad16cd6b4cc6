package com.promlbac.gateway.enforcement;

import lombok.Getter;
import lombok.NonNull;

/**
 * Terminal failure while deriving the enforced label set of a request.
 * <p>
 * The exception message is meant for logs and may contain claim values or upstream status codes. Callers only get
 * {@link EnforcementFailure#getPublicMessage()}.
 */
@Getter
public class LabelEnforcementException extends RuntimeException {

    private final EnforcementFailure failure;

    public LabelEnforcementException(@NonNull EnforcementFailure failure, String message) {
        super(message);
        this.failure = failure;
    }

    public LabelEnforcementException(@NonNull EnforcementFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }
}
