package com.promlbac.gateway.enforcement;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Classification of a rejected request. Determines the response status and the message shown to the caller; the
 * caller never sees more than this message.
 */
@Getter
@RequiredArgsConstructor
public enum EnforcementFailure {
    MISSING_CREDENTIAL(HttpStatus.UNAUTHORIZED, "Missing identity token"),
    INVALID_CREDENTIAL(HttpStatus.UNAUTHORIZED, "Invalid identity token"),
    INTERNAL_FAILURE(HttpStatus.INTERNAL_SERVER_ERROR, "Unable to determine authorization scope"),
    UPSTREAM_UNAVAILABLE(HttpStatus.INTERNAL_SERVER_ERROR, "Unable to fetch team memberships"),
    NO_AUTHORIZATION_SCOPE(HttpStatus.NOT_FOUND, "Not a member of any team in this organization"),
    LABEL_PROXY_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE, "Label proxy unavailable");

    private final HttpStatus status;
    private final String publicMessage;

    public boolean isServerError() {
        return this.status.is5xxServerError();
    }
}
