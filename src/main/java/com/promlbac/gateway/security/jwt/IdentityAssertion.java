package com.promlbac.gateway.security.jwt;

import lombok.NonNull;
import lombok.Value;

/**
 * A verified identity token and the claims that were extracted from it.
 */
@Value
public class IdentityAssertion {

    /**
     * The raw, serialized token
     */
    @NonNull
    String tokenValue;

    /**
     * Grafana user id, from the {@code sub} claim
     */
    @NonNull
    String callerId;

    /**
     * Grafana organization id, from the {@code aud} claim
     */
    long claimedOrgId;

    @Override
    public String toString() {
        return "IdentityAssertion(callerId=%s, claimedOrgId=%d)".formatted(this.callerId, this.claimedOrgId);
    }
}
