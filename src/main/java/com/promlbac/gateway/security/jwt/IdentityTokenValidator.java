package com.promlbac.gateway.security.jwt;

import com.promlbac.gateway.enforcement.EnforcementFailure;
import com.promlbac.gateway.enforcement.LabelEnforcementException;
import com.promlbac.gateway.security.jwt.TypedIdentifier.MalformedIdentifierException;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.Nullable;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimNames;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.ReactiveJwtDecoder;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

/**
 * Verifies Grafana id tokens and extracts the caller and the organization the token was issued for.
 * <p>
 * Every verification failure, whatever the cause, is reported as {@link EnforcementFailure#INVALID_CREDENTIAL}. A
 * correctly signed token with claims that do not follow the Grafana conventions points at an incompatible issuer and
 * is reported as {@link EnforcementFailure#INTERNAL_FAILURE}.
 */
@RequiredArgsConstructor
public class IdentityTokenValidator {

    @NonNull
    private final ReactiveJwtDecoder decoder;

    public Mono<IdentityAssertion> validate(@Nullable String rawToken) {
        if (!StringUtils.hasText(rawToken)) {
            return Mono.error(new LabelEnforcementException(EnforcementFailure.MISSING_CREDENTIAL,
                    "No identity token present"));
        }

        // NimbusReactiveJwtDecoder throws parse errors instead of returning them
        return Mono.defer(() -> this.decoder.decode(rawToken))
                .onErrorMap(JwtException.class, ex -> new LabelEnforcementException(
                        EnforcementFailure.INVALID_CREDENTIAL, "Identity token rejected: " + ex.getMessage(), ex))
                .map(IdentityTokenValidator::toAssertion);
    }

    private static IdentityAssertion toAssertion(Jwt jwt) {
        try {
            var subject = TypedIdentifier.parse(JwtClaimNames.SUB, jwt.getSubject());
            var audience = TypedIdentifier.parseSingle(JwtClaimNames.AUD, jwt.getAudience());

            return new IdentityAssertion(jwt.getTokenValue(), subject.getId(), audience.numericId(JwtClaimNames.AUD));
        } catch (MalformedIdentifierException ex) {
            throw new LabelEnforcementException(EnforcementFailure.INTERNAL_FAILURE, ex.getMessage(), ex);
        }
    }
}
