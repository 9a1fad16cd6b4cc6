package com.promlbac.gateway.security.jwt;

import static com.promlbac.gateway.test.assertj.MonoAssert.assertThat;

import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jwt.JWTClaimsSet;
import com.promlbac.gateway.enforcement.EnforcementFailure;
import com.promlbac.gateway.security.jwk.JwkKeyResolver;
import com.promlbac.gateway.test.security.jwt.SingleKeyTokenSigner;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class IdentityTokenValidatorTest {

    private static final SingleKeyTokenSigner GRAFANA_SIGNER = new SingleKeyTokenSigner();
    private static final SingleKeyTokenSigner OTHER_SIGNER = new SingleKeyTokenSigner();

    private final IdentityTokenValidator validator = createValidator(GRAFANA_SIGNER.getSigningKeys());

    private static IdentityTokenValidator createValidator(JWKSet jwkSet) {
        JwkKeyResolver resolver = keyId -> Optional.ofNullable(jwkSet.getKeyByKeyId(keyId));
        return new IdentityTokenValidator(IdentityTokenDecoderBuilder.create()
                .keyResolver(resolver)
                .jwsAlgorithms(List.of("ES256", "RS256"))
                .build());
    }

    @Test
    void validToken() {
        var token = GRAFANA_SIGNER.sign("user:42", "org:7");

        assertThat(validator.validate(token)).hasValue(new IdentityAssertion(token, "42", 7));
    }

    @Test
    void missingToken() {
        assertThat(validator.validate(null)).failsWith(EnforcementFailure.MISSING_CREDENTIAL);
        assertThat(validator.validate("")).failsWith(EnforcementFailure.MISSING_CREDENTIAL);
        assertThat(validator.validate("   ")).failsWith(EnforcementFailure.MISSING_CREDENTIAL);
    }

    @Test
    void tokenSignedWithUnknownKey() {
        var token = OTHER_SIGNER.sign("user:42", "org:7");

        assertThat(validator.validate(token)).failsWith(EnforcementFailure.INVALID_CREDENTIAL);
    }

    @Test
    void tokenWithTamperedClaims() {
        var token = GRAFANA_SIGNER.sign("user:42", "org:7");
        var otherToken = GRAFANA_SIGNER.sign("user:1", "org:1");
        var parts = token.split("\\.");
        var tampered = parts[0] + "." + otherToken.split("\\.")[1] + "." + parts[2];

        assertThat(validator.validate(tampered)).failsWith(EnforcementFailure.INVALID_CREDENTIAL);
    }

    @Test
    void malformedToken() {
        assertThat(validator.validate("not-a-jwt")).failsWith(EnforcementFailure.INVALID_CREDENTIAL);
    }

    @Test
    void expiredToken() {
        var issuedAt = Instant.now().minus(Duration.ofHours(2));
        var claims = SingleKeyTokenSigner.claims("user:42", List.of("org:7"))
                .issueTime(Date.from(issuedAt))
                .expirationTime(Date.from(issuedAt.plus(Duration.ofMinutes(5))))
                .build();
        var token = GRAFANA_SIGNER.sign(claims).serialize();

        assertThat(validator.validate(token)).failsWith(EnforcementFailure.INVALID_CREDENTIAL);
    }

    @Test
    void algorithmNotAccepted() {
        var rsaSigner = SingleKeyTokenSigner.rsa();
        var esOnlyValidator = new IdentityTokenValidator(IdentityTokenDecoderBuilder.create()
                .keyResolver(keyId -> Optional.ofNullable(rsaSigner.getSigningKeys().getKeyByKeyId(keyId)))
                .jwsAlgorithm("ES256")
                .build());

        var token = rsaSigner.sign("user:42", "org:7");

        assertThat(esOnlyValidator.validate(token)).failsWith(EnforcementFailure.INVALID_CREDENTIAL);
    }

    @Test
    void missingSubject() {
        var claims = new JWTClaimsSet.Builder(SingleKeyTokenSigner.claims("user:42", List.of("org:7")).build())
                .subject(null)
                .build();
        var token = GRAFANA_SIGNER.sign(claims).serialize();

        assertThat(validator.validate(token)).failsWith(EnforcementFailure.INTERNAL_FAILURE);
    }

    @Test
    void malformedSubject() {
        var token = GRAFANA_SIGNER.sign("42", "org:7");

        assertThat(validator.validate(token)).failsWith(EnforcementFailure.INTERNAL_FAILURE);
    }

    @Test
    void missingAudience() {
        var claims = new JWTClaimsSet.Builder(SingleKeyTokenSigner.claims("user:42", List.of("org:7")).build())
                .audience((String) null)
                .build();
        var token = GRAFANA_SIGNER.sign(claims).serialize();

        assertThat(validator.validate(token)).failsWith(EnforcementFailure.INTERNAL_FAILURE);
    }

    @Test
    void multipleAudiences_areNeverResolved() {
        var token = GRAFANA_SIGNER.sign("user:42", List.of("org:7", "org:8"));

        assertThat(validator.validate(token)).failsWith(EnforcementFailure.INTERNAL_FAILURE);
    }

    @Test
    void nonNumericOrganization() {
        var token = GRAFANA_SIGNER.sign("user:42", "org:main");

        assertThat(validator.validate(token)).failsWith(EnforcementFailure.INTERNAL_FAILURE);
    }
}
