package com.promlbac.gateway.security.jwt;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.nimbusds.jwt.JWTClaimsSet;
import com.promlbac.gateway.security.jwk.JwkKeyResolver;
import com.promlbac.gateway.test.security.jwt.SingleKeyTokenSigner;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jwt.BadJwtException;

class IdentityTokenDecoderBuilderTest {

    private static final SingleKeyTokenSigner ES_SIGNER = new SingleKeyTokenSigner();
    private static final SingleKeyTokenSigner RS_SIGNER = SingleKeyTokenSigner.rsa();

    private static final JwkKeyResolver KEY_RESOLVER = keyId -> Optional.ofNullable(
                    ES_SIGNER.getSigningKeys().getKeyByKeyId(keyId))
            .or(() -> Optional.ofNullable(RS_SIGNER.getSigningKeys().getKeyByKeyId(keyId)));

    private static String sign(SingleKeyTokenSigner signer, String issuer) {
        JWTClaimsSet claims = SingleKeyTokenSigner.claims("user:1", List.of("org:1"))
                .issuer(issuer)
                .build();
        return signer.sign(claims).serialize();
    }

    @Test
    void buildWithoutIssuer() {
        var decoder = IdentityTokenDecoderBuilder.create()
                .keyResolver(KEY_RESOLVER)
                .jwsAlgorithms(List.of("ES256", "RS256"))
                .build();

        assertThatCode(() -> decoder.decode(sign(ES_SIGNER, "https://grafana.example")).block())
                .doesNotThrowAnyException();
        assertThatCode(() -> decoder.decode(sign(RS_SIGNER, "https://other.example")).block())
                .doesNotThrowAnyException();
    }

    @Test
    void buildWithIssuer() {
        var decoder = IdentityTokenDecoderBuilder.create()
                .keyResolver(KEY_RESOLVER)
                .issuer("https://grafana.example")
                .jwsAlgorithm("ES256")
                .build();

        // Valid signed JWT
        assertThatCode(() -> decoder.decode(sign(ES_SIGNER, "https://grafana.example")).block())
                .doesNotThrowAnyException();

        // Invalid signed JWT (incorrect issuer)
        assertThatThrownBy(() -> decoder.decode(sign(ES_SIGNER, "https://other.example")).block())
                .isInstanceOf(BadJwtException.class);

        // Invalid signed JWT (algorithm not accepted)
        assertThatThrownBy(() -> decoder.decode(sign(RS_SIGNER, "https://grafana.example")).block())
                .isInstanceOf(BadJwtException.class);
    }

    @Test
    void buildWithoutKeyResolver() {
        assertThatThrownBy(() -> IdentityTokenDecoderBuilder.create().jwsAlgorithm("ES256").build())
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void buildWithoutAlgorithms() {
        assertThatThrownBy(() -> IdentityTokenDecoderBuilder.create().keyResolver(KEY_RESOLVER).build())
                .isInstanceOf(IllegalStateException.class);
    }
}
