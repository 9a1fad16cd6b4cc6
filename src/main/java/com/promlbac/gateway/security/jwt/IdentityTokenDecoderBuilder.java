package com.promlbac.gateway.security.jwt;

import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.proc.JWKSecurityContext;
import com.nimbusds.jose.proc.JWSVerificationKeySelector;
import com.nimbusds.jose.jwk.source.JWKSecurityContextJWKSet;
import com.promlbac.gateway.security.jwk.JwkKeyResolver;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.Accessors;
import org.springframework.security.oauth2.jwt.JwtValidators;
import org.springframework.security.oauth2.jwt.NimbusReactiveJwtDecoder;
import org.springframework.security.oauth2.jwt.ReactiveJwtDecoder;
import reactor.core.publisher.Flux;

@Accessors(fluent = true)
@Setter
@NoArgsConstructor(staticName = "create")
public class IdentityTokenDecoderBuilder {

    private JwkKeyResolver keyResolver;
    private String issuer;
    private Set<String> jwsAlgorithms = new LinkedHashSet<>();

    public IdentityTokenDecoderBuilder jwsAlgorithm(String jwsAlgorithm) {
        return jwsAlgorithms(List.of(jwsAlgorithm));
    }

    public IdentityTokenDecoderBuilder jwsAlgorithms(Collection<String> jwsAlgorithms) {
        this.jwsAlgorithms.addAll(jwsAlgorithms);
        return this;
    }

    public ReactiveJwtDecoder build() {
        if (keyResolver == null) {
            throw new IllegalStateException("No keyResolver provided. Can not construct a JWT decoder.");
        }
        if (jwsAlgorithms.isEmpty()) {
            throw new IllegalStateException("No JWS algorithms provided. Can not construct a JWT decoder.");
        }

        var resolver = this.keyResolver;
        var algorithms = jwsAlgorithms.stream()
                .map(JWSAlgorithm::parse)
                .collect(Collectors.toUnmodifiableSet());

        // keys are looked up by the 'kid' header only, the processor then checks that the key matches the algorithm
        var decoder = NimbusReactiveJwtDecoder.withJwkSource(
                        signedJwt -> Flux.fromStream(resolver.resolve(signedJwt.getHeader().getKeyID()).stream()))
                .jwtProcessorCustomizer(processor -> processor.setJWSKeySelector(
                        new JWSVerificationKeySelector<JWKSecurityContext>(algorithms, new JWKSecurityContextJWKSet())))
                .build();

        var defaultValidator = issuer != null ?
                JwtValidators.createDefaultWithIssuer(issuer) :
                JwtValidators.createDefault();
        decoder.setJwtValidator(defaultValidator);
        return decoder;
    }
}
