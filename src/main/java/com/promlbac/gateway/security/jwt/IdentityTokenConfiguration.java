package com.promlbac.gateway.security.jwt;

import com.nimbusds.jose.jwk.source.JWKSetSource;
import com.nimbusds.jose.jwk.source.URLBasedJWKSetSource;
import com.nimbusds.jose.proc.SecurityContext;
import com.nimbusds.jose.util.DefaultResourceRetriever;
import com.promlbac.gateway.grafana.GrafanaProperties;
import com.promlbac.gateway.security.jwk.RefreshingJwkKeyResolver;
import com.promlbac.gateway.security.jwk.actuate.SigningKeysHealthIndicator;
import java.net.MalformedURLException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.autoconfigure.health.ConditionalOnEnabledHealthIndicator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.oauth2.jwt.ReactiveJwtDecoder;

@Slf4j
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties({GrafanaProperties.class, IdentityTokenProperties.class})
public class IdentityTokenConfiguration {

    private static final int JWK_SET_SIZE_LIMIT = 50 * 1024;

    @Bean
    RefreshingJwkKeyResolver signingKeyResolver(GrafanaProperties grafana, IdentityTokenProperties token)
            throws MalformedURLException {
        var signingKeysUri = grafana.getSigningKeysUri();
        var timeoutMillis = Math.toIntExact(grafana.getTimeout().toMillis());
        JWKSetSource<SecurityContext> source = new URLBasedJWKSetSource<>(signingKeysUri.toURL(),
                new DefaultResourceRetriever(timeoutMillis, timeoutMillis, JWK_SET_SIZE_LIMIT));

        log.info("Loading signing keys from {}, refreshing every {}", signingKeysUri,
                token.getKeyRefreshInterval());
        return new RefreshingJwkKeyResolver(source, token.getKeyRefreshInterval());
    }

    @Bean
    ReactiveJwtDecoder identityTokenDecoder(RefreshingJwkKeyResolver signingKeyResolver,
            IdentityTokenProperties token) {
        return IdentityTokenDecoderBuilder.create()
                .keyResolver(signingKeyResolver)
                .issuer(token.getIssuer())
                .jwsAlgorithms(token.getJwsAlgorithms())
                .build();
    }

    @Bean
    IdentityTokenValidator identityTokenValidator(ReactiveJwtDecoder identityTokenDecoder) {
        return new IdentityTokenValidator(identityTokenDecoder);
    }

    @Bean
    @ConditionalOnEnabledHealthIndicator("signingKeys")
    SigningKeysHealthIndicator signingKeysHealthIndicator(RefreshingJwkKeyResolver signingKeyResolver) {
        return new SigningKeysHealthIndicator(signingKeyResolver);
    }
}
