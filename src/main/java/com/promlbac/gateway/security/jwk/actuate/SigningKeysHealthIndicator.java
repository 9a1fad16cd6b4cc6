package com.promlbac.gateway.security.jwk.actuate;

import com.promlbac.gateway.security.jwk.RefreshingJwkKeyResolver;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

@RequiredArgsConstructor
public class SigningKeysHealthIndicator implements HealthIndicator {

    @NonNull
    private final RefreshingJwkKeyResolver keyResolver;

    @Override
    public Health health() {
        var keyCount = this.keyResolver.getKeyCount();
        var builder = keyCount > 0 ? Health.up() : Health.down();
        return builder
                .withDetail("keys", keyCount)
                .withDetail("lastRefreshed", this.keyResolver.getLastRefreshed().toString())
                .build();
    }
}
