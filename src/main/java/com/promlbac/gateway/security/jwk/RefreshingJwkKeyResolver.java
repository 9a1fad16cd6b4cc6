package com.promlbac.gateway.security.jwk;

import com.nimbusds.jose.KeySourceException;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.source.JWKSetCacheRefreshEvaluator;
import com.nimbusds.jose.jwk.source.JWKSetSource;
import com.nimbusds.jose.proc.SecurityContext;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * {@link JwkKeyResolver} that keeps the last successfully loaded {@link JWKSet} in memory and reloads it from a
 * {@link JWKSetSource} on a fixed interval.
 * <p>
 * The first load happens during construction and must succeed. A failed background reload is logged and leaves the
 * previously loaded keys in place.
 */
@Slf4j
public class RefreshingJwkKeyResolver implements JwkKeyResolver, AutoCloseable {

    private final JWKSetSource<SecurityContext> source;
    private final Clock clock;

    private final AtomicReference<LoadedKeys> current = new AtomicReference<>();
    private final Disposable refreshTask;

    public RefreshingJwkKeyResolver(JWKSetSource<SecurityContext> source, Duration refreshInterval) {
        this(source, refreshInterval, Schedulers.boundedElastic(), Clock.systemUTC());
    }

    public RefreshingJwkKeyResolver(
            @NonNull JWKSetSource<SecurityContext> source,
            @NonNull Duration refreshInterval,
            @NonNull Scheduler scheduler,
            @NonNull Clock clock
    ) {
        this.source = source;
        this.clock = clock;

        try {
            this.current.set(this.load());
        } catch (KeySourceException e) {
            throw new IllegalStateException("Failed to load signing keys from %s".formatted(source), e);
        }

        this.refreshTask = Flux.interval(refreshInterval, refreshInterval, scheduler)
                .subscribe(tick -> this.refresh());
    }

    @Override
    public Optional<JWK> resolve(String keyId) {
        if (keyId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(this.current.get().keys().getKeyByKeyId(keyId))
                .map(JWK::toPublicJWK);
    }

    /**
     * Reloads the signing keys. The held keys are only replaced when loading succeeds.
     *
     * @return whether the keys were replaced
     */
    public boolean refresh() {
        try {
            var loaded = this.load();
            this.current.set(loaded);
            log.debug("Signing keys from {} were refreshed ({} keys)", this.source, loaded.keys().getKeys().size());
            return true;
        } catch (KeySourceException | RuntimeException e) {
            // exceptions must not escape, they would terminate the refresh interval
            log.error("Failed to refresh signing keys from {}; keeping {} keys loaded at {}", this.source,
                    this.getKeyCount(), this.getLastRefreshed(), e);
            return false;
        }
    }

    public int getKeyCount() {
        return this.current.get().keys().getKeys().size();
    }

    public Instant getLastRefreshed() {
        return this.current.get().loadedAt();
    }

    private LoadedKeys load() throws KeySourceException {
        var now = this.clock.instant();
        var jwkSet = this.source.getJWKSet(JWKSetCacheRefreshEvaluator.forceRefresh(), now.toEpochMilli(), null);
        return new LoadedKeys(jwkSet, now);
    }

    @Override
    public void close() {
        this.refreshTask.dispose();
    }

    private record LoadedKeys(JWKSet keys, Instant loadedAt) {

    }
}
