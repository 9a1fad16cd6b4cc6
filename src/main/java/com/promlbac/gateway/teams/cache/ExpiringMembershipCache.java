package com.promlbac.gateway.teams.cache;

import com.promlbac.gateway.teams.GroupMembership;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

/**
 * {@link MembershipCache} backed by a {@link ConcurrentHashMap} of immutable entries.
 * <p>
 * Expired entries are dropped when they are read, and by a periodic sweep once {@link #scheduleCleanup(Duration,
 * Scheduler)} has been called.
 */
@Slf4j
public class ExpiringMembershipCache implements MembershipCache, AutoCloseable {

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();

    private final Duration defaultTimeToLive;
    private final Clock clock;

    private final Disposable.Swap cleanupTask = Disposables.swap();

    public ExpiringMembershipCache(@NonNull Duration defaultTimeToLive, @NonNull Clock clock) {
        this.defaultTimeToLive = defaultTimeToLive;
        this.clock = clock;
    }

    @Override
    public Optional<List<GroupMembership>> get(@NonNull String callerId) {
        var entry = this.entries.get(callerId);
        if (entry == null) {
            return Optional.empty();
        }
        if (entry.isExpiredAt(this.clock.instant())) {
            // only removes this exact entry, a concurrent put is kept
            this.entries.remove(callerId, entry);
            return Optional.empty();
        }
        return Optional.of(entry.memberships());
    }

    @Override
    public void put(String callerId, List<GroupMembership> memberships) {
        this.put(callerId, memberships, this.defaultTimeToLive);
    }

    @Override
    public void put(@NonNull String callerId, @NonNull List<GroupMembership> memberships,
            @NonNull Duration timeToLive) {
        this.entries.put(callerId, new Entry(List.copyOf(memberships), this.clock.instant().plus(timeToLive)));
    }

    @Override
    public int evictExpired() {
        var now = this.clock.instant();
        var evicted = 0;
        for (var entry : this.entries.entrySet()) {
            if (entry.getValue().isExpiredAt(now) && this.entries.remove(entry.getKey(), entry.getValue())) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.debug("Evicted {} expired team membership entries", evicted);
        }
        return evicted;
    }

    public int size() {
        return this.entries.size();
    }

    /**
     * Starts evicting expired entries every {@code interval}, replacing a previously scheduled cleanup.
     */
    public ExpiringMembershipCache scheduleCleanup(@NonNull Duration interval, @NonNull Scheduler scheduler) {
        this.cleanupTask.update(Flux.interval(interval, interval, scheduler)
                .subscribe(tick -> this.evictExpired()));
        return this;
    }

    @Override
    public void close() {
        this.cleanupTask.dispose();
    }

    private record Entry(List<GroupMembership> memberships, Instant expiresAt) {

        boolean isExpiredAt(Instant instant) {
            return !instant.isBefore(this.expiresAt);
        }
    }
}
