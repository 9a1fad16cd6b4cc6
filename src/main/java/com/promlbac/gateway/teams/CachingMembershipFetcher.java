package com.promlbac.gateway.teams;

import com.promlbac.gateway.teams.cache.MembershipCache;
import java.util.List;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Serves memberships from a {@link MembershipCache}, only calling the delegate on a cache miss. Failed fetches are
 * not cached.
 */
@Slf4j
@RequiredArgsConstructor
public class CachingMembershipFetcher implements MembershipFetcher {

    @NonNull
    private final MembershipFetcher delegate;

    @NonNull
    private final MembershipCache cache;

    @Override
    public Mono<List<GroupMembership>> fetchMemberships(String callerId) {
        return Mono.defer(() -> Mono.justOrEmpty(this.cache.get(callerId)))
                .doOnNext(memberships -> log.trace("Team memberships of userId={} served from cache", callerId))
                .switchIfEmpty(Mono.defer(() -> this.delegate.fetchMemberships(callerId)
                        .doOnNext(memberships -> this.cache.put(callerId, memberships))));
    }
}
