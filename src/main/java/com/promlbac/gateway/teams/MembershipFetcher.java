package com.promlbac.gateway.teams;

import java.util.List;
import reactor.core.publisher.Mono;

public interface MembershipFetcher {

    /**
     * Fetches all team memberships of a user, across all organizations, in the order the upstream returned them.
     *
     * @param callerId the Grafana user id
     * @return the memberships, or an error classified as
     * {@link com.promlbac.gateway.enforcement.EnforcementFailure#UPSTREAM_UNAVAILABLE}
     */
    Mono<List<GroupMembership>> fetchMemberships(String callerId);
}
