package com.promlbac.gateway.teams.cache;

import com.promlbac.gateway.teams.GroupMembership;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Time-bounded cache of the unfiltered team memberships of a user, keyed by user id.
 * <p>
 * Implementations must be safe for concurrent use. A reader racing a writer for the same user sees either the old
 * or the new list, never a mix of both.
 */
public interface MembershipCache {

    /**
     * @return the cached memberships, or empty when there is no entry or the entry has expired
     */
    Optional<List<GroupMembership>> get(String callerId);

    /**
     * Stores memberships with the default time-to-live, replacing any existing entry.
     */
    void put(String callerId, List<GroupMembership> memberships);

    void put(String callerId, List<GroupMembership> memberships, Duration timeToLive);

    /**
     * Removes all expired entries.
     *
     * @return the number of removed entries
     */
    int evictExpired();
}
