package com.promlbac.gateway.enforcement;

import com.promlbac.gateway.teams.GroupMembership;
import java.util.List;
import lombok.NonNull;
import lombok.Value;

/**
 * The label values the downstream proxy has to enforce for a request: the names of the caller's teams in the
 * organization the identity token was issued for, in upstream order.
 */
@Value
public class EnforcedLabelSet {

    long orgId;

    @NonNull
    List<String> values;

    /**
     * Keeps the names of the memberships in {@code orgId}.
     *
     * @throws LabelEnforcementException with {@link EnforcementFailure#NO_AUTHORIZATION_SCOPE} when there are none
     */
    public static EnforcedLabelSet scopedTo(long orgId, String callerId, List<GroupMembership> memberships) {
        var names = memberships.stream()
                .filter(membership -> membership.orgId() == orgId)
                .map(GroupMembership::name)
                .toList();

        if (names.isEmpty()) {
            throw new LabelEnforcementException(EnforcementFailure.NO_AUTHORIZATION_SCOPE,
                    "userId=%s is not a member of any teams in orgId=%d".formatted(callerId, orgId));
        }

        return new EnforcedLabelSet(orgId, names);
    }
}
