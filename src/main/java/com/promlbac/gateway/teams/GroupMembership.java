package com.promlbac.gateway.teams;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.NonNull;

/**
 * A Grafana team the caller is a member of. The team name is the label value that ends up being enforced.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record GroupMembership(
        @JsonProperty("id") long groupId,
        @JsonProperty("orgId") long orgId,
        @JsonProperty("name") @NonNull String name
) {

}
