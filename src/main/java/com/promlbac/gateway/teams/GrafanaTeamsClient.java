package com.promlbac.gateway.teams;

import com.promlbac.gateway.enforcement.EnforcementFailure;
import com.promlbac.gateway.enforcement.LabelEnforcementException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Fetches the team memberships of a user from the Grafana HTTP API.
 * <p>
 * The {@link WebClient} is expected to be configured with the Grafana base URL and the service account credentials.
 */
@Slf4j
@RequiredArgsConstructor
public class GrafanaTeamsClient implements MembershipFetcher {

    private static final ParameterizedTypeReference<List<GroupMembership>> MEMBERSHIP_LIST =
            new ParameterizedTypeReference<>() {
            };

    @NonNull
    private final WebClient webClient;

    @NonNull
    private final String teamsPath;

    @NonNull
    private final Duration timeout;

    @Override
    public Mono<List<GroupMembership>> fetchMemberships(@NonNull String callerId) {
        return this.webClient.get()
                .uri(this.teamsPath, Map.of("userId", callerId))
                .accept(MediaType.APPLICATION_JSON)
                .retrieve()
                .onStatus(status -> !status.is2xxSuccessful(), response -> unexpectedStatus(callerId, response))
                .bodyToMono(MEMBERSHIP_LIST)
                .<List<GroupMembership>>handle((memberships, sink) -> {
                    if (memberships.stream().anyMatch(Objects::isNull)) {
                        sink.error(new LabelEnforcementException(EnforcementFailure.UPSTREAM_UNAVAILABLE,
                                "Teams response for userId=%s contains null entries".formatted(callerId)));
                    } else {
                        sink.next(memberships);
                    }
                })
                .switchIfEmpty(Mono.error(() -> new LabelEnforcementException(EnforcementFailure.UPSTREAM_UNAVAILABLE,
                        "Empty teams response for userId=%s".formatted(callerId))))
                .timeout(this.timeout)
                .onErrorMap(ex -> !(ex instanceof LabelEnforcementException),
                        ex -> new LabelEnforcementException(EnforcementFailure.UPSTREAM_UNAVAILABLE,
                                "Fetching teams for userId=%s failed: %s".formatted(callerId, ex.toString()), ex))
                .doOnNext(memberships -> log.debug("Fetched {} team memberships for userId={}", memberships.size(),
                        callerId));
    }

    private static Mono<LabelEnforcementException> unexpectedStatus(String callerId, ClientResponse response) {
        return Mono.just(new LabelEnforcementException(EnforcementFailure.UPSTREAM_UNAVAILABLE,
                "Unexpected status %d fetching teams for userId=%s".formatted(response.statusCode().value(),
                        callerId)));
    }
}
