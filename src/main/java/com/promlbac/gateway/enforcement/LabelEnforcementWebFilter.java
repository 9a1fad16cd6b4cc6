package com.promlbac.gateway.enforcement;

import com.promlbac.gateway.security.jwt.IdentityTokenValidator;
import com.promlbac.gateway.teams.MembershipFetcher;
import java.util.List;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import org.springframework.web.util.pattern.PathPattern;
import reactor.core.publisher.Mono;

/**
 * Derives the {@link EnforcedLabelSet} of a request from its Grafana identity token and stores it as the
 * {@link #ENFORCED_LABEL_SET_ATTR} exchange attribute before continuing the chain.
 * <p>
 * Any failure ends the request with the status of its {@link EnforcementFailure}; the chain is not continued.
 */
@Slf4j
@RequiredArgsConstructor
public class LabelEnforcementWebFilter implements WebFilter, Ordered {

    public static final String ENFORCED_LABEL_SET_ATTR = "com.promlbac.gateway.enforced-label-set";

    /**
     * Runs before the gateway handles the request, the gateway filters read the published attribute.
     */
    public static final int LABEL_ENFORCEMENT_FILTER_ORDER = -100;

    @NonNull
    private final String tokenHeaderName;

    @NonNull
    private final IdentityTokenValidator tokenValidator;

    @NonNull
    private final MembershipFetcher membershipFetcher;

    @NonNull
    private final List<PathPattern> unprotectedPaths;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (this.isUnprotected(exchange)) {
            return chain.filter(exchange);
        }

        return this.resolveLabelSet(exchange)
                .onErrorResume(LabelEnforcementException.class,
                        ex -> EnforcementRejection.reject(exchange, ex).then(Mono.<EnforcedLabelSet>empty()))
                .flatMap(labelSet -> {
                    exchange.getAttributes().put(ENFORCED_LABEL_SET_ATTR, labelSet);
                    return chain.filter(exchange);
                });
    }

    private Mono<EnforcedLabelSet> resolveLabelSet(ServerWebExchange exchange) {
        var rawToken = exchange.getRequest().getHeaders().getFirst(this.tokenHeaderName);

        return this.tokenValidator.validate(rawToken)
                .flatMap(assertion -> this.membershipFetcher.fetchMemberships(assertion.getCallerId())
                        .map(memberships -> EnforcedLabelSet.scopedTo(assertion.getClaimedOrgId(),
                                assertion.getCallerId(), memberships))
                        .doOnNext(labelSet -> log.debug("{} {} -> {} enforcing {}",
                                exchange.getRequest().getMethod(), exchange.getRequest().getPath(), assertion,
                                labelSet.getValues())));
    }

    private boolean isUnprotected(ServerWebExchange exchange) {
        var path = exchange.getRequest().getPath().pathWithinApplication();
        return this.unprotectedPaths.stream().anyMatch(pattern -> pattern.matches(path));
    }

    @Override
    public int getOrder() {
        return LABEL_ENFORCEMENT_FILTER_ORDER;
    }
}
