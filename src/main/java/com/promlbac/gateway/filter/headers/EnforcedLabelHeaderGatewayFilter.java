package com.promlbac.gateway.filter.headers;

import static com.promlbac.gateway.enforcement.LabelEnforcementWebFilter.ENFORCED_LABEL_SET_ATTR;
import static org.springframework.cloud.gateway.support.ServerWebExchangeUtils.GATEWAY_REQUEST_URL_ATTR;

import com.promlbac.gateway.enforcement.EnforcedLabelSet;
import com.promlbac.gateway.enforcement.EnforcementFailure;
import com.promlbac.gateway.enforcement.EnforcementRejection;
import com.promlbac.gateway.enforcement.LabelEnforcementException;
import java.net.SocketException;
import java.util.Optional;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.gateway.filter.GatewayFilter;
import org.springframework.cloud.gateway.filter.GatewayFilterChain;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Relays the {@link EnforcedLabelSet} of the exchange to the upstream label-enforcing proxy as a request header.
 * <p>
 * Any incoming value of the label header is always dropped, as is the identity token. Exchanges without an enforced
 * label set are not forwarded. In list syntax the proxy splits the header on commas and trims the parts, so a label
 * set with values it would read back differently is rejected instead of relayed.
 */
@Slf4j
@RequiredArgsConstructor
public class EnforcedLabelHeaderGatewayFilter implements GatewayFilter {

    private static final String LIST_SEPARATOR = ",";

    @NonNull
    private final String labelHeaderName;

    private final boolean listSyntax;

    @NonNull
    private final String tokenHeaderName;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, GatewayFilterChain chain) {
        var labelSet = loadFromWebExchange(exchange);
        if (labelSet.isEmpty()) {
            var request = exchange.getRequest();
            log.warn("No enforced label set for {} {}, not forwarding", request.getMethod(), request.getURI());
            exchange.getResponse().setStatusCode(HttpStatus.FORBIDDEN);
            return exchange.getResponse().setComplete();
        }

        if (this.listSyntax) {
            var unrelayable = labelSet.get().getValues().stream()
                    .filter(value -> value.contains(LIST_SEPARATOR) || !value.equals(value.strip()))
                    .findFirst();
            if (unrelayable.isPresent()) {
                return EnforcementRejection.reject(exchange, new LabelEnforcementException(
                        EnforcementFailure.INTERNAL_FAILURE,
                        "Label value '%s' can not be relayed in list syntax".formatted(unrelayable.get())));
            }
        }

        var mutated = exchange.mutate()
                .request(request -> request.headers(headers -> this.writeHeaders(headers, labelSet.get())))
                .build();
        return chain.filter(mutated)
                .onErrorResume(SocketException.class, ex -> EnforcementRejection.reject(mutated,
                        new LabelEnforcementException(EnforcementFailure.LABEL_PROXY_UNAVAILABLE,
                                "Forwarding to %s failed: %s".formatted(
                                        mutated.getAttribute(GATEWAY_REQUEST_URL_ATTR), ex), ex)));
    }

    private void writeHeaders(HttpHeaders headers, EnforcedLabelSet labelSet) {
        headers.remove(this.tokenHeaderName);
        headers.remove(this.labelHeaderName);
        if (this.listSyntax) {
            headers.set(this.labelHeaderName, String.join(LIST_SEPARATOR, labelSet.getValues()));
        } else {
            labelSet.getValues().forEach(value -> headers.add(this.labelHeaderName, value));
        }
    }

    private static Optional<EnforcedLabelSet> loadFromWebExchange(ServerWebExchange exchange) {
        return Optional.ofNullable(exchange.getAttribute(ENFORCED_LABEL_SET_ATTR))
                .filter(EnforcedLabelSet.class::isInstance)
                .map(EnforcedLabelSet.class::cast);
    }
}
