package com.promlbac.gateway.enforcement;

import java.nio.charset.StandardCharsets;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

/**
 * Ends an exchange with the status and public message of a {@link LabelEnforcementException}.
 */
@Slf4j
@UtilityClass
public class EnforcementRejection {

    public Mono<Void> reject(ServerWebExchange exchange, LabelEnforcementException ex) {
        var failure = ex.getFailure();
        var request = exchange.getRequest();

        if (failure.isServerError()) {
            log.error("{} {} rejected with {}: {}", request.getMethod(), request.getPath(), failure,
                    ex.getMessage(), ex.getCause());
        } else {
            log.debug("{} {} rejected with {}: {}", request.getMethod(), request.getPath(), failure,
                    ex.getMessage());
        }

        var response = exchange.getResponse();
        if (response.isCommitted()) {
            return Mono.error(ex);
        }
        response.setStatusCode(failure.getStatus());
        response.getHeaders().setContentType(MediaType.TEXT_PLAIN);
        var body = response.bufferFactory().wrap(failure.getPublicMessage().getBytes(StandardCharsets.UTF_8));
        return response.writeWith(Mono.just(body));
    }
}
