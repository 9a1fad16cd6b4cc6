package com.promlbac.gateway.filter.headers;

import com.promlbac.gateway.filter.headers.EnforcedLabelHeaderGatewayFilterFactory.Config;
import jakarta.validation.constraints.NotBlank;
import java.util.List;
import lombok.Data;
import org.springframework.cloud.gateway.filter.GatewayFilter;
import org.springframework.cloud.gateway.filter.factory.AbstractGatewayFilterFactory;
import org.springframework.cloud.gateway.support.GatewayToStringStyler;
import org.springframework.util.Assert;
import org.springframework.validation.annotation.Validated;

/**
 * Route filter {@code EnforcedLabelHeader=<header-name>[,<list-syntax>]}.
 *
 * @see EnforcedLabelHeaderGatewayFilter
 */
public class EnforcedLabelHeaderGatewayFilterFactory extends AbstractGatewayFilterFactory<Config> {

    private final String tokenHeaderName;

    public EnforcedLabelHeaderGatewayFilterFactory(String tokenHeaderName) {
        super(Config.class);
        this.tokenHeaderName = tokenHeaderName;
    }

    @Override
    public List<String> shortcutFieldOrder() {
        return List.of("name", "listSyntax");
    }

    @Override
    public GatewayFilter apply(Config config) {
        Assert.hasText(config.getName(), "EnforcedLabelHeader requires a header name");

        return new EnforcedLabelHeaderGatewayFilter(config.getName(), config.isListSyntax(), this.tokenHeaderName) {
            @Override
            public String toString() {
                return GatewayToStringStyler.filterToStringCreator(EnforcedLabelHeaderGatewayFilterFactory.this)
                        .append("name", config.getName())
                        .append("listSyntax", config.isListSyntax())
                        .toString();
            }
        };
    }

    @Data
    @Validated
    public static class Config {

        @NotBlank
        private String name;

        /**
         * Send all values as a single comma-separated header line instead of one line per value
         */
        private boolean listSyntax;
    }
}
