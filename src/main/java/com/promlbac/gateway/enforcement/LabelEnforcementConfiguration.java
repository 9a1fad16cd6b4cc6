package com.promlbac.gateway.enforcement;

import com.promlbac.gateway.filter.headers.EnforcedLabelHeaderGatewayFilterFactory;
import com.promlbac.gateway.security.jwt.IdentityTokenProperties;
import com.promlbac.gateway.security.jwt.IdentityTokenValidator;
import com.promlbac.gateway.teams.MembershipFetcher;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.util.pattern.PathPatternParser;

@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties({LabelEnforcementProperties.class, IdentityTokenProperties.class})
public class LabelEnforcementConfiguration {

    @Bean
    LabelEnforcementWebFilter labelEnforcementWebFilter(
            LabelEnforcementProperties enforcement,
            IdentityTokenProperties token,
            IdentityTokenValidator identityTokenValidator,
            MembershipFetcher membershipFetcher
    ) {
        var unprotectedPaths = enforcement.getUnprotectedPaths().stream()
                .map(PathPatternParser.defaultInstance::parse)
                .toList();
        return new LabelEnforcementWebFilter(token.getHeaderName(), identityTokenValidator, membershipFetcher,
                unprotectedPaths);
    }

    @Bean
    EnforcedLabelHeaderGatewayFilterFactory enforcedLabelHeaderGatewayFilterFactory(IdentityTokenProperties token) {
        return new EnforcedLabelHeaderGatewayFilterFactory(token.getHeaderName());
    }
}
