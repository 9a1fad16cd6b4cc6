package com.promlbac.gateway.security.jwt;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.time.Duration;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties("lbac.token")
public class IdentityTokenProperties {

    @NotBlank
    private String headerName = "X-Grafana-Id";

    /**
     * When set, tokens must carry this exact {@code iss} claim
     */
    private String issuer;

    @NotEmpty
    private List<String> jwsAlgorithms = List.of("ES256", "RS256");

    private Duration keyRefreshInterval = Duration.ofHours(1);
}
