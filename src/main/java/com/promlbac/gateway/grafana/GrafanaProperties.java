package com.promlbac.gateway.grafana;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Duration;
import java.util.Set;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.Assert;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Connection to the Grafana instance that issues the identity tokens and owns the team memberships.
 */
@Data
@Validated
@ConfigurationProperties("lbac.grafana")
public class GrafanaProperties {

    private static final Set<String> SUPPORTED_SCHEMES = Set.of("http", "https");

    @NotNull
    private URI url;

    /**
     * Service account used for the team lookups, usually provided through {@code GRAFANA_ADMIN_USER}
     */
    @NotBlank
    private String username;

    /**
     * Usually provided through {@code GRAFANA_ADMIN_PASS}
     */
    @NotBlank
    private String password;

    /**
     * Upper bound on a single team lookup
     */
    private Duration timeout = Duration.ofSeconds(5);

    private String signingKeysPath = "/api/signing-keys/keys";

    /**
     * URI template of the per-user teams endpoint, {@code {userId}} is expanded with the caller id
     */
    private String teamsPath = "/api/users/{userId}/teams";

    public URI getSigningKeysUri() {
        return UriComponentsBuilder.fromUri(this.getCheckedUrl())
                .path(this.signingKeysPath)
                .build()
                .toUri();
    }

    public URI getCheckedUrl() {
        Assert.notNull(this.url, "lbac.grafana.url is required");
        Assert.isTrue(this.url.getScheme() != null && SUPPORTED_SCHEMES.contains(this.url.getScheme()),
                () -> "Invalid scheme for grafana URL '%s', only 'http' and 'https' are supported".formatted(this.url));
        return this.url;
    }
}
