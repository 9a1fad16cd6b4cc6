package com.promlbac.gateway.teams.cache;

import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties("lbac.cache")
public class MembershipCacheProperties {

    @NotNull
    private Duration timeToLive = Duration.ofMinutes(5);

    @NotNull
    private Duration cleanupInterval = Duration.ofMinutes(10);
}
