package com.promlbac.gateway.teams;

import com.promlbac.gateway.grafana.GrafanaProperties;
import com.promlbac.gateway.teams.cache.ExpiringMembershipCache;
import com.promlbac.gateway.teams.cache.MembershipCache;
import com.promlbac.gateway.teams.cache.MembershipCacheProperties;
import java.time.Clock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Schedulers;

@Slf4j
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties({GrafanaProperties.class, MembershipCacheProperties.class})
public class TeamsConfiguration {

    @Bean
    ExpiringMembershipCache membershipCache(MembershipCacheProperties properties) {
        log.info("Caching team memberships for {}, evicting expired entries every {}", properties.getTimeToLive(),
                properties.getCleanupInterval());
        return new ExpiringMembershipCache(properties.getTimeToLive(), Clock.systemUTC())
                .scheduleCleanup(properties.getCleanupInterval(), Schedulers.parallel());
    }

    @Bean
    GrafanaTeamsClient grafanaTeamsClient(WebClient.Builder webClientBuilder, GrafanaProperties grafana) {
        var webClient = webClientBuilder.clone()
                .baseUrl(grafana.getCheckedUrl().toString())
                .defaultHeaders(headers -> headers.setBasicAuth(grafana.getUsername(), grafana.getPassword()))
                .build();
        return new GrafanaTeamsClient(webClient, grafana.getTeamsPath(), grafana.getTimeout());
    }

    @Bean
    @Primary
    MembershipFetcher cachingMembershipFetcher(GrafanaTeamsClient grafanaTeamsClient, MembershipCache membershipCache) {
        return new CachingMembershipFetcher(grafanaTeamsClient, membershipCache);
    }
}
