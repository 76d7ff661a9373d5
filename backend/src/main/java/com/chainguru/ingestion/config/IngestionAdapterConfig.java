package com.chainguru.ingestion.config;

import com.chainguru.ingestion.adapter.ChainDataClient;
import com.chainguru.ingestion.adapter.GatedChainDataClient;
import com.chainguru.ingestion.fetch.DnsHostResolver;
import com.chainguru.ingestion.fetch.HostResolver;
import com.chainguru.ingestion.fetch.SafeFetchGate;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.netty.channel.ChannelOption;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;

/**
 * Outbound plumbing shared by samplers and registries: the gate's WebClient (no redirects, bounded body),
 * the process-wide request budget and the DNS resolver.
 */
@Configuration
@EnableConfigurationProperties({ FetchGateProperties.class, MeasurementProperties.class, SamplingProperties.class, RegistryProperties.class })
public class IngestionAdapterConfig {

    @Bean(name = "fetchWebClient")
    public WebClient fetchWebClient(WebClient.Builder webClientBuilder, FetchGateProperties properties) {
        HttpClient httpClient = HttpClient.create()
                .followRedirect(false)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, Math.max(1, properties.getConnectTimeoutMs()))
                .responseTimeout(Duration.ofMillis(Math.max(1L, properties.getTimeoutMs())));
        return webClientBuilder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(c -> c.defaultCodecs().maxInMemorySize(properties.getMaxBodyBytes()))
                .build();
    }

    @Bean(name = "fetchRateLimiter")
    public RateLimiter fetchRateLimiter(FetchGateProperties properties) {
        int rps = Math.max(1, properties.getMaxRequestsPerSecond());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(rps)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, properties.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("outbound-fetch", config);
    }

    @Bean
    public HostResolver hostResolver() {
        return new DnsHostResolver();
    }

    @Bean
    public ChainDataClient chainDataClient(SafeFetchGate safeFetchGate) {
        return new GatedChainDataClient(safeFetchGate);
    }
}
