package com.chainguru.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Outbound fetch limits applied by SafeFetchGate to every sampler and registry request.
 */
@ConfigurationProperties(prefix = "chainguru.fetch")
@NoArgsConstructor
@Getter
@Setter
public class FetchGateProperties {

    /** Whole-request timeout (connect + response + body). */
    private long timeoutMs = 15_000;

    private int connectTimeoutMs = 5_000;

    /** Response bodies above this size fail with "body_too_large". Default 5 MiB. */
    private int maxBodyBytes = 5 * 1024 * 1024;

    /**
     * Process-wide outbound request budget. With concurrency 50 and several requests per sample, 100/s keeps
     * public endpoints from throttling a whole run.
     */
    private int maxRequestsPerSecond = 100;

    /** How long a caller waits for a permit before failing with "rate_limited". */
    private long limiterTimeoutMs = 5_000;

    private String userAgent = "Mozilla/5.0 (compatible; ChainGuru/1.0)";
}
