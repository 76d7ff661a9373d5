package com.chainguru.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Measurement run settings (scheduler cadence, dispatcher limits).
 */
@ConfigurationProperties(prefix = "chainguru.measurement")
@NoArgsConstructor
@Getter
@Setter
public class MeasurementProperties {

    /** Max targets sampled at the same time. */
    private int concurrency = 50;

    /** A target still running after this is cancelled and recorded as "timeout". */
    private long perTargetTimeoutMs = 60_000;

    /** Store commit cadence, in completed targets. */
    private int commitEvery = 10;

    /** Delay between the end of one run and the start of the next. Default 6 h. */
    private long pollIntervalMs = 21_600_000;

    /** Start a run as soon as the application is ready instead of waiting for the first poll. */
    private boolean runOnStartup = false;

    /** Progress is logged every this many completions. */
    private int progressLogEvery = 25;
}
