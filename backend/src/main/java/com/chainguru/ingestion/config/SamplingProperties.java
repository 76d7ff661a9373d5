package com.chainguru.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Estimation constants per sampler ({@code chainguru.sampling.<sampler>.*}). Defaults follow what each network
 * family tolerates on public endpoints: deep lookbacks for fast chains, shallow ones where blocks are expensive.
 */
@ConfigurationProperties(prefix = "chainguru.sampling")
@NoArgsConstructor
@Getter
@Setter
public class SamplingProperties {

    private WindowSettings evm = WindowSettings.of(100, List.of(10L, 1L), 5, 600L, null, null);
    private WindowSettings bitcoin = WindowSettings.of(3, List.of(1L), 5, null, 10.0, 600.0);
    private WindowSettings cosmos = WindowSettings.of(50, List.of(10L), 10, null, null, null);
    private WindowSettings sui = WindowSettings.of(20, List.of(5L), 5, null, null, null);
    private WindowSettings aptos = WindowSettings.of(1000, List.of(100L), 5, null, null, null);
    private WindowSettings substrate = WindowSettings.of(10, List.of(1L), 5, null, null, 6.0);
    private WindowSettings near = WindowSettings.of(100, List.of(10L), 3, null, null, null);
    private WindowSettings algorand = WindowSettings.of(20, List.of(5L), 5, null, null, null);
    private WindowSettings stellar = WindowSettings.of(100, List.of(10L), 5, null, null, null);
    private WindowSettings tron = WindowSettings.of(200, List.of(20L), 5, null, null, null);
    private WindowSettings starknet = WindowSettings.of(20, List.of(5L), 5, null, null, null);

    private Solana solana = new Solana();

    /**
     * Window and sampling knobs shared by all block-like samplers.
     */
    @NoArgsConstructor
    @Getter
    @Setter
    public static class WindowSettings {

        /** Units (blocks, checkpoints, rounds) between the head and the reference point. */
        private long lookback;

        /** Tried in order when the reference unit at {@code lookback} cannot be fetched. */
        private List<Long> fallbackLookbacks = new ArrayList<>();

        /** Max units fetched to count transactions. */
        private int sampleSize = 5;

        /**
         * When set, the reference point is moved so the window spans about this many seconds, based on the unit
         * time observed between the head and the first reference.
         */
        private Long targetWindowSeconds;

        /** A refined reference that cannot be fetched is replaced by the first one only if that window is longer. */
        private long refinementKeepSeconds = 60;

        /** Windows shorter than this fall back to the assumed unit time (when one is configured). */
        private Double minWindowSeconds;

        /** Used when the family exposes no timestamps or the observed window is too short. */
        private Double assumedBlockTimeSeconds;

        public static WindowSettings of(long lookback, List<Long> fallbackLookbacks, int sampleSize,
                                        Long targetWindowSeconds, Double minWindowSeconds,
                                        Double assumedBlockTimeSeconds) {
            WindowSettings s = new WindowSettings();
            s.setLookback(lookback);
            s.setFallbackLookbacks(new ArrayList<>(fallbackLookbacks));
            s.setSampleSize(sampleSize);
            s.setTargetWindowSeconds(targetWindowSeconds);
            s.setMinWindowSeconds(minWindowSeconds);
            s.setAssumedBlockTimeSeconds(assumedBlockTimeSeconds);
            return s;
        }
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Solana {

        /** Performance samples requested from the node (each usually covers 60 s). */
        private int performanceSamples = 4;
    }
}
