package com.chainguru.ingestion.adapter;

/**
 * One block-like unit (block, checkpoint, round) as seen by a sampler.
 *
 * @param timestampSeconds unit time in epoch seconds, null when the family does not expose it
 * @param txCount          transactions in the unit, -1 when the unit was fetched without them
 * @param runningTxCount   cumulative transactions up to this unit, when the family exposes such a counter
 */
public record ChainUnit(long height, Double timestampSeconds, int txCount, Long runningTxCount) {

    public static ChainUnit of(long height, Double timestampSeconds, int txCount) {
        return new ChainUnit(height, timestampSeconds, txCount, null);
    }

    public boolean hasTimestamp() {
        return timestampSeconds != null;
    }
}
