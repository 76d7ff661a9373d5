package com.chainguru.reporting;

/**
 * Sums over one family class. Missing tps / total values count as 0.
 */
public record FamilyTotals(ChainFamilyClass familyClass, long chainCount, double tpsSum, double totalTxSum) {

    static FamilyTotals empty(ChainFamilyClass familyClass) {
        return new FamilyTotals(familyClass, 0, 0.0, 0.0);
    }

    FamilyTotals add(Double tps, Double totalTx) {
        return new FamilyTotals(familyClass, chainCount + 1,
                tpsSum + (tps != null ? tps : 0.0),
                totalTxSum + (totalTx != null ? totalTx : 0.0));
    }
}
