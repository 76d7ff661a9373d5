package com.chainguru.reporting;

public record ChainMetricsSummary(FamilyTotals evm, FamilyTotals nonEvm) {
}
