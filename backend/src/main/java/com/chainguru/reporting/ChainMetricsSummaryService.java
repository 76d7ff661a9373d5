package com.chainguru.reporting;

import com.chainguru.domain.ChainMetrics;
import com.chainguru.domain.ChainMetricsRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Read-only totals over chain_metrics for the public read API: TPS and lifetime transactions per family class.
 */
@Service
@RequiredArgsConstructor
public class ChainMetricsSummaryService {

    private final ChainMetricsRepository repository;

    public ChainMetricsSummary summarize() {
        FamilyTotals evm = FamilyTotals.empty(ChainFamilyClass.EVM);
        FamilyTotals nonEvm = FamilyTotals.empty(ChainFamilyClass.NON_EVM);
        for (ChainMetrics metrics : repository.findAll()) {
            if (ChainFamilyClass.of(metrics.getChainId()) == ChainFamilyClass.EVM) {
                evm = evm.add(metrics.getTps10min(), metrics.getTotalTxCount());
            } else {
                nonEvm = nonEvm.add(metrics.getTps10min(), metrics.getTotalTxCount());
            }
        }
        return new ChainMetricsSummary(evm, nonEvm);
    }
}
