package com.chainguru.reporting;

import com.chainguru.common.NumberParsing;

/**
 * Reporting split of persisted chains. Account-model chains are keyed by their numeric chain id.
 */
public enum ChainFamilyClass {
    EVM,
    NON_EVM;

    public static ChainFamilyClass of(String chainId) {
        return NumberParsing.isDigitsOnly(chainId) ? EVM : NON_EVM;
    }
}
