package com.chainguru.domain;

import java.util.List;
import java.util.Locale;

/**
 * One network to measure in a run. Built from the registry and read-only for the run's duration.
 *
 * @param protocol optional lower-case hint selecting a concrete sampler inside the family (e.g. "sui", "near")
 */
public record ChainTarget(String chainId,
                          String chainName,
                          ProtocolFamily protocolFamily,
                          String protocol,
                          List<String> candidateEndpoints,
                          String explorerUrl) {

    public ChainTarget {
        candidateEndpoints = candidateEndpoints != null ? List.copyOf(candidateEndpoints) : List.of();
        protocol = protocol != null && !protocol.isBlank() ? protocol.trim().toLowerCase(Locale.ROOT) : null;
        explorerUrl = explorerUrl != null && !explorerUrl.isBlank() ? explorerUrl.trim() : null;
    }

    public boolean hasCandidateEndpoints() {
        return !candidateEndpoints.isEmpty();
    }

    public boolean hasExplorerUrl() {
        return explorerUrl != null;
    }

    /** True when no protocol hint is set or the hint equals {@code name}. */
    public boolean protocolIsOrDefault(String name) {
        return protocol == null || protocol.equals(name);
    }
}
