package com.chainguru.ingestion.registry;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One record of the curated registry document.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RegistryEntry(
        @JsonProperty("chain_id") String chainId,
        @JsonProperty("chain_name") String chainName,
        @JsonProperty("protocol_family") String protocolFamily,
        @JsonProperty("protocol") String protocol,
        @JsonProperty("candidate_endpoints") List<String> candidateEndpoints,
        @JsonProperty("explorer_url") String explorerUrl) {
}
