package com.chainguru.ingestion.registry;

import com.chainguru.domain.ChainTarget;
import com.chainguru.domain.ProtocolFamily;
import com.chainguru.ingestion.config.RegistryProperties;
import com.chainguru.ingestion.fetch.FetchException;
import com.chainguru.ingestion.fetch.SafeFetchGate;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Account-model chains from the public chain listing (chainid.network). Keeps only plain http(s) RPC URLs:
 * templated URLs ({@code ${INFURA_API_KEY}}) and websocket endpoints are dropped.
 */
@Slf4j
@Component
@Order(2)
@ConditionalOnProperty(prefix = "chainguru.registry.chainlist", name = "enabled", havingValue = "true")
@RequiredArgsConstructor
public class ChainlistTargetRegistry implements TargetRegistry {

    private final SafeFetchGate safeFetchGate;
    private final RegistryProperties properties;

    @Override
    public String name() {
        return "chainlist:" + properties.getChainlist().getUrl();
    }

    @Override
    public List<ChainTarget> loadTargets() {
        JsonNode listing;
        try {
            listing = safeFetchGate.getJson(properties.getChainlist().getUrl());
        } catch (FetchException e) {
            throw new RegistryUnavailableException("Chain listing unavailable: " + e.getMessage(), e);
        }
        if (!listing.isArray()) {
            throw new RegistryUnavailableException("Chain listing is not a JSON array");
        }
        int maxEndpoints = Math.max(1, properties.getChainlist().getMaxEndpointsPerChain());
        List<ChainTarget> targets = new ArrayList<>();
        for (JsonNode chain : listing) {
            JsonNode id = chain.path("chainId");
            if (!id.canConvertToLong()) {
                continue;
            }
            List<String> endpoints = new ArrayList<>();
            for (JsonNode rpc : chain.path("rpc")) {
                String url = rpc.isTextual() ? rpc.asText() : rpc.path("url").asText(null);
                if (isUsableRpcUrl(url) && endpoints.size() < maxEndpoints) {
                    endpoints.add(url.trim());
                }
            }
            String explorer = null;
            for (JsonNode e : chain.path("explorers")) {
                explorer = e.path("url").asText(null);
                if (explorer != null) {
                    break;
                }
            }
            targets.add(new ChainTarget(Long.toString(id.asLong()), chain.path("name").asText(null),
                    ProtocolFamily.ACCOUNT_MODEL, null, endpoints, explorer));
        }
        log.info("Loaded {} chains from {}", targets.size(), properties.getChainlist().getUrl());
        return targets;
    }

    static boolean isUsableRpcUrl(String url) {
        if (url == null || url.isBlank() || url.contains("${")) {
            return false;
        }
        String lower = url.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith("https://") || lower.startsWith("http://");
    }
}
