package com.chainguru.ingestion.registry;

import com.chainguru.domain.ChainTarget;
import com.chainguru.domain.ProtocolFamily;
import com.chainguru.ingestion.config.RegistryProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Curated targets from a JSON document (array of {@link RegistryEntry}). An unknown protocol family leaves the
 * target without one so the loader drops it.
 */
@Slf4j
@Component
@Order(1)
@RequiredArgsConstructor
public class StaticTargetRegistry implements TargetRegistry {

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;
    private final RegistryProperties properties;

    @Override
    public String name() {
        return "static:" + properties.getStaticLocation();
    }

    @Override
    public List<ChainTarget> loadTargets() {
        Resource resource = resourceLoader.getResource(properties.getStaticLocation());
        if (!resource.exists()) {
            throw new RegistryUnavailableException("Registry document not found: " + properties.getStaticLocation());
        }
        List<RegistryEntry> entries;
        try (InputStream in = resource.getInputStream()) {
            entries = objectMapper.readValue(in, new TypeReference<List<RegistryEntry>>() {});
        } catch (IOException e) {
            throw new RegistryUnavailableException("Cannot read registry document " + properties.getStaticLocation(), e);
        }
        List<ChainTarget> targets = new ArrayList<>(entries.size());
        for (RegistryEntry entry : entries) {
            if (entry == null) {
                continue;
            }
            targets.add(new ChainTarget(entry.chainId(), entry.chainName(), family(entry), entry.protocol(),
                    entry.candidateEndpoints(), entry.explorerUrl()));
        }
        return targets;
    }

    private static ProtocolFamily family(RegistryEntry entry) {
        if (entry.protocolFamily() == null) {
            return null;
        }
        try {
            return ProtocolFamily.fromWireName(entry.protocolFamily());
        } catch (IllegalArgumentException e) {
            log.warn("Registry entry {} has unknown protocol family '{}'", entry.chainId(), entry.protocolFamily());
            return null;
        }
    }
}
