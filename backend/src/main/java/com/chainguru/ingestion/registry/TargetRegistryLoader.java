package com.chainguru.ingestion.registry;

import com.chainguru.domain.ChainTarget;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merges all registries in order. The first occurrence of a chainId wins; entries without a chainId or protocol
 * family are dropped with a warning.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TargetRegistryLoader {

    private final List<TargetRegistry> registries;

    /**
     * @throws RegistryUnavailableException when any registry cannot be read
     */
    public List<ChainTarget> loadTargets() {
        Map<String, ChainTarget> merged = new LinkedHashMap<>();
        for (TargetRegistry registry : registries) {
            List<ChainTarget> targets;
            try {
                targets = registry.loadTargets();
            } catch (RegistryUnavailableException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new RegistryUnavailableException("Registry " + registry.name() + " failed: " + e.getMessage(), e);
            }
            int dropped = 0;
            for (ChainTarget target : targets) {
                if (target.chainId() == null || target.chainId().isBlank() || target.protocolFamily() == null) {
                    log.warn("Dropping invalid target from {}: chainId={} family={}", registry.name(),
                            target.chainId(), target.protocolFamily());
                    dropped++;
                    continue;
                }
                merged.putIfAbsent(target.chainId(), target);
            }
            log.debug("Registry {}: {} targets, {} dropped", registry.name(), targets.size(), dropped);
        }
        return List.copyOf(merged.values());
    }
}
