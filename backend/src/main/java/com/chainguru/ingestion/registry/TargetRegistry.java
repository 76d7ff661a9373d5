package com.chainguru.ingestion.registry;

import com.chainguru.domain.ChainTarget;

import java.util.List;

/**
 * Source of measurement targets.
 */
public interface TargetRegistry {

    /** Short name for logs. */
    String name();

    /**
     * @throws RegistryUnavailableException when the source cannot be read
     */
    List<ChainTarget> loadTargets();
}
