package com.chainguru.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Where measurement targets come from.
 */
@ConfigurationProperties(prefix = "chainguru.registry")
@NoArgsConstructor
@Getter
@Setter
public class RegistryProperties {

    /** Spring resource location of the curated target document. */
    private String staticLocation = "classpath:registry/chains.json";

    private Chainlist chainlist = new Chainlist();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Chainlist {

        /** Also load account-model chains from the public chain listing. */
        private boolean enabled = false;

        private String url = "https://chainid.network/chains.json";

        /** Cap on endpoints kept per chain; the listing carries dozens for popular chains. */
        private int maxEndpointsPerChain = 5;
    }
}
