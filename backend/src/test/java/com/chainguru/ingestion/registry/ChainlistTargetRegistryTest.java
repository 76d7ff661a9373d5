package com.chainguru.ingestion.registry;

import com.chainguru.domain.ChainTarget;
import com.chainguru.domain.ProtocolFamily;
import com.chainguru.ingestion.config.RegistryProperties;
import com.chainguru.ingestion.fetch.FetchException;
import com.chainguru.ingestion.fetch.SafeFetchGate;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ChainlistTargetRegistryTest {

    private static final String LISTING = """
            [
              {"name":"Ethereum Mainnet","chainId":1,
               "rpc":["https://mainnet.infura.io/v3/${INFURA_API_KEY}","wss://eth.ws.test",
                      "https://eth.rpc.test",{"url":"https://eth2.rpc.test","tracking":"none"},
                      "https://eth3.rpc.test"],
               "explorers":[{"name":"etherscan","url":"https://etherscan.io","standard":"EIP3091"}]},
              {"name":"Broken","chainId":"not-a-number","rpc":["https://broken.test"]},
              {"name":"No RPC","chainId":424242,"rpc":[]}
            ]
            """;

    private SafeFetchGate gate;
    private RegistryProperties properties;
    private ChainlistTargetRegistry registry;

    @BeforeEach
    void setUp() throws Exception {
        gate = mock(SafeFetchGate.class);
        properties = new RegistryProperties();
        properties.getChainlist().setEnabled(true);
        properties.getChainlist().setMaxEndpointsPerChain(2);
        registry = new ChainlistTargetRegistry(gate, properties);
        when(gate.getJson(properties.getChainlist().getUrl())).thenReturn(new ObjectMapper().readTree(LISTING));
    }

    @Test
    void loadTargets_keepsPlainHttpRpcUrlsUpToCap() {
        List<ChainTarget> targets = registry.loadTargets();

        ChainTarget eth = targets.get(0);
        assertThat(eth.chainId()).isEqualTo("1");
        assertThat(eth.chainName()).isEqualTo("Ethereum Mainnet");
        assertThat(eth.protocolFamily()).isEqualTo(ProtocolFamily.ACCOUNT_MODEL);
        assertThat(eth.candidateEndpoints()).containsExactly("https://eth.rpc.test", "https://eth2.rpc.test");
        assertThat(eth.explorerUrl()).isEqualTo("https://etherscan.io");
    }

    @Test
    void loadTargets_nonNumericChainIdSkipped() {
        assertThat(registry.loadTargets()).extracting(ChainTarget::chainId).containsExactly("1", "424242");
    }

    @Test
    void loadTargets_chainWithoutRpc_keptWithoutEndpoints() {
        assertThat(registry.loadTargets().get(1).hasCandidateEndpoints()).isFalse();
    }

    @Test
    void loadTargets_listingUnreachable_registryUnavailable() {
        when(gate.getJson(properties.getChainlist().getUrl())).thenThrow(new FetchException("http_503"));

        assertThatThrownBy(() -> registry.loadTargets())
                .isInstanceOf(RegistryUnavailableException.class)
                .hasMessageContaining("http_503");
    }

    @Test
    void isUsableRpcUrl_rejectsTemplatesAndWebsockets() {
        assertThat(ChainlistTargetRegistry.isUsableRpcUrl("https://rpc.test")).isTrue();
        assertThat(ChainlistTargetRegistry.isUsableRpcUrl("HTTP://rpc.test")).isTrue();
        assertThat(ChainlistTargetRegistry.isUsableRpcUrl("wss://rpc.test")).isFalse();
        assertThat(ChainlistTargetRegistry.isUsableRpcUrl("https://rpc.test/${API_KEY}")).isFalse();
        assertThat(ChainlistTargetRegistry.isUsableRpcUrl(null)).isFalse();
    }
}
