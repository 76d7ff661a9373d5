package com.chainguru.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MeasurementResultTest {

    private static final ChainTarget TARGET = new ChainTarget("1", "Ethereum", ProtocolFamily.ACCOUNT_MODEL, null,
            List.of("https://rpc.example"), null);

    @Test
    @DisplayName("success carries tps, endpoint and Live health label")
    void success() {
        MeasurementResult r = MeasurementResult.success(TARGET, "https://rpc.example", 12.5, 1000.0);

        assertThat(r.isSuccess()).isTrue();
        assertThat(r.errorDetail()).isNull();
        assertThat(r.source()).isEqualTo(MeasurementSource.PROTOCOL_RPC);
        assertThat(r.healthLabel()).isEqualTo("Live");
        assertThat(r.chainName()).isEqualTo("Ethereum");
    }

    @Test
    void pageInspection_hasScrapedLabelAndNoEndpoint() {
        MeasurementResult r = MeasurementResult.pageInspection(TARGET, 3.0, null);

        assertThat(r.healthLabel()).isEqualTo("Live (Scraped)");
        assertThat(r.endpointUsed()).isNull();
        assertThat(r.source()).isEqualTo(MeasurementSource.PAGE_INSPECTION);
    }

    @Test
    void error_healthLabelIsDetail() {
        MeasurementResult r = MeasurementResult.error(TARGET, "http_503");

        assertThat(r.status()).isEqualTo(MeasurementStatus.ERROR);
        assertThat(r.healthLabel()).isEqualTo("http_503");
        assertThat(r.tpsEstimate()).isNull();
    }

    @Test
    @DisplayName("SUCCESS without tps or with an error detail is rejected")
    void successInvariant() {
        assertThatThrownBy(() -> new MeasurementResult("1", null, null, null, null, MeasurementStatus.SUCCESS,
                null, null, Instant.now())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MeasurementResult("1", null, null, 1.0, null, MeasurementStatus.SUCCESS,
                "boom", null, Instant.now())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void errorWithoutDetail_rejected() {
        assertThatThrownBy(() -> new MeasurementResult("1", null, null, null, null, MeasurementStatus.ERROR,
                null, null, Instant.now())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void negativeEstimates_rejected() {
        assertThatThrownBy(() -> MeasurementResult.success(TARGET, "https://rpc.example", -1.0, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MeasurementResult.success(TARGET, "https://rpc.example", 1.0, -5.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MeasurementResult.success(TARGET, "https://rpc.example", Double.NaN, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void protocolFamily_acceptsWireAndConstantNames() {
        assertThat(ProtocolFamily.fromWireName("cosmos-like")).isEqualTo(ProtocolFamily.COSMOS_LIKE);
        assertThat(ProtocolFamily.fromWireName("CHECKPOINT_LEDGER")).isEqualTo(ProtocolFamily.CHECKPOINT_LEDGER);
        assertThatThrownBy(() -> ProtocolFamily.fromWireName("plasma")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void measurementStatus_wireValueIsLowerCase() {
        assertThat(MeasurementStatus.SUCCESS.wireValue()).isEqualTo("success");
        assertThat(MeasurementStatus.fromWireValue("skipped")).isEqualTo(MeasurementStatus.SKIPPED);
        assertThat(MeasurementStatus.fromWireValue("ERROR")).isEqualTo(MeasurementStatus.ERROR);
    }

    @Test
    void chainTarget_normalizesProtocolAndExplorer() {
        ChainTarget t = new ChainTarget("sui", "Sui", ProtocolFamily.CHECKPOINT_LEDGER, " SUI ", null, "  ");

        assertThat(t.protocol()).isEqualTo("sui");
        assertThat(t.hasExplorerUrl()).isFalse();
        assertThat(t.hasCandidateEndpoints()).isFalse();
        assertThat(t.protocolIsOrDefault("sui")).isTrue();
        assertThat(t.protocolIsOrDefault("aptos")).isFalse();
    }
}
