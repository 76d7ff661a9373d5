package com.chainguru.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Chain category that decides which sampling strategy applies. Wire names match the registry document.
 */
public enum ProtocolFamily {
    ACCOUNT_MODEL("account-model"),
    UTXO_FORK("utxo-fork"),
    COSMOS_LIKE("cosmos-like"),
    CHECKPOINT_LEDGER("checkpoint-ledger"),
    SUBSTRATE("substrate"),
    CUSTOM("custom");

    private final String wireName;

    ProtocolFamily(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Accepts the wire name ("account-model") or the constant name ("ACCOUNT_MODEL"), case-insensitive.
     *
     * @throws IllegalArgumentException for unknown values
     */
    @JsonCreator
    public static ProtocolFamily fromWireName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Protocol family is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (ProtocolFamily family : values()) {
            if (family.wireName.equals(normalized)) {
                return family;
            }
        }
        throw new IllegalArgumentException("Unknown protocol family: " + value);
    }
}
