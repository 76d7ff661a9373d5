package com.chainguru.ingestion.fetch;

/**
 * URL rejected by {@link SafeFetchGate#validate(String)}; no network call was attempted.
 * Message is the block reason (e.g. "private_ip_blocked").
 */
public class FetchBlockedException extends FetchException {

    private final String url;

    public FetchBlockedException(String url, String reason) {
        super(reason);
        this.url = url;
    }

    public String getUrl() {
        return url;
    }

    public String getReason() {
        return getMessage();
    }
}
