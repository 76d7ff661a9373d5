package com.chainguru.ingestion.fetch;

/**
 * Result of {@link SafeFetchGate#validate(String)}. {@code reason} is null when allowed.
 */
public record UrlValidation(boolean allowed, String reason) {

    public static final String INVALID_URL = "invalid_url";
    public static final String INVALID_SCHEME = "invalid_scheme";
    public static final String MISSING_HOST = "missing_host";
    public static final String LOCALHOST_BLOCKED = "localhost_blocked";
    public static final String PRIVATE_IP_BLOCKED = "private_ip_blocked";
    public static final String DNS_ERROR = "dns_error";

    private static final UrlValidation ALLOWED = new UrlValidation(true, null);

    public static UrlValidation allow() {
        return ALLOWED;
    }

    public static UrlValidation reject(String reason) {
        return new UrlValidation(false, reason);
    }
}
