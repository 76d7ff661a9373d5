package com.chainguru.ingestion.fetch;

import org.springframework.http.HttpMethod;

/**
 * Request shape for {@link SafeFetchGate#fetch(String, FetchOptions)}. A non-null jsonBody is sent as application/json.
 */
public record FetchOptions(HttpMethod method, Object jsonBody) {

    public static FetchOptions get() {
        return new FetchOptions(HttpMethod.GET, null);
    }

    public static FetchOptions postJson(Object body) {
        return new FetchOptions(HttpMethod.POST, body);
    }
}
