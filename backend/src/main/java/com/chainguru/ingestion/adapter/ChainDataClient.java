package com.chainguru.ingestion.adapter;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Chain data access used by samplers: JSON-RPC calls, REST GETs and REST POSTs. Implementations route every request through the
 * fetch gate; tests substitute canned responses.
 */
public interface ChainDataClient {

    /**
     * Perform a single JSON-RPC 2.0 call.
     *
     * @param endpointUrl RPC endpoint URL
     * @param method      e.g. "eth_getBlockByNumber"
     * @param params      method params (list or object); null sends an empty list
     * @return the {@code result} node (may be a NullNode); throws FetchException on transport or RPC error
     */
    JsonNode call(String endpointUrl, String method, Object params);

    /**
     * GET a JSON document.
     *
     * @return parsed body; throws FetchException on transport error or non-2xx
     */
    JsonNode get(String url);

    /**
     * POST a JSON body to a REST endpoint (TronGrid style) and return the parsed response as is.
     */
    JsonNode post(String url, Object body);
}
