package com.chainguru.ingestion.adapter;

import com.chainguru.ingestion.fetch.FetchException;
import com.chainguru.ingestion.fetch.SafeFetchGate;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.List;
import java.util.Map;

/**
 * {@link ChainDataClient} over {@link SafeFetchGate}. Used by every sampler.
 */
public class GatedChainDataClient implements ChainDataClient {

    private final SafeFetchGate gate;

    public GatedChainDataClient(SafeFetchGate gate) {
        this.gate = gate;
    }

    @Override
    public JsonNode call(String endpointUrl, String method, Object params) {
        Map<String, Object> body = Map.of(
                "jsonrpc", "2.0",
                "id", 1,
                "method", method,
                "params", params != null ? params : List.of()
        );
        JsonNode root = gate.postJson(endpointUrl, body);
        JsonNode error = root.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            String message = error.path("message").asText(error.toString());
            throw new FetchException(method + " error: " + message);
        }
        JsonNode result = root.path("result");
        return result.isMissingNode() ? NullNode.getInstance() : result;
    }

    @Override
    public JsonNode get(String url) {
        return gate.getJson(url);
    }

    @Override
    public JsonNode post(String url, Object body) {
        return gate.postJson(url, body != null ? body : Map.of());
    }
}
