package com.chainguru.domain;

/**
 * How a successful estimate was obtained, so consumers can weight confidence.
 */
public enum MeasurementSource {
    /** Measured by sampling the chain's RPC/REST surface. */
    PROTOCOL_RPC,
    /** Derived by inspecting a block-explorer page. */
    PAGE_INSPECTION
}
