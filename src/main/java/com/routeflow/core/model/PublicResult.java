package com.routeflow.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * What the request handler receives for one query.
 *
 * @param response   user-facing response text, never blank
 * @param provenance stages that ran, in execution order
 * @param confidence overall confidence in [0,1]
 * @param metadata   severity, specialists invoked, recommendation count,
 *                   per-stage timings and related run details
 */
public record PublicResult(
    String response,
    List<String> provenance,
    double confidence,
    Map<String, Object> metadata
) implements Serializable {}
