package com.fractionax.propertyEngine.orchestrator.model;

/**
 * What happened to a provider during one resolution.
 */
public enum DataSourceStatus {
    /**
     * Called and contributed data.
     */
    USED,
    /**
     * Called and failed; its fields stay null.
     */
    FAILED,
    /**
     * Called and had nothing for the query.
     */
    NOT_FOUND,
    /**
     * Not called for this query.
     */
    SKIPPED
}
