package com.fractionax.propertyEngine.query.model;

/**
 * Search type of a property query. Determined once per query and drives which
 * resolution path runs.
 */
public enum SearchType {

    /**
     * Exact address lookup against the property-data provider.
     */
    ADDRESS,

    /**
     * Free-text listing search against the listings provider.
     */
    GENERAL
}
