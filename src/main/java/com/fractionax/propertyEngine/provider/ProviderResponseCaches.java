package com.fractionax.propertyEngine.provider;

import com.fractionax.propertyEngine.cache.ProviderResponseCache;
import com.fractionax.propertyEngine.provider.model.ParcelMatch;
import com.fractionax.propertyEngine.provider.model.StructureData;
import com.fractionax.propertyEngine.provider.model.ValuationData;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Per-call caches in front of the provider APIs.
 *
 * Parcel lookups, structure and valuation are keyed by address or parcel id and outlive
 * the query-level cache, so general searches that enrich the same parcels again reuse them.
 * Valuations change more often than structure; listing photos hardly ever.
 */
@Component
public class ProviderResponseCaches {

    private final ProviderResponseCache<String, ParcelMatch> parcelsByAddress;
    private final ProviderResponseCache<String, StructureData> structures;
    private final ProviderResponseCache<String, ValuationData> valuations;
    private final ProviderResponseCache<String, List<String>> images;

    public ProviderResponseCaches(@Value("${engine.provider-cache.maximum-size:5000}") long maximumSize,
                                  @Value("${engine.provider-cache.parcel-ttl:24h}") Duration parcelTtl,
                                  @Value("${engine.provider-cache.structure-ttl:12h}") Duration structureTtl,
                                  @Value("${engine.provider-cache.valuation-ttl:6h}") Duration valuationTtl,
                                  @Value("${engine.provider-cache.images-ttl:30d}") Duration imagesTtl,
                                  Clock clock) {
        this.parcelsByAddress = new ProviderResponseCache<>("parcelsByAddress", parcelTtl, maximumSize, clock);
        this.structures = new ProviderResponseCache<>("structures", structureTtl, maximumSize, clock);
        this.valuations = new ProviderResponseCache<>("valuations", valuationTtl, maximumSize, clock);
        this.images = new ProviderResponseCache<>("images", imagesTtl, maximumSize, clock);
    }

    public ProviderResponseCache<String, ParcelMatch> parcelsByAddress() {
        return parcelsByAddress;
    }

    public ProviderResponseCache<String, StructureData> structures() {
        return structures;
    }

    public ProviderResponseCache<String, ValuationData> valuations() {
        return valuations;
    }

    public ProviderResponseCache<String, List<String>> images() {
        return images;
    }

    /**
     * Drops every cached provider response.
     */
    public void clear() {
        parcelsByAddress.clear();
        structures.clear();
        valuations.clear();
        images.clear();
    }
}
