package com.fractionax.propertyEngine.provider;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Looks up provider adapters by {@link ProviderId}.
 */
@Slf4j
@Component
public class ProviderRegistry {

    private final Map<ProviderId, PropertyProvider> providers = new EnumMap<>(ProviderId.class);

    public ProviderRegistry(List<PropertyProvider> adapters) {
        for (PropertyProvider adapter : adapters) {
            PropertyProvider previous = providers.put(adapter.providerId(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Duplicate provider adapter for " + adapter.providerId()
                        + ": " + previous.getClass().getSimpleName() + ", " + adapter.getClass().getSimpleName());
            }
        }
        log.info("Registered provider adapters: {}", providers.keySet());
    }

    public PropertyDataProvider propertyData(ProviderId id) {
        return lookup(id, PropertyDataProvider.class);
    }

    public ListingsProvider listings(ProviderId id) {
        return lookup(id, ListingsProvider.class);
    }

    private <T extends PropertyProvider> T lookup(ProviderId id, Class<T> capability) {
        PropertyProvider provider = providers.get(id);
        if (provider == null) {
            throw new IllegalStateException("No provider adapter registered for " + id);
        }
        if (!capability.isInstance(provider)) {
            throw new IllegalStateException("Provider " + id + " does not implement " + capability.getSimpleName());
        }
        return capability.cast(provider);
    }
}
