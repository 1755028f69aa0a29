package com.fractionax.propertyEngine.provider.corelogic;

import com.fractionax.propertyEngine.auth.service.CredentialManager;
import com.fractionax.propertyEngine.provider.PropertyDataProvider;
import com.fractionax.propertyEngine.provider.ProviderCallTemplate;
import com.fractionax.propertyEngine.provider.ProviderId;
import com.fractionax.propertyEngine.provider.ProviderResponseCaches;
import com.fractionax.propertyEngine.provider.corelogic.dto.CoreLogicAvmResponse;
import com.fractionax.propertyEngine.provider.corelogic.dto.CoreLogicBuildingsResponse;
import com.fractionax.propertyEngine.provider.corelogic.dto.CoreLogicSearchResponse;
import com.fractionax.propertyEngine.provider.exception.ProviderHttpException;
import com.fractionax.propertyEngine.provider.model.ParcelMatch;
import com.fractionax.propertyEngine.provider.model.StructureData;
import com.fractionax.propertyEngine.provider.model.ValuationData;
import com.fractionax.propertyEngine.query.model.StreetAddress;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Client for the CoreLogic property API (spatial lookup, property search, buildings, AVM).
 *
 * Every request carries a bearer token from {@link CredentialManager}. A 401 invalidates
 * the cached token so the next request re-authenticates. Address matches, structure and
 * valuation are served from {@link ProviderResponseCaches} when present.
 */
@Slf4j
@Service
public class CoreLogicClient implements PropertyDataProvider {

    private final RestClient restClient;
    private final CredentialManager credentialManager;
    private final ProviderCallTemplate callTemplate;
    private final ProviderResponseCaches caches;
    private final int spatialRadiusMeters;

    public CoreLogicClient(@Qualifier("coreLogicRestClientBuilder") RestClient.Builder restClientBuilder,
                           @Value("${providers.corelogic.base-url:https://property.corelogicapi.com}") String baseUrl,
                           @Value("${providers.corelogic.spatial-radius-meters:100}") int spatialRadiusMeters,
                           CredentialManager credentialManager,
                           ProviderCallTemplate callTemplate,
                           ProviderResponseCaches caches) {
        this.restClient = restClientBuilder
                .baseUrl(baseUrl)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.credentialManager = credentialManager;
        this.callTemplate = callTemplate;
        this.caches = caches;
        this.spatialRadiusMeters = spatialRadiusMeters;
    }

    @Override
    public ProviderId providerId() {
        return ProviderId.CORELOGIC;
    }

    @Override
    public List<ParcelMatch> lookupBySpatial(double lat, double lng) {
        log.debug("CoreLogic spatial lookup - lat: {}, lng: {}, radius: {}m", lat, lng, spatialRadiusMeters);

        CoreLogicSearchResponse response = call("lookupBySpatial", () -> restClient.get()
                .uri(uriBuilder -> uriBuilder.path("/spatial/v1/properties")
                        .queryParam("latitude", lat)
                        .queryParam("longitude", lng)
                        .queryParam("radius", spatialRadiusMeters)
                        .build())
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .retrieve()
                .body(CoreLogicSearchResponse.class));

        if (response == null || response.getItems() == null) {
            return List.of();
        }

        return response.getItems().stream()
                .filter(item -> item.getClip() != null)
                .sorted(Comparator.comparing(item -> item.getDistanceMeters() != null ? item.getDistanceMeters() : Double.MAX_VALUE))
                .map(this::toParcelMatch)
                .toList();
    }

    @Override
    public Optional<ParcelMatch> lookupByAddress(StreetAddress address) {
        String key = address.oneLine().trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
        return Optional.ofNullable(caches.parcelsByAddress().get(key, k -> fetchByAddress(address).orElse(null)));
    }

    private Optional<ParcelMatch> fetchByAddress(StreetAddress address) {
        log.debug("CoreLogic address lookup - address: {}", address.oneLine());

        CoreLogicSearchResponse response;
        try {
            response = call("lookupByAddress", () -> restClient.get()
                    .uri(uriBuilder -> {
                        uriBuilder.path("/v2/properties/search/geocode")
                                .queryParam("streetAddress", address.getLine1())
                                .queryParam("bestMatch", true);
                        if (address.getCity() != null) {
                            uriBuilder.queryParam("city", address.getCity());
                        }
                        if (address.getState() != null) {
                            uriBuilder.queryParam("state", address.getState());
                        }
                        if (address.getPostalCode() != null) {
                            uriBuilder.queryParam("zipCode", address.getPostalCode());
                        }
                        return uriBuilder.build();
                    })
                    .header(HttpHeaders.AUTHORIZATION, bearer())
                    .retrieve()
                    .body(CoreLogicSearchResponse.class));
        } catch (ProviderHttpException e) {
            if (e.getStatus() == HttpStatus.NOT_FOUND.value()) {
                log.info("CoreLogic has no parcel for address - address: {}", address.oneLine());
                return Optional.empty();
            }
            throw e;
        }

        if (response == null || response.getItems() == null) {
            return Optional.empty();
        }

        return response.getItems().stream()
                .filter(item -> item.getClip() != null)
                .findFirst()
                .map(this::toParcelMatch);
    }

    @Override
    public StructureData getStructure(String parcelId) {
        return caches.structures().get(parcelId, this::fetchStructure);
    }

    private StructureData fetchStructure(String parcelId) {
        log.debug("CoreLogic buildings - parcelId: {}", parcelId);

        CoreLogicBuildingsResponse response = call("getStructure", () -> restClient.get()
                .uri("/v2/properties/{clip}/buildings", parcelId)
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .retrieve()
                .body(CoreLogicBuildingsResponse.class));

        if (response == null) {
            return StructureData.builder().build();
        }

        CoreLogicBuildingsResponse.Building main = response.getBuildings() == null ? null
                : response.getBuildings().stream()
                        .filter(Objects::nonNull)
                        .max(Comparator.comparing(building -> building.getLivingAreaSquareFeet() != null
                                ? building.getLivingAreaSquareFeet() : 0))
                        .orElse(null);

        return StructureData.builder()
                .propertyType(normalizePropertyType(response.getPropertyType()))
                .yearBuilt(main != null ? main.getYearBuilt() : null)
                .squareFeet(main != null ? main.getLivingAreaSquareFeet() : null)
                .bedrooms(main != null ? main.getBedroomsCount() : null)
                .bathrooms(main != null ? main.getBathroomsCount() : null)
                .build();
    }

    @Override
    public ValuationData getValuation(String parcelId) {
        return caches.valuations().get(parcelId, this::fetchValuation);
    }

    private ValuationData fetchValuation(String parcelId) {
        log.debug("CoreLogic AVM - parcelId: {}", parcelId);

        CoreLogicAvmResponse response = call("getValuation", () -> restClient.get()
                .uri("/v2/properties/{clip}/avm", parcelId)
                .header(HttpHeaders.AUTHORIZATION, bearer())
                .retrieve()
                .body(CoreLogicAvmResponse.class));

        CoreLogicAvmResponse.Valuation valuation = response != null ? response.getValuation() : null;
        if (valuation == null) {
            return ValuationData.builder().build();
        }

        return ValuationData.builder()
                .currentValue(valuation.getEstimatedValue())
                .assessedValue(valuation.getTaxAssessedValue())
                .confidenceScore(valuation.getConfidenceScore())
                .build();
    }

    private <T> T call(String operation, Supplier<T> request) {
        try {
            return callTemplate.execute(ProviderId.CORELOGIC, operation, request);
        } catch (ProviderHttpException e) {
            if (e.getStatus() == HttpStatus.UNAUTHORIZED.value()) {
                credentialManager.invalidate(ProviderId.CORELOGIC);
            }
            throw e;
        }
    }

    private String bearer() {
        return "Bearer " + credentialManager.getToken(ProviderId.CORELOGIC).getAccessToken();
    }

    private ParcelMatch toParcelMatch(CoreLogicSearchResponse.Item item) {
        CoreLogicSearchResponse.Address address = item.getAddress();
        CoreLogicSearchResponse.Location location = item.getLocation();
        return ParcelMatch.builder()
                .parcelId(item.getClip())
                .address(address == null ? null : StreetAddress.builder()
                        .line1(address.getStreetAddress())
                        .city(address.getCity())
                        .state(address.getState())
                        .postalCode(address.getZipCode())
                        .build())
                .latitude(location != null ? location.getLatitude() : null)
                .longitude(location != null ? location.getLongitude() : null)
                .build();
    }

    /**
     * Maps CoreLogic land-use descriptions onto the listing vocabulary ("house", "condo", ...).
     */
    static String normalizePropertyType(String landUse) {
        if (landUse == null || landUse.isBlank()) {
            return null;
        }
        String value = landUse.trim().toLowerCase();
        if (value.contains("condo")) {
            return "condo";
        }
        if (value.contains("townhouse") || value.contains("townhome")) {
            return "townhouse";
        }
        if (value.contains("apartment")) {
            return "apartment";
        }
        if (value.contains("duplex") || value.contains("multi") || value.contains("triplex") || value.contains("fourplex")) {
            return "multi_family";
        }
        if (value.contains("vacant") || value.contains("land")) {
            return "land";
        }
        if (value.contains("single family") || value.contains("sfr") || value.contains("residential")) {
            return "house";
        }
        return value.replace(' ', '_');
    }
}
