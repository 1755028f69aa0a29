package com.fractionax.propertyEngine.provider.zillow;

import com.fractionax.propertyEngine.provider.ListingsProvider;
import com.fractionax.propertyEngine.provider.ProviderCallTemplate;
import com.fractionax.propertyEngine.provider.ProviderId;
import com.fractionax.propertyEngine.provider.ProviderResponseCaches;
import com.fractionax.propertyEngine.provider.model.ListingData;
import com.fractionax.propertyEngine.provider.model.ListingSearchResult;
import com.fractionax.propertyEngine.provider.model.StructureData;
import com.fractionax.propertyEngine.provider.zillow.dto.ZillowImagesResponse;
import com.fractionax.propertyEngine.provider.zillow.dto.ZillowSearchResponse;
import com.fractionax.propertyEngine.query.model.SearchFilters;
import com.fractionax.propertyEngine.query.util.AddressParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriBuilder;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Client for the Zillow listings API on RapidAPI.
 *
 * Authenticates with static {@code x-rapidapi-key} / {@code x-rapidapi-host} headers.
 * Location, price bounds, status and minimum bedrooms are sent as query parameters;
 * property type is left to the caller's post-filter. Photo lists are cached per zpid.
 */
@Slf4j
@Service
public class ZillowClient implements ListingsProvider {

    static final String DEFAULT_STATUS = "ForSale";

    private static final Set<String> SUPPORTED_FILTERS = Set.of(
            SearchFilters.LOCATION,
            SearchFilters.MIN_PRICE,
            SearchFilters.MAX_PRICE,
            SearchFilters.STATUS,
            SearchFilters.MIN_BEDS
    );

    private final RestClient restClient;
    private final ProviderCallTemplate callTemplate;
    private final ProviderResponseCaches caches;

    public ZillowClient(@Qualifier("zillowRestClientBuilder") RestClient.Builder restClientBuilder,
                        @Value("${providers.zillow.base-url:https://zillow-com1.p.rapidapi.com}") String baseUrl,
                        @Value("${providers.zillow.api-key:}") String apiKey,
                        @Value("${providers.zillow.api-host:zillow-com1.p.rapidapi.com}") String apiHost,
                        ProviderCallTemplate callTemplate,
                        ProviderResponseCaches caches) {
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("Zillow API key is not configured. Set providers.zillow.api-key in application.yaml");
        }
        this.restClient = restClientBuilder
                .baseUrl(baseUrl)
                .defaultHeader("x-rapidapi-key", apiKey)
                .defaultHeader("x-rapidapi-host", apiHost)
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.callTemplate = callTemplate;
        this.caches = caches;
    }

    @Override
    public ProviderId providerId() {
        return ProviderId.ZILLOW;
    }

    @Override
    public Set<String> supportedFilters() {
        return SUPPORTED_FILTERS;
    }

    @Override
    public ListingSearchResult searchByLocation(String text, SearchFilters filters) {
        SearchFilters effective = filters != null ? filters : SearchFilters.builder().build();
        String location = effective.getLocation() != null && !effective.getLocation().isBlank()
                ? effective.getLocation()
                : text;
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("Listing search requires a location");
        }

        Set<String> applied = new LinkedHashSet<>();
        applied.add(SearchFilters.LOCATION);
        String status = effective.getStatus() != null ? effective.getStatus() : DEFAULT_STATUS;
        if (effective.getStatus() != null) {
            applied.add(SearchFilters.STATUS);
        }
        if (effective.getMinPrice() != null) {
            applied.add(SearchFilters.MIN_PRICE);
        }
        if (effective.getMaxPrice() != null) {
            applied.add(SearchFilters.MAX_PRICE);
        }
        if (effective.getMinBeds() != null) {
            applied.add(SearchFilters.MIN_BEDS);
        }

        log.debug("Zillow listing search - location: '{}', filters: {}", location, applied);

        ZillowSearchResponse response = callTemplate.execute(ProviderId.ZILLOW, "searchByLocation", () -> restClient.get()
                .uri(uriBuilder -> {
                    UriBuilder builder = uriBuilder.path("/propertyExtendedSearch")
                            .queryParam("location", location)
                            .queryParam("status_type", status);
                    if (effective.getMinPrice() != null) {
                        builder.queryParam("minPrice", effective.getMinPrice());
                    }
                    if (effective.getMaxPrice() != null) {
                        builder.queryParam("maxPrice", effective.getMaxPrice());
                    }
                    if (effective.getMinBeds() != null) {
                        builder.queryParam("bedsMin", effective.getMinBeds());
                    }
                    return builder.build();
                })
                .retrieve()
                .body(ZillowSearchResponse.class));

        List<ListingData> listings = toListings(response);
        Integer total = response != null && response.getTotalResultCount() != null
                ? response.getTotalResultCount()
                : listings.size();

        log.info("Zillow listing search returned {} listings (total: {})", listings.size(), total);
        return ListingSearchResult.builder()
                .listings(listings)
                .totalResultCount(total)
                .appliedFilters(applied)
                .build();
    }

    @Override
    public List<String> getImages(String listingId) {
        List<String> images = caches.images().get(listingId, zpid -> {
            List<String> fetched = fetchImages(zpid);
            return fetched.isEmpty() ? null : fetched;
        });
        return images != null ? images : List.of();
    }

    private List<String> fetchImages(String listingId) {
        log.debug("Zillow images - zpid: {}", listingId);

        ZillowImagesResponse response = callTemplate.execute(ProviderId.ZILLOW, "getImages", () -> restClient.get()
                .uri(uriBuilder -> uriBuilder.path("/images").queryParam("zpid", listingId).build())
                .retrieve()
                .body(ZillowImagesResponse.class));

        if (response == null || response.getImages() == null) {
            return List.of();
        }
        return response.getImages().stream()
                .filter(Objects::nonNull)
                .filter(url -> !url.isBlank())
                .distinct()
                .toList();
    }

    private List<ListingData> toListings(ZillowSearchResponse response) {
        if (response == null) {
            return List.of();
        }
        if (response.isSingleMatch()) {
            return List.of(listing(response.getZpid(), response.getAddress(), response.getPrice(),
                    response.getHomeStatus(), response.getLatitude(), response.getLongitude(),
                    structure(response.getPropertyType(), response.getBedrooms(), response.getBathrooms(), response.getLivingArea()),
                    images(response.getImgSrc(), null)));
        }
        if (response.getProps() == null) {
            return List.of();
        }
        return response.getProps().stream()
                .filter(Objects::nonNull)
                .filter(prop -> prop.getZpid() != null)
                .map(prop -> listing(prop.getZpid(), prop.getAddress(), prop.getPrice(), prop.getListingStatus(),
                        prop.getLatitude(), prop.getLongitude(),
                        structure(prop.getPropertyType(), prop.getBedrooms(), prop.getBathrooms(), prop.getLivingArea()),
                        images(prop.getImgSrc(), prop.getCarouselPhotos())))
                .toList();
    }

    private ListingData listing(String zpid, String addressText, Long price, String status,
                                Double latitude, Double longitude, StructureData structure, List<String> images) {
        return ListingData.builder()
                .listingId(zpid)
                .addressText(addressText)
                .address(AddressParser.parse(addressText).orElse(null))
                .price(price)
                .status(status)
                .latitude(latitude)
                .longitude(longitude)
                .structure(structure)
                .images(images)
                .build();
    }

    private StructureData structure(String propertyType, Integer bedrooms, Double bathrooms, Integer livingArea) {
        return StructureData.builder()
                .propertyType(normalizePropertyType(propertyType))
                .bedrooms(bedrooms)
                .bathrooms(bathrooms)
                .squareFeet(livingArea)
                .build();
    }

    private List<String> images(String imgSrc, List<ZillowSearchResponse.Photo> carousel) {
        Set<String> urls = new LinkedHashSet<>();
        if (imgSrc != null && !imgSrc.isBlank()) {
            urls.add(imgSrc);
        }
        if (carousel != null) {
            carousel.stream()
                    .filter(Objects::nonNull)
                    .map(ZillowSearchResponse.Photo::getUrl)
                    .filter(url -> url != null && !url.isBlank())
                    .forEach(urls::add);
        }
        return new ArrayList<>(urls);
    }

    /**
     * Maps Zillow home types ("SINGLE_FAMILY", "CONDO", ...) onto the listing vocabulary.
     */
    static String normalizePropertyType(String homeType) {
        if (homeType == null || homeType.isBlank()) {
            return null;
        }
        return switch (homeType.trim().toUpperCase(Locale.ROOT)) {
            case "SINGLE_FAMILY", "MANUFACTURED" -> "house";
            case "CONDO" -> "condo";
            case "TOWNHOUSE" -> "townhouse";
            case "APARTMENT" -> "apartment";
            case "MULTI_FAMILY" -> "multi_family";
            case "LOT", "LAND" -> "land";
            default -> homeType.trim().toLowerCase(Locale.ROOT);
        };
    }
}
