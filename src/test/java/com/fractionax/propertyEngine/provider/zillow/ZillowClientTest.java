package com.fractionax.propertyEngine.provider.zillow;

import com.fractionax.propertyEngine.provider.ProviderCallTemplate;
import com.fractionax.propertyEngine.provider.ProviderResponseCaches;
import com.fractionax.propertyEngine.provider.exception.ProviderHttpException;
import com.fractionax.propertyEngine.provider.model.ListingData;
import com.fractionax.propertyEngine.provider.model.ListingSearchResult;
import com.fractionax.propertyEngine.query.model.SearchFilters;
import com.fractionax.propertyEngine.support.JsonFixtures;
import com.fractionax.propertyEngine.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class ZillowClientTest {

    private static final String BASE_URL = "https://zillow.test";

    private MockRestServiceServer server;
    private ZillowClient client;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        ProviderResponseCaches caches = new ProviderResponseCaches(100, Duration.ofHours(24), Duration.ofHours(12),
                Duration.ofHours(6), Duration.ofDays(30), new MutableClock(Instant.parse("2024-06-01T12:00:00Z")));
        client = new ZillowClient(builder, BASE_URL, "test-key", "zillow.test", new ProviderCallTemplate(), caches);
    }

    @Test
    @DisplayName("search sends RapidAPI headers and the supported filters")
    void searchSendsFilters() {
        server.expect(requestTo(startsWith(BASE_URL + "/propertyExtendedSearch")))
                .andExpect(header("x-rapidapi-key", "test-key"))
                .andExpect(header("x-rapidapi-host", "zillow.test"))
                .andExpect(queryParam("location", containsString("Houston")))
                .andExpect(queryParam("status_type", "ForSale"))
                .andExpect(queryParam("maxPrice", "300000"))
                .andExpect(queryParam("bedsMin", "3"))
                .andRespond(withSuccess(JsonFixtures.load("zillow/search-houston.json"), MediaType.APPLICATION_JSON));

        SearchFilters filters = SearchFilters.builder()
                .location("Houston, TX")
                .maxPrice(300_000L)
                .minBeds(3)
                .status("ForSale")
                .propertyType("house")
                .build();

        ListingSearchResult result = client.searchByLocation("3 bedroom houses in Houston under 300k", filters);

        assertEquals(412, result.getTotalResultCount());
        assertEquals(Set.of("location", "status", "maxPrice", "minBeds"), result.getAppliedFilters());
        assertFalse(result.getAppliedFilters().contains(SearchFilters.PROPERTY_TYPE));
        server.verify();
    }

    @Test
    @DisplayName("search maps listings and drops entries without a zpid")
    void searchMapsListings() {
        server.expect(requestTo(startsWith(BASE_URL + "/propertyExtendedSearch")))
                .andRespond(withSuccess(JsonFixtures.load("zillow/search-houston.json"), MediaType.APPLICATION_JSON));

        List<ListingData> listings = client.searchByLocation("Houston, TX", null).getListings();

        assertEquals(2, listings.size());
        ListingData first = listings.get(0);
        assertEquals("27941236", first.getListingId());
        assertEquals(285_000L, first.getPrice());
        assertEquals("FOR_SALE", first.getStatus());
        assertEquals("123 Main St", first.getAddress().getLine1());
        assertEquals("Houston", first.getAddress().getCity());
        assertEquals("house", first.getStructure().getPropertyType());
        assertEquals(3, first.getStructure().getBedrooms());
        assertEquals(1650, first.getStructure().getSquareFeet());
        assertEquals(List.of("https://photos.example.com/27941236-a.jpg", "https://photos.example.com/27941236-b.jpg"),
                first.getImages());

        ListingData second = listings.get(1);
        assertEquals("condo", second.getStructure().getPropertyType());
        assertTrue(second.getImages().isEmpty());
    }

    @Test
    @DisplayName("search without a status reports only the location as applied")
    void defaultStatusIsNotReportedAsApplied() {
        server.expect(requestTo(startsWith(BASE_URL + "/propertyExtendedSearch")))
                .andExpect(queryParam("status_type", "ForSale"))
                .andRespond(withSuccess(JsonFixtures.load("zillow/search-houston.json"), MediaType.APPLICATION_JSON));

        ListingSearchResult result = client.searchByLocation("Austin", SearchFilters.builder().build());

        assertEquals(Set.of("location"), result.getAppliedFilters());
    }

    @Test
    @DisplayName("an exact address answer becomes a single listing")
    void singleMatch() {
        server.expect(requestTo(startsWith(BASE_URL + "/propertyExtendedSearch")))
                .andRespond(withSuccess(JsonFixtures.load("zillow/search-single.json"), MediaType.APPLICATION_JSON));

        ListingSearchResult result = client.searchByLocation("1600 Amphitheatre Pkwy, Mountain View, CA 94043", null);

        assertEquals(1, result.getListings().size());
        ListingData listing = result.getListings().get(0);
        assertEquals("19520814", listing.getListingId());
        assertEquals(1_925_000L, listing.getPrice());
        assertEquals(3.0, listing.getStructure().getBathrooms());
        assertEquals("94043", listing.getAddress().getPostalCode());
        assertTrue(listing.getImages().isEmpty());
        assertEquals(1, result.getTotalResultCount());
    }

    @Test
    @DisplayName("search without any location is rejected before calling the provider")
    void searchRequiresLocation() {
        assertThrows(IllegalArgumentException.class, () -> client.searchByLocation(" ", null));
        server.verify();
    }

    @Test
    @DisplayName("images are de-duplicated in order")
    void getImages() {
        server.expect(requestTo(BASE_URL + "/images?zpid=19520814"))
                .andRespond(withSuccess(JsonFixtures.load("zillow/images.json"), MediaType.APPLICATION_JSON));

        List<String> images = client.getImages("19520814");

        assertEquals(List.of("https://photos.example.com/19520814-1.jpg", "https://photos.example.com/19520814-2.jpg"),
                images);
    }

    @Test
    @DisplayName("429 is surfaced without retry")
    void rateLimitedNotRetried() {
        server.expect(requestTo(startsWith(BASE_URL + "/propertyExtendedSearch")))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        ProviderHttpException ex = assertThrows(ProviderHttpException.class,
                () -> client.searchByLocation("Houston, TX", null));

        assertEquals(429, ex.getStatus());
        server.verify();
    }

    @Test
    @DisplayName("home types map onto the listing vocabulary")
    void normalizesPropertyType() {
        assertEquals("house", ZillowClient.normalizePropertyType("SINGLE_FAMILY"));
        assertEquals("land", ZillowClient.normalizePropertyType("LOT"));
        assertEquals("multi_family", ZillowClient.normalizePropertyType("multi_family"));
        assertNull(ZillowClient.normalizePropertyType(null));
    }

    @Test
    @DisplayName("photos of a listing are fetched once")
    void imagesAreCached() {
        server.expect(ExpectedCount.once(), requestTo(BASE_URL + "/images?zpid=19520814"))
                .andRespond(withSuccess(JsonFixtures.load("zillow/images.json"), MediaType.APPLICATION_JSON));

        List<String> first = client.getImages("19520814");

        assertEquals(first, client.getImages("19520814"));
        server.verify();
    }

    @Test
    @DisplayName("a listing without photos is asked again")
    void emptyImagesAreNotCached() {
        server.expect(ExpectedCount.times(2), requestTo(BASE_URL + "/images?zpid=27941237"))
                .andRespond(withSuccess("{\"images\":[]}", MediaType.APPLICATION_JSON));

        assertTrue(client.getImages("27941237").isEmpty());
        assertTrue(client.getImages("27941237").isEmpty());
        server.verify();
    }
}
