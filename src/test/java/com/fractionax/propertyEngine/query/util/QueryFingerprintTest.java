package com.fractionax.propertyEngine.query.util;

import com.fractionax.propertyEngine.query.model.PropertyQuery;
import com.fractionax.propertyEngine.query.model.SearchType;
import com.fractionax.propertyEngine.query.service.QueryNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class QueryFingerprintTest {

    private final QueryNormalizer normalizer = new QueryNormalizer();

    private String fingerprint(PropertyQuery query, SearchType type) {
        return QueryFingerprint.of(normalizer.normalize(query, type));
    }

    @Test
    @DisplayName("casing and whitespace variants of a general query share a fingerprint")
    void generalVariants() {
        String a = fingerprint(PropertyQuery.builder().rawText("affordable homes in Houston").build(), SearchType.GENERAL);
        String b = fingerprint(PropertyQuery.builder().rawText("  Affordable   HOMES in houston ").build(), SearchType.GENERAL);

        assertEquals(a, b);
        assertEquals(64, a.length());
        assertTrue(a.matches("[0-9a-f]+"));
    }

    @Test
    @DisplayName("casing and whitespace variants of a structured address share a fingerprint")
    void addressVariants() {
        String a = fingerprint(PropertyQuery.builder()
                .address1("1600 Amphitheatre Parkway").city("Mountain View").state("CA").build(), SearchType.ADDRESS);
        String b = fingerprint(PropertyQuery.builder()
                .address1(" 1600  amphitheatre parkway").city("mountain view ").state("ca").build(), SearchType.ADDRESS);

        assertEquals(a, b);
    }

    @Test
    @DisplayName("different queries get different fingerprints")
    void distinctQueries() {
        String houston = fingerprint(PropertyQuery.builder().rawText("homes in Houston").build(), SearchType.GENERAL);
        String austin = fingerprint(PropertyQuery.builder().rawText("homes in Austin").build(), SearchType.GENERAL);
        String withCoordinates = fingerprint(PropertyQuery.builder()
                .address1("123 Main St").postalCode("77002").lat(29.76).lng(-95.36).build(), SearchType.ADDRESS);
        String withoutCoordinates = fingerprint(PropertyQuery.builder()
                .address1("123 Main St").postalCode("77002").build(), SearchType.ADDRESS);

        assertNotEquals(houston, austin);
        assertNotEquals(withCoordinates, withoutCoordinates);
    }

    @Test
    @DisplayName("parcel fingerprints ignore casing and surrounding whitespace")
    void parcelFingerprint() {
        assertEquals(QueryFingerprint.ofParcel("ABC123"), QueryFingerprint.ofParcel(" abc123 "));
    }
}
