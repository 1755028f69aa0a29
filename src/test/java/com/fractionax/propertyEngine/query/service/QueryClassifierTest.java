package com.fractionax.propertyEngine.query.service;

import com.fractionax.propertyEngine.query.model.PropertyQuery;
import com.fractionax.propertyEngine.query.model.SearchType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class QueryClassifierTest {

    private final QueryClassifier classifier = new QueryClassifier();

    @Test
    @DisplayName("structured street line with city and state is an address lookup")
    void structuredAddressWithCityAndState() {
        PropertyQuery query = PropertyQuery.builder()
                .address1("1600 Amphitheatre Parkway")
                .city("Mountain View")
                .state("CA")
                .build();

        assertEquals(SearchType.ADDRESS, classifier.classify(query));
    }

    @Test
    @DisplayName("structured street line with only a postal code is an address lookup")
    void structuredAddressWithPostalCode() {
        PropertyQuery query = PropertyQuery.builder()
                .address1("123 Main St")
                .postalCode("77002")
                .build();

        assertEquals(SearchType.ADDRESS, classifier.classify(query));
    }

    @Test
    @DisplayName("structured street line without locality falls back to general search")
    void structuredAddressWithoutLocality() {
        PropertyQuery query = PropertyQuery.builder()
                .address1("123 Main St")
                .city("Houston")
                .build();

        assertEquals(SearchType.GENERAL, classifier.classify(query));
    }

    @Test
    @DisplayName("structured address1 without street number is general search")
    void structuredWithoutStreetNumber() {
        PropertyQuery query = PropertyQuery.builder()
                .address1("Main Street")
                .city("Houston")
                .state("TX")
                .build();

        assertEquals(SearchType.GENERAL, classifier.classify(query));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "1600 Amphitheatre Parkway, Mountain View, CA",
            "1600 Amphitheatre Parkway, Mountain View, CA 94043",
            "123 Main St, Houston, TX",
            "123 Main St",
            "456 Oak Dr Apt 4B",
            "123 Hanover St, Boston, MA 02113",
            "2500 Clover Ln, Dallas, TX",
            "45 Lighthouse Rd, Miami, FL",
            "900 Homestead Rd, Santa Clara, CA 95051",
            "12 Pool Rd, Tampa, FL"
    })
    @DisplayName("free-text street addresses are address lookups")
    void freeTextAddresses(String text) {
        assertEquals(SearchType.ADDRESS, classifier.classify(PropertyQuery.builder().rawText(text).build()));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "affordable homes in Houston",
            "3 bedroom homes in houston, tx",
            "123 Main St condo under 300k",
            "condos under 400k near Austin",
            "Houston",
            "2 bed apartments for rent in Seattle",
            "3 homes in houston, tx",
            "4 bedroom house on Main St, Austin, TX",
            "123 Pool Rd with garage"
    })
    @DisplayName("listing searches and bare places are general searches")
    void generalSearches(String text) {
        assertEquals(SearchType.GENERAL, classifier.classify(PropertyQuery.builder().rawText(text).build()));
    }

    @Test
    @DisplayName("empty and null queries default to general search")
    void emptyQuery() {
        assertEquals(SearchType.GENERAL, classifier.classify(PropertyQuery.builder().rawText("   ").build()));
        assertEquals(SearchType.GENERAL, classifier.classify(null));
    }

    @Test
    @DisplayName("classification is deterministic")
    void deterministic() {
        PropertyQuery query = PropertyQuery.builder().rawText("123 Main St, Houston, TX").build();

        assertEquals(classifier.classify(query), classifier.classify(query));
    }
}
