package com.fractionax.propertyEngine.query.service;

import com.fractionax.propertyEngine.query.model.NormalizedQuery;
import com.fractionax.propertyEngine.query.model.PropertyQuery;
import com.fractionax.propertyEngine.query.model.SearchType;
import com.fractionax.propertyEngine.query.model.StreetAddress;
import com.fractionax.propertyEngine.query.util.AddressParser;
import com.fractionax.propertyEngine.query.util.SearchFilterParser;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Turns a classified query into the normalized form used for provider calls and fingerprinting.
 */
@Service
public class QueryNormalizer {

    /**
     * Normalizes a query for the given search type.
     *
     * @param query Inbound query
     * @param searchType Type decided by {@link QueryClassifier}
     * @return Normalized query
     */
    public NormalizedQuery normalize(PropertyQuery query, SearchType searchType) {
        NormalizedQuery.NormalizedQueryBuilder builder = NormalizedQuery.builder()
                .searchType(searchType)
                .latitude(query.getLat())
                .longitude(query.getLng());

        if (searchType == SearchType.ADDRESS) {
            StreetAddress address = query.isStructured()
                    ? fromStructured(query)
                    : AddressParser.parse(query.getRawText())
                            .orElseThrow(() -> new IllegalArgumentException("Query text is not a street address"));
            return builder.address(address).text(address.oneLine()).build();
        }

        String text = query.isStructured() ? fromStructured(query).oneLine() : collapse(query.getRawText());
        return builder.text(text)
                .filters(SearchFilterParser.parse(text))
                .build();
    }

    private StreetAddress fromStructured(PropertyQuery query) {
        return StreetAddress.builder()
                .line1(collapse(query.getAddress1()))
                .city(collapse(query.getCity()))
                .state(query.getState() != null ? query.getState().trim().toUpperCase(Locale.ROOT) : null)
                .postalCode(query.getPostalCode() != null ? query.getPostalCode().trim() : null)
                .build();
    }

    private static String collapse(String value) {
        if (value == null) {
            return null;
        }
        String collapsed = value.trim().replaceAll("\\s+", " ");
        return collapsed.isEmpty() ? null : collapsed;
    }
}
