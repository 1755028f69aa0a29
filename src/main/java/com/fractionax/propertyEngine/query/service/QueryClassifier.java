package com.fractionax.propertyEngine.query.service;

import com.fractionax.propertyEngine.query.model.PropertyQuery;
import com.fractionax.propertyEngine.query.model.SearchType;
import com.fractionax.propertyEngine.query.util.AddressParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Decides whether a query is an exact address lookup or a general listing search.
 *
 * Pure function of the query: no I/O, no state.
 */
@Slf4j
@Service
public class QueryClassifier {

    /**
     * Listing-search phrasing: counts, price qualifiers and search adjectives.
     * Vetoes both address forms when it appears in the street segment.
     */
    private static final Pattern LISTING_TERMS = Pattern.compile(
            "\\b(?:beds?|bedrooms?|baths?|bathrooms?|br|bd|under|over|above|below|for sale|for rent"
                    + "|price|priced|budget|cheap|cheapest|expensive|luxury|affordable|sqft|square feet|lot size)\\b");

    /**
     * Property nouns and features. "3 bedroom house" is a search, but "45 Lighthouse Rd" is not,
     * so these only veto the bare street-suffix form.
     */
    private static final Pattern PROPERTY_TERMS = Pattern.compile(
            "\\b(?:houses?|homes?|condos?|apartments|townhouses?|townhomes?|property|properties"
                    + "|pool|garage|acres?)\\b");

    /**
     * Plural property nouns or a locality preposition in the street segment: "3 homes in houston, tx".
     */
    private static final Pattern SEARCH_PHRASE = Pattern.compile(
            "\\b(?:houses|homes|condos|apartments|townhouses|townhomes|properties|in|near|around)\\b");

    /**
     * "123 Main St, Houston, TX" / "1600 Amphitheatre Parkway, Mountain View, CA 94043".
     */
    private static final Pattern ADDRESS_WITH_LOCALITY = Pattern.compile(
            "^\\d+[a-z]?\\s+[a-z0-9][a-z0-9 .'-]*[a-z][a-z0-9 .'-]*,\\s*[a-z .'-]+(?:,\\s*[a-z]{2}(?:\\s+\\d{5}(?:-\\d{4})?)?|\\s+[a-z]{2}(?:\\s+\\d{5}(?:-\\d{4})?)?|,\\s*\\d{5}(?:-\\d{4})?)?(?:,\\s*(?:usa|us|united states))?$");

    /**
     * "123 Main St" / "456 Oak Dr Apt 4B".
     */
    private static final Pattern ADDRESS_WITH_SUFFIX = Pattern.compile(
            "^\\d+[a-z]?\\s+[a-z][a-z0-9 .'-]*\\s+(?:" + AddressParser.STREET_SUFFIXES + ")\\b\\.?"
                    + "(?:\\s+(?:apt|apartment|unit|ste|suite|#)\\s*[a-z0-9-]+)?$");

    /**
     * Classifies a query.
     *
     * @param query Inbound query
     * @return ADDRESS for a recognisable street address, otherwise GENERAL
     */
    public SearchType classify(PropertyQuery query) {
        if (query == null || query.isEmpty()) {
            return SearchType.GENERAL;
        }

        if (query.isStructured()) {
            return classifyStructured(query);
        }

        return classifyText(query.getRawText());
    }

    private SearchType classifyStructured(PropertyQuery query) {
        boolean streetLine = AddressParser.isStreetLine(query.getAddress1());
        boolean cityAndState = notBlank(query.getCity()) && notBlank(query.getState());
        boolean postalCode = AddressParser.postalPrefix(query.getPostalCode()) != null;

        if (streetLine && (cityAndState || postalCode)) {
            return SearchType.ADDRESS;
        }

        log.debug("Structured query lacks street number or locality - classifying GENERAL (ambiguous)");
        return SearchType.GENERAL;
    }

    private SearchType classifyText(String rawText) {
        String text = rawText.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);

        if (ADDRESS_WITH_LOCALITY.matcher(text).matches() && AddressParser.parse(text).isPresent()) {
            String street = text.substring(0, text.indexOf(',')).trim();
            if (!LISTING_TERMS.matcher(street).find() && !SEARCH_PHRASE.matcher(street).find()) {
                return SearchType.ADDRESS;
            }
            return SearchType.GENERAL;
        }

        if (LISTING_TERMS.matcher(text).find() || PROPERTY_TERMS.matcher(text).find()) {
            return SearchType.GENERAL;
        }

        if (ADDRESS_WITH_SUFFIX.matcher(text).matches()) {
            return SearchType.ADDRESS;
        }

        if (!Character.isDigit(text.charAt(0)) && !text.contains(" in ")) {
            log.debug("Ambiguous free-text query defaults to GENERAL - text: '{}'", text);
        }
        return SearchType.GENERAL;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
