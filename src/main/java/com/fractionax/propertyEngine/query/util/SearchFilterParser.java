package com.fractionax.propertyEngine.query.util;

import com.fractionax.propertyEngine.query.model.SearchFilters;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Utility class for extracting listing-search filters from free text.
 *
 * Handles the common phrasings deterministically: "under 300k", "between $200k and $400k",
 * "3+ bedrooms", "condos for rent in Austin, TX".
 */
@Slf4j
public final class SearchFilterParser {

    public static final String STATUS_FOR_SALE = "ForSale";
    public static final String STATUS_FOR_RENT = "ForRent";
    public static final String STATUS_RECENTLY_SOLD = "RecentlySold";

    private static final String AMOUNT = "\\$?\\s*(\\d++(?:[.,]\\d++)*+)\\s*+(million|thousand|mm|m|k)?\\b";

    private static final Pattern DOT_GROUPED = Pattern.compile("^\\d{1,3}(?:\\.\\d{3})+$");

    private static final Pattern BETWEEN = Pattern.compile(
            "\\bbetween\\s+" + AMOUNT + "\\s+(?:and|-|to)\\s+" + AMOUNT);

    private static final Pattern RANGE = Pattern.compile(
            "\\$\\s*(\\d++(?:[.,]\\d++)*+)\\s*+(million|thousand|mm|m|k)?\\s*(?:-|to)\\s*" + AMOUNT);

    private static final Pattern MAX_PRICE = Pattern.compile(
            "\\b(?:under|below|less than|max(?:imum)?|up to|at most|no more than|cheaper than)\\s+" + AMOUNT);

    private static final Pattern MIN_PRICE = Pattern.compile(
            "\\b(?:over|above|more than|min(?:imum)?|at least|starting at|from)\\s+" + AMOUNT
                    + "(?!\\s*(?:\\+\\s*)?(?:bed|beds|bedroom|bedrooms|br|bd)\\b)");

    private static final Pattern BEDS = Pattern.compile(
            "\\b(\\d+)\\s*\\+?\\s*(?:-\\s*)?(?:bed|beds|bedroom|bedrooms|br|bd)\\b");

    private static final Pattern LOCATION = Pattern.compile(
            "\\b(?:in|near|around)\\s+([a-z][a-z .'-]*?(?:,\\s*[a-z]{2})?)"
                    + "(?=\\s+(?:under|below|over|above|with|for|between|less|more|at|priced|max|min|from|that|which)\\b|[,.;!?]?\\s*$)");

    private static final Pattern PLACE_ONLY = Pattern.compile("^[a-z][a-z .'-]*(?:,\\s*[a-z]{2})?$");

    private SearchFilterParser() {}

    /**
     * Parses filters from a free-text general query.
     *
     * @param text Free text, e.g. "3 bedroom houses under 300k in Houston, TX"
     * @return Parsed filters; location falls back to the whole text when no locality phrase is found
     */
    public static SearchFilters parse(String text) {
        String lower = text == null ? "" : text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);

        SearchFilters.SearchFiltersBuilder builder = SearchFilters.builder()
                .location(extractLocation(lower))
                .status(extractStatus(lower))
                .minBeds(extractMinBeds(lower))
                .propertyType(extractPropertyType(lower));

        Matcher between = BETWEEN.matcher(lower);
        Matcher range = RANGE.matcher(lower);
        if (between.find()) {
            builder.minPrice(toAmount(between.group(1), between.group(2)));
            builder.maxPrice(toAmount(between.group(3), between.group(4)));
        } else if (range.find()) {
            builder.minPrice(toAmount(range.group(1), range.group(2)));
            builder.maxPrice(toAmount(range.group(3), range.group(4)));
        } else {
            Matcher max = MAX_PRICE.matcher(lower);
            if (max.find()) {
                builder.maxPrice(toAmount(max.group(1), max.group(2)));
            }
            Matcher min = MIN_PRICE.matcher(lower);
            if (min.find()) {
                builder.minPrice(toAmount(min.group(1), min.group(2)));
            }
        }

        SearchFilters filters = builder.build();
        log.debug("Parsed search filters - text: '{}', filters: {}", lower, filters.active());
        return filters;
    }

    private static String extractLocation(String lower) {
        Matcher matcher = LOCATION.matcher(lower);
        String location = null;
        while (matcher.find()) {
            location = matcher.group(1);
        }
        if (location == null && PLACE_ONLY.matcher(lower).matches()) {
            location = lower;
        }
        if (location == null) {
            return lower.isEmpty() ? null : lower;
        }
        return toTitleCase(location.trim());
    }

    private static String extractStatus(String lower) {
        if (lower.contains("for rent") || lower.contains("rental") || lower.contains("to rent")) {
            return STATUS_FOR_RENT;
        }
        if (lower.contains("recently sold") || lower.matches(".*\\bsold\\b.*")) {
            return STATUS_RECENTLY_SOLD;
        }
        return null;
    }

    private static Integer extractMinBeds(String lower) {
        Matcher matcher = BEDS.matcher(lower);
        if (!matcher.find()) {
            return null;
        }
        try {
            return Integer.valueOf(matcher.group(1));
        } catch (NumberFormatException e) {
            log.debug("Ignoring bedroom count out of range - value: '{}'", matcher.group(1));
            return null;
        }
    }

    private static String extractPropertyType(String lower) {
        if (lower.matches(".*\\bcondos?\\b.*") || lower.contains("condominium")) {
            return "condo";
        }
        if (lower.matches(".*\\btown(?:house|home)s?\\b.*")) {
            return "townhouse";
        }
        if (lower.matches(".*\\bapartments?\\b.*")) {
            return "apartment";
        }
        if (lower.matches(".*\\bmulti[- ]?family\\b.*") || lower.contains("duplex")) {
            return "multi_family";
        }
        if (lower.matches(".*\\b(?:land|lots?)\\b.*")) {
            return "land";
        }
        if (lower.matches(".*\\bhouses?\\b.*") || lower.contains("single family") || lower.contains("single-family")) {
            return "house";
        }
        return null;
    }

    /**
     * Converts a matched amount to whole dollars. Dots grouping exactly three digits are
     * thousands separators ("1.500.000", "2.500"), except a single group before a unit
     * ("1.500 million" is 1.5 million). Unparseable or out-of-range amounts yield null.
     */
    private static Long toAmount(String number, String unit) {
        String digits = number.replace(",", "");
        if (DOT_GROUPED.matcher(number).matches() && (unit == null || number.indexOf('.') != number.lastIndexOf('.'))) {
            digits = number.replace(".", "");
        }

        BigDecimal value;
        try {
            value = new BigDecimal(digits);
        } catch (NumberFormatException e) {
            log.debug("Ignoring unparseable amount - value: '{}'", number);
            return null;
        }
        if (unit != null) {
            switch (unit) {
                case "k", "thousand" -> value = value.multiply(BigDecimal.valueOf(1_000));
                case "m", "mm", "million" -> value = value.multiply(BigDecimal.valueOf(1_000_000));
                default -> { }
            }
        }
        try {
            return value.setScale(0, RoundingMode.HALF_UP).longValueExact();
        } catch (ArithmeticException e) {
            log.debug("Ignoring amount out of range - value: '{}'", number);
            return null;
        }
    }

    private static String toTitleCase(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        boolean capitalizeNext = true;
        String[] parts = value.split(",", 2);
        for (char c : parts[0].toCharArray()) {
            sb.append(capitalizeNext ? Character.toUpperCase(c) : c);
            capitalizeNext = c == ' ' || c == '-' || c == '.';
        }
        if (parts.length > 1) {
            sb.append(", ").append(parts[1].trim().toUpperCase(Locale.ROOT));
        }
        return sb.toString();
    }
}
