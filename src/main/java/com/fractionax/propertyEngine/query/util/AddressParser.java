package com.fractionax.propertyEngine.query.util;

import com.fractionax.propertyEngine.query.model.StreetAddress;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Utility class for parsing and normalizing US street addresses.
 *
 * Deterministic only: no geocoding, no I/O.
 */
public final class AddressParser {

    /**
     * Street suffixes recognised without a comma-separated locality, e.g. "123 Main St".
     */
    public static final String STREET_SUFFIXES =
            "st|street|ave|avenue|dr|drive|rd|road|ct|court|ln|lane|way|blvd|boulevard|pl|place"
                    + "|ter|terrace|cir|circle|pkwy|parkway|hwy|highway|trl|trail|loop|sq|square";

    private static final Pattern STREET_LINE = Pattern.compile("^(\\d+[A-Za-z]?(?:-\\d+)?)\\s+(.*[A-Za-z].*)$");

    private static final Pattern STATE_ZIP = Pattern.compile("^([A-Za-z]{2})(?:\\s+(\\d{5}(?:-\\d{4})?))?$");

    private static final Pattern ZIP_ONLY = Pattern.compile("^(\\d{5})(?:-\\d{4})?$");

    private static final Pattern CITY_STATE_ZIP =
            Pattern.compile("^(.+?)\\s+([A-Za-z]{2})(?:\\s+(\\d{5}(?:-\\d{4})?))?$");

    private static final Pattern UNIT_SUFFIX = Pattern.compile("\\s+(?:apt|apartment|unit|ste|suite|#)\\s*[A-Za-z0-9-]+$",
            Pattern.CASE_INSENSITIVE);

    private static final List<String> COUNTRY_PARTS = List.of("usa", "us", "united states", "united states of america");

    private static final Map<String, String> ABBREVIATIONS = Map.ofEntries(
            Map.entry("street", "st"),
            Map.entry("avenue", "ave"),
            Map.entry("av", "ave"),
            Map.entry("drive", "dr"),
            Map.entry("road", "rd"),
            Map.entry("court", "ct"),
            Map.entry("lane", "ln"),
            Map.entry("boulevard", "blvd"),
            Map.entry("place", "pl"),
            Map.entry("terrace", "ter"),
            Map.entry("circle", "cir"),
            Map.entry("parkway", "pkwy"),
            Map.entry("highway", "hwy"),
            Map.entry("trail", "trl"),
            Map.entry("square", "sq"),
            Map.entry("north", "n"),
            Map.entry("south", "s"),
            Map.entry("east", "e"),
            Map.entry("west", "w"),
            Map.entry("northeast", "ne"),
            Map.entry("northwest", "nw"),
            Map.entry("southeast", "se"),
            Map.entry("southwest", "sw")
    );

    private AddressParser() {}

    /**
     * Returns true if the line starts with a street number followed by a street name.
     */
    public static boolean isStreetLine(String line) {
        return line != null && STREET_LINE.matcher(line.trim()).matches();
    }

    /**
     * Parses a one-line address such as "1600 Amphitheatre Parkway, Mountain View, CA 94043".
     *
     * @param text Free-text address
     * @return Parsed address, or empty if the text does not start with a street line
     */
    public static Optional<StreetAddress> parse(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }

        List<String> parts = Arrays.stream(text.trim().split(","))
                .map(String::trim)
                .filter(part -> !part.isEmpty())
                .collect(Collectors.toCollection(ArrayList::new));

        while (parts.size() > 1 && COUNTRY_PARTS.contains(parts.get(parts.size() - 1).toLowerCase(Locale.ROOT))) {
            parts.remove(parts.size() - 1);
        }

        if (parts.isEmpty() || !isStreetLine(parts.get(0))) {
            return Optional.empty();
        }

        StreetAddress.StreetAddressBuilder builder = StreetAddress.builder().line1(collapse(parts.get(0)));

        if (parts.size() >= 3) {
            builder.city(collapse(parts.get(1)));
            applyStateZip(builder, parts.get(2));
        } else if (parts.size() == 2) {
            String locality = collapse(parts.get(1));
            Matcher zipOnly = ZIP_ONLY.matcher(locality);
            Matcher cityStateZip = CITY_STATE_ZIP.matcher(locality);
            if (zipOnly.matches()) {
                builder.postalCode(zipOnly.group(1));
            } else if (STATE_ZIP.matcher(locality).matches()) {
                applyStateZip(builder, locality);
            } else if (cityStateZip.matches()) {
                builder.city(cityStateZip.group(1));
                builder.state(cityStateZip.group(2).toUpperCase(Locale.ROOT));
                builder.postalCode(cityStateZip.group(3));
            } else {
                builder.city(locality);
            }
        }

        return Optional.of(builder.build());
    }

    /**
     * Extracts the street number from a street line.
     *
     * @param line1 Street line, e.g. "1600 Amphitheatre Pkwy"
     * @return "1600", or null if the line has no leading number
     */
    public static String streetNumber(String line1) {
        if (line1 == null) {
            return null;
        }
        Matcher matcher = STREET_LINE.matcher(line1.trim());
        return matcher.matches() ? matcher.group(1).toLowerCase(Locale.ROOT) : null;
    }

    /**
     * Extracts the street name from a street line and normalizes it for comparison:
     * lowercase, punctuation and unit designators removed, suffixes and directionals
     * abbreviated ("Amphitheatre Parkway" and "amphitheatre pkwy." compare equal).
     *
     * @param line1 Street line
     * @return Normalized street name, or null if the line has no leading number
     */
    public static String normalizedStreetName(String line1) {
        if (line1 == null) {
            return null;
        }
        Matcher matcher = STREET_LINE.matcher(line1.trim());
        if (!matcher.matches()) {
            return null;
        }
        String name = UNIT_SUFFIX.matcher(matcher.group(2)).replaceAll("");
        return Arrays.stream(name.toLowerCase(Locale.ROOT).replaceAll("[.,']", "").split("\\s+"))
                .filter(word -> !word.isEmpty())
                .map(word -> ABBREVIATIONS.getOrDefault(word, word))
                .collect(Collectors.joining(" "));
    }

    /**
     * Returns the 5-digit prefix of a postal code, or null.
     */
    public static String postalPrefix(String postalCode) {
        if (postalCode == null) {
            return null;
        }
        String digits = postalCode.trim();
        return digits.length() >= 5 && digits.substring(0, 5).chars().allMatch(Character::isDigit)
                ? digits.substring(0, 5)
                : null;
    }

    private static void applyStateZip(StreetAddress.StreetAddressBuilder builder, String part) {
        Matcher matcher = STATE_ZIP.matcher(collapse(part));
        if (matcher.matches()) {
            builder.state(matcher.group(1).toUpperCase(Locale.ROOT));
            builder.postalCode(matcher.group(2));
            return;
        }
        Matcher zipOnly = ZIP_ONLY.matcher(part.trim());
        if (zipOnly.matches()) {
            builder.postalCode(zipOnly.group(1));
        }
    }

    private static String collapse(String value) {
        return value.trim().replaceAll("\\s+", " ");
    }
}
