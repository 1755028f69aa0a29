package com.fractionax.propertyEngine.verification.service;

import com.fractionax.propertyEngine.orchestrator.model.CanonicalProperty;
import com.fractionax.propertyEngine.orchestrator.model.Coordinates;
import com.fractionax.propertyEngine.orchestrator.model.PropertyAddress;
import com.fractionax.propertyEngine.query.model.NormalizedQuery;
import com.fractionax.propertyEngine.query.model.SearchType;
import com.fractionax.propertyEngine.query.model.StreetAddress;
import com.fractionax.propertyEngine.query.util.AddressParser;
import com.fractionax.propertyEngine.verification.model.VerificationEnvelope;
import com.fractionax.propertyEngine.verification.util.GeoDistance;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Verification service - cross-checks merged properties against the query.
 *
 * ADDRESS: street number, street name and postal code (or city) must match, and the
 * resolved coordinates must lie within the tolerance of caller-supplied coordinates.
 * GENERAL: always valid; reports where each filter was applied.
 */
@Slf4j
@Service
public class VerificationService {

    static final String PROVIDER_APPLIED = "provider";
    static final String POST_FILTER_APPLIED = "post-filter";

    private final double toleranceMeters;

    public VerificationService(@Value("${engine.verification.tolerance-meters:500}") double toleranceMeters) {
        this.toleranceMeters = toleranceMeters;
    }

    /**
     * Verifies one merged property.
     *
     * @param query Normalized query
     * @param property Merged property
     * @param providerFilters Filter names the listings provider applied as query parameters
     * @return Envelope for the property
     */
    public VerificationEnvelope verify(NormalizedQuery query, CanonicalProperty property, Set<String> providerFilters) {
        if (query.getSearchType() == SearchType.ADDRESS) {
            return verifyAddress(query, property);
        }
        return verifyGeneral(query, providerFilters);
    }

    /**
     * Builds the response-level envelope from the per-property ones.
     *
     * An address lookup is valid when its best match is; a general search is always valid.
     */
    public VerificationEnvelope summarize(NormalizedQuery query, List<CanonicalProperty> results, Set<String> providerFilters) {
        if (query.getSearchType() == SearchType.GENERAL) {
            return verifyGeneral(query, providerFilters);
        }
        if (results.isEmpty()) {
            return VerificationEnvelope.builder()
                    .valid(false)
                    .reason("no property found for address")
                    .build();
        }
        VerificationEnvelope best = results.get(0).getVerification();
        return best != null ? best : verifyAddress(query, results.get(0));
    }

    private VerificationEnvelope verifyAddress(NormalizedQuery query, CanonicalProperty property) {
        VerificationEnvelope.VerificationEnvelopeBuilder envelope = VerificationEnvelope.builder();
        boolean valid = true;

        StreetAddress input = query.getAddress();
        PropertyAddress resolved = property.getAddress();
        String resolvedStreet = resolved != null ? resolved.getStreet() : null;

        String inputNumber = AddressParser.streetNumber(input.getLine1());
        String resolvedNumber = AddressParser.streetNumber(resolvedStreet);
        if (inputNumber != null && inputNumber.equals(resolvedNumber)) {
            envelope.matchedField("streetNumber");
        } else {
            valid = false;
            envelope.reason("street number mismatch: expected " + inputNumber + ", resolved " + resolvedNumber);
        }

        String inputName = AddressParser.normalizedStreetName(input.getLine1());
        String resolvedName = AddressParser.normalizedStreetName(resolvedStreet);
        if (inputName != null && inputName.equals(resolvedName)) {
            envelope.matchedField("streetName");
        } else {
            valid = false;
            envelope.reason("street name mismatch: expected '" + inputName + "', resolved '" + resolvedName + "'");
        }

        String inputPostal = AddressParser.postalPrefix(input.getPostalCode());
        if (inputPostal != null) {
            String resolvedPostal = resolved != null ? AddressParser.postalPrefix(resolved.getPostalCode()) : null;
            if (inputPostal.equals(resolvedPostal)) {
                envelope.matchedField("postalCode");
            } else {
                valid = false;
                envelope.reason("postal code mismatch: expected " + inputPostal + ", resolved " + resolvedPostal);
            }
        } else if (input.getCity() != null) {
            String resolvedCity = resolved != null ? resolved.getCity() : null;
            if (sameText(input.getCity(), resolvedCity)) {
                envelope.matchedField("city");
            } else {
                valid = false;
                envelope.reason("city mismatch: expected '" + input.getCity() + "', resolved '" + resolvedCity + "'");
            }
        }

        if (query.hasCoordinates()) {
            Coordinates coordinates = property.getCoordinates();
            if (coordinates == null || !coordinates.isPresent()) {
                valid = false;
                envelope.reason("resolved coordinates missing");
            } else {
                double distance = GeoDistance.meters(query.getLatitude(), query.getLongitude(),
                        coordinates.getLatitude(), coordinates.getLongitude());
                if (distance <= toleranceMeters) {
                    envelope.matchedField("coordinates");
                } else {
                    valid = false;
                    envelope.reason(String.format(Locale.ROOT,
                            "resolved coordinates %.0fm from input (tolerance %.0fm)", distance, toleranceMeters));
                }
            }
        }

        if (!valid) {
            log.debug("Address verification failed - parcelId: {}", property.getParcelId());
        }
        return envelope.valid(valid).build();
    }

    private VerificationEnvelope verifyGeneral(NormalizedQuery query, Set<String> providerFilters) {
        VerificationEnvelope.VerificationEnvelopeBuilder envelope = VerificationEnvelope.builder().valid(true);
        if (query.getFilters() != null) {
            Set<String> applied = providerFilters != null ? providerFilters : Set.of();
            query.getFilters().active().keySet().forEach(name -> envelope.matchedField(
                    name + ":" + (applied.contains(name) ? PROVIDER_APPLIED : POST_FILTER_APPLIED)));
        }
        return envelope.build();
    }

    private static boolean sameText(String a, String b) {
        return a != null && b != null
                && Objects.equals(a.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT),
                b.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT));
    }
}
