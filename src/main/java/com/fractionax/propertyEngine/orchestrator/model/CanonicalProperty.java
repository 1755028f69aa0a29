package com.fractionax.propertyEngine.orchestrator.model;

import com.fractionax.propertyEngine.provider.ProviderId;
import com.fractionax.propertyEngine.verification.model.VerificationEnvelope;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Unified property record produced by merging provider results.
 *
 * Nested objects are always present; a field no provider reported is null.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CanonicalProperty {

    /**
     * Parcel id (CLIP) from the property-data provider. Null for listings that could not be matched to a parcel.
     */
    private String parcelId;

    @Builder.Default
    private PropertyAddress address = new PropertyAddress();

    @Builder.Default
    private Coordinates coordinates = new Coordinates();

    @Builder.Default
    private PropertyStructure structure = new PropertyStructure();

    @Builder.Default
    private PropertyValuation valuation = new PropertyValuation();

    @Builder.Default
    private PropertyListing listing = new PropertyListing();

    /**
     * Providers that contributed at least one field.
     */
    @Builder.Default
    private Set<ProviderId> sources = EnumSet.noneOf(ProviderId.class);

    @Builder.Default
    private List<FieldAlternate> alternates = new ArrayList<>();

    private VerificationEnvelope verification;
}
