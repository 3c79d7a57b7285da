package com.findstaffing.api.reconcile;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.findstaffing.core.domain.Region;
import com.findstaffing.core.domain.Trade;

import java.util.UUID;

/**
 * Trade or region as seen through a membership relation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReferenceEntity(
        UUID id,
        String name,
        String slug,
        String description,
        @JsonProperty("state_code") String stateCode
) {

    public static ReferenceEntity of(Trade trade) {
        return new ReferenceEntity(trade.getId(), trade.getName(), trade.getSlug(), trade.getDescription(), null);
    }

    public static ReferenceEntity of(Region region) {
        return new ReferenceEntity(region.getId(), region.getName(), region.getSlug(), null, region.getStateCode());
    }
}
