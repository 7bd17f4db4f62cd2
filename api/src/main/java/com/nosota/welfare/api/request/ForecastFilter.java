package com.nosota.welfare.api.request;

import java.util.UUID;

/**
 * Optional filters applied to read-side queries over recurring payments.
 * Each {@code null} field means "no restriction".
 */
public record ForecastFilter(
        UUID schemeId,
        UUID projectId,
        UUID stateId,
        UUID districtId
) {
    public static ForecastFilter none() {
        return new ForecastFilter(null, null, null, null);
    }
}
