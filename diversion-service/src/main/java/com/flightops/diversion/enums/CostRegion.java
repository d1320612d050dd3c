package com.flightops.diversion.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Regional passenger-care, handling and crew accommodation rates in USD.
 */
@Getter
@RequiredArgsConstructor
public enum CostRegion {
    DOMESTIC("domestic", 120, 25, 200, 2_000, 100),
    EUROPEAN("european", 180, 35, 300, 3_500, 150),
    LONGHAUL("longhaul", 250, 50, 500, 5_000, 200);

    @JsonValue
    private final String code;
    private final int hotelRate;
    private final int mealRate;
    private final int rebookingRate;
    private final int handlingBaseFee;
    private final int crewAccommodationRate;
}
