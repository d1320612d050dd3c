package com.flightops.diversion.dto;

import com.flightops.diversion.enums.RiskLevel;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FuelOptimizationResult {

    int currentBurn;
    int optimizedBurn;
    int potentialSavings;
    boolean exceedsHistoricalAverage;

    @Builder.Default
    List<String> recommendations = new ArrayList<>();

    RiskLevel riskLevel;
}
