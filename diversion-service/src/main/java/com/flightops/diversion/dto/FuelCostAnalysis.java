package com.flightops.diversion.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FuelCostAnalysis {

    Summary summary;

    @Builder.Default
    List<RouteEfficiency> routeAnalysis = new ArrayList<>();

    @Builder.Default
    List<String> recommendations = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @FieldDefaults(level = AccessLevel.PRIVATE)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Summary {

        int totalOperations;
        int totalWastedFuel;
        BigDecimal totalWasteCost;
        double averageEfficiency;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @FieldDefaults(level = AccessLevel.PRIVATE)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class RouteEfficiency {

        String route;
        double efficiency;
        int waste;
        BigDecimal cost;
        double fuelPerKm;
    }
}
