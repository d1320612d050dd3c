package com.flightops.diversion.dto;

import com.flightops.diversion.enums.FuelMonitorStatus;
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
public class FuelMonitoringResult {

    int currentFuel;
    int projectedFuelAtDestination;
    int fuelMargin;
    FuelMonitorStatus status;

    @Builder.Default
    List<String> alerts = new ArrayList<>();

    String recommendedAction;
}
