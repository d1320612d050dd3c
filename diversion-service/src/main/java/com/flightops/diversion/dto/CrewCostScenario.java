package com.flightops.diversion.dto;

import com.flightops.diversion.enums.CostRegion;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CrewCostScenario {

    double overtimeHours;
    int accommodationNights;
    boolean positioning;
    boolean replacement;
    CostRegion location;
}
