package com.flightops.diversion.dto;

import com.flightops.diversion.enums.CostRegion;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

/**
 * Commercial context of a diversion assessment.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AdvisoryRequest {

    int passengers;

    @Builder.Default
    CostRegion region = CostRegion.EUROPEAN;

    boolean overnightRequired;
    boolean missedConnection;

    /** Extra fuel requested for the diversion in kg; zero means the scenario burn was requested. */
    int requestedExtraFuel;
}
