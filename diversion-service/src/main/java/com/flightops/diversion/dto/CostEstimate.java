package com.flightops.diversion.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;

/**
 * Passenger-care and operational cost of a diversion, in whole USD.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CostEstimate {

    BigDecimal hotel;
    BigDecimal meals;
    BigDecimal rebooking;
    BigDecimal total;
    Breakdown breakdown;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @FieldDefaults(level = AccessLevel.PRIVATE)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Breakdown {

        BigDecimal perPassenger;
        BigDecimal operationalOverhead;
        BigDecimal crewCosts;
        BigDecimal fuelCosts;
        BigDecimal handlingFees;
    }
}
