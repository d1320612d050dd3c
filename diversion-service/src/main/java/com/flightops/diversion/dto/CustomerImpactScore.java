package com.flightops.diversion.dto;

import com.flightops.diversion.enums.CustomerImpactCategory;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CustomerImpactScore {

    /** 0-100. */
    int score;

    Factors factors;
    CustomerImpactCategory category;

    /** Per-passenger compensation in USD. */
    BigDecimal estimatedCompensation;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @FieldDefaults(level = AccessLevel.PRIVATE)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Factors {

        int delayMinutes;
        boolean rerouteRequired;
        boolean missedConnection;
        boolean compensationRequired;
    }
}
