package com.flightops.diversion.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;

/**
 * A mitigation option weighed by the cost-benefit analysis.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CostBenefitOption {

    String name;
    BigDecimal cost;

    /** 0-100. */
    int riskReduction;

    /** Minutes. */
    int timeToImplement;

    /** 0-1. */
    double successProbability;
}
