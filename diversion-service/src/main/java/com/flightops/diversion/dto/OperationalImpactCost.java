package com.flightops.diversion.dto;

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
public class OperationalImpactCost {

    BigDecimal diversionCost;
    BigDecimal downstreamImpact;
    BigDecimal slotLossCost;
    BigDecimal utilizationLoss;
    BigDecimal totalOperationalCost;
}
