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
public class CrewCostBreakdown {

    BigDecimal overtime;
    BigDecimal accommodation;
    BigDecimal positioning;
    BigDecimal replacement;
    BigDecimal total;
}
