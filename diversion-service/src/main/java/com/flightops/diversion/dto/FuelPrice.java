package com.flightops.diversion.dto;

import com.flightops.diversion.enums.DataProvenance;
import com.flightops.diversion.enums.FuelAvailability;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FuelPrice {

    String airport;
    BigDecimal pricePerKg;
    String currency;
    String supplier;
    LocalDateTime lastUpdated;
    boolean contractRate;
    FuelAvailability availability;
    DataProvenance provenance;
}
