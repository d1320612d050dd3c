package com.flightops.diversion.dto;

import com.flightops.diversion.enums.DataProvenance;
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
public class AirportOperationalData {

    String airport;
    WeatherReport weather;

    @Builder.Default
    List<Notam> notams = new ArrayList<>();

    FuelPrice fuelPrice;
    String summary;

    /** MIXED when the parts came from different sources. */
    DataProvenance provenance;
}
