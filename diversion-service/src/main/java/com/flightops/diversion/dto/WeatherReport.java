package com.flightops.diversion.dto;

import com.flightops.diversion.enums.DataProvenance;
import com.flightops.diversion.enums.FlightConditions;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WeatherReport {

    String airport;
    FlightConditions conditions;

    /** km. */
    double visibility;

    /** feet. */
    int ceiling;

    Winds winds;
    int temperature;
    int dewpoint;

    /** hPa. */
    int qnh;

    @Builder.Default
    List<String> phenomena = new ArrayList<>();

    String trend;
    LocalDateTime timestamp;
    DataProvenance provenance;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @FieldDefaults(level = AccessLevel.PRIVATE)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Winds {

        int direction;
        int speed;

        /** Absent when the wind is not gusting. */
        Integer gusts;
    }
}
