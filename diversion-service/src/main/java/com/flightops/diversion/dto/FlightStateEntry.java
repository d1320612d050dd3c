package com.flightops.diversion.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import lombok.experimental.FieldDefaults;

import java.time.LocalDateTime;

/**
 * Snapshot of a flight's state as exchanged with presentation collaborators.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class FlightStateEntry {

    String flightNumber;
    String origin;
    String destination;
    String aircraftType;
    Integer crewOnDuty;
    Integer fuelOnBoard;
    LocalDateTime etd;
    LocalDateTime eta;
    String status;
}
