package com.flightops.diversion.mapper;

import com.flightops.diversion.dto.FlightStateEntry;
import com.flightops.diversion.enums.FlightStatus;
import com.flightops.diversion.model.FlightState;
import com.flightops.diversion.util.StringUtils;

public final class FlightStateMapper {

    private FlightStateMapper() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static FlightStateEntry toEntry(FlightState flight) {
        if (flight == null) {
            return null;
        }

        return FlightStateEntry.builder()
                .flightNumber(flight.getFlightNumber())
                .origin(flight.getOrigin())
                .destination(flight.getDestination())
                .aircraftType(flight.getAircraftType())
                .crewOnDuty(flight.getCrewOnDuty())
                .fuelOnBoard(flight.getFuelOnBoard())
                .etd(flight.getEtd())
                .eta(flight.getEta())
                .status(flight.getStatus() != null ? flight.getStatus().getLabel() : null)
                .build();
    }

    public static FlightState toState(FlightStateEntry entry) {
        if (entry == null) {
            return null;
        }

        return FlightState.builder()
                .flightNumber(StringUtils.normalizeCode(entry.getFlightNumber()))
                .origin(StringUtils.normalizeCode(entry.getOrigin()))
                .destination(StringUtils.normalizeCode(entry.getDestination()))
                .aircraftType(StringUtils.normalizeCode(entry.getAircraftType()))
                .crewOnDuty(entry.getCrewOnDuty() != null ? entry.getCrewOnDuty() : 0)
                .fuelOnBoard(entry.getFuelOnBoard() != null ? entry.getFuelOnBoard() : 0)
                .etd(entry.getEtd())
                .eta(entry.getEta())
                .status(FlightStatus.fromLabel(entry.getStatus()))
                .build();
    }
}
