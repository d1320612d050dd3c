package com.flightops.diversion.model;

import com.flightops.diversion.enums.FlightStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static com.flightops.diversion.constants.DiversionConstants.CREW_APPROACHING_LIMIT_MINUTES;
import static com.flightops.diversion.constants.DiversionConstants.CREW_DIVERSION_BUFFER_MINUTES;
import static com.flightops.diversion.constants.DiversionConstants.CREW_DUTY_LIMITED_MINUTES;
import static com.flightops.diversion.constants.DiversionConstants.DIVERSION_FUEL_RESERVE_FACTOR;
import static com.flightops.diversion.constants.DiversionConstants.MINIMUM_LANDING_RESERVE_KG;

/**
 * Operational state of a single flight.
 *
 * <p>Crew duty and fuel never go negative: every write clamps at zero. A flight has one
 * owner at a time; concurrent diversion simulations against the same instance must be
 * serialized by the caller.
 */
@Getter
@Slf4j
public class FlightState {

    private final String flightNumber;
    private final String origin;
    private final String destination;
    private final String aircraftType;
    private final LocalDateTime etd;

    /** Resolved from {@code aircraftType}, never supplied separately. */
    private final AircraftPerformanceProfile performance;

    /** Crew duty minutes remaining. */
    private int crewOnDuty;

    /** Fuel on board in kg. */
    private int fuelOnBoard;

    private LocalDateTime eta;
    private FlightStatus status;

    @Builder
    public FlightState(String flightNumber,
                       String origin,
                       String destination,
                       String aircraftType,
                       int crewOnDuty,
                       int fuelOnBoard,
                       LocalDateTime etd,
                       LocalDateTime eta,
                       FlightStatus status) {
        this.flightNumber = flightNumber;
        this.origin = origin;
        this.destination = destination;
        this.aircraftType = aircraftType;
        this.crewOnDuty = Math.max(0, crewOnDuty);
        this.fuelOnBoard = Math.max(0, fuelOnBoard);
        this.etd = etd;
        this.eta = eta;
        this.status = status != null ? status : FlightStatus.SCHEDULED;
        this.performance = AircraftPerformanceProfile.forType(aircraftType);
    }

    // ========== Mutations ==========

    public void updateEta(LocalDateTime newEta) {
        this.eta = newEta;
    }

    /**
     * Moves the flight to a new status. Leaving a terminal status is ignored.
     *
     * @return true when the status changed
     */
    public boolean updateStatus(FlightStatus newStatus) {
        if (newStatus == null) {
            return false;
        }
        if (status.isTerminal() && newStatus != status) {
            log.warn("Ignoring status change for terminal flight: flight={}, status={}, requested={}",
                    flightNumber, status.getLabel(), newStatus.getLabel());
            return false;
        }
        this.status = newStatus;
        return true;
    }

    public void updateCrewDuty(int minutes) {
        this.crewOnDuty = Math.max(0, minutes);
    }

    public void updateFuelOnBoard(int fuelKg) {
        this.fuelOnBoard = Math.max(0, fuelKg);
    }

    // ========== Queries ==========

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public int getCrewDutyHours() {
        return crewOnDuty / 60;
    }

    public int getCrewDutyMinutes() {
        return crewOnDuty % 60;
    }

    public boolean isCrewDutyLimited() {
        return crewOnDuty <= CREW_DUTY_LIMITED_MINUTES;
    }

    public boolean isFuelCritical() {
        return fuelOnBoard <= performance.getFuelCriticalThresholdKg();
    }

    /**
     * Scheduled block time in minutes, zero when the schedule is missing or inverted.
     */
    public long getEstimatedFlightTime() {
        if (etd == null || eta == null) {
            return 0;
        }
        return Math.max(0, Duration.between(etd, eta).toMinutes());
    }

    public List<String> getOperationalLimitations() {
        List<String> limitations = new ArrayList<>();

        if (isCrewDutyLimited()) {
            limitations.add(String.format(Locale.US, "Crew duty limited: %dh %dm remaining",
                    getCrewDutyHours(), getCrewDutyMinutes()));
        }
        if (isFuelCritical()) {
            limitations.add(String.format(Locale.US, "Fuel critical: %,d kg remaining", fuelOnBoard));
        }
        if (crewOnDuty <= CREW_APPROACHING_LIMIT_MINUTES) {
            limitations.add("Crew approaching maximum duty time");
        }
        return limitations;
    }

    // ========== Diversion Checks ==========

    /**
     * Fuel for a diversion of the given length including a 10% reserve, in whole kg.
     */
    public int calculateDiversionFuel(int diversionMinutes) {
        double burn = performance.burnPerMinute() * diversionMinutes;
        return (int) Math.round(burn * DIVERSION_FUEL_RESERVE_FACTOR);
    }

    public boolean canCompleteDiversion(int diversionMinutes) {
        return fuelOnBoard - calculateDiversionFuel(diversionMinutes) >= MINIMUM_LANDING_RESERVE_KG;
    }

    public boolean canAcceptDiversion(int additionalMinutes) {
        return crewOnDuty - additionalMinutes > CREW_DIVERSION_BUFFER_MINUTES;
    }
}
