package com.flightops.diversion.service;

import com.flightops.diversion.model.AircraftPerformanceProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Injectable view of the per-type performance table held by {@link AircraftPerformanceProfile}.
 * Calculators and flight state read the same table, so their numbers never disagree.
 */
@Service
@Slf4j
public class AircraftPerformanceService {

    public AircraftPerformanceProfile profileFor(String aircraftType) {
        AircraftPerformanceProfile profile = AircraftPerformanceProfile.forType(aircraftType);
        if (profile.isDefault()) {
            log.debug("No performance profile for aircraft type {}, using default", aircraftType);
        }
        return profile;
    }
}
