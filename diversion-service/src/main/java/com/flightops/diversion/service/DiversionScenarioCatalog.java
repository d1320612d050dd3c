package com.flightops.diversion.service;

import com.flightops.diversion.enums.EmergencyType;
import com.flightops.diversion.enums.FacilitiesRating;
import com.flightops.diversion.enums.Urgency;
import com.flightops.diversion.enums.WeatherSuitability;
import com.flightops.diversion.model.DiversionScenario;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed candidate diversions per emergency type, in preference order.
 */
@Component
public class DiversionScenarioCatalog {

    private final Map<EmergencyType, List<DiversionScenario>> candidates = new EnumMap<>(EmergencyType.class);

    public DiversionScenarioCatalog() {
        candidates.put(EmergencyType.MEDICAL, List.of(
                scenario("EGLL", "London Heathrow", 180, 25, 2_800, 45,
                        "Medical emergency - passenger requires immediate hospital care",
                        Urgency.EMERGENCY, WeatherSuitability.EXCELLENT, FacilitiesRating.EXCELLENT),
                scenario("EHAM", "Amsterdam Schiphol", 220, 32, 3_200, 55,
                        "Medical emergency - alternate with medical facilities",
                        Urgency.EMERGENCY, WeatherSuitability.GOOD, FacilitiesRating.EXCELLENT)));

        candidates.put(EmergencyType.TECHNICAL, List.of(
                scenario("EDDF", "Frankfurt Main", 320, 45, 4_200, 70,
                        "Engine parameter abnormality - precautionary landing",
                        Urgency.URGENT, WeatherSuitability.GOOD, FacilitiesRating.EXCELLENT),
                scenario("LFPG", "Paris Charles de Gaulle", 290, 40, 3_800, 65,
                        "Technical issue - maintenance required",
                        Urgency.URGENT, WeatherSuitability.EXCELLENT, FacilitiesRating.GOOD)));

        candidates.put(EmergencyType.WEATHER, List.of(
                scenario("ESSA", "Stockholm Arlanda", 450, 60, 5_400, 85,
                        "Severe weather at destination - holding not possible",
                        Urgency.ROUTINE, WeatherSuitability.EXCELLENT, FacilitiesRating.GOOD)));
    }

    public List<DiversionScenario> candidatesFor(EmergencyType emergencyType) {
        return candidates.getOrDefault(emergencyType, List.of());
    }

    private static DiversionScenario scenario(String airport, String airportName, int distance, int flightTime,
                                              int extraFuelBurn, int crewTimeUsed, String reason, Urgency urgency,
                                              WeatherSuitability weather, FacilitiesRating facilities) {
        return DiversionScenario.builder()
                .airport(airport)
                .airportName(airportName)
                .distance(distance)
                .estimatedFlightTime(flightTime)
                .extraFuelBurn(extraFuelBurn)
                .crewTimeUsed(crewTimeUsed)
                .reason(reason)
                .urgency(urgency)
                .weatherSuitability(weather)
                .facilitiesRating(facilities)
                .build();
    }
}
