package com.flightops.diversion.validator;

import com.flightops.diversion.dto.IncidentReportData;
import com.flightops.diversion.exception.DiversionValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DiversionInputValidator Unit Tests")
class DiversionInputValidatorTest {

    @Test
    @DisplayName("Should normalise a valid ICAO code")
    void validateIcao_Valid_ReturnsNormalised() {
        assertThat(DiversionInputValidator.validateIcao(" eddf ")).isEqualTo("EDDF");
    }

    @Test
    @DisplayName("Should reject malformed ICAO codes")
    void validateIcao_Malformed_Throws() {
        assertThatThrownBy(() -> DiversionInputValidator.validateIcao("LHR"))
                .isInstanceOf(DiversionValidationException.class)
                .hasMessageContaining("LHR");
        assertThatThrownBy(() -> DiversionInputValidator.validateIcao("  "))
                .isInstanceOf(DiversionValidationException.class)
                .hasFieldOrPropertyWithValue("errorCode", "VALIDATION_ERROR");
    }

    @Test
    @DisplayName("Should name the missing report section")
    void validateReportData_MissingSection_Throws() {
        assertThatThrownBy(() -> DiversionInputValidator.validateReportData(IncidentReportData.builder().build()))
                .isInstanceOf(DiversionValidationException.class)
                .hasMessage("Report data is missing flight");
    }
}
