package com.flightops.diversion.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.*;

@DisplayName("StringUtils Unit Tests")
class StringUtilsTest {

    @Test
    @DisplayName("Should trim and upper-case codes")
    void normalizeCode_TrimsAndUpperCases() {
        assertThat(StringUtils.normalizeCode("  egll ")).isEqualTo("EGLL");
        assertThat(StringUtils.normalizeCode("b787-9")).isEqualTo("B787-9");
    }

    @Test
    @DisplayName("Should return null for blank codes")
    void normalizeCode_Blank_ReturnsNull() {
        assertThat(StringUtils.normalizeCode(null)).isNull();
        assertThat(StringUtils.normalizeCode("   ")).isNull();
    }

    @Test
    @DisplayName("Should not depend on the default locale")
    void normalizeCode_TurkishDefaultLocale_StaysAscii() {
        Locale original = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));

            assertThat(StringUtils.normalizeCode("ltfm")).isEqualTo("LTFM");
            assertThat(StringUtils.normalizeCode("lirf")).isEqualTo("LIRF");
        } finally {
            Locale.setDefault(original);
        }
    }
}
