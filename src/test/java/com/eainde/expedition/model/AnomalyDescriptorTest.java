package com.eainde.expedition.model;

import com.eainde.expedition.DiagnosisFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class AnomalyDescriptorTest {

    private static final String SUMMARY =
            "google_search cpa spike 60.0% (observed 160.00 vs expected 100.00, z=37.90)";

    private Locale hostLocale;

    @BeforeEach
    void setUp() {
        hostLocale = Locale.getDefault();
    }

    @AfterEach
    void tearDown() {
        Locale.setDefault(hostLocale);
    }

    @Test
    void summary_shouldUseDotDecimalsOnAGermanHost() {
        // Arrange
        Locale.setDefault(Locale.GERMANY);

        // Act
        String summary = DiagnosisFixtures.anomaly().summary();

        // Assert
        assertThat(summary).isEqualTo(SUMMARY);
    }

    @Test
    void summary_shouldKeepTheDottedDirectionOnATurkishHost() {
        // Arrange
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));

        // Act
        String summary = DiagnosisFixtures.anomaly().summary();

        // Assert
        assertThat(summary).isEqualTo(SUMMARY).contains("spike");
    }
}
