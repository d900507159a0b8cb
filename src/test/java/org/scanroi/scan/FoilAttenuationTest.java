package org.scanroi.scan;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class FoilAttenuationTest {

    @Test
    void decode_leftPadsToFourDigits() {
        assertThat(FoilAttenuation.decode(11)).containsExactly(0, 0, 1, 1);
        assertThat(FoilAttenuation.decode(0)).containsExactly(0, 0, 0, 0);
        assertThat(FoilAttenuation.decode(1000)).containsExactly(1, 0, 0, 0);
        assertThat(FoilAttenuation.decode(1111)).containsExactly(1, 1, 1, 1);
    }

    @Test
    void attenuation_noFoilsIsOne() {
        FoilAttenuation foils = FoilAttenuation.of(0.7, -1.2, 3.4, 0.05);
        assertThat(foils.attenuation(0)).isEqualTo(1.0);
    }

    @Test
    void attenuation_sumsLogAttenuationOfInsertedFoils() {
        FoilAttenuation foils = FoilAttenuation.of(0, 0, 0.1, 0.2);
        assertThat(foils.attenuation(11)).isCloseTo(Math.exp(0.3), within(1e-12));
        assertThat(foils.attenuation(11)).isCloseTo(1.3499, within(1e-4));
    }

    @Test
    void attenuation_matchesExponentOfDigitSumForEveryCode() {
        double[] c = {0.5, 1.25, -0.75, 2.0};
        FoilAttenuation foils = FoilAttenuation.of(c[0], c[1], c[2], c[3]);
        for (int mask = 0; mask < 16; mask++) {
            long code = Long.parseLong(Integer.toBinaryString(mask));
            double exponent = 0;
            for (int i = 0; i < 4; i++) {
                int digit = (mask >> (3 - i)) & 1;
                exponent += digit * c[i];
            }
            assertThat(foils.attenuation(code)).as("code %s", code).isCloseTo(Math.exp(exponent), within(1e-12));
        }
    }

    @Test
    void decode_rejectsMoreThanFourDigits() {
        assertThatThrownBy(() -> FoilAttenuation.decode(10000))
                .isInstanceOfSatisfying(ScanException.class, e -> assertThat(e.kind()).isEqualTo(ScanException.Kind.INVALID_FOIL_CODE));
    }

    @Test
    void decode_rejectsNonBinaryDigitsAndNegatives() {
        assertThatThrownBy(() -> FoilAttenuation.decode(12))
                .isInstanceOfSatisfying(ScanException.class, e -> assertThat(e.kind()).isEqualTo(ScanException.Kind.INVALID_FOIL_CODE));
        assertThatThrownBy(() -> FoilAttenuation.decode(-1))
                .isInstanceOfSatisfying(ScanException.class, e -> assertThat(e.kind()).isEqualTo(ScanException.Kind.INVALID_FOIL_CODE));
    }

    @Test
    void codeOf_requiresIntegralValue() {
        assertThat(FoilAttenuation.codeOf(11.0)).isEqualTo(11L);
        assertThatThrownBy(() -> FoilAttenuation.codeOf(11.5))
                .isInstanceOfSatisfying(ScanException.class, e -> assertThat(e.kind()).isEqualTo(ScanException.Kind.INVALID_FOIL_CODE));
        assertThatThrownBy(() -> FoilAttenuation.codeOf(Double.NaN))
                .isInstanceOf(ScanException.class);
    }

    @Test
    void constructor_requiresExactlyFourCoefficients() {
        assertThatThrownBy(() -> new FoilAttenuation(List.of(0.1, 0.2, 0.3)))
                .isInstanceOfSatisfying(ScanException.class, e -> assertThat(e.kind()).isEqualTo(ScanException.Kind.INVALID_FOIL_COEFFICIENTS));
        assertThatThrownBy(() -> new FoilAttenuation(null))
                .isInstanceOfSatisfying(ScanException.class, e -> assertThat(e.kind()).isEqualTo(ScanException.Kind.INVALID_FOIL_COEFFICIENTS));
    }
}
