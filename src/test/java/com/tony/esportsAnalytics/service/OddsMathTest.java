package com.tony.esportsAnalytics.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class OddsMathTest {

    @Test
    @DisplayName("Une cote de 2.0 correspond à une probabilité implicite de 50%")
    void impliedProbabilityOfEvenOdds() {
        assertThat(OddsMath.impliedProbability(2.0)).isEqualTo(0.5);
    }

    @Test
    @DisplayName("Pas de probabilité implicite pour une cote absente ou non positive")
    void impliedProbabilityOfInvalidOdds() {
        assertThat(OddsMath.impliedProbability(null)).isNull();
        assertThat(OddsMath.impliedProbability(0.0)).isNull();
        assertThat(OddsMath.impliedProbability(-1.5)).isNull();
    }

    @Test
    @DisplayName("EV d'un pari à 62% sur une cote de 2.0 : +0.24")
    void expectedValue() {
        assertThat(OddsMath.expectedValue(0.62, 2.0)).isCloseTo(0.24, within(1e-9));
    }

    @Test
    @DisplayName("Kelly d'un pari à 62% sur une cote de 2.0 : 24% de la bankroll")
    void kellyFraction() {
        assertThat(OddsMath.kellyFraction(0.62, 2.0)).isCloseTo(0.24, within(1e-9));
    }

    @Test
    @DisplayName("Kelly est borné à 0 pour un pari perdant et à 1 au maximum")
    void kellyIsClamped() {
        assertThat(OddsMath.kellyFraction(0.30, 2.0)).isZero();
        assertThat(OddsMath.kellyFraction(1.5, 3.0)).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Une cote inférieure ou égale à 1 n'est pas exploitable")
    void degenerateOdds() {
        assertThat(OddsMath.kellyFraction(0.9, 1.0)).isZero();
        assertThat(OddsMath.isValidOdds(1.0)).isFalse();
        assertThat(OddsMath.isValidOdds(0.95)).isFalse();
        assertThat(OddsMath.isValidOdds(null)).isFalse();
        assertThat(OddsMath.isValidOdds(1.01)).isTrue();
    }
}
