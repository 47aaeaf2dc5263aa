package com.tony.esportsAnalytics.service;

/**
 * Calculs de paris sur cotes décimales. Fonctions pures, sans état.
 */
public final class OddsMath {

    private OddsMath() {
    }

    /** Une cote décimale n'a de sens que strictement au-dessus de 1. */
    public static boolean isValidOdds(Double odds) {
        return odds != null && !odds.isNaN() && !odds.isInfinite() && odds > 1.0;
    }

    /**
     * Probabilité implicite 1/cote, sans retrait de la marge du bookmaker.
     * Null si la cote est absente ou non positive.
     */
    public static Double impliedProbability(Double odds) {
        if (odds == null || odds.isNaN() || odds <= 0) return null;
        return 1.0 / odds;
    }

    /** Espérance de gain pour une mise de 1 : p * cote - 1. */
    public static double expectedValue(double probability, double odds) {
        return probability * odds - 1.0;
    }

    /**
     * Fraction de Kelly (cote*p - 1) / (cote - 1), bornée à [0, 1].
     * Renvoie 0 pour une cote inférieure ou égale à 1.
     */
    public static double kellyFraction(double probability, double odds) {
        if (odds <= 1.0) return 0.0;
        double kelly = (odds * probability - 1.0) / (odds - 1.0);
        return Math.max(0.0, Math.min(1.0, kelly));
    }
}
