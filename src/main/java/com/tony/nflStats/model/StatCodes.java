package com.tony.nflStats.model;

import java.util.Set;

/**
 * Codes stat_id du flux "playstats" et leur signification.
 */
public final class StatCodes {

    private StatCodes() {
    }

    // --- Passe ---
    public static final Set<Integer> COMPLETION = Set.of(15, 16);
    public static final Set<Integer> PASS_ATTEMPT = Set.of(14, 15, 16, 19);
    public static final int PASS_TD = 16;
    public static final int INTERCEPTION = 19;
    public static final int SACK = 20;
    public static final Set<Integer> AIR_YARDS = Set.of(111, 112);
    public static final int AIR_YARDS_COMPLETE = 111;

    // --- Course ---
    public static final Set<Integer> CARRY = Set.of(10, 11);
    public static final Set<Integer> RUSH_YARDS = Set.of(10, 11, 12, 13);
    public static final Set<Integer> RUSH_TD = Set.of(11, 13);

    // --- Réception ---
    public static final Set<Integer> RECEPTION = Set.of(21, 22);
    public static final Set<Integer> REC_YARDS = Set.of(21, 22, 23, 24);
    public static final Set<Integer> REC_TD = Set.of(22, 24);
    public static final int YAC = 113;
    public static final int TARGET = 115;
    // Saisons 2003-2008 : la cible n'était pas codée seule, les réceptions comptent aussi
    public static final Set<Integer> LEGACY_TARGET = Set.of(21, 22, 115);

    // --- Conversions à 2 points ---
    public static final int PASS_2PT = 77;
    public static final int RUSH_2PT = 75;
    public static final int REC_2PT = 104;

    // --- Codes recherchés parmi les codes co-occurrents de l'action ---
    public static final Set<Integer> FUMBLE = Set.of(52, 53, 54);
    public static final int FUMBLE_LOST = 106;
    public static final int RUSH_FIRST_DOWN = 3;
    public static final int PASS_FIRST_DOWN = 4;

    public static final Set<Integer> TOUCHDOWN = Set.of(11, 13, 22, 24);

    public static final int LEGACY_FIRST_SEASON = 2003;
    public static final int LEGACY_LAST_SEASON = 2008;

    /**
     * Saison du format historique (2003-2008 inclus).
     */
    public static boolean isLegacyTargetSeason(Integer season) {
        return season != null && season >= LEGACY_FIRST_SEASON && season <= LEGACY_LAST_SEASON;
    }

    /**
     * Prédicat unique "cet événement est une cible", utilisé à la fois pour les totaux
     * équipe/match (dénominateurs) et pour la colonne is_target de chaque événement.
     */
    public static boolean isTarget(Integer season, Integer statId) {
        if (statId == null) return false;
        return isLegacyTargetSeason(season) ? LEGACY_TARGET.contains(statId) : statId == TARGET;
    }

    public static boolean isAirYards(Integer statId) {
        return statId != null && AIR_YARDS.contains(statId);
    }
}
