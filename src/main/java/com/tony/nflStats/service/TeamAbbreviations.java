package com.tony.nflStats.service;

import java.util.Map;

/**
 * Codes d'équipes historiques -> codes actuels (déménagements, anciens codes du flux).
 */
public final class TeamAbbreviations {

    private static final Map<String, String> HISTORICAL_TO_CURRENT = Map.of(
            "STL", "LA",
            "SD", "LAC",
            "OAK", "LV",
            "JAC", "JAX",
            "SL", "LA",
            "ARZ", "ARI",
            "BLT", "BAL",
            "CLV", "CLE",
            "HST", "HOU"
    );

    private TeamAbbreviations() {
    }

    public static String normalize(String abbr) {
        if (abbr == null) return null;
        return HISTORICAL_TO_CURRENT.getOrDefault(abbr, abbr);
    }

    /**
     * Variante du fichier playstats, qui contient aussi "LAR" pour les Rams.
     */
    public static String normalizeStatTeam(String abbr) {
        return "LAR".equals(abbr) ? "LA" : normalize(abbr);
    }
}
