package com.tony.nflStats.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tony.nflStats.model.Play;
import com.tony.nflStats.model.csv.MissingValues;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Nettoyage du play-by-play brut : projection, codes équipes, valeurs manquantes,
 * indicateurs dérivés, typage puis validation.
 * Ne lève jamais d'exception : les lignes invalides sont simplement écartées
 * (le flux source contient régulièrement des lignes incomplètes).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PlayRecordCleaner {

    private static final TypeReference<Map<String, Object>> ROW_TYPE = new TypeReference<>() {};

    static final List<String> ALLOWED_COLUMNS = List.of(
            // Identifiants
            "play_id", "game_id", "season", "week", "season_type",
            // Équipes
            "home_team", "away_team", "posteam", "defteam",
            // Temps
            "game_date", "qtr", "game_seconds_remaining", "half_seconds_remaining", "time_of_day",
            // Terrain
            "down", "ydstogo", "yardline_100", "goal_to_go",
            // Score
            "score_differential", "posteam_score", "defteam_score", "total_home_score", "total_away_score",
            // Classification
            "play_type", "shotgun", "no_huddle", "qb_dropback", "qb_scramble", "qb_kneel", "qb_spike",
            "pass_length", "pass_location", "run_location", "run_gap",
            // Performance
            "epa", "qb_epa", "wp", "wpa", "air_yards", "yards_after_catch", "cpoe", "success", "xpass",
            // Issues
            "first_down_rush", "first_down_pass", "first_down", "rush_attempt", "pass_attempt",
            "complete_pass", "incomplete_pass", "sack", "touchdown", "interception", "fumble",
            "fumble_lost", "pass_touchdown", "rush_touchdown",
            // Joueurs
            "passer_player_id", "passer_player_name", "passing_yards",
            "rusher_player_id", "rusher_player_name", "rushing_yards",
            "receiver_player_id", "receiver_player_name", "receiving_yards",
            // Match
            "stadium", "roof", "surface", "temp", "wind", "div_game",
            // Équipes spéciales
            "special", "special_teams_play",
            // Indicateurs dérivés (repris tels quels quand leur source est absente)
            "is_trailing", "is_leading", "is_red_zone", "is_early_down", "is_late_down",
            "is_likely_pass", "is_dropback", "is_success"
    );

    private static final List<String> TEAM_COLUMNS = List.of("home_team", "away_team", "posteam", "defteam");

    // Indicateurs : 0 quand la valeur manque
    private static final Set<String> FLAG_COLUMNS = Set.of(
            "touchdown", "interception", "sack", "fumble", "complete_pass", "incomplete_pass",
            "first_down", "first_down_rush", "first_down_pass", "rush_attempt", "pass_attempt",
            "qb_dropback", "qb_scramble", "qb_kneel", "qb_spike", "shotgun", "no_huddle",
            "fumble_lost", "pass_touchdown", "rush_touchdown", "success", "xpass",
            "special", "special_teams_play"
    );

    // Entiers : valeur illisible ou manquante -> 0
    private static final Set<String> INT_COLUMNS = Set.of(
            "week", "qtr", "goal_to_go", "touchdown", "interception", "sack", "fumble",
            "complete_pass", "incomplete_pass", "first_down", "rush_attempt", "pass_attempt"
    );

    // Entiers sans valeur par défaut (season est une clé, down est null hors tentatives)
    private static final Set<String> NULLABLE_INT_COLUMNS = Set.of("season", "down");

    private static final Set<String> FLOAT_COLUMNS = Set.of(
            "epa", "qb_epa", "wp", "wpa", "cpoe", "xpass", "yardline_100", "score_differential",
            "game_seconds_remaining", "half_seconds_remaining", "ydstogo",
            "posteam_score", "defteam_score", "total_home_score", "total_away_score",
            "air_yards", "yards_after_catch", "passing_yards", "rushing_yards", "receiving_yards",
            "temp", "wind"
    );

    // Booléens stockés en 0/1
    private static final Set<String> BOOL_COLUMNS = Set.of(
            "shotgun", "no_huddle", "qb_dropback", "qb_scramble", "qb_kneel", "qb_spike",
            "success", "fumble_lost", "first_down_rush", "first_down_pass",
            "pass_touchdown", "rush_touchdown", "div_game", "special", "special_teams_play"
    );

    static final Set<String> VALID_PLAY_TYPES = Set.of(
            "pass", "run", "punt", "field_goal", "kickoff", "extra_point", "qb_kneel", "qb_spike", "no_play"
    );

    private final ObjectMapper objectMapper;

    /**
     * Applique toutes les étapes, dans l'ordre, à chaque ligne brute.
     */
    public List<Play> clean(List<? extends Map<String, ?>> rawPlays) {
        List<Play> plays = new ArrayList<>(rawPlays.size());
        int dropped = 0;

        for (Map<String, ?> raw : rawPlays) {
            Map<String, Object> row = filterColumns(raw);
            normalizeTeams(row);
            handleMissingValues(row);
            addDerivedFields(row);
            convertTypes(row);
            if (!validate(row)) {
                dropped++;
                continue;
            }
            plays.add(objectMapper.convertValue(row, Play.class));
        }

        if (dropped > 0) {
            log.info("🧹 Nettoyage PBP : {} lignes conservées, {} écartées", plays.size(), dropped);
        }
        return plays;
    }

    /**
     * Vue "ligne brute" d'une action déjà nettoyée (colonnes nulles absentes),
     * qui peut repasser dans {@link #clean(List)}.
     */
    public List<Map<String, Object>> toRows(List<Play> plays) {
        return plays.stream().map(p -> objectMapper.convertValue(p, ROW_TYPE)).toList();
    }

    // --- 1. Projection ---
    Map<String, Object> filterColumns(Map<String, ?> raw) {
        Map<String, Object> row = new LinkedHashMap<>();
        for (String column : ALLOWED_COLUMNS) {
            if (raw.containsKey(column)) {
                row.put(column, raw.get(column));
            }
        }
        return row;
    }

    // --- 2. Codes équipes ---
    void normalizeTeams(Map<String, Object> row) {
        for (String column : TEAM_COLUMNS) {
            if (row.containsKey(column) && row.get(column) != null) {
                row.put(column, TeamAbbreviations.normalize(row.get(column).toString()));
            }
        }
    }

    // --- 3. Valeurs manquantes ---
    void handleMissingValues(Map<String, Object> row) {
        for (String column : row.keySet()) {
            if (!MissingValues.isMissing(row.get(column))) continue;

            if (FLAG_COLUMNS.contains(column) || "score_differential".equals(column)) {
                row.put(column, 0);
            } else if ("yardline_100".equals(column)) {
                row.put(column, 50);
            } else if (column.endsWith("_id")) {
                row.put(column, "");
            }
        }
    }

    // --- 4. Indicateurs dérivés ---
    void addDerivedFields(Map<String, Object> row) {
        if (row.containsKey("score_differential")) {
            double diff = toDouble(row.get("score_differential"), 0.0);
            row.put("is_trailing", diff < 0 ? 1 : 0);
            row.put("is_leading", diff > 0 ? 1 : 0);
        }
        if (row.containsKey("yardline_100")) {
            row.put("is_red_zone", toDouble(row.get("yardline_100"), 100.0) <= 20 ? 1 : 0);
        }
        if (row.containsKey("down")) {
            // down manquant : ni premier/deuxième, ni troisième/quatrième essai
            Double down = MissingValues.parseDouble(row.get("down"));
            row.put("is_early_down", down != null && down <= 2 ? 1 : 0);
            row.put("is_late_down", down != null && down >= 3 ? 1 : 0);
        }
        if (row.containsKey("xpass")) {
            row.put("is_likely_pass", toDouble(row.get("xpass"), 0.0) >= 0.5 ? 1 : 0);
        }
        if (row.containsKey("qb_dropback")) {
            row.put("is_dropback", (int) toDouble(row.get("qb_dropback"), 0.0));
        }
        if (row.containsKey("success")) {
            row.put("is_success", (int) toDouble(row.get("success"), 0.0));
        }
    }

    // --- 5. Typage ---
    void convertTypes(Map<String, Object> row) {
        for (Map.Entry<String, Object> entry : row.entrySet()) {
            String column = entry.getKey();
            Object value = entry.getValue();

            if (INT_COLUMNS.contains(column) || BOOL_COLUMNS.contains(column) || column.startsWith("is_")) {
                entry.setValue((int) toDouble(value, 0.0));
            } else if (NULLABLE_INT_COLUMNS.contains(column)) {
                Double parsed = MissingValues.parseDouble(value);
                entry.setValue(parsed == null ? null : parsed.intValue());
            } else if (FLOAT_COLUMNS.contains(column)) {
                entry.setValue(MissingValues.parseDouble(value));
            } else if ("play_id".equals(column)) {
                // Converti à la validation
                entry.setValue(value == null ? null : value.toString().trim());
            } else if (column.endsWith("_id")) {
                entry.setValue(value == null ? "" : value.toString());
            } else {
                entry.setValue(MissingValues.isMissing(value) ? null : value.toString());
            }
        }
    }

    // --- 6. Validation ---
    boolean validate(Map<String, Object> row) {
        if (MissingValues.isMissing(row.get("play_id"))
                || MissingValues.isMissing(row.get("game_id"))
                || row.get("season") == null) {
            return false;
        }

        Double playId = MissingValues.parseDouble(row.get("play_id"));
        if (playId == null) return false;
        row.put("play_id", playId.longValue());

        Object down = row.get("down");
        if (down != null) {
            int d = ((Number) down).intValue();
            if (d < 1 || d > 4) return false;
        }

        Object playType = row.get("play_type");
        return playType == null || VALID_PLAY_TYPES.contains(playType.toString());
    }

    // --- HELPERS ---
    private static double toDouble(Object value, double fallback) {
        Double parsed = MissingValues.parseDouble(value);
        return parsed != null ? parsed : fallback;
    }
}
