package com.tony.nflStats.service;

import com.tony.nflStats.model.StatTable;
import com.tony.nflStats.model.csv.MissingValues;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Nettoyage des tables de dimension : matchs, joueurs, équipes, snap counts.
 * Chaque table sort avec un jeu de colonnes fixe, celui des tables SQL.
 */
@Service
@Slf4j
public class DimensionCleaner {

    public static final List<String> GAME_COLUMNS = List.of(
            "game_id", "season", "game_type", "week", "gameday", "weekday", "gametime",
            "away_team", "away_score", "home_team", "home_score", "location", "result", "total",
            "overtime", "gsis", "nfl_detail_id", "pfr", "pff", "espn", "ftn",
            "away_rest", "home_rest", "away_moneyline", "home_moneyline", "spread_line",
            "away_spread_odds", "home_spread_odds", "total_line", "under_odds", "over_odds",
            "div_game", "roof", "surface", "temp", "wind",
            "away_qb_id", "home_qb_id", "away_qb_name", "home_qb_name",
            "away_coach", "home_coach", "stadium_id", "stadium");

    private static final Set<String> GAME_INTEGER_COLUMNS = Set.of(
            "season", "week", "away_score", "home_score", "result", "total", "overtime",
            "away_rest", "home_rest", "away_moneyline", "home_moneyline",
            "away_spread_odds", "home_spread_odds", "under_odds", "over_odds",
            "div_game", "temp", "wind");

    private static final Set<String> GAME_DECIMAL_COLUMNS = Set.of("spread_line", "total_line");

    public static final List<String> PLAYER_COLUMNS = List.of(
            "gsis_id", "status", "display_name", "first_name", "last_name", "esb_id", "birth_date",
            "college_name", "position", "jersey_number", "height", "weight", "team_abbr",
            "current_team_id", "entry_year", "rookie_year", "draft_club", "college_conference",
            "status_short_description", "gsis_it_id", "short_name", "headshot",
            "draft_number", "draftround");

    private static final Set<String> PLAYER_INTEGER_COLUMNS = Set.of(
            "jersey_number", "height", "weight", "entry_year", "rookie_year",
            "gsis_it_id", "draft_number", "draftround");

    public static final List<String> TEAM_COLUMNS = List.of(
            "team_abbr", "team_name", "team_id", "team_nick", "team_conf", "team_division",
            "team_color", "team_color2", "team_color3", "team_color4",
            "team_logo_wikipedia", "team_logo_espn", "team_wordmark",
            "team_conference_logo", "team_league_logo", "team_logo_squared");

    public static final List<String> SNAP_COUNT_COLUMNS = List.of(
            "gsis_id", "game_id", "season", "week", "offense_snaps", "offense_pct");

    private static final Set<String> SNAP_POSITIONS = Set.of("QB", "RB", "WR", "TE");

    /**
     * Matchs : équipes normalisées, scores et cotes typés. Les lignes sans game_id sont écartées.
     */
    public StatTable cleanGames(List<? extends Map<String, ?>> raw) {
        List<Map<String, Object>> rows = new ArrayList<>();

        for (Map<String, ?> source : raw) {
            if (MissingValues.isMissing(source.get("game_id"))) continue;

            Map<String, Object> row = new LinkedHashMap<>();
            for (String column : GAME_COLUMNS) {
                Object value = source.get(column);
                if (GAME_INTEGER_COLUMNS.contains(column)) row.put(column, MissingValues.parseInteger(value));
                else if (GAME_DECIMAL_COLUMNS.contains(column)) row.put(column, MissingValues.parseDouble(value));
                else if ("gameday".equals(column)) row.put(column, parseDate(value));
                else row.put(column, MissingValues.text(value));
            }
            row.put("away_team", TeamAbbreviations.normalize((String) row.get("away_team")));
            row.put("home_team", TeamAbbreviations.normalize((String) row.get("home_team")));
            rows.add(row);
        }

        log.info("🧹 Matchs : {} lignes conservées sur {}", rows.size(), raw.size());
        return new StatTable(GAME_COLUMNS, rows);
    }

    /**
     * Joueurs : taille et poids repris du fichier d'identifiants (jointure gsis_id),
     * équipes normalisées. Les joueurs sans gsis_id ou sans équipe sont écartés.
     */
    public StatTable cleanPlayers(List<? extends Map<String, ?>> raw, List<? extends Map<String, ?>> ids) {
        Map<String, Map<String, ?>> idsByGsis = new HashMap<>();
        for (Map<String, ?> id : ids) {
            String gsisId = MissingValues.text(id.get("gsis_id"));
            if (gsisId != null) idsByGsis.putIfAbsent(gsisId, id);
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Map<String, ?> source : raw) {
            String gsisId = MissingValues.text(source.get("gsis_id"));
            String team = TeamAbbreviations.normalize(MissingValues.text(source.get("team_abbr")));
            if (gsisId == null || team == null || !seen.add(gsisId)) continue;

            Map<String, ?> id = idsByGsis.getOrDefault(gsisId, Map.of());
            Map<String, Object> row = new LinkedHashMap<>();
            for (String column : PLAYER_COLUMNS) {
                Object value = "height".equals(column) || "weight".equals(column) ? id.get(column) : source.get(column);
                if (PLAYER_INTEGER_COLUMNS.contains(column)) row.put(column, MissingValues.parseInteger(value));
                else if ("birth_date".equals(column)) row.put(column, parseDate(value));
                else row.put(column, MissingValues.text(value));
            }
            row.put("team_abbr", team);
            row.put("draft_club", TeamAbbreviations.normalize((String) row.get("draft_club")));
            rows.add(row);
        }

        log.info("🧹 Joueurs : {} lignes conservées sur {}", rows.size(), raw.size());
        return new StatTable(PLAYER_COLUMNS, rows);
    }

    /**
     * Équipes actives : celles qui reçoivent au moins un match lors de la saison la plus
     * récente présente dans les matchs.
     */
    public StatTable cleanTeams(List<? extends Map<String, ?>> raw, StatTable games) {
        Set<String> activeTeams = activeTeams(games);
        if (activeTeams.isEmpty()) {
            log.warn("⚠️ Aucun match chargé : table des équipes vide");
            return StatTable.empty("Aucun match chargé");
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Map<String, ?> source : raw) {
            String abbr = MissingValues.text(source.get("team_abbr"));
            if (abbr == null || !activeTeams.contains(abbr) || !seen.add(abbr)) continue;

            Map<String, Object> row = new LinkedHashMap<>();
            for (String column : TEAM_COLUMNS) {
                row.put(column, MissingValues.text(source.get(column)));
            }
            rows.add(row);
        }

        log.info("🧹 Équipes : {} actives sur {}", rows.size(), raw.size());
        return new StatTable(TEAM_COLUMNS, rows);
    }

    /**
     * Snap counts offensifs (QB, RB, WR, TE), identifiant PFR traduit en gsis_id.
     * Les joueurs sans correspondance sont écartés.
     */
    public StatTable cleanSnapCounts(List<? extends Map<String, ?>> raw, List<? extends Map<String, ?>> ids) {
        Map<String, String> gsisByPfr = new HashMap<>();
        for (Map<String, ?> id : ids) {
            String pfrId = MissingValues.text(id.get("pfr_id"));
            String gsisId = MissingValues.text(id.get("gsis_id"));
            if (pfrId != null && gsisId != null) gsisByPfr.putIfAbsent(pfrId, gsisId);
        }

        List<Map<String, Object>> rows = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Map<String, ?> source : raw) {
            if (!SNAP_POSITIONS.contains(MissingValues.text(source.get("position")))) continue;
            String gsisId = gsisByPfr.get(MissingValues.text(source.get("pfr_player_id")));
            String gameId = MissingValues.text(source.get("game_id"));
            if (gsisId == null || gameId == null || !seen.add(gsisId + "|" + gameId)) continue;

            Map<String, Object> row = new LinkedHashMap<>();
            row.put("gsis_id", gsisId);
            row.put("game_id", gameId);
            row.put("season", MissingValues.parseInteger(source.get("season")));
            row.put("week", MissingValues.parseInteger(source.get("week")));
            row.put("offense_snaps", MissingValues.parseInteger(source.get("offense_snaps")));
            row.put("offense_pct", MissingValues.parseDouble(source.get("offense_pct")));
            rows.add(row);
        }

        log.info("🧹 Snap counts : {} lignes conservées sur {}", rows.size(), raw.size());
        return new StatTable(SNAP_COUNT_COLUMNS, rows);
    }

    static Set<String> activeTeams(StatTable games) {
        Integer latest = games.column("season").stream()
                .filter(Objects::nonNull)
                .map(s -> (Integer) s)
                .max(Integer::compare)
                .orElse(null);
        if (latest == null) return Set.of();

        return games.getRows().stream()
                .filter(g -> latest.equals(g.get("season")))
                .map(g -> (String) g.get("home_team"))
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
    }

    private static LocalDate parseDate(Object value) {
        String text = MissingValues.text(value);
        if (text == null) return null;
        try {
            return LocalDate.parse(text.length() > 10 ? text.substring(0, 10) : text);
        } catch (DateTimeParseException e) {
            log.warn("⚠️ Date illisible ignorée : {}", text);
            return null;
        }
    }
}
