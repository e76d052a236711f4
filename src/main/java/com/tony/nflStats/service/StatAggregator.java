package com.tony.nflStats.service;

import com.tony.nflStats.model.EnrichedEvent;
import com.tony.nflStats.model.StatTable;
import com.tony.nflStats.model.StatType;
import com.tony.nflStats.model.SummaryLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;
import java.util.stream.Collectors;

/**
 * Regroupe les événements enrichis, calcule les ratios (PACR, RACR, ADOT, parts de ciblage, WOPR),
 * fusionne les sorties des extracteurs play-by-play puis ordonne colonnes et lignes.
 */
@Service
@Slf4j
public class StatAggregator {

    // Compteurs : nombre d'événements du groupe portant le drapeau
    private static final Map<String, Predicate<EnrichedEvent>> COUNTS = new LinkedHashMap<>();
    // Sommes de yards ventilés
    private static final Map<String, ToIntFunction<EnrichedEvent>> YARDS = new LinkedHashMap<>();

    static {
        // Passe
        COUNTS.put("completions", EnrichedEvent::isComp);
        COUNTS.put("attempts", EnrichedEvent::isAtt);
        COUNTS.put("passing_tds", EnrichedEvent::isPassTd);
        COUNTS.put("interceptions", EnrichedEvent::isInterception);
        COUNTS.put("sacks", EnrichedEvent::isSack);
        COUNTS.put("sack_fumbles", EnrichedEvent::isSackFumble);
        COUNTS.put("sack_fumbles_lost", EnrichedEvent::isSackFumbleLost);
        COUNTS.put("passing_first_downs", EnrichedEvent::isPassFirstDown);
        COUNTS.put("passing_2pt_conversions", EnrichedEvent::isPass2pt);
        COUNTS.put("qb_targets", EnrichedEvent::isQbTarget);
        // Course
        COUNTS.put("carries", EnrichedEvent::isCarry);
        COUNTS.put("rushing_tds", EnrichedEvent::isRushTd);
        COUNTS.put("rushing_fumbles", EnrichedEvent::isRushFumble);
        COUNTS.put("rushing_fumbles_lost", EnrichedEvent::isRushFumbleLost);
        COUNTS.put("rushing_first_downs", EnrichedEvent::isRushFirstDown);
        COUNTS.put("rushing_2pt_conversions", EnrichedEvent::isRush2pt);
        // Réception
        COUNTS.put("receptions", EnrichedEvent::isRec);
        COUNTS.put("targets", EnrichedEvent::isTarget);
        COUNTS.put("receiving_tds", EnrichedEvent::isRecTd);
        COUNTS.put("receiving_fumbles", EnrichedEvent::isRecFumble);
        COUNTS.put("receiving_fumbles_lost", EnrichedEvent::isRecFumbleLost);
        COUNTS.put("receiving_first_downs", EnrichedEvent::isRecFirstDown);
        COUNTS.put("receiving_2pt_conversions", EnrichedEvent::isRec2pt);
        // Équipes spéciales
        COUNTS.put("special_teams_tds", EnrichedEvent::isSpecialTd);

        YARDS.put("passing_yards", EnrichedEvent::getPassYards);
        YARDS.put("sack_yards", EnrichedEvent::getSackYards);
        YARDS.put("passing_air_yards", EnrichedEvent::getAirYards);
        YARDS.put("rushing_yards", EnrichedEvent::getRushYards);
        YARDS.put("receiving_yards", EnrichedEvent::getRecYards);
        YARDS.put("receiving_yards_after_catch", EnrichedEvent::getYac);
    }

    private static final List<String> RATIO_COLUMNS = List.of(
            "passing_yards_after_catch", "qb_adot", "pacr", "racr", "receiver_adot");

    private static final List<String> SHARE_COLUMNS = List.of("target_share", "air_yards_share", "wopr");

    // Bloc EPA / efficacité passe, placé après le premier bloc de comptage
    private static final List<String> PASSING_EPA_BLOCK = List.of(
            "passing_epa", "passing_cpoe", "qb_adot", "dropback_epa", "dropback_success_rate",
            "epa_per_dropback", "scramble_epa", "epa_per_scramble", "passing_success_rate",
            "scramble_success_rate");

    private record PlayerTeamKey(Integer season, String playerId, String team) {}

    private record TeamGameKey(Integer season, String gameId, String team) {}

    /**
     * @param extractorOutputs tables play-by-play à fusionner (null ou vides ignorées)
     */
    public StatTable aggregate(List<EnrichedEvent> events,
                               List<String> groupKeys,
                               StatType statType,
                               SummaryLevel summaryLevel,
                               List<StatTable> extractorOutputs) {
        boolean player = statType == StatType.PLAYER;
        boolean week = summaryLevel == SummaryLevel.WEEK;

        Map<List<Object>, List<EnrichedEvent>> groups = new LinkedHashMap<>();
        for (EnrichedEvent e : events) {
            List<Object> key = groupKey(e, groupKeys);
            if (key != null) {
                groups.computeIfAbsent(key, k -> new ArrayList<>()).add(e);
            }
        }

        Map<PlayerTeamKey, int[]> seasonDenominators = player && !week
                ? seasonTeamTotals(events)
                : Map.of();

        List<Map<String, Object>> rows = new ArrayList<>(groups.size());
        groups.forEach((key, group) -> {
            Map<String, Object> row = new LinkedHashMap<>();
            for (int i = 0; i < groupKeys.size(); i++) {
                row.put(groupKeys.get(i), key.get(i));
            }
            fillIdentity(row, group, player, week);
            fillCounts(row, group, player);
            fillRatios(row);
            if (player) {
                fillShares(row, group, week, seasonDenominators);
            }
            if (week) {
                row.put("opponent_team", opponentOf(group.get(0)));
            } else {
                row.put("season_type", group.stream()
                        .map(EnrichedEvent::getSeasonType)
                        .filter(Objects::nonNull)
                        .distinct()
                        .collect(Collectors.joining("+")));
            }
            row.replaceAll((column, value) -> "".equals(value) ? null : value);
            rows.add(row);
        });

        StatTable result = new StatTable(baseColumns(groupKeys, player, week), rows);

        for (StatTable extra : extractorOutputs) {
            if (extra != null && !extra.isEmpty()) {
                result = result.leftJoin(extra, groupKeys);
            }
        }

        log.info("📊 Agrégation {} / {} : {} lignes", statType.getCode(), summaryLevel.getCode(), result.size());
        return result.select(orderColumns(result.getColumns())).sortBy(groupKeys);
    }

    // --- Identité du groupe : nom, type de saison, équipe, matchs ---
    private void fillIdentity(Map<String, Object> row, List<EnrichedEvent> group, boolean player, boolean week) {
        if (player) {
            row.put("player_name", mode(group.stream().map(EnrichedEvent::getPlayerName).toList()));
        }
        if (week) {
            row.put("season_type", group.get(0).getSeasonType());
        }
        if (player) {
            EnrichedEvent teamSource = week ? group.get(group.size() - 1) : group.get(0);
            row.put("team", teamSource.getTeam());
        }
        if (!week) {
            row.put("games", (int) group.stream().map(EnrichedEvent::getGameId).distinct().count());
        }
    }

    private void fillCounts(Map<String, Object> row, List<EnrichedEvent> group, boolean player) {
        COUNTS.forEach((column, flag) -> row.put(column, (int) group.stream().filter(flag).count()));
        YARDS.forEach((column, yards) -> row.put(column, group.stream().mapToInt(yards).sum()));

        // Joueur : yards aériens de l'équipe sur chaque action où il est ciblé
        int receivingAirYards = player
                ? group.stream().filter(EnrichedEvent::isTarget).mapToInt(EnrichedEvent::getTeamPlayAirYards).sum()
                : group.stream().mapToInt(EnrichedEvent::getAirYards).sum();
        row.put("receiving_air_yards", receivingAirYards);

        int airYardsComplete = group.stream().mapToInt(EnrichedEvent::getAirYardsComplete).sum();
        row.put("passing_yards_after_catch", (int) row.get("passing_yards") - airYardsComplete);
    }

    private void fillRatios(Map<String, Object> row) {
        int passingYards = (int) row.get("passing_yards");
        int passingAirYards = (int) row.get("passing_air_yards");
        int receivingYards = (int) row.get("receiving_yards");
        int receivingAirYards = (int) row.get("receiving_air_yards");

        row.put("qb_adot", ratio(passingAirYards, (int) row.get("qb_targets")));
        row.put("pacr", ratio(passingYards, passingAirYards));
        row.put("racr", ratio(receivingYards, receivingAirYards));
        row.put("receiver_adot", ratio(receivingAirYards, (int) row.get("targets")));
    }

    /**
     * Parts de ciblage. En semaine : totaux du match (première valeur du groupe).
     * En saison : somme des totaux de chaque match joué par le joueur avec cette équipe.
     */
    private void fillShares(Map<String, Object> row, List<EnrichedEvent> group, boolean week,
                            Map<PlayerTeamKey, int[]> seasonDenominators) {
        int targets = (int) row.get("targets");
        int receivingAirYards = (int) row.get("receiving_air_yards");

        Double targetShare;
        Double airYardsShare;
        Double wopr;
        if (week) {
            int teamTargets = group.get(0).getTeamGameTargets();
            int teamAirYards = group.get(0).getTeamGameAirYards();
            targetShare = teamTargets != 0 ? (double) targets / teamTargets : null;
            airYardsShare = teamAirYards != 0 ? (double) receivingAirYards / teamAirYards : null;
        } else {
            int[] totals = seasonDenominators.get(new PlayerTeamKey(
                    (Integer) row.get("season"), (String) row.get("player_id"), (String) row.get("team")));
            int teamTargets = totals != null ? totals[0] : 0;
            int teamAirYards = totals != null ? totals[1] : 0;
            targetShare = teamTargets > 0 ? (double) targets / teamTargets : null;
            airYardsShare = teamAirYards > 0 ? (double) receivingAirYards / teamAirYards : null;
        }
        wopr = targetShare != null && airYardsShare != null ? 1.5 * targetShare + 0.7 * airYardsShare : null;

        row.put("target_share", targetShare);
        row.put("air_yards_share", airYardsShare);
        row.put("wopr", wopr);
    }

    /**
     * Totaux équipe (cibles, yards aériens) sommés sur les matchs distincts de chaque
     * couple (saison, joueur, équipe).
     */
    private Map<PlayerTeamKey, int[]> seasonTeamTotals(List<EnrichedEvent> events) {
        Map<TeamGameKey, int[]> teamGames = new HashMap<>();
        Map<PlayerTeamKey, Set<String>> playerGames = new HashMap<>();
        for (EnrichedEvent e : events) {
            teamGames.putIfAbsent(new TeamGameKey(e.getSeason(), e.getGameId(), e.getTeam()),
                    new int[]{e.getTeamGameTargets(), e.getTeamGameAirYards()});
            playerGames.computeIfAbsent(new PlayerTeamKey(e.getSeason(), e.getPlayerId(), e.getTeam()),
                    k -> new LinkedHashSet<>()).add(e.getGameId());
        }

        Map<PlayerTeamKey, int[]> totals = new HashMap<>();
        playerGames.forEach((key, games) -> {
            int[] sum = new int[2];
            for (String gameId : games) {
                int[] game = teamGames.get(new TeamGameKey(key.season(), gameId, key.team()));
                sum[0] += game[0];
                sum[1] += game[1];
            }
            totals.put(key, sum);
        });
        return totals;
    }

    private static String opponentOf(EnrichedEvent representative) {
        return Objects.equals(representative.getTeam(), representative.getOffenseTeam())
                ? representative.getDefenseTeam()
                : representative.getOffenseTeam();
    }

    // Valeur la plus fréquente (à égalité : la plus petite), null si aucune
    static String mode(List<String> values) {
        Map<String, Long> counts = values.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.groupingBy(v -> v, Collectors.counting()));
        return counts.entrySet().stream()
                .max(Map.Entry.<String, Long>comparingByValue()
                        .thenComparing(Map.Entry.<String, Long>comparingByKey(Comparator.reverseOrder())))
                .map(Map.Entry::getKey)
                .orElse(null);
    }

    private static Double ratio(int numerator, int denominator) {
        return denominator != 0 ? (double) numerator / denominator : null;
    }

    private static List<Object> groupKey(EnrichedEvent e, List<String> groupKeys) {
        List<Object> key = new ArrayList<>(groupKeys.size());
        for (String column : groupKeys) {
            Object value = switch (column) {
                case "season" -> e.getSeason();
                case "week" -> e.getWeek();
                case "game_id" -> e.getGameId();
                case "player_id" -> e.getPlayerId();
                case "team" -> e.getTeam();
                default -> throw new IllegalArgumentException("Clé de regroupement inconnue : " + column);
            };
            if (value == null) return null;
            key.add(value);
        }
        return key;
    }

    // Colonnes produites par l'agrégation, dans leur ordre naturel
    private static List<String> baseColumns(List<String> groupKeys, boolean player, boolean week) {
        List<String> columns = new ArrayList<>(groupKeys);
        if (player) columns.add("player_name");
        if (week) columns.add("season_type");
        if (player) columns.add("team");
        if (!week) columns.add("games");
        columns.addAll(COUNTS.keySet());
        columns.addAll(YARDS.keySet());
        columns.add("receiving_air_yards");
        columns.addAll(RATIO_COLUMNS);
        if (player) columns.addAll(SHARE_COLUMNS);
        columns.add(week ? "opponent_team" : "season_type");
        return columns;
    }

    /**
     * Ordre de présentation : identifiants et comptages passe, bloc EPA passe, comptages
     * intermédiaires, EPA course, comptages réception, EPA réception, puis le reste.
     */
    static List<String> orderColumns(List<String> natural) {
        List<String> ordered = new ArrayList<>(slice(natural, "season", "passing_first_downs"));
        PASSING_EPA_BLOCK.stream().filter(natural::contains).forEach(ordered::add);
        ordered.addAll(slice(natural, "passing_2pt_conversions", "rushing_first_downs"));
        if (natural.contains("rushing_epa")) ordered.add("rushing_epa");
        ordered.addAll(slice(natural, "rushing_2pt_conversions", "receiving_first_downs"));
        if (natural.contains("receiving_epa")) ordered.add("receiving_epa");
        ordered.addAll(natural);
        return List.copyOf(new LinkedHashSet<>(ordered));
    }

    private static List<String> slice(List<String> columns, String from, String to) {
        int start = columns.indexOf(from);
        int end = columns.indexOf(to);
        if (start < 0 || end < start) return List.of();
        return columns.subList(start, end + 1);
    }
}
