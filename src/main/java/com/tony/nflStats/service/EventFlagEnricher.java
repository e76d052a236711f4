package com.tony.nflStats.service;

import com.tony.nflStats.model.EnrichedEvent;
import com.tony.nflStats.model.Play;
import com.tony.nflStats.model.StatCodes;
import com.tony.nflStats.model.StatEvent;
import com.tony.nflStats.model.csv.MissingValues;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.*;

import static com.tony.nflStats.model.StatCodes.*;

/**
 * Rattache les événements stat aux actions nettoyées et calcule les drapeaux par événement.
 */
@Service
@Slf4j
public class EventFlagEnricher {

    private record PlayKey(String gameId, Long playId) {}

    private record PlayerPlayKey(Integer season, Integer week, Long playId, String playerId) {}

    private record TeamPlayKey(Integer season, Integer week, Long playId, String team) {}

    private record TeamGameKey(Integer season, String gameId, String team) {}

    private record EventKey(String gameId, Long playId, String playerId, Integer statId) {}

    // Contexte d'une action : première équipe offensive/défensive rencontrée
    private static final class PlayContext {
        private final String offense;
        private final String defense;
        private int special;

        private PlayContext(String offense, String defense) {
            this.offense = offense;
            this.defense = defense;
        }
    }

    private static final class TeamGameTotals {
        private int targets;
        private int airYards;
    }

    /**
     * @param plays   actions nettoyées (seules leurs actions sont conservées)
     * @param events  événements bruts du flux playstats
     * @param seasons saisons demandées
     */
    public List<EnrichedEvent> enrich(List<Play> plays, List<StatEvent> events, List<Integer> seasons) {
        List<Integer> legacySeasons = seasons.stream().filter(StatCodes::isLegacyTargetSeason).toList();
        if (!legacySeasons.isEmpty()) {
            log.info("ℹ️ Saisons {} : cibles au format historique (codes {})", legacySeasons, LEGACY_TARGET);
        }

        Map<PlayKey, PlayContext> contexts = buildPlayContexts(plays);
        Map<String, String> seasonTypes = new HashMap<>();
        plays.forEach(p -> seasonTypes.putIfAbsent(p.getGameId(), p.getSeasonType()));

        List<StatEvent> kept = restrictAndDeduplicate(events, contexts.keySet());

        // --- Agrégats par action (joueur / équipe) et par match ---
        Map<PlayerPlayKey, Set<Integer>> playerCodes = new HashMap<>();
        Map<TeamPlayKey, Set<Integer>> teamCodes = new HashMap<>();
        Map<TeamPlayKey, Integer> teamPlayAirYards = new HashMap<>();
        Map<TeamGameKey, TeamGameTotals> teamGameTotals = new HashMap<>();

        for (StatEvent e : kept) {
            int yards = yardsOf(e);
            if (e.getStatId() != null) {
                playerCodes.computeIfAbsent(playerPlayKey(e), k -> new HashSet<>()).add(e.getStatId());
                teamCodes.computeIfAbsent(teamPlayKey(e), k -> new HashSet<>()).add(e.getStatId());
            }
            int air = isAirYards(e.getStatId()) ? yards : 0;
            teamPlayAirYards.merge(teamPlayKey(e), air, Integer::sum);

            TeamGameTotals totals = teamGameTotals.computeIfAbsent(
                    new TeamGameKey(e.getSeason(), e.getGameId(), e.getTeam()), k -> new TeamGameTotals());
            if (isTarget(e.getSeason(), e.getStatId())) totals.targets++;
            totals.airYards += air;
        }

        List<EnrichedEvent> enriched = new ArrayList<>(kept.size());
        for (StatEvent e : kept) {
            PlayContext ctx = contexts.get(new PlayKey(e.getGameId(), e.getPlayId()));
            TeamGameTotals totals = teamGameTotals.get(new TeamGameKey(e.getSeason(), e.getGameId(), e.getTeam()));
            enriched.add(toEnriched(
                    e,
                    ctx,
                    seasonTypes.get(e.getGameId()),
                    playerCodes.getOrDefault(playerPlayKey(e), Set.of()),
                    teamCodes.getOrDefault(teamPlayKey(e), Set.of()),
                    teamPlayAirYards.getOrDefault(teamPlayKey(e), 0),
                    totals));
        }

        log.info("✅ {} événements enrichis ({} reçus)", enriched.size(), events.size());
        return enriched;
    }

    private Map<PlayKey, PlayContext> buildPlayContexts(List<Play> plays) {
        Map<PlayKey, PlayContext> contexts = new LinkedHashMap<>();
        for (Play p : plays) {
            PlayContext ctx = contexts.computeIfAbsent(new PlayKey(p.getGameId(), p.getPlayId()),
                    k -> new PlayContext(p.getPosteam(), p.getDefteam()));
            if (p.getSpecial() != null && p.getSpecial() == 1) {
                ctx.special = 1;
            }
        }
        return contexts;
    }

    /**
     * Garde les événements dont l'action a survécu au nettoyage, remplace l'identifiant
     * joueur absent par TEAM puis dédoublonne (premier conservé).
     */
    private List<StatEvent> restrictAndDeduplicate(List<StatEvent> events, Set<PlayKey> knownPlays) {
        Set<EventKey> seen = new HashSet<>();
        List<StatEvent> kept = new ArrayList<>();
        int orphans = 0;

        for (StatEvent e : events) {
            if (!knownPlays.contains(new PlayKey(e.getGameId(), e.getPlayId()))) {
                orphans++;
                continue;
            }
            if (MissingValues.isMissing(e.getPlayerId())) {
                e = e.toBuilder().playerId(StatEvent.TEAM_PLAYER_ID).build();
            }
            if (seen.add(new EventKey(e.getGameId(), e.getPlayId(), e.getPlayerId(), e.getStatId()))) {
                kept.add(e);
            }
        }

        if (orphans > 0) {
            log.debug("{} événements sans action correspondante ignorés", orphans);
        }
        return kept;
    }

    private EnrichedEvent toEnriched(StatEvent e, PlayContext ctx, String seasonType,
                                     Set<Integer> playerPlayCodes, Set<Integer> teamPlayCodes,
                                     int teamPlayAir, TeamGameTotals totals) {
        Integer statId = e.getStatId();
        int yards = yardsOf(e);
        int special = ctx != null ? ctx.special : 0;

        boolean comp = in(COMPLETION, statId);
        boolean att = in(PASS_ATTEMPT, statId);
        boolean sack = is(SACK, statId);
        boolean airYardsEvent = isAirYards(statId);
        boolean carry = in(CARRY, statId);
        boolean rushYardsEvent = in(RUSH_YARDS, statId);
        boolean rec = in(RECEPTION, statId);
        boolean recYardsEvent = in(REC_YARDS, statId);
        boolean yacEvent = is(YAC, statId);

        boolean qbTarget = isLegacyTargetSeason(e.getSeason())
                ? att
                : att && teamPlayCodes.contains(TARGET);

        boolean hasFumble = playerPlayCodes.stream().anyMatch(FUMBLE::contains);
        boolean hasFumbleLost = playerPlayCodes.contains(FUMBLE_LOST);
        boolean hasRushFirstDown = teamPlayCodes.contains(RUSH_FIRST_DOWN);
        boolean hasPassFirstDown = teamPlayCodes.contains(PASS_FIRST_DOWN);

        return EnrichedEvent.builder()
                .season(e.getSeason())
                .week(e.getWeek())
                .gameId(e.getGameId())
                .playId(e.getPlayId())
                .playerId(e.getPlayerId())
                .playerName(e.getPlayerName())
                .team(e.getTeam())
                .statId(statId)
                .yards(yards)
                .offenseTeam(ctx != null ? ctx.offense : null)
                .defenseTeam(ctx != null ? ctx.defense : null)
                .special(special)
                .seasonType(seasonType)
                .playerPlayCodes(playerPlayCodes)
                .teamPlayCodes(teamPlayCodes)
                .teamPlayAirYards(teamPlayAir)
                .teamGameTargets(totals != null ? totals.targets : 0)
                .teamGameAirYards(totals != null ? totals.airYards : 0)
                // Drapeaux simples
                .comp(comp)
                .att(att)
                .passTd(is(PASS_TD, statId))
                .interception(is(INTERCEPTION, statId))
                .sack(sack)
                .airYardsEvent(airYardsEvent)
                .qbTarget(qbTarget)
                .carry(carry)
                .rushYardsEvent(rushYardsEvent)
                .rushTd(in(RUSH_TD, statId))
                .rec(rec)
                .target(isTarget(e.getSeason(), statId))
                .recYardsEvent(recYardsEvent)
                .recTd(in(REC_TD, statId))
                .yacEvent(yacEvent)
                .pass2pt(is(PASS_2PT, statId))
                .rush2pt(is(RUSH_2PT, statId))
                .rec2pt(is(REC_2PT, statId))
                // Drapeaux composés
                .fumbleOnPlay(hasFumble)
                .fumbleLostOnPlay(hasFumbleLost)
                .rushFirstDownOnPlay(hasRushFirstDown)
                .passFirstDownOnPlay(hasPassFirstDown)
                .sackFumble(sack && hasFumble)
                .sackFumbleLost(sack && hasFumbleLost)
                .rushFumble(carry && hasFumble)
                .rushFumbleLost(carry && hasFumbleLost)
                .recFumble(rec && hasFumble)
                .recFumbleLost(rec && hasFumbleLost)
                .rushFirstDown(carry && hasRushFirstDown)
                .passFirstDown(comp && hasPassFirstDown)
                .recFirstDown(rec && hasPassFirstDown)
                .specialTd(special == 1 && in(TOUCHDOWN, statId))
                // Yards ventilés
                .passYards(comp ? yards : 0)
                .sackYards(sack ? -yards : 0)
                .airYards(airYardsEvent ? yards : 0)
                .airYardsComplete(is(AIR_YARDS_COMPLETE, statId) ? yards : 0)
                .rushYards(rushYardsEvent ? yards : 0)
                .recYards(recYardsEvent ? yards : 0)
                .yac(yacEvent ? yards : 0)
                .build();
    }

    private static PlayerPlayKey playerPlayKey(StatEvent e) {
        return new PlayerPlayKey(e.getSeason(), e.getWeek(), e.getPlayId(), e.getPlayerId());
    }

    private static TeamPlayKey teamPlayKey(StatEvent e) {
        return new TeamPlayKey(e.getSeason(), e.getWeek(), e.getPlayId(), e.getTeam());
    }

    private static int yardsOf(StatEvent e) {
        return e.getYards() != null ? e.getYards() : 0;
    }

    private static boolean in(Set<Integer> codes, Integer statId) {
        return statId != null && codes.contains(statId);
    }

    private static boolean is(int code, Integer statId) {
        return statId != null && statId == code;
    }
}
