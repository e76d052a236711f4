package com.tony.nflStats.service;

import com.tony.nflStats.config.StatsProperties;
import com.tony.nflStats.model.*;
import com.tony.nflStats.model.dto.StatsQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Point d'entrée du calcul : validation des paramètres, chargement, nettoyage,
 * enrichissement, extracteurs play-by-play puis agrégation.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StatsCalculationService {

    private final SeasonDataLoader dataLoader;
    private final StatsProperties properties;
    private final PlayRecordCleaner cleaner;
    private final EventFlagEnricher enricher;
    private final PlayByPlayStatsService playByPlayStats;
    private final StatAggregator aggregator;
    private final SeasonCalendar seasonCalendar;

    /**
     * Calcule les stats à partir des fichiers saisonniers.
     *
     * @throws IllegalArgumentException   paramètre invalide (avant toute lecture)
     * @throws MissingSourceDataException fichier saisonnier absent
     */
    public StatTable calculateStats(StatsQuery query) {
        ResolvedQuery resolved = resolve(query);
        List<Map<String, String>> rawPlays = dataLoader.loadPlays(query.getSeasons());
        return compute(resolved, query.getSeasons(), rawPlays, () -> dataLoader.loadStatEvents(query.getSeasons()));
    }

    /**
     * Même calcul sur des données déjà chargées.
     */
    public StatTable calculateStats(StatsQuery query, List<? extends Map<String, ?>> rawPlays, List<StatEvent> rawEvents) {
        ResolvedQuery resolved = resolve(query);
        return compute(resolved, query.getSeasons(), rawPlays, () -> rawEvents);
    }

    public static List<String> groupingKeys(SummaryLevel summaryLevel, StatType statType) {
        String entity = statType == StatType.PLAYER ? "player_id" : "team";
        return summaryLevel == SummaryLevel.SEASON
                ? List.of("season", entity)
                : List.of("season", "week", "game_id", entity);
    }

    private record ResolvedQuery(SummaryLevel summaryLevel, StatType statType, SeasonType seasonType) {}

    private ResolvedQuery resolve(StatsQuery query) {
        SummaryLevel summaryLevel = SummaryLevel.fromCode(query.getSummaryLevel());
        StatType statType = StatType.fromCode(query.getStatType());
        SeasonType seasonType = SeasonType.fromCode(query.getSeasonType());

        seasonCalendar.checkSeasons(query.getSeasons(), properties.getFirstSeason());
        return new ResolvedQuery(summaryLevel, statType, seasonType);
    }

    private StatTable compute(ResolvedQuery query, List<Integer> seasons,
                              List<? extends Map<String, ?>> rawPlays, Supplier<List<StatEvent>> rawEvents) {
        long start = System.currentTimeMillis();
        log.info("🚀 Calcul stats {} / {} ({}) pour {}",
                query.statType().getCode(), query.summaryLevel().getCode(), query.seasonType(), seasons);

        List<String> groupKeys = groupingKeys(query.summaryLevel(), query.statType());
        List<Play> plays = cleaner.clean(rawPlays);

        // Le filtre REG/POST ne s'applique qu'aux résumés saison
        if (query.summaryLevel() == SummaryLevel.SEASON && query.seasonType().isFilter()) {
            String wanted = query.seasonType().name();
            plays = plays.stream().filter(p -> wanted.equals(p.getSeasonType())).toList();
            if (plays.isEmpty()) {
                String diagnostic = String.format(
                        "Filtering %s data to season_type == %s resulted in 0 rows. Returning empty table.",
                        seasons, wanted);
                log.warn("⚠️ {}", diagnostic);
                return StatTable.empty(diagnostic);
            }
        }

        List<EnrichedEvent> events = enricher.enrich(plays, rawEvents.get(), seasons);

        List<StatTable> extractorOutputs = List.of(
                playByPlayStats.passingStats(plays, groupKeys),
                playByPlayStats.rushingStats(plays, groupKeys),
                playByPlayStats.receivingStats(plays, groupKeys),
                playByPlayStats.dropbackStats(plays, groupKeys),
                playByPlayStats.scrambleStats(plays, groupKeys));

        StatTable stats = aggregator.aggregate(events, groupKeys, query.statType(), query.summaryLevel(), extractorOutputs);
        log.info("✅ {} lignes calculées en {} ms", stats.size(), System.currentTimeMillis() - start);
        return stats;
    }
}
