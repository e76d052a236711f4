package com.tony.nflStats.service;

import com.tony.nflStats.config.StatsProperties;
import com.tony.nflStats.model.*;
import com.tony.nflStats.model.dto.StatsQuery;
import com.tony.nflStats.repository.PlayRepository;
import com.tony.nflStats.repository.PlayStatRepository;
import com.tony.nflStats.repository.StatTableWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

/**
 * Alimentation de la base : dimensions, actions nettoyées (plays), événements enrichis (playstats)
 * et tables de stats calculées.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DatabaseSeedService {

    private final SeasonDataLoader dataLoader;
    private final PlayRecordCleaner cleaner;
    private final EventFlagEnricher enricher;
    private final PlayRepository playRepository;
    private final PlayStatRepository playStatRepository;
    private final StatsCalculationService statsCalculationService;
    private final StatTableWriter statTableWriter;
    private final StatsProperties properties;
    private final SeasonCalendar seasonCalendar;
    private final DimensionSeedService dimensionSeedService;

    /**
     * Saisons à charger quand l'appelant n'en précise pas : celles de la configuration,
     * sinon la saison en cours.
     */
    public List<Integer> defaultSeasons() {
        if (!properties.getSeedSeasons().isEmpty()) {
            return List.copyOf(properties.getSeedSeasons());
        }
        return List.of(seasonCalendar.mostRecentSeason());
    }

    @Transactional
    public String seed(List<Integer> seasons) {
        List<Integer> target = seasons == null || seasons.isEmpty() ? defaultSeasons() : seasons;
        long start = System.currentTimeMillis();
        log.info("🚀 Seed des saisons {}...", target);

        String dimensions = dimensionSeedService.seed(target);

        List<Map<String, String>> rawPlays = dataLoader.loadPlays(target);
        List<Play> plays = cleaner.clean(rawPlays);
        List<EnrichedEvent> events = enricher.enrich(plays, dataLoader.loadStatEvents(target), target);

        // Rechargement complet des saisons ciblées
        int deletedEvents = playStatRepository.deleteBySeasonIn(target);
        int deletedPlays = playRepository.deleteBySeasonIn(target);
        log.info("🧹 {} actions et {} événements supprimés avant rechargement", deletedPlays, deletedEvents);

        playRepository.saveAll(plays);
        playStatRepository.saveAll(events);

        for (Integer season : target) {
            log.info("📊 Saison {} : {} actions, {} événements en base",
                    season, playRepository.countBySeason(season), playStatRepository.countBySeason(season));
        }

        return String.format("✅ Saisons %s : %d actions, %d événements ; %s (%d ms).",
                target, plays.size(), events.size(), dimensions, System.currentTimeMillis() - start);
    }

    /**
     * Calcule une table de stats et l'upserte dans la table correspondante.
     */
    public String publishStats(StatsQuery query) {
        StatTable table = statsCalculationService.calculateStats(query);
        StatType statType = StatType.fromCode(query.getStatType());
        SummaryLevel summaryLevel = SummaryLevel.fromCode(query.getSummaryLevel());

        if (table.isEmpty()) {
            String reason = table.getDiagnostic() != null ? table.getDiagnostic() : "aucune ligne";
            return "⚠️ " + StatTableWriter.tableName(statType, summaryLevel) + " non modifiée : " + reason;
        }

        int written = statTableWriter.write(table, statType, summaryLevel);
        return String.format("✅ %s : %d lignes publiées.", StatTableWriter.tableName(statType, summaryLevel), written);
    }
}
