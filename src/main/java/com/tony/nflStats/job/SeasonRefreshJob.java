package com.tony.nflStats.job;

import com.tony.nflStats.config.StatsProperties;
import com.tony.nflStats.service.DatabaseSeedService;
import com.tony.nflStats.service.SeasonCalendar;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class SeasonRefreshJob {

    private final DatabaseSeedService seedService;
    private final SeasonCalendar seasonCalendar;
    private final StatsProperties properties;

    /**
     * Rechargement de la saison en cours, le mardi à 09:00 (matchs du week-end et du lundi soir joués).
     * Désactivé tant que nfl.stats.refresh-enabled vaut false.
     */
    @Scheduled(cron = "0 0 9 * * TUE")
    public void refreshCurrentSeason() {
        if (!properties.isRefreshEnabled()) {
            log.debug("[CRON] Rechargement hebdomadaire désactivé");
            return;
        }

        int season = seasonCalendar.mostRecentSeason();
        log.info("⏰ [CRON] Rechargement de la saison {}...", season);
        try {
            String report = seedService.seed(List.of(season));
            log.info("   -> {}", report);
            log.info("✅ [CRON] Saison {} rechargée.", season);
        } catch (Exception e) {
            log.error("❌ [CRON] Echec du rechargement de la saison " + season, e);
        }
    }
}
