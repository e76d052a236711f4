package com.tony.nflStats.service;

import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.MonthDay;
import java.time.temporal.TemporalAdjusters;
import java.util.List;

/**
 * Saison NFL "en cours" : la saison N commence le jeudi qui suit le Labor Day
 * (pour les effectifs : le 15 mars, ouverture du marché des agents libres).
 */
@Component
public class SeasonCalendar {

    private static final MonthDay ROSTER_YEAR_START = MonthDay.of(3, 15);

    public int mostRecentSeason() {
        return mostRecentSeason(LocalDate.now(), false);
    }

    public int mostRecentSeason(LocalDate today, boolean roster) {
        int year = today.getYear();
        if (roster) {
            return MonthDay.from(today).isBefore(ROSTER_YEAR_START) ? year - 1 : year;
        }
        return today.isBefore(seasonOpener(year)) ? year - 1 : year;
    }

    /**
     * Saisons demandées : liste non vide, chaque saison entre {@code firstSeason} et la saison en cours.
     *
     * @throws IllegalArgumentException saison hors bornes
     */
    public void checkSeasons(List<Integer> seasons, int firstSeason) {
        if (seasons == null || seasons.isEmpty()) {
            throw new IllegalArgumentException("Au moins une saison est requise");
        }
        int latest = mostRecentSeason();
        for (Integer season : seasons) {
            if (season == null || season < firstSeason) {
                throw new IllegalArgumentException("PBP data only available from " + firstSeason + " onwards");
            }
            if (season > latest) {
                throw new IllegalArgumentException(
                        "Saison " + season + " invalide : la saison la plus récente est " + latest);
            }
        }
    }

    // Premier lundi de septembre
    public static LocalDate laborDay(int year) {
        return LocalDate.of(year, 9, 1).with(TemporalAdjusters.firstInMonth(DayOfWeek.MONDAY));
    }

    public static LocalDate seasonOpener(int year) {
        return laborDay(year).plusDays(3);
    }
}
