package com.tony.nflStats.service;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeasonCalendarTest {

    private final SeasonCalendar calendar = new SeasonCalendar();

    @Test
    void seasonOpensThursdayAfterLaborDay() {
        assertThat(SeasonCalendar.laborDay(2024)).isEqualTo(LocalDate.of(2024, 9, 2));
        assertThat(SeasonCalendar.seasonOpener(2024)).isEqualTo(LocalDate.of(2024, 9, 5));
        assertThat(SeasonCalendar.laborDay(2025)).isEqualTo(LocalDate.of(2025, 9, 1));
    }

    @Test
    void mostRecentSeasonSwitchesOnOpener() {
        assertThat(calendar.mostRecentSeason(LocalDate.of(2024, 9, 4), false)).isEqualTo(2023);
        assertThat(calendar.mostRecentSeason(LocalDate.of(2024, 9, 5), false)).isEqualTo(2024);
        assertThat(calendar.mostRecentSeason(LocalDate.of(2025, 1, 20), false)).isEqualTo(2024);
    }

    @Test
    void rosterYearStartsMidMarch() {
        assertThat(calendar.mostRecentSeason(LocalDate.of(2024, 3, 14), true)).isEqualTo(2023);
        assertThat(calendar.mostRecentSeason(LocalDate.of(2024, 3, 15), true)).isEqualTo(2024);
    }

    @Test
    void checkSeasonsShouldBoundBothEnds() {
        int latest = calendar.mostRecentSeason();

        assertThatCode(() -> calendar.checkSeasons(List.of(1999, latest), 1999)).doesNotThrowAnyException();
        assertThatThrownBy(() -> calendar.checkSeasons(List.of(1998), 1999))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("PBP data only available from 1999 onwards");
        assertThatThrownBy(() -> calendar.checkSeasons(List.of(latest + 1), 1999))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(String.valueOf(latest));
        assertThatThrownBy(() -> calendar.checkSeasons(List.of(), 1999))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
