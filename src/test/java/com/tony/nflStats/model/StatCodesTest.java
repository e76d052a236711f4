package com.tony.nflStats.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StatCodesTest {

    @Test
    void legacySeasonsShouldBe2003To2008Inclusive() {
        assertThat(StatCodes.isLegacyTargetSeason(2002)).isFalse();
        assertThat(StatCodes.isLegacyTargetSeason(2003)).isTrue();
        assertThat(StatCodes.isLegacyTargetSeason(2008)).isTrue();
        assertThat(StatCodes.isLegacyTargetSeason(2009)).isFalse();
        assertThat(StatCodes.isLegacyTargetSeason(null)).isFalse();
    }

    @Test
    @DisplayName("2003-2008 : une réception compte comme cible")
    void legacyEraTargetsIncludeReceptions() {
        assertThat(StatCodes.isTarget(2005, 21)).isTrue();
        assertThat(StatCodes.isTarget(2005, 22)).isTrue();
        assertThat(StatCodes.isTarget(2005, 115)).isTrue();
        assertThat(StatCodes.isTarget(2005, 23)).isFalse();
    }

    @Test
    @DisplayName("Hors 2003-2008 : seul le code 115 est une cible")
    void modernEraTargetIsOnly115() {
        assertThat(StatCodes.isTarget(2015, 115)).isTrue();
        assertThat(StatCodes.isTarget(2015, 21)).isFalse();
        assertThat(StatCodes.isTarget(2015, 22)).isFalse();
        assertThat(StatCodes.isTarget(2001, 22)).isFalse();
        assertThat(StatCodes.isTarget(2015, null)).isFalse();
    }

    @Test
    void completionsShouldBeSubsetOfAttempts() {
        assertThat(StatCodes.PASS_ATTEMPT).containsAll(StatCodes.COMPLETION);
    }
}
