package com.tony.nflStats.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum SummaryLevel {
    SEASON("season"),
    WEEK("week");

    private final String code;

    public static SummaryLevel fromCode(String code) {
        for (SummaryLevel level : values()) {
            if (level.code.equals(code)) return level;
        }
        throw new IllegalArgumentException("summary_level must be 'season' or 'week'");
    }
}
