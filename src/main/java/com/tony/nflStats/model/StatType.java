package com.tony.nflStats.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum StatType {
    PLAYER("player"),
    TEAM("team");

    private final String code;

    public static StatType fromCode(String code) {
        for (StatType type : values()) {
            if (type.code.equals(code)) return type;
        }
        throw new IllegalArgumentException("stat_type must be 'player' or 'team'");
    }
}
