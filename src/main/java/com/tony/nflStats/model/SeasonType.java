package com.tony.nflStats.model;

public enum SeasonType {
    REG, POST, ALL;

    public static SeasonType fromCode(String code) {
        for (SeasonType type : values()) {
            if (type.name().equals(code)) return type;
        }
        throw new IllegalArgumentException("season_type must be 'REG', 'POST', or 'ALL'");
    }

    // ALL ne filtre rien
    public boolean isFilter() {
        return this != ALL;
    }
}
