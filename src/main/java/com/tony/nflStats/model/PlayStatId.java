package com.tony.nflStats.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlayStatId implements Serializable {
    private Integer season;
    private Long playId;
    private String gameId;
    private String playerId;
    private Integer statId;
}
