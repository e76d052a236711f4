package com.tony.nflStats.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class PlayId implements Serializable {
    private Integer season;
    private Long playId;
    private String gameId;
}
