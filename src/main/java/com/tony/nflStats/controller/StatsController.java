package com.tony.nflStats.controller;

import com.tony.nflStats.model.StatTable;
import com.tony.nflStats.model.dto.StatsQuery;
import com.tony.nflStats.service.MissingSourceDataException;
import com.tony.nflStats.service.SeasonCalendar;
import com.tony.nflStats.service.StatsCalculationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/stats")
@RequiredArgsConstructor
@Slf4j
public class StatsController {
    private final StatsCalculationService statsCalculationService;
    private final SeasonCalendar seasonCalendar;

    // Ex : GET /api/v1/stats?seasons=2022,2023&summaryLevel=week&statType=team
    @GetMapping
    public ResponseEntity<?> getStats(
            @RequestParam(required = false) List<Integer> seasons,
            @RequestParam(defaultValue = "season") String summaryLevel,
            @RequestParam(defaultValue = "player") String statType,
            @RequestParam(defaultValue = "REG") String seasonType) {

        List<Integer> requested = seasons == null || seasons.isEmpty()
                ? List.of(seasonCalendar.mostRecentSeason())
                : seasons;

        try {
            StatTable table = statsCalculationService.calculateStats(
                    new StatsQuery(requested, summaryLevel, statType, seasonType));
            return ResponseEntity.ok(table);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (MissingSourceDataException e) {
            log.warn("⚠️ Données absentes : {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }
}
