package com.tony.nflStats.controller;

import com.tony.nflStats.model.dto.StatsQuery;
import com.tony.nflStats.service.DatabaseSeedService;
import com.tony.nflStats.service.MissingSourceDataException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
public class AdminController {
    private final DatabaseSeedService seedService;

    // Sans paramètre : saisons de la configuration, sinon saison en cours
    @PostMapping("/seed")
    public ResponseEntity<?> seed(@RequestParam(required = false) List<Integer> seasons) {
        log.info("🚀 Seed manuel demandé par l'admin ({})", seasons);
        try {
            return ResponseEntity.ok(Map.of("message", seedService.seed(seasons)));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (MissingSourceDataException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * Calcule une table (ex. {"seasons":[2023],"summaryLevel":"week","statType":"player"})
     * et l'upserte dans la table de stats correspondante.
     */
    @PostMapping("/stats/publish")
    public ResponseEntity<?> publishStats(@Valid @RequestBody StatsQuery query) {
        try {
            return ResponseEntity.ok(Map.of("message", seedService.publishStats(query)));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (MissingSourceDataException e) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", e.getMessage()));
        }
    }
}
