package de.htwsaar.assetserver.server.web;

import de.htwsaar.assetserver.core.AssetServer;
import de.htwsaar.assetserver.server.AssetMetricsService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Admin-API für Server-Metriken. Zugriff nur mit {@code X-Admin-Token}.
 */
@RestController
@RequestMapping("/_assetserver/admin/stats")
public class AssetAdminStatsController {

    private final AssetMetricsService metricsService;
    private final AssetServer assetServer;

    /**
     * Constructor Injection.
     *
     * @param metricsService Metriken-Service
     * @param assetServer    liefert die Cache-Größe
     */
    public AssetAdminStatsController(AssetMetricsService metricsService, AssetServer assetServer) {
        this.metricsService = metricsService;
        this.assetServer = assetServer;
    }

    /**
     * Liefert einen Metriken-Snapshot.
     *
     * @param windowSec Zeitfenster in Sekunden für Request-Rate (Standard: 60)
     * @return Metriken-Snapshot
     */
    @GetMapping
    public ResponseEntity<AssetMetricsService.AssetStatsSnapshot> getStats(
            @RequestParam(value = "windowSec", defaultValue = "60") int windowSec) {
        return ResponseEntity.ok(metricsService.snapshot(windowSec, assetServer.cachedEntries()));
    }
}
