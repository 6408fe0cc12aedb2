package de.htwsaar.assetserver.server;

import de.htwsaar.assetserver.core.AssetServer;
import de.htwsaar.assetserver.server.config.AssetServerConfig;
import de.htwsaar.assetserver.server.web.CachePolicy;
import java.nio.file.Path;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Zentrale Spring-Verdrahtung des Asset-Servers.
 *
 * <p>Schichtung: Controller → {@link AssetServer} (Loader, Cache) → Ports → Adapter</p>
 */
@Configuration
public class AssetServerBeans {

    private static final Logger log = LoggerFactory.getLogger(AssetServerBeans.class);

    /**
     * Systemuhr für Metrik-Zeitfenster.
     *
     * @return UTC-Clock
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Liest die Startkonfiguration einmalig aus den Properties.
     *
     * @param root      Wurzelverzeichnis des Dateibaums (Standard: "assets")
     * @param noCache   Entwicklungsmodus ohne Client-Caching (Standard: false)
     * @param mountPath externes Pfad-Präfix (Standard: leer)
     * @return unveränderliche Konfiguration
     */
    @Bean
    public AssetServerConfig assetServerConfig(
            @Value("${assetserver.root:assets}") String root,
            @Value("${assetserver.no-cache:false}") boolean noCache,
            @Value("${assetserver.mount-path:}") String mountPath) {
        AssetServerConfig config = new AssetServerConfig(Path.of(root), noCache, mountPath);
        log.info("Serving assets from {} (mount='{}', noCache={})", config.root(), config.mountPath(), noCache);
        return config;
    }

    /**
     * Genau ein Asset-Server (und damit ein Cache) pro Dateibaum.
     *
     * @param config Startkonfiguration
     * @return Asset-Server über das lokale Wurzelverzeichnis
     */
    @Bean
    public AssetServer assetServer(AssetServerConfig config) {
        return AssetServer.forDirectory(config.root());
    }

    /**
     * @param config Startkonfiguration
     * @return Cache-Control-Auswahl passend zum Modus
     */
    @Bean
    public CachePolicy cachePolicy(AssetServerConfig config) {
        return new CachePolicy(config.noCache());
    }
}
