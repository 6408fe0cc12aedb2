package de.htwsaar.assetserver.server;

import de.htwsaar.assetserver.common.auth.SecurityConfig;
import de.htwsaar.assetserver.common.logging.LoggingConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@Import({LoggingConfig.class, SecurityConfig.class})
public class AssetServerApp {
    public static void main(String[] args) {
        SpringApplication.run(AssetServerApp.class, args);
    }
}
