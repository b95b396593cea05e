package com.polytrade.engine;

import com.polytrade.config.ConfigInvalidException;
import com.polytrade.config.EngineConfig;
import com.polytrade.persistence.JsonMappers;
import com.polytrade.scanner.JsonFileMarketScanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

/**
 * Process entry point. Usage: {@code PolytradeApplication [opportunity-feed.json]}.
 */
public final class PolytradeApplication {
    private static final Logger logger = LoggerFactory.getLogger(PolytradeApplication.class);

    private PolytradeApplication() {
    }

    public static void main(String[] args) {
        EngineConfig config;
        try {
            config = EngineConfig.load();
        } catch (ConfigInvalidException e) {
            logger.error("Refusing to start: {}", e.getMessage());
            System.exit(2);
            return;
        }
        if (!config.isPaperTrading()) {
            // No venue gateway ships with this build.
            logger.error("Live trading needs an OrderGateway implementation; set PAPER_TRADING=true");
            System.exit(2);
            return;
        }

        Path feed = Path.of(args.length > 0 ? args[0] : "opportunities.json");
        TradingEngine engine = new TradingEngine(config, new JsonFileMarketScanner(feed, JsonMappers.create()), null);
        Runtime.getRuntime().addShutdownHook(new Thread(engine::stop, "shutdown"));

        logger.info("Starting Polytrade engine (feed: {})", feed.toAbsolutePath());
        engine.start();
    }
}
