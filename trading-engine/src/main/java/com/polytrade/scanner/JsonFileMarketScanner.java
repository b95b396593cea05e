package com.polytrade.scanner;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads scanner output from a JSON file that an external market-data process keeps current.
 * A missing file means nothing to trade this cycle; an unreadable one is a scanner failure.
 */
public final class JsonFileMarketScanner implements MarketScanner {
    private static final Logger logger = LoggerFactory.getLogger(JsonFileMarketScanner.class);

    private final Path feed;
    private final ObjectMapper mapper;
    private final OpportunityParser parser;

    public JsonFileMarketScanner(Path feed, ObjectMapper mapper) {
        this.feed = feed;
        this.mapper = mapper;
        this.parser = new OpportunityParser(mapper);
    }

    @Override
    public ScanResult scan() {
        if (!Files.exists(feed)) {
            logger.debug("No opportunity feed at {}", feed);
            return ScanResult.empty();
        }
        JsonNode root;
        try {
            root = mapper.readTree(feed.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read opportunity feed " + feed, e);
        }
        List<Opportunity> opportunities = parser.parseAll(root);
        logger.info("🔍 Scanned {} markets, {} valid opportunities", root.size(), opportunities.size());
        return new ScanResult(root.size(), opportunities);
    }
}
