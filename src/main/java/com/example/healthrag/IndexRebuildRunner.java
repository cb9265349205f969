package com.example.healthrag;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Repopulates the in-memory vector index from the durable store at startup. Disable with
 * {@code index.rebuild-on-startup=false}, e.g. when the index is loaded from a persisted file.
 */
@Component
@ConditionalOnProperty(name = "index.rebuild-on-startup", havingValue = "true", matchIfMissing = true)
public class IndexRebuildRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(IndexRebuildRunner.class);

    @Autowired
    private VectorIndex vectorIndex;

    @Override
    public void run(String... args) {
        long started = System.currentTimeMillis();
        try {
            vectorIndex.rebuildFromDatabase();
            log.info("Vector index rebuilt from database: size={} in {} ms", vectorIndex.size(), System.currentTimeMillis() - started);
        } catch (Exception e) {
            log.error("Vector index rebuild failed; searches will only see records ingested from now on: {}", e.getMessage(), e);
        }
    }
}
