package com.example.baselinediff.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Externalized settings under the {@code baseline} prefix.
 */
@ConfigurationProperties(prefix = "baseline")
@Getter
@Setter
public class BaselineProperties {

    private Storage storage = new Storage();
    private Query query = new Query();
    private Scan scan = new Scan();
    private Classifier classifier = new Classifier();

    @Getter
    @Setter
    public static class Storage {
        /**
         * Maximum bound parameters per statement.
         */
        private int batchSize = 500;
    }

    @Getter
    @Setter
    public static class Query {
        private int defaultPageSize = 100;
        private int maxPageSize = 1000;
        private int unboundedCeiling = 50_000;
        private int relatedLimit = 5;
    }

    @Getter
    @Setter
    public static class Scan {
        /**
         * 0 reads the whole history of every project.
         */
        private int maxCommitsPerProject = 0;
        /**
         * Project logs read ahead of ingestion. Bounds the commits held in memory.
         */
        private int readsInFlight = 4;
        private Duration lockAtMostFor = Duration.ofHours(2);
    }

    @Getter
    @Setter
    public static class Classifier {
        private Duration lockAtMostFor = Duration.ofMinutes(30);
    }
}
