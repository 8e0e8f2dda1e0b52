package com.vidnyan.govern.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for the governance engine.
 * Bound from application.yml under the {@code govern} prefix.
 */
@Data
@Component
@ConfigurationProperties(prefix = "govern")
public class GovernProperties {

    private Store store = new Store();
    private Scan scan = new Scan();
    private Inventory inventory = new Inventory();
    private Library library = new Library();
    private Waiver waiver = new Waiver();

    @Data
    public static class Store {
        /**
         * {@code memory} or {@code file}.
         */
        private String type = "memory";

        /**
         * Root directory of the file-backed stores.
         */
        private String directory = ".govern";

        public boolean isFileBacked() {
            return "file".equalsIgnoreCase(type);
        }
    }

    @Data
    public static class Scan {
        /**
         * Resources evaluated concurrently by a bulk scan; 1 scans sequentially.
         */
        private int parallelism = 1;

        private Duration timeout = Duration.ofSeconds(30);

        /**
         * Framework scanned by the command-line runner. Unset disables the runner.
         */
        private String framework;

        private String scope = "all";
    }

    @Data
    public static class Inventory {
        /**
         * JSON file holding the resource snapshot.
         */
        private String path;
    }

    @Data
    public static class Library {
        private String path = "classpath*:policies/library/*.json";
    }

    @Data
    public static class Waiver {
        private int defaultExpiryDays = 90;
    }
}
