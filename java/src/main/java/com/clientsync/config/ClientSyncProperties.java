package com.clientsync.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Tunables of the sync engine, bound from application.yml under "clientsync".
 *
 * The Notion adapter reads its own connection settings (clientsync.notion.*) with @Value.
 */
@Component
@ConfigurationProperties(prefix = "clientsync")
@Validated
@Getter
@Setter
public class ClientSyncProperties {

    @Valid
    private Source source = new Source();
    @Valid
    private Matching matching = new Matching();
    @Valid
    private Sync sync = new Sync();
    @Valid
    private Scheduler scheduler = new Scheduler();
    @Valid
    private Health health = new Health();
    private Webhook webhook = new Webhook();
    private Admin admin = new Admin();
    private Database database = new Database();

    @Getter
    @Setter
    public static class Source {
        /** Notion database holding the client pages. */
        private String collectionId = "";
        /** Minimum spacing between two Notion API calls. */
        @NotNull
        private Duration minRequestInterval = Duration.ofMillis(350);
    }

    @Getter
    @Setter
    public static class Matching {
        /**
         * Fuzzy and base-name matches must score strictly above this. Lower values merge
         * distinct clients, higher values create duplicates.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double fuzzyThreshold = 0.75;
    }

    @Getter
    @Setter
    public static class Sync {
        @NotNull
        private Duration storeTimeout = Duration.ofSeconds(10);
    }

    @Getter
    @Setter
    public static class Scheduler {
        private boolean enabled = true;
        private String incrementalCron = "0 */30 9-18 * * MON-FRI";
        private String fullCron = "0 0 2 * * *";
        @NotNull
        private ZoneId zone = ZoneId.of("America/New_York");
        @NotNull
        private Duration incrementalLookback = Duration.ofHours(2);
        @NotNull
        private Duration initialDelay = Duration.ofSeconds(5);
    }

    @Getter
    @Setter
    public static class Health {
        @Min(0)
        @Max(23)
        private int activeHoursStart = 9;
        @Min(0)
        @Max(23)
        private int activeHoursEnd = 18;
        @NotNull
        private Duration maxStaleness = Duration.ofHours(2);
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double maxFailureRate = 0.25;
        @Min(1)
        private int recentErrorCapacity = 10;
    }

    @Getter
    @Setter
    public static class Webhook {
        /** Shared secret for X-Notion-Signature; empty means deliveries are not verified. */
        private String secret = "";
        /** Reject every delivery when no secret is configured. */
        private boolean requireSignature = false;
    }

    @Getter
    @Setter
    public static class Admin {
        private String apiKey = "";
    }

    @Getter
    @Setter
    public static class Database {
        private boolean initializeSchema = false;
    }
}
