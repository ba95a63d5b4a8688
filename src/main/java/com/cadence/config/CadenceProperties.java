package com.cadence.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralizes topic names and engine tuning.
 *
 * Bound from application.yml under the "cadence" prefix:
 *   cadence:
 *     topics:
 *       events: cadence.events
 *       dlq: cadence.events.dlq
 *       sends: cadence.sends
 *       alerts: cadence.alerts
 *     engine:
 *       max-hops-per-pass: 20
 *       lock-ttl: PT2M
 *     nurture:
 *       cadence-min-days: 30
 *       cadence-max-days: 45
 *       archive-after-days: 360
 *       exit-on-re-entry: false
 *     suppression:
 *       frequency-cap-max: 5
 *       frequency-cap-window: P7D
 */
@Component
@ConfigurationProperties(prefix = "cadence")
@Getter
@Setter
public class CadenceProperties {

    private Topics topics = new Topics();
    private Engine engine = new Engine();
    private Nurture nurture = new Nurture();
    private Suppression suppression = new Suppression();

    @Getter
    @Setter
    public static class Topics {
        private String events = "cadence.events";
        private String dlq = "cadence.events.dlq";
        private String sends = "cadence.sends";
        private String alerts = "cadence.alerts";
    }

    @Getter
    @Setter
    public static class Engine {
        /** Node hops allowed in one advancement pass before yielding. */
        private int maxHopsPerPass = 20;
        /** Lifetime of the per-enrollment advancement lock. */
        private Duration lockTtl = Duration.ofMinutes(2);
        private long sweepIntervalMs = 60_000;
        private boolean schedulingEnabled = true;
    }

    @Getter
    @Setter
    public static class Nurture {
        private int cadenceMinDays = 30;
        private int cadenceMaxDays = 45;
        private int archiveAfterDays = 360;
        /**
         * When true, a re-entry into the primary workflow moves the lead's
         * active nurture row to EXITED. When false both tracks may hold the lead.
         */
        private boolean exitOnReEntry = false;
        private String archiveCron = "0 0 3 * * *";
    }

    @Getter
    @Setter
    public static class Suppression {
        private int frequencyCapMax = 5;
        private Duration frequencyCapWindow = Duration.ofDays(7);
        private int domainThrottleMax = 50;
        private Duration domainThrottleWindow = Duration.ofHours(1);
    }
}
