package com.supperclub.reservation.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "reservation")
public class ReservationProperties {

    private Hold hold = new Hold();
    private Availability availability = new Availability();
    private Booking booking = new Booking();
    private Webhook webhook = new Webhook();
    private Outbox outbox = new Outbox();
    private Reconciliation reconciliation = new Reconciliation();

    @Getter
    @Setter
    public static class Hold {
        private Duration ttl = Duration.ofMinutes(20);
        private Duration sweepInterval = Duration.ofMinutes(2);
    }

    @Getter
    @Setter
    public static class Availability {
        private Duration cacheTtl = Duration.ofMinutes(5);
    }

    @Getter
    @Setter
    public static class Booking {
        /** Online sales close this many days before the event date. */
        private int ticketCutoffDays = 3;
    }

    @Getter
    @Setter
    public static class Webhook {
        private String signingSecret = "";
        private Duration tolerance = Duration.ofMinutes(5);

        public boolean hasSigningSecret() {
            return signingSecret != null && !signingSecret.isBlank();
        }
    }

    @Getter
    @Setter
    public static class Outbox {
        private int batchSize = 50;
        /** Sends per notification before it is marked FAILED and escalated. */
        private int maxAttempts = 8;
        private Duration retention = Duration.ofDays(3);
    }

    @Getter
    @Setter
    public static class Reconciliation {
        /** Must stay shorter than the sweep interval so a crashed pod cannot block the next run. */
        private Duration lockLease = Duration.ofMinutes(4);
    }
}
