package com.inboxpilot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Engine settings bound from {@code inbox.*} in application YAML.
 */
@Component
@ConfigurationProperties(prefix = "inbox")
public class InboxProperties {

    private String zone = "UTC";
    private BusinessHours businessHours = new BusinessHours();
    private Booking booking = new Booking();
    private Interrupt interrupt = new Interrupt();

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public ZoneId zoneId() {
        return ZoneId.of(zone);
    }

    public BusinessHours getBusinessHours() {
        return businessHours;
    }

    public void setBusinessHours(BusinessHours businessHours) {
        this.businessHours = businessHours;
    }

    public Booking getBooking() {
        return booking;
    }

    public void setBooking(Booking booking) {
        this.booking = booking;
    }

    public Interrupt getInterrupt() {
        return interrupt;
    }

    public void setInterrupt(Interrupt interrupt) {
        this.interrupt = interrupt;
    }

    /** Weekday window suggested alternatives must fall in, {@code [start, end)} hours. */
    public static class BusinessHours {
        private int start = 9;
        private int end = 17;

        public int getStart() {
            return start;
        }

        public void setStart(int start) {
            this.start = start;
        }

        public int getEnd() {
            return end;
        }

        public void setEnd(int end) {
            this.end = end;
        }
    }

    public static class Booking {
        private Duration alternativeOffset = Duration.ofHours(2);
        private int defaultDurationMinutes = 60;

        public Duration getAlternativeOffset() {
            return alternativeOffset;
        }

        public void setAlternativeOffset(Duration alternativeOffset) {
            this.alternativeOffset = alternativeOffset;
        }

        public int getDefaultDurationMinutes() {
            return defaultDurationMinutes;
        }

        public void setDefaultDurationMinutes(int defaultDurationMinutes) {
            this.defaultDurationMinutes = defaultDurationMinutes;
        }
    }

    public static class Interrupt {
        private Duration reviewTimeout = Duration.ofHours(24);
        private Duration bookingTimeout = Duration.ofMinutes(5);
        private long sweepIntervalMs = 60_000;

        public Duration getReviewTimeout() {
            return reviewTimeout;
        }

        public void setReviewTimeout(Duration reviewTimeout) {
            this.reviewTimeout = reviewTimeout;
        }

        public Duration getBookingTimeout() {
            return bookingTimeout;
        }

        public void setBookingTimeout(Duration bookingTimeout) {
            this.bookingTimeout = bookingTimeout;
        }

        public long getSweepIntervalMs() {
            return sweepIntervalMs;
        }

        public void setSweepIntervalMs(long sweepIntervalMs) {
            this.sweepIntervalMs = sweepIntervalMs;
        }
    }
}
