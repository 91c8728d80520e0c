package com.inboxpilot.core.booking;

import com.inboxpilot.config.InboxProperties;
import com.inboxpilot.core.model.CalendarEvent;
import com.inboxpilot.core.model.TimeSlot;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

/**
 * Suggests two alternative start times when the requested slot conflicts:
 * right after the blocking event, and the requested start shifted by the configured offset.
 * <p>
 * Both are clamped forward into weekday business hours {@code [start, end)}. An alternative that
 * lands inside the blocking event moves to its end, and a second alternative equal to the first
 * moves one hour later, so the two are always distinct from each other, from the requested start
 * and from the blocking interval.
 */
@Component
public class AlternativeSlotPlanner {

    private final int openHour;
    private final int closeHour;
    private final Duration offset;

    public AlternativeSlotPlanner(InboxProperties properties) {
        this(properties.getBusinessHours().getStart(), properties.getBusinessHours().getEnd(),
                properties.getBooking().getAlternativeOffset());
    }

    AlternativeSlotPlanner(int openHour, int closeHour, Duration offset) {
        if (openHour < 0 || closeHour > 24 || openHour >= closeHour) {
            throw new IllegalArgumentException("Invalid business hours " + openHour + "-" + closeHour);
        }
        this.openHour = openHour;
        this.closeHour = closeHour;
        this.offset = offset;
    }

    public List<LocalDateTime> alternatives(TimeSlot requested, CalendarEvent blocking) {
        TimeSlot blocked = blocking.slot();
        LocalDateTime first = avoid(clamp(blocked.end()), blocked);
        LocalDateTime second = avoid(clamp(requested.start().plus(offset)), blocked);
        if (second.equals(first)) {
            second = clamp(first.plusHours(1));
        }
        return List.of(first, second);
    }

    /**
     * Moves {@code time} forward to the nearest instant inside weekday business hours.
     * Times already inside are returned unchanged.
     */
    public LocalDateTime clamp(LocalDateTime time) {
        LocalDateTime candidate = time;
        while (!isWithinBusinessHours(candidate)) {
            if (!isWeekend(candidate.getDayOfWeek()) && candidate.getHour() < openHour) {
                candidate = candidate.toLocalDate().atTime(LocalTime.of(openHour, 0));
            } else {
                candidate = candidate.toLocalDate().plusDays(1).atTime(LocalTime.of(openHour, 0));
            }
        }
        return candidate;
    }

    public boolean isWithinBusinessHours(LocalDateTime time) {
        return !isWeekend(time.getDayOfWeek()) && time.getHour() >= openHour && time.getHour() < closeHour;
    }

    private LocalDateTime avoid(LocalDateTime time, TimeSlot blocked) {
        return blocked.contains(time) ? clamp(blocked.end()) : time;
    }

    private static boolean isWeekend(DayOfWeek day) {
        return day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
    }
}
