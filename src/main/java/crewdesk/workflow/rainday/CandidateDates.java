package crewdesk.workflow.rainday;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Working-day arithmetic for rescheduling. Sundays are never offered.
 */
public final class CandidateDates {

    static final int DEFAULT_SPREAD_DAYS = 14;
    static final int MIN_SPREAD_DAYS = 7;
    static final int MAX_SPREAD_DAYS = 30;

    private CandidateDates() {
    }

    /**
     * The next {@code count} non-Sunday dates strictly after {@code date}.
     */
    public static List<LocalDate> after(LocalDate date, int count) {
        List<LocalDate> dates = new ArrayList<>(count);
        LocalDate cursor = date;
        while (dates.size() < count) {
            cursor = cursor.plusDays(1);
            if (cursor.getDayOfWeek() != DayOfWeek.SUNDAY) {
                dates.add(cursor);
            }
        }
        return dates;
    }

    /**
     * The first non-Sunday date after {@code date}.
     */
    public static LocalDate nextWorkday(LocalDate date) {
        return after(date, 1).get(0);
    }

    public static int clampSpreadDays(Integer requested) {
        int days = requested != null ? requested : DEFAULT_SPREAD_DAYS;
        return Math.min(Math.max(days, MIN_SPREAD_DAYS), MAX_SPREAD_DAYS);
    }
}
