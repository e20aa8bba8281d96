package crewdesk.workflow.rainday;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Job counts per candidate date, in candidate order.
 * Immutable: {@link #increment} returns a new load.
 */
public final class SpreadLoad {

    private final Map<LocalDate, Integer> counts;

    private SpreadLoad(Map<LocalDate, Integer> counts) {
        this.counts = Collections.unmodifiableMap(counts);
    }

    /**
     * @param dates       candidate dates, in preference order
     * @param priorCounts jobs already booked per date (missing dates count as zero)
     */
    public static SpreadLoad of(List<LocalDate> dates, Map<LocalDate, Integer> priorCounts) {
        if (dates == null || dates.isEmpty()) {
            throw new IllegalArgumentException("at least one candidate date is required");
        }
        Map<LocalDate, Integer> counts = new LinkedHashMap<>();
        for (LocalDate date : dates) {
            counts.put(date, priorCounts.getOrDefault(date, 0));
        }
        return new SpreadLoad(counts);
    }

    /**
     * The date with the fewest jobs; ties go to the earliest candidate.
     */
    public LocalDate leastLoaded() {
        LocalDate best = null;
        int bestCount = Integer.MAX_VALUE;
        for (Map.Entry<LocalDate, Integer> entry : counts.entrySet()) {
            if (entry.getValue() < bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    public SpreadLoad increment(LocalDate date) {
        if (!counts.containsKey(date)) {
            throw new IllegalArgumentException("not a candidate date: " + date);
        }
        Map<LocalDate, Integer> next = new LinkedHashMap<>(counts);
        next.merge(date, 1, Integer::sum);
        return new SpreadLoad(next);
    }

    public int countFor(LocalDate date) {
        return counts.getOrDefault(date, 0);
    }

    public Map<LocalDate, Integer> counts() {
        return counts;
    }
}
