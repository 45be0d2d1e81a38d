package world.willfrog.storeagent.agent;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * run_frequency values understood by the scheduler.
 */
public final class Cadences {

    public static final Map<String, String> OPTIONS;

    static {
        Map<String, String> options = new LinkedHashMap<>();
        options.put("hourly", "Hourly");
        options.put("every_six_hours", "Every 6 Hours");
        options.put("daily", "Daily");
        options.put("weekly", "Weekly");
        options.put("monthly", "Monthly");
        OPTIONS = Collections.unmodifiableMap(options);
    }

    private Cadences() {
    }

    public static Duration of(String frequency) {
        if (frequency == null) {
            return Duration.ofDays(1);
        }
        return switch (frequency) {
            case "hourly" -> Duration.ofHours(1);
            case "every_six_hours" -> Duration.ofHours(6);
            case "weekly" -> Duration.ofDays(7);
            case "monthly" -> Duration.ofDays(30);
            default -> Duration.ofDays(1);
        };
    }
}
