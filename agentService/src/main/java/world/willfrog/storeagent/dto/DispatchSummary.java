package world.willfrog.storeagent.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Aggregate of one scheduler tick or one event fan-out.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DispatchSummary {
    private int considered;
    private int completed;
    private int failed;
    private int skipped;
    private List<RunOutcome> outcomes;
}
