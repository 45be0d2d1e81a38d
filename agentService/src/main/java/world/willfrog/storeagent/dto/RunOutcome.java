package world.willfrog.storeagent.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What happened when the runner was asked to run one (store, agent) pair.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunOutcome {

    public static final String SKIPPED = "skipped";
    public static final String LOCKED = "locked";
    public static final String COMPLETED = "completed";
    public static final String FAILED = "failed";

    private Long storeId;
    private String agentSlug;
    /** Null when no run row was created. */
    private Long runId;
    private String status;
    private String message;
    private int actionsCreated;

    public static RunOutcome notRun(Long storeId, String agentSlug, String status, String message) {
        return RunOutcome.builder().storeId(storeId).agentSlug(agentSlug).status(status).message(message).build();
    }
}
