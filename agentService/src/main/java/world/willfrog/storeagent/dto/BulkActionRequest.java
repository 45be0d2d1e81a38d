package world.willfrog.storeagent.dto;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.Data;

import java.util.List;

@Data
public class BulkActionRequest {
    @NotEmpty
    @Size(max = 200)
    private List<Long> actionIds;

    /** Bulk approve only: execute the approved actions right away. */
    private boolean execute;
}
