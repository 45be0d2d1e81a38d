package world.willfrog.storeagent.service;

import lombok.RequiredArgsConstructor;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import world.willfrog.storeagent.dto.ActionListResponse;
import world.willfrog.storeagent.entity.AgentAction;
import world.willfrog.storeagent.entity.AgentRun;
import world.willfrog.storeagent.exception.NotFoundException;
import world.willfrog.storeagent.exception.ValidationException;
import world.willfrog.storeagent.mapper.AgentActionMapper;
import world.willfrog.storeagent.mapper.AgentRunMapper;
import world.willfrog.storeagent.model.AgentActionStatus;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read side of runs and actions for the settings UI.
 */
@Service
@RequiredArgsConstructor
public class AgentActivityService {

    private static final int MAX_LIMIT = 200;

    private final AgentRunMapper runMapper;
    private final AgentActionMapper actionMapper;

    public List<AgentRun> listRuns(Long storeId, String agentSlug, int limit, int offset) {
        return runMapper.listByStore(storeId, StringUtils.trimToNull(agentSlug), clamp(limit), Math.max(0, offset));
    }

    public AgentRun getRun(Long storeId, Long runId) {
        AgentRun run = runMapper.findById(runId);
        if (run == null || !run.getStoreId().equals(storeId)) {
            throw new NotFoundException("run " + runId + " not found");
        }
        return run;
    }

    public List<AgentAction> listRunActions(Long storeId, Long runId) {
        return actionMapper.listByRun(getRun(storeId, runId).getId());
    }

    /**
     * @param status a status name, or "all" / blank for every status
     */
    public ActionListResponse listActions(Long storeId, String status, int limit, int offset) {
        AgentActionStatus filter = parseStatus(status);
        int safeLimit = clamp(limit);
        int safeOffset = Math.max(0, offset);
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (AgentActionStatus value : AgentActionStatus.values()) {
            counts.put(value.name().toLowerCase(), actionMapper.countByStoreAndStatus(storeId, value));
        }
        return ActionListResponse.builder()
                .items(actionMapper.listByStore(storeId, filter, safeLimit, safeOffset))
                .counts(counts)
                .limit(safeLimit)
                .offset(safeOffset)
                .build();
    }

    private static AgentActionStatus parseStatus(String status) {
        if (StringUtils.isBlank(status) || "all".equalsIgnoreCase(status.trim())) {
            return null;
        }
        try {
            return AgentActionStatus.fromValue(status);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("unknown action status " + status);
        }
    }

    private static int clamp(int limit) {
        if (limit <= 0) {
            return 20;
        }
        return Math.min(limit, MAX_LIMIT);
    }
}
