package world.willfrog.storeagent.controller;

import org.springframework.web.bind.annotation.*;
import world.willfrog.storeagent.common.dto.ResponseWrapper;
import world.willfrog.storeagent.entity.AgentAction;
import world.willfrog.storeagent.entity.AgentRun;
import world.willfrog.storeagent.service.AgentActivityService;

import java.util.List;

@RestController
@RequestMapping("/api/agent-runs")
public class AgentRunController {

    private final AgentActivityService activityService;

    public AgentRunController(AgentActivityService activityService) {
        this.activityService = activityService;
    }

    @GetMapping
    public ResponseWrapper<List<AgentRun>> list(
            @RequestHeader("X-Store-Id") Long storeId,
            @RequestParam(value = "agent", required = false) String agentSlug,
            @RequestParam(value = "limit", defaultValue = "20") int limit,
            @RequestParam(value = "offset", defaultValue = "0") int offset) {
        return ResponseWrapper.success(activityService.listRuns(storeId, agentSlug, limit, offset));
    }

    @GetMapping("/{id}")
    public ResponseWrapper<AgentRun> get(
            @RequestHeader("X-Store-Id") Long storeId,
            @PathVariable("id") Long runId) {
        return ResponseWrapper.success(activityService.getRun(storeId, runId));
    }

    @GetMapping("/{id}/actions")
    public ResponseWrapper<List<AgentAction>> actions(
            @RequestHeader("X-Store-Id") Long storeId,
            @PathVariable("id") Long runId) {
        return ResponseWrapper.success(activityService.listRunActions(storeId, runId));
    }
}
