package world.willfrog.storeagent.controller;

import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;
import world.willfrog.storeagent.common.dto.ResponseWrapper;
import world.willfrog.storeagent.dto.ActionDecision;
import world.willfrog.storeagent.dto.ActionListResponse;
import world.willfrog.storeagent.dto.BulkActionRequest;
import world.willfrog.storeagent.service.ActionExecutor;
import world.willfrog.storeagent.service.AgentActivityService;

import java.util.List;

@RestController
@RequestMapping("/api/agent-actions")
public class AgentActionController {

    private final AgentActivityService activityService;
    private final ActionExecutor actionExecutor;

    public AgentActionController(AgentActivityService activityService, ActionExecutor actionExecutor) {
        this.activityService = activityService;
        this.actionExecutor = actionExecutor;
    }

    @GetMapping
    public ResponseWrapper<ActionListResponse> list(
            @RequestHeader("X-Store-Id") Long storeId,
            @RequestParam(value = "status", defaultValue = "pending") String status,
            @RequestParam(value = "limit", defaultValue = "20") int limit,
            @RequestParam(value = "offset", defaultValue = "0") int offset) {
        return ResponseWrapper.success(activityService.listActions(storeId, status, limit, offset));
    }

    @PostMapping("/{id}/approve")
    public ResponseWrapper<ActionDecision> approve(
            @RequestHeader("X-Store-Id") Long storeId,
            @RequestHeader("X-User-Id") Long userId,
            @PathVariable("id") Long actionId,
            @RequestParam(value = "execute", defaultValue = "true") boolean execute) {
        return ResponseWrapper.success(actionExecutor.approve(storeId, actionId, userId, execute));
    }

    @PostMapping("/{id}/reject")
    public ResponseWrapper<ActionDecision> reject(
            @RequestHeader("X-Store-Id") Long storeId,
            @RequestHeader("X-User-Id") Long userId,
            @PathVariable("id") Long actionId) {
        return ResponseWrapper.success(actionExecutor.reject(storeId, actionId, userId));
    }

    @PostMapping("/{id}/rollback")
    public ResponseWrapper<ActionDecision> rollback(
            @RequestHeader("X-Store-Id") Long storeId,
            @PathVariable("id") Long actionId) {
        return ResponseWrapper.success(actionExecutor.rollback(storeId, actionId));
    }

    @PostMapping("/bulk-approve")
    public ResponseWrapper<List<ActionDecision>> bulkApprove(
            @RequestHeader("X-Store-Id") Long storeId,
            @RequestHeader("X-User-Id") Long userId,
            @Valid @RequestBody BulkActionRequest request) {
        return ResponseWrapper.success(actionExecutor.bulkApprove(storeId, request.getActionIds(), userId, request.isExecute()));
    }

    @PostMapping("/bulk-reject")
    public ResponseWrapper<List<ActionDecision>> bulkReject(
            @RequestHeader("X-Store-Id") Long storeId,
            @RequestHeader("X-User-Id") Long userId,
            @Valid @RequestBody BulkActionRequest request) {
        return ResponseWrapper.success(actionExecutor.bulkReject(storeId, request.getActionIds(), userId));
    }
}
