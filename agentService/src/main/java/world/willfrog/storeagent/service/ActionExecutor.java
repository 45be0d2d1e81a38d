package world.willfrog.storeagent.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import world.willfrog.storeagent.action.ActionHandler;
import world.willfrog.storeagent.action.ActionResult;
import world.willfrog.storeagent.dto.ActionDecision;
import world.willfrog.storeagent.entity.AgentAction;
import world.willfrog.storeagent.exception.ExecutionFailureException;
import world.willfrog.storeagent.exception.NotFoundException;
import world.willfrog.storeagent.exception.ValidationException;
import world.willfrog.storeagent.mapper.AgentActionMapper;
import world.willfrog.storeagent.model.AgentActionStatus;
import world.willfrog.storeagent.registry.AgentRegistry;
import world.willfrog.storeagent.support.JsonSupport;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns one approved or auto-executable action into at most one side effect, and applies human decisions
 * (approve, reject, rollback) to action rows.
 * <p>
 * The claim ({@code markExecuting}) is the only way into EXECUTING, so concurrent or repeated dispatch of the
 * same action reaches the handler once.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActionExecutor {

    static final int MAX_ERROR_LENGTH = 500;

    private final AgentActionMapper actionMapper;
    private final AgentRegistry registry;
    private final JsonSupport json;

    public ActionResult execute(Long actionId) {
        AgentAction action = actionMapper.findById(actionId);
        if (action == null) {
            log.warn("Action not found, ignore actionId={}", actionId);
            return ActionResult.skipped("action " + actionId + " not found");
        }
        return execute(action);
    }

    public ActionResult execute(AgentAction action) {
        Long actionId = action.getId();
        Optional<ActionHandler> resolved = registry.findAction(action.getActionType());
        if (resolved.isEmpty()) {
            String error = NotFoundException.actionType(action.getActionType()).getMessage();
            int updated = actionMapper.failOpen(actionId, error, OffsetDateTime.now());
            if (updated == 0) {
                log.info("Action already resolved, skip actionId={} status={}", actionId, action.getStatus());
                return ActionResult.skipped("action " + actionId + " is not executable");
            }
            log.error("Action failed, unknown type actionId={} type={}", actionId, action.getActionType());
            return ActionResult.failure(error);
        }
        ActionHandler handler = resolved.get();

        AgentActionStatus status = action.getStatus();
        if (status == null || !status.isExecutable()) {
            log.info("Action not executable, skip actionId={} status={}", actionId, status);
            return ActionResult.skipped("action " + actionId + " is " + lower(status));
        }
        if (status == AgentActionStatus.PENDING && Boolean.TRUE.equals(action.getRequiresApproval())) {
            log.info("Action awaits approval, skip actionId={}", actionId);
            return ActionResult.skipped("action " + actionId + " requires approval");
        }
        if (actionMapper.markExecuting(actionId, OffsetDateTime.now()) == 0) {
            log.info("Action claimed elsewhere or changed state, skip actionId={}", actionId);
            return ActionResult.skipped("action " + actionId + " is already being handled");
        }

        Map<String, Object> payload = json.toMap(action.getPayload());
        if (!handler.validatePayload(payload)) {
            String error = "invalid payload for " + handler.getType();
            finish(actionId, AgentActionStatus.FAILED, null, error);
            log.warn("Action payload invalid actionId={} type={}", actionId, handler.getType());
            return ActionResult.failure(error);
        }

        ActionResult result;
        try {
            result = handler.execute(action, payload);
            if (result == null) {
                result = ActionResult.failure("handler returned no result");
            }
        } catch (Exception e) {
            log.error("Action execution threw actionId={} type={}", actionId, handler.getType(), e);
            result = ActionResult.failure(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }

        if (result.isSuccess()) {
            finish(actionId, AgentActionStatus.EXECUTED, json.toJson(result.toResultMap()), null);
            log.info("Action executed actionId={} type={} message={}", actionId, handler.getType(), result.getMessage());
        } else {
            finish(actionId, AgentActionStatus.FAILED, json.toJson(result.toResultMap()), result.getMessage());
            log.warn("Action failed actionId={} type={} message={}", actionId, handler.getType(), result.getMessage());
        }
        return result;
    }

    public ActionDecision approve(Long storeId, Long actionId, Long userId, boolean executeNow) {
        AgentAction action = load(storeId, actionId);
        if (actionMapper.approve(actionId, userId, OffsetDateTime.now()) == 0) {
            throw new ValidationException("action " + actionId + " is " + lower(action.getStatus()) + ", not pending");
        }
        log.info("Action approved actionId={} storeId={} userId={}", actionId, storeId, userId);
        if (!executeNow) {
            return decision(actionId, AgentActionStatus.APPROVED, true, "approved", null);
        }
        action.setStatus(AgentActionStatus.APPROVED);
        ActionResult result = execute(action);
        AgentActionStatus after = result.isSuccess() ? AgentActionStatus.EXECUTED
                : result.isSkipped() ? AgentActionStatus.APPROVED : AgentActionStatus.FAILED;
        return decision(actionId, after, true, result.getMessage(), result.toResultMap());
    }

    public ActionDecision reject(Long storeId, Long actionId, Long userId) {
        AgentAction action = load(storeId, actionId);
        if (actionMapper.reject(actionId, userId, OffsetDateTime.now()) == 0) {
            throw new ValidationException("action " + actionId + " is " + lower(action.getStatus()) + ", not pending");
        }
        log.info("Action rejected actionId={} storeId={} userId={}", actionId, storeId, userId);
        return decision(actionId, AgentActionStatus.REJECTED, true, "rejected", null);
    }

    /**
     * Approves the store's pending actions among {@code actionIds}; the others are reported as not applied.
     */
    public List<ActionDecision> bulkApprove(Long storeId, List<Long> actionIds, Long userId, boolean executeNow) {
        Set<Long> pending = pendingAmong(storeId, actionIds);
        List<ActionDecision> decisions = new ArrayList<>();
        for (Long actionId : actionIds) {
            if (!pending.contains(actionId)) {
                decisions.add(decision(actionId, null, false, "not a pending action of this store", null));
                continue;
            }
            try {
                decisions.add(approve(storeId, actionId, userId, executeNow));
            } catch (ValidationException | NotFoundException e) {
                decisions.add(decision(actionId, null, false, e.getMessage(), null));
            }
        }
        return decisions;
    }

    public List<ActionDecision> bulkReject(Long storeId, List<Long> actionIds, Long userId) {
        Set<Long> pending = pendingAmong(storeId, actionIds);
        List<ActionDecision> decisions = new ArrayList<>();
        for (Long actionId : actionIds) {
            if (!pending.contains(actionId)) {
                decisions.add(decision(actionId, null, false, "not a pending action of this store", null));
                continue;
            }
            try {
                decisions.add(reject(storeId, actionId, userId));
            } catch (ValidationException | NotFoundException e) {
                decisions.add(decision(actionId, null, false, e.getMessage(), null));
            }
        }
        return decisions;
    }

    /**
     * Compensates an executed action from the "before" state captured in its result. The status stays EXECUTED;
     * the result records {@code rolled_back_at}.
     */
    public ActionDecision rollback(Long storeId, Long actionId) {
        AgentAction action = load(storeId, actionId);
        if (action.getStatus() != AgentActionStatus.EXECUTED) {
            throw new ValidationException("only executed actions can be rolled back, action " + actionId
                    + " is " + lower(action.getStatus()));
        }
        ActionHandler handler = registry.getAction(action.getActionType());
        if (!handler.supportsRollback()) {
            throw new ValidationException("action type " + handler.getType() + " does not support rollback");
        }
        Map<String, Object> result = json.toMap(action.getResult());
        if (result.containsKey("rolled_back_at")) {
            throw new ValidationException("action " + actionId + " was already rolled back");
        }

        boolean applied;
        try {
            applied = handler.rollback(action, json.toMap(action.getPayload()), result);
        } catch (Exception e) {
            log.error("Rollback threw actionId={} type={}", actionId, handler.getType(), e);
            throw new ExecutionFailureException("rollback of action " + actionId + " failed: " + e.getMessage(), e);
        }
        if (!applied) {
            throw new ExecutionFailureException("rollback of action " + actionId + " was not applied");
        }

        Map<String, Object> updated = new LinkedHashMap<>(result);
        updated.put("rolled_back_at", OffsetDateTime.now().toString());
        actionMapper.updateResult(actionId, json.toJson(updated));
        log.info("Action rolled back actionId={} type={}", actionId, handler.getType());
        return decision(actionId, AgentActionStatus.EXECUTED, true, "rolled back", updated);
    }

    private void finish(Long actionId, AgentActionStatus status, String result, String errorMessage) {
        int updated = actionMapper.finishExecution(actionId, status, result,
                StringUtils.abbreviate(errorMessage, MAX_ERROR_LENGTH), OffsetDateTime.now());
        if (updated == 0) {
            // reconciler failed the claim while the handler was running
            log.warn("Action left EXECUTING before finish, outcome not recorded actionId={} status={}", actionId, status);
        }
    }

    private AgentAction load(Long storeId, Long actionId) {
        AgentAction action = actionMapper.findByIdAndStore(actionId, storeId);
        if (action == null) {
            throw new NotFoundException("action " + actionId + " not found");
        }
        return action;
    }

    private Set<Long> pendingAmong(Long storeId, List<Long> actionIds) {
        if (actionIds == null || actionIds.isEmpty()) {
            return Set.of();
        }
        return new HashSet<>(actionMapper.filterPendingIds(storeId, actionIds));
    }

    private static ActionDecision decision(Long actionId, AgentActionStatus status, boolean applied,
                                           String message, Map<String, Object> result) {
        return ActionDecision.builder()
                .actionId(actionId)
                .status(status == null ? null : lower(status))
                .applied(applied)
                .message(message)
                .result(result)
                .build();
    }

    private static String lower(AgentActionStatus status) {
        return status == null ? "unknown" : status.name().toLowerCase();
    }
}
