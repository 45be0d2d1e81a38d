package world.willfrog.storeagent.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import world.willfrog.storeagent.action.ActionHandler;
import world.willfrog.storeagent.action.ProposedAction;
import world.willfrog.storeagent.entity.AgentAction;
import world.willfrog.storeagent.entity.AgentRun;
import world.willfrog.storeagent.entity.StoreAgent;
import world.willfrog.storeagent.exception.ValidationException;
import world.willfrog.storeagent.mapper.AgentActionMapper;
import world.willfrog.storeagent.model.AgentActionStatus;
import world.willfrog.storeagent.registry.AgentRegistry;
import world.willfrog.storeagent.support.JsonSupport;

import java.util.Map;
import java.util.Optional;

/**
 * Persists agent proposals as PENDING AgentActions.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ActionProposalService {

    private final AgentActionMapper actionMapper;
    private final AgentRegistry registry;
    private final ApprovalPolicy approvalPolicy;
    private final JsonSupport json;

    /**
     * @return the created action, or empty when the same target already has an open action of this type
     * @throws ValidationException when the handler rejects the payload
     */
    public Optional<AgentAction> propose(AgentRun run, StoreAgent storeAgent, ProposedAction proposal) {
        ActionHandler handler = registry.getAction(proposal.getActionType());
        if (!handler.validatePayload(proposal.getPayload() == null ? Map.of() : proposal.getPayload())) {
            throw new ValidationException("invalid payload for " + proposal.getActionType()
                    + " target=" + proposal.getTargetType() + ":" + proposal.getTargetId());
        }
        int open = actionMapper.countOpenForTarget(run.getStoreId(), proposal.getActionType(),
                proposal.getTargetType(), proposal.getTargetId());
        if (open > 0) {
            log.info("Skip duplicate proposal runId={} type={} target={}:{}",
                    run.getId(), proposal.getActionType(), proposal.getTargetType(), proposal.getTargetId());
            return Optional.empty();
        }

        AgentAction action = new AgentAction();
        action.setAgentRunId(run.getId());
        action.setStoreId(run.getStoreId());
        action.setAgentSlug(run.getAgentSlug());
        action.setActionType(proposal.getActionType());
        action.setTargetType(proposal.getTargetType());
        action.setTargetId(proposal.getTargetId());
        action.setStatus(AgentActionStatus.PENDING);
        action.setRequiresApproval(approvalPolicy.requiresApproval(storeAgent, handler,
                proposal.getPayload(), proposal.isApprovalHint()));
        action.setPayload(json.toJson(proposal.getPayload()));
        actionMapper.insert(action);
        log.info("Proposed action id={} runId={} type={} target={}:{} requiresApproval={}",
                action.getId(), run.getId(), action.getActionType(), action.getTargetType(), action.getTargetId(),
                action.getRequiresApproval());
        return Optional.of(action);
    }
}
