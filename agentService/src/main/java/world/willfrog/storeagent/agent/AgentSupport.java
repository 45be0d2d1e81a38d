package world.willfrog.storeagent.agent;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import world.willfrog.storeagent.service.ActionProposalService;
import world.willfrog.storeagent.support.JsonSupport;

/**
 * Collaborators every agent needs, bundled to keep agent constructors about their own dependencies.
 */
@Getter
@Component
@RequiredArgsConstructor
public class AgentSupport {
    private final AgentConfigResolver configResolver;
    private final ActionProposalService proposalService;
    private final JsonSupport json;
}
