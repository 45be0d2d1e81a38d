package world.willfrog.storeagent.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import world.willfrog.storeagent.agent.Agent;
import world.willfrog.storeagent.agent.AgentConfig;
import world.willfrog.storeagent.agent.AgentConfigResolver;
import world.willfrog.storeagent.dto.RunOutcome;
import world.willfrog.storeagent.dto.StoreAgentUpdateRequest;
import world.willfrog.storeagent.dto.StoreAgentView;
import world.willfrog.storeagent.entity.StoreAgent;
import world.willfrog.storeagent.exception.NotFoundException;
import world.willfrog.storeagent.exception.ValidationException;
import world.willfrog.storeagent.mapper.AgentRunMapper;
import world.willfrog.storeagent.mapper.StoreAgentMapper;
import world.willfrog.storeagent.model.PermissionLevel;
import world.willfrog.storeagent.model.TriggerType;
import world.willfrog.storeagent.registry.AgentRegistry;
import world.willfrog.storeagent.support.JsonSupport;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Store-facing settings: which agents are enabled, with what autonomy and which config overrides.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StoreAgentSettingsService {

    private static final int RECENT_RUNS = 10;

    private final AgentRegistry registry;
    private final StoreAgentMapper storeAgentMapper;
    private final AgentRunMapper runMapper;
    private final AgentConfigResolver configResolver;
    private final AgentRunner runner;
    private final JsonSupport json;

    public List<StoreAgentView> list(Long storeId) {
        Map<String, StoreAgent> rows = storeAgentMapper.listByStore(storeId).stream()
                .collect(Collectors.toMap(StoreAgent::getAgentSlug, Function.identity(), (a, b) -> a));
        List<StoreAgentView> views = new ArrayList<>();
        for (Agent agent : registry.agents()) {
            views.add(baseView(agent, rows.get(agent.getSlug())).build());
        }
        views.sort(Comparator.comparing(StoreAgentView::getName));
        return views;
    }

    public StoreAgentView detail(Long storeId, String slug) {
        Agent agent = registry.getAgent(slug);
        StoreAgent row = storeAgentMapper.findByStoreAndSlug(storeId, slug);
        AgentConfig config;
        try {
            config = configResolver.resolve(agent, row);
        } catch (ValidationException e) {
            log.warn("Stored overrides invalid, show defaults storeId={} agent={} error={}", storeId, slug, e.getMessage());
            config = AgentConfig.defaultsOf(agent);
        }
        return baseView(agent, row)
                .config(config.asMap())
                .overrides(row == null ? Map.of() : json.toMap(row.getConfig()))
                .configSchema(agent.getConfigSchema())
                .recentRuns(row == null ? List.of() : runMapper.listByStore(storeId, slug, RECENT_RUNS, 0))
                .build();
    }

    public StoreAgentView update(Long storeId, String slug, StoreAgentUpdateRequest request) {
        Agent agent = registry.getAgent(slug);
        PermissionLevel permission = parsePermission(request.getPermissionLevel());
        if (request.getConfig() != null) {
            configResolver.validateOverrides(agent, request.getConfig());
        }

        StoreAgent row = storeAgentMapper.findByStoreAndSlug(storeId, slug);
        if (row == null) {
            row = new StoreAgent();
            row.setStoreId(storeId);
            row.setAgentSlug(slug);
            row.setEnabled(request.getEnabled() != null && request.getEnabled());
            row.setPermissionLevel(permission == null ? PermissionLevel.AUTO : permission);
            row.setConfig(request.getConfig() == null ? null : json.toJson(request.getConfig()));
            storeAgentMapper.insert(row);
        } else {
            if (request.getEnabled() != null) {
                row.setEnabled(request.getEnabled());
            }
            if (permission != null) {
                row.setPermissionLevel(permission);
            }
            if (request.getConfig() != null) {
                row.setConfig(json.toJson(request.getConfig()));
            }
            storeAgentMapper.updateSettings(row);
        }
        log.info("Store agent settings saved storeId={} agent={} enabled={} permission={}",
                storeId, slug, row.getEnabled(), row.getPermissionLevel());
        return detail(storeId, slug);
    }

    /**
     * Runs the agent now, ignoring its cadence. Still single-flight with scheduled and event runs.
     */
    public RunOutcome runNow(Long storeId, String slug) {
        registry.getAgent(slug);
        StoreAgent row = storeAgentMapper.findByStoreAndSlug(storeId, slug);
        if (row == null) {
            throw new NotFoundException("agent " + slug + " is not set up for store " + storeId);
        }
        return runner.runFor(row, TriggerType.MANUAL, Map.of());
    }

    private StoreAgentView.StoreAgentViewBuilder baseView(Agent agent, StoreAgent row) {
        return StoreAgentView.builder()
                .slug(agent.getSlug())
                .name(agent.getName())
                .description(agent.getDescription())
                .type(agent.getType().name().toLowerCase())
                .enabled(row != null && Boolean.TRUE.equals(row.getEnabled()))
                .permissionLevel(row == null || row.getPermissionLevel() == null
                        ? PermissionLevel.AUTO.name().toLowerCase()
                        : row.getPermissionLevel().name().toLowerCase())
                .lastRunAt(row == null ? null : row.getLastRunAt())
                .nextRunAt(row == null ? null : row.getNextRunAt())
                .subscribedEvents(agent.getSubscribedEvents());
    }

    private static PermissionLevel parsePermission(String value) {
        if (value == null) {
            return null;
        }
        try {
            return PermissionLevel.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("permission level must be auto, approve or block");
        }
    }
}
