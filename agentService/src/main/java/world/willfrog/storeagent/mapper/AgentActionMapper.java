package world.willfrog.storeagent.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import world.willfrog.storeagent.entity.AgentAction;
import world.willfrog.storeagent.model.AgentActionStatus;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * Every status transition is a compare-and-set: the WHERE clause carries the expected source status
 * and the caller checks the affected row count.
 */
@Mapper
public interface AgentActionMapper {

    int insert(AgentAction action);

    AgentAction findById(@Param("id") Long id);

    AgentAction findByIdAndStore(@Param("id") Long id, @Param("storeId") Long storeId);

    List<AgentAction> listByStore(@Param("storeId") Long storeId,
                                  @Param("status") AgentActionStatus status,
                                  @Param("limit") int limit,
                                  @Param("offset") int offset);

    int countByStoreAndStatus(@Param("storeId") Long storeId, @Param("status") AgentActionStatus status);

    List<AgentAction> listByRun(@Param("agentRunId") Long agentRunId);

    /**
     * Ids of the run's PENDING actions that do not need approval.
     */
    List<Long> listAutoExecutableIds(@Param("agentRunId") Long agentRunId);

    /**
     * Counts PENDING, APPROVED or EXECUTING actions for the same target and type.
     */
    int countOpenForTarget(@Param("storeId") Long storeId,
                           @Param("actionType") String actionType,
                           @Param("targetType") String targetType,
                           @Param("targetId") String targetId);

    List<Long> filterPendingIds(@Param("storeId") Long storeId, @Param("ids") List<Long> ids);

    /**
     * Claims an action for execution: APPROVED, or PENDING without approval, becomes EXECUTING.
     *
     * @return 1 if this caller owns the execution, 0 otherwise
     */
    int markExecuting(@Param("id") Long id, @Param("now") OffsetDateTime now);

    int finishExecution(@Param("id") Long id,
                        @Param("status") AgentActionStatus status,
                        @Param("result") String result,
                        @Param("errorMessage") String errorMessage,
                        @Param("executedAt") OffsetDateTime executedAt);

    /**
     * Fails an action that never got claimed (PENDING or APPROVED), e.g. unknown type.
     */
    int failOpen(@Param("id") Long id,
                 @Param("errorMessage") String errorMessage,
                 @Param("now") OffsetDateTime now);

    int approve(@Param("id") Long id,
                @Param("approvedBy") Long approvedBy,
                @Param("approvedAt") OffsetDateTime approvedAt);

    int reject(@Param("id") Long id,
               @Param("rejectedBy") Long rejectedBy,
               @Param("rejectedAt") OffsetDateTime rejectedAt);

    int updateResult(@Param("id") Long id, @Param("result") String result);

    int failStaleExecuting(@Param("claimedBefore") OffsetDateTime claimedBefore,
                           @Param("errorMessage") String errorMessage,
                           @Param("now") OffsetDateTime now);
}
