package world.willfrog.storeagent.mapper;

import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;
import world.willfrog.storeagent.entity.AgentRun;
import world.willfrog.storeagent.model.AgentRunStatus;

import java.time.OffsetDateTime;
import java.util.List;

@Mapper
public interface AgentRunMapper {

    int insert(AgentRun run);

    AgentRun findById(@Param("id") Long id);

    List<AgentRun> listByStore(@Param("storeId") Long storeId,
                               @Param("agentSlug") String agentSlug,
                               @Param("limit") int limit,
                               @Param("offset") int offset);

    /**
     * Moves a run out of RUNNING.
     *
     * @return 1 when the run was still RUNNING, 0 when it already reached a terminal status
     */
    int finish(@Param("id") Long id,
               @Param("status") AgentRunStatus status,
               @Param("summary") String summary,
               @Param("errorMessage") String errorMessage,
               @Param("completedAt") OffsetDateTime completedAt);

    List<AgentRun> listStaleRunning(@Param("startedBefore") OffsetDateTime startedBefore,
                                    @Param("limit") int limit);
}
