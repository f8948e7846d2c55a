package world.willfrog.agentguard.common.dao.killswitch;

import org.apache.ibatis.annotations.*;
import world.willfrog.agentguard.common.pojo.killswitch.Agent;

import java.time.OffsetDateTime;
import java.util.List;

/**
 * 所有状态变更都是带前置状态条件的单条 UPDATE，返回受影响行数；0 表示条件不满足（已被并发修改或本就处于目标状态）。
 */
@Mapper
public interface AgentDao {

    @Select("SELECT * FROM ag_agent WHERE owner_id = #{ownerId} AND external_id = #{externalId}")
    @Results(id = "agentResultMap", value = {
            @Result(property = "id", column = "id", id = true),
            @Result(property = "externalId", column = "external_id"),
            @Result(property = "ownerId", column = "owner_id"),
            @Result(property = "agentName", column = "agent_name"),
            @Result(property = "status", column = "status"),
            @Result(property = "pauseUntil", column = "pause_until"),
            @Result(property = "monthlyCostLimit", column = "monthly_cost_limit"),
            @Result(property = "killReason", column = "kill_reason"),
            @Result(property = "killedAt", column = "killed_at"),
            @Result(property = "killedBy", column = "killed_by"),
            @Result(property = "createdAt", column = "created_at"),
            @Result(property = "updatedAt", column = "updated_at")
    })
    Agent findByOwnerAndExternalId(@Param("ownerId") String ownerId,
                                   @Param("externalId") String externalId);

    @Select("SELECT * FROM ag_agent WHERE id = #{id}")
    @ResultMap("agentResultMap")
    Agent findById(@Param("id") Long id);

    @Select("SELECT * FROM ag_agent WHERE owner_id = #{ownerId} ORDER BY created_at DESC")
    @ResultMap("agentResultMap")
    List<Agent> listByOwner(@Param("ownerId") String ownerId);

    @Insert("INSERT INTO ag_agent (external_id, owner_id, agent_name, status) " +
            "VALUES (#{externalId}, #{ownerId}, #{agentName}, 'ACTIVE') " +
            "ON CONFLICT (owner_id, external_id) DO NOTHING")
    int insertIfAbsent(Agent agent);

    @Update("UPDATE ag_agent SET status = 'KILLED', kill_reason = #{reason}, killed_at = #{killedAt}, " +
            "killed_by = #{killedBy}, pause_until = NULL, updated_at = #{killedAt} " +
            "WHERE id = #{id} AND status IN ('ACTIVE', 'PAUSED')")
    int markKilled(@Param("id") Long id,
                   @Param("reason") String reason,
                   @Param("killedBy") String killedBy,
                   @Param("killedAt") OffsetDateTime killedAt);

    @Update("UPDATE ag_agent SET status = 'PAUSED', pause_until = #{pauseUntil}, updated_at = #{now} " +
            "WHERE id = #{id} AND status = 'ACTIVE'")
    int markPaused(@Param("id") Long id,
                   @Param("pauseUntil") OffsetDateTime pauseUntil,
                   @Param("now") OffsetDateTime now);

    @Update("UPDATE ag_agent SET status = 'ACTIVE', pause_until = NULL, kill_reason = NULL, killed_at = NULL, " +
            "killed_by = NULL, updated_at = #{now} " +
            "WHERE id = #{id} AND status IN ('KILLED', 'PAUSED')")
    int markRevived(@Param("id") Long id, @Param("now") OffsetDateTime now);

    @Update("UPDATE ag_agent SET status = 'ACTIVE', pause_until = NULL, updated_at = #{now} " +
            "WHERE id = #{id} AND status = 'PAUSED' AND pause_until <= #{now}")
    int expirePause(@Param("id") Long id, @Param("now") OffsetDateTime now);

    @Select("UPDATE ag_agent SET status = 'KILLED', kill_reason = #{reason}, killed_at = #{killedAt}, " +
            "killed_by = #{killedBy}, pause_until = NULL, updated_at = #{killedAt} " +
            "WHERE status <> 'KILLED' RETURNING *")
    @ResultMap("agentResultMap")
    @Options(flushCache = Options.FlushCachePolicy.TRUE)
    List<Agent> killAllNotKilled(@Param("reason") String reason,
                                 @Param("killedBy") String killedBy,
                                 @Param("killedAt") OffsetDateTime killedAt);

    @Select("UPDATE ag_agent SET status = 'KILLED', kill_reason = #{reason}, killed_at = #{killedAt}, " +
            "killed_by = #{killedBy}, pause_until = NULL, updated_at = #{killedAt} " +
            "WHERE owner_id = #{ownerId} AND status <> 'KILLED' AND id IN (" +
            "SELECT DISTINCT agent_id FROM ag_usage_event WHERE owner_id = #{ownerId} AND customer_id = #{customerId}" +
            ") RETURNING *")
    @ResultMap("agentResultMap")
    @Options(flushCache = Options.FlushCachePolicy.TRUE)
    List<Agent> killByCustomer(@Param("ownerId") String ownerId,
                               @Param("customerId") String customerId,
                               @Param("reason") String reason,
                               @Param("killedBy") String killedBy,
                               @Param("killedAt") OffsetDateTime killedAt);
}
