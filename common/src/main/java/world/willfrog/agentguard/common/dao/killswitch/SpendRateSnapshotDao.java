package world.willfrog.agentguard.common.dao.killswitch;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.time.OffsetDateTime;

@Mapper
public interface SpendRateSnapshotDao {

    /**
     * 以一条 INSERT ... SELECT 写入窗口内每个活跃 agent 的花费快照，返回写入行数。
     */
    @Insert("INSERT INTO ag_spend_rate_snapshot (" +
            "owner_id, agent_id, window_start, window_end, window_duration_minutes, total_cost, total_requests, " +
            "total_tokens, error_count, cost_per_minute, requests_per_minute, error_rate" +
            ") SELECT ue.owner_id, ue.agent_id, #{windowStart}, #{windowEnd}, #{minutes}, " +
            "SUM(ue.cost_amount), COUNT(*), COALESCE(SUM(ue.total_tokens), 0), " +
            "SUM(CASE WHEN ue.error_message IS NOT NULL THEN 1 ELSE 0 END), " +
            "SUM(ue.cost_amount) / #{minutes}, COUNT(*) * 1.0 / #{minutes}, " +
            "SUM(CASE WHEN ue.error_message IS NOT NULL THEN 1 ELSE 0 END) * 100.0 / COUNT(*) " +
            "FROM ag_usage_event ue JOIN ag_agent a ON ue.agent_id = a.id " +
            "WHERE ue.created_at >= #{windowStart} AND ue.created_at < #{windowEnd} AND a.status = 'ACTIVE' " +
            "GROUP BY ue.owner_id, ue.agent_id")
    int insertWindow(@Param("windowStart") OffsetDateTime windowStart,
                     @Param("windowEnd") OffsetDateTime windowEnd,
                     @Param("minutes") int minutes);
}
