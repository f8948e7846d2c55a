package world.willfrog.agentguard.common.dao.killswitch;

import org.apache.ibatis.annotations.*;
import world.willfrog.agentguard.common.pojo.killswitch.GlobalStop;

import java.time.OffsetDateTime;

/**
 * ag_global_stop 只有 id = 1 一行。
 */
@Mapper
public interface GlobalStopDao {

    @Select("SELECT active, reason, actor, stopped_at FROM ag_global_stop WHERE id = 1")
    @Results(id = "globalStopResultMap", value = {
            @Result(property = "active", column = "active"),
            @Result(property = "reason", column = "reason"),
            @Result(property = "actor", column = "actor"),
            @Result(property = "stoppedAt", column = "stopped_at")
    })
    GlobalStop load();

    @Update("UPDATE ag_global_stop SET active = TRUE, reason = #{reason}, actor = #{actor}, stopped_at = #{stoppedAt} " +
            "WHERE id = 1")
    int activate(@Param("reason") String reason,
                 @Param("actor") String actor,
                 @Param("stoppedAt") OffsetDateTime stoppedAt);

    @Update("UPDATE ag_global_stop SET active = FALSE, reason = NULL, actor = NULL, stopped_at = NULL " +
            "WHERE id = 1 AND active = TRUE")
    int clear();
}
