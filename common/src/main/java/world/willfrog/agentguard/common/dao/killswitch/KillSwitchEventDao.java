package world.willfrog.agentguard.common.dao.killswitch;

import org.apache.ibatis.annotations.*;
import world.willfrog.agentguard.common.pojo.killswitch.KillSwitchEvent;
import world.willfrog.agentguard.common.pojo.killswitch.TargetType;

import java.util.List;

/**
 * 审计表只追加。
 */
@Mapper
public interface KillSwitchEventDao {

    @Insert("INSERT INTO ag_kill_switch_event (" +
            "event_type, target_type, target_id, owner_id, actor, reason, metadata" +
            ") VALUES (" +
            "#{eventType}, #{targetType}, #{targetId}, #{ownerId}, #{actor}, #{reason}, CAST(#{metadataJson} AS jsonb)" +
            ")")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insert(KillSwitchEvent event);

    @Select("SELECT * FROM ag_kill_switch_event " +
            "WHERE owner_id = #{ownerId} OR target_type = 'GLOBAL' " +
            "ORDER BY created_at DESC, id DESC LIMIT #{limit}")
    @Results(id = "killSwitchEventResultMap", value = {
            @Result(property = "id", column = "id", id = true),
            @Result(property = "eventType", column = "event_type"),
            @Result(property = "targetType", column = "target_type"),
            @Result(property = "targetId", column = "target_id"),
            @Result(property = "ownerId", column = "owner_id"),
            @Result(property = "actor", column = "actor"),
            @Result(property = "reason", column = "reason"),
            @Result(property = "metadataJson", column = "metadata"),
            @Result(property = "createdAt", column = "created_at")
    })
    List<KillSwitchEvent> listRecent(@Param("ownerId") String ownerId, @Param("limit") int limit);

    @Select("<script>" +
            "SELECT * FROM ag_kill_switch_event " +
            "WHERE (owner_id = #{ownerId} OR target_type = 'GLOBAL')" +
            "<if test='targetType != null'> AND target_type = #{targetType}</if>" +
            "<if test='targetId != null and targetId != \"\"'> AND target_id = #{targetId}</if>" +
            " ORDER BY created_at DESC, id DESC LIMIT #{limit}" +
            "</script>")
    @ResultMap("killSwitchEventResultMap")
    List<KillSwitchEvent> listByTarget(@Param("ownerId") String ownerId,
                                       @Param("targetType") TargetType targetType,
                                       @Param("targetId") String targetId,
                                       @Param("limit") int limit);
}
