package world.willfrog.agentguard.common.dao.killswitch;

import org.apache.ibatis.annotations.*;
import world.willfrog.agentguard.common.pojo.killswitch.KillTrigger;
import world.willfrog.agentguard.common.pojo.killswitch.TriggerKind;

import java.util.Collection;
import java.util.List;

@Mapper
public interface KillTriggerDao {

    @Insert("INSERT INTO ag_kill_trigger (" +
            "owner_id, trigger_name, trigger_kind, threshold_value, window_unit, scope, scope_target_id, active, metadata" +
            ") VALUES (" +
            "#{ownerId}, #{triggerName}, #{triggerKind}, #{thresholdValue}, #{windowUnit}, #{scope}, #{scopeTargetId}, " +
            "#{active}, CAST(#{metadataJson} AS jsonb)" +
            ")")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insert(KillTrigger trigger);

    @Select("SELECT * FROM ag_kill_trigger WHERE id = #{id} AND owner_id = #{ownerId}")
    @Results(id = "killTriggerResultMap", value = {
            @Result(property = "id", column = "id", id = true),
            @Result(property = "ownerId", column = "owner_id"),
            @Result(property = "triggerName", column = "trigger_name"),
            @Result(property = "triggerKind", column = "trigger_kind"),
            @Result(property = "thresholdValue", column = "threshold_value"),
            @Result(property = "windowUnit", column = "window_unit"),
            @Result(property = "scope", column = "scope"),
            @Result(property = "scopeTargetId", column = "scope_target_id"),
            @Result(property = "active", column = "active"),
            @Result(property = "metadataJson", column = "metadata"),
            @Result(property = "createdAt", column = "created_at"),
            @Result(property = "updatedAt", column = "updated_at")
    })
    KillTrigger findByIdAndOwner(@Param("id") Long id, @Param("ownerId") String ownerId);

    @Select("SELECT * FROM ag_kill_trigger WHERE owner_id = #{ownerId} ORDER BY created_at DESC")
    @ResultMap("killTriggerResultMap")
    List<KillTrigger> listByOwner(@Param("ownerId") String ownerId);

    @Select("<script>" +
            "SELECT * FROM ag_kill_trigger WHERE active = TRUE AND trigger_kind IN " +
            "<foreach collection='kinds' item='kind' open='(' separator=',' close=')'>#{kind}</foreach>" +
            " ORDER BY id" +
            "</script>")
    @ResultMap("killTriggerResultMap")
    List<KillTrigger> listActiveByKinds(@Param("kinds") Collection<TriggerKind> kinds);

    @Update("UPDATE ag_kill_trigger SET trigger_name = #{triggerName}, threshold_value = #{thresholdValue}, " +
            "window_unit = #{windowUnit}, active = #{active}, metadata = CAST(#{metadataJson} AS jsonb), updated_at = NOW() " +
            "WHERE id = #{id} AND owner_id = #{ownerId}")
    int update(KillTrigger trigger);

    @Delete("DELETE FROM ag_kill_trigger WHERE id = #{id} AND owner_id = #{ownerId}")
    int deleteByIdAndOwner(@Param("id") Long id, @Param("ownerId") String ownerId);
}
