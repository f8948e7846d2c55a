package world.willfrog.agentguard.common.dao.killswitch;

import org.apache.ibatis.annotations.*;
import world.willfrog.agentguard.common.pojo.killswitch.AgentErrorStats;
import world.willfrog.agentguard.common.pojo.killswitch.AgentSpendAggregate;
import world.willfrog.agentguard.common.pojo.killswitch.RepeatedRequestGroup;
import world.willfrog.agentguard.common.pojo.killswitch.UsageEvent;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;

/**
 * 账本（ag_usage_event）只追加，不提供 update / delete。
 * 周期花费与触发器窗口都按服务端写入时间 created_at 统计，occurred_at 只作记录，调用方回填的时间不影响预算归属。
 */
@Mapper
public interface UsageEventDao {

    @Insert("INSERT INTO ag_usage_event (" +
            "owner_id, agent_id, customer_id, event_name, vendor, model, cost_amount, input_tokens, output_tokens, " +
            "total_tokens, request_signature, error_message, metadata, occurred_at" +
            ") VALUES (" +
            "#{ownerId}, #{agentId}, #{customerId}, #{eventName}, #{vendor}, #{model}, #{costAmount}, #{inputTokens}, " +
            "#{outputTokens}, #{totalTokens}, #{requestSignature}, #{errorMessage}, CAST(#{metadataJson} AS jsonb), #{occurredAt}" +
            ")")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insert(UsageEvent event);

    @Select("SELECT COALESCE(SUM(cost_amount), 0) FROM ag_usage_event " +
            "WHERE agent_id = #{agentId} AND created_at >= #{from} AND created_at < #{to}")
    BigDecimal sumCost(@Param("agentId") Long agentId,
                       @Param("from") OffsetDateTime from,
                       @Param("to") OffsetDateTime to);

    @Select("SELECT a.id AS agent_id, a.external_id, a.owner_id, " +
            "COALESCE(SUM(ue.cost_amount), 0) AS total_cost, COUNT(ue.id) AS event_count " +
            "FROM ag_agent a LEFT JOIN ag_usage_event ue ON ue.agent_id = a.id " +
            "AND ue.created_at >= #{from} AND ue.created_at < #{to} " +
            "WHERE a.id = #{agentId} GROUP BY a.id, a.external_id, a.owner_id")
    AgentSpendAggregate periodSummary(@Param("agentId") Long agentId,
                                      @Param("from") OffsetDateTime from,
                                      @Param("to") OffsetDateTime to);

    @Select("SELECT a.id AS agent_id, a.external_id, a.owner_id, " +
            "COALESCE(SUM(ue.cost_amount), 0) AS total_cost, COUNT(ue.id) AS event_count " +
            "FROM ag_agent a LEFT JOIN ag_usage_event ue ON ue.agent_id = a.id " +
            "AND ue.created_at >= #{from} AND ue.created_at < #{to} " +
            "WHERE a.monthly_cost_limit IS NOT NULL GROUP BY a.id, a.external_id, a.owner_id")
    List<AgentSpendAggregate> sumPeriodForLimitedAgents(@Param("from") OffsetDateTime from,
                                                        @Param("to") OffsetDateTime to);

    @Select("SELECT EXISTS (SELECT 1 FROM ag_usage_event WHERE owner_id = #{ownerId} AND customer_id = #{customerId})")
    boolean existsForCustomer(@Param("ownerId") String ownerId, @Param("customerId") String customerId);

    @Select("<script>" +
            "SELECT a.id AS agent_id, a.external_id, a.owner_id, SUM(ue.cost_amount) AS total_cost, COUNT(*) AS event_count " +
            "FROM ag_usage_event ue JOIN ag_agent a ON ue.agent_id = a.id " +
            "WHERE ue.created_at <![CDATA[>=]]> #{since} AND a.status = 'ACTIVE'" +
            "<if test='ownerId != null'> AND ue.owner_id = #{ownerId}</if>" +
            "<if test='customerId != null'> AND ue.customer_id = #{customerId}</if>" +
            "<if test='agentExternalId != null'> AND a.external_id = #{agentExternalId}</if>" +
            " GROUP BY a.id, a.external_id, a.owner_id " +
            "HAVING SUM(ue.cost_amount) <![CDATA[>]]> #{threshold}" +
            "</script>")
    List<AgentSpendAggregate> findSpendAbove(@Param("ownerId") String ownerId,
                                             @Param("customerId") String customerId,
                                             @Param("agentExternalId") String agentExternalId,
                                             @Param("since") OffsetDateTime since,
                                             @Param("threshold") BigDecimal threshold);

    @Select("<script>" +
            "SELECT ue.agent_id, a.external_id, a.owner_id, ue.event_name, ue.model, ue.request_signature, " +
            "COUNT(*) AS repeat_count " +
            "FROM ag_usage_event ue JOIN ag_agent a ON ue.agent_id = a.id " +
            "WHERE ue.created_at <![CDATA[>=]]> #{since} AND a.status = 'ACTIVE' AND ue.request_signature IS NOT NULL" +
            "<if test='ownerId != null'> AND ue.owner_id = #{ownerId}</if>" +
            "<if test='customerId != null'> AND ue.customer_id = #{customerId}</if>" +
            "<if test='agentExternalId != null'> AND a.external_id = #{agentExternalId}</if>" +
            " GROUP BY ue.agent_id, a.external_id, a.owner_id, ue.event_name, ue.model, ue.request_signature " +
            "HAVING COUNT(*) <![CDATA[>=]]> #{minRepeats}" +
            "</script>")
    List<RepeatedRequestGroup> findRepeatedRequests(@Param("ownerId") String ownerId,
                                                    @Param("customerId") String customerId,
                                                    @Param("agentExternalId") String agentExternalId,
                                                    @Param("since") OffsetDateTime since,
                                                    @Param("minRepeats") long minRepeats);

    @Select("<script>" +
            "SELECT a.id AS agent_id, a.external_id, a.owner_id, COUNT(*) AS total_requests, " +
            "SUM(CASE WHEN ue.error_message IS NOT NULL THEN 1 ELSE 0 END) AS error_count " +
            "FROM ag_usage_event ue JOIN ag_agent a ON ue.agent_id = a.id " +
            "WHERE ue.created_at <![CDATA[>=]]> #{since} AND a.status = 'ACTIVE'" +
            "<if test='ownerId != null'> AND ue.owner_id = #{ownerId}</if>" +
            "<if test='customerId != null'> AND ue.customer_id = #{customerId}</if>" +
            "<if test='agentExternalId != null'> AND a.external_id = #{agentExternalId}</if>" +
            " GROUP BY a.id, a.external_id, a.owner_id " +
            "HAVING COUNT(*) <![CDATA[>=]]> #{minSamples}" +
            "</script>")
    List<AgentErrorStats> findErrorStats(@Param("ownerId") String ownerId,
                                         @Param("customerId") String customerId,
                                         @Param("agentExternalId") String agentExternalId,
                                         @Param("since") OffsetDateTime since,
                                         @Param("minSamples") long minSamples);
}
