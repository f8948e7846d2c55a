package world.willfrog.agentguard.killswitch.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import world.willfrog.agentguard.common.dao.killswitch.AgentDao;
import world.willfrog.agentguard.common.dto.ResponseCode;
import world.willfrog.agentguard.common.pojo.killswitch.Agent;
import world.willfrog.agentguard.common.pojo.killswitch.UsageEvent;
import world.willfrog.agentguard.killswitch.dto.UsageRecordRequest;
import world.willfrog.agentguard.killswitch.exception.BizException;
import world.willfrog.agentguard.killswitch.model.AdmissionDecision;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 用量写入：准入 -> 登记 agent -> （延迟检查）-> 写账本 -> 确认缓存。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UsageRecordService {

    private static final int MAX_ERROR_LENGTH = 2000;

    private final AdmissionGate admissionGate;
    private final AgentDao agentDao;
    private final UsageLedgerWriter usageLedgerWriter;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public UsageRecordResult record(String ownerId, UsageRecordRequest request) {
        return recordBulk(ownerId, List.of(request));
    }

    /**
     * 每条事件独立过准入；任一条被拒绝则整批放弃，并撤回已做的预占。
     * 没有预占的放行（缓存不可用或关闭预占）在批内按 agent 累计，计入后续事件的检查。
     */
    public UsageRecordResult recordBulk(String ownerId, List<UsageRecordRequest> requests) {
        List<AdmissionDecision> admitted = new ArrayList<>();
        Map<String, BigDecimal> unreserved = new HashMap<>();
        List<UsageEvent> written;
        try {
            List<UsageEvent> events = new ArrayList<>();
            for (int i = 0; i < requests.size(); i++) {
                UsageRecordRequest request = requests.get(i);
                String metadataJson = toJson(request);
                AdmissionDecision decision = admitOne(ownerId, request,
                        unreserved.getOrDefault(request.agentId(), BigDecimal.ZERO));
                if (decision.isDenied()) {
                    admitted.forEach(admissionGate::release);
                    log.info("Usage denied: ownerId={} agentId={} code={} index={}",
                            ownerId, request.agentId(), decision.getDenyCode(), i);
                    return UsageRecordResult.denied(decision, requests.size() > 1 ? i : null);
                }
                admitted.add(decision);
                if (!decision.isReserved()) {
                    unreserved.merge(request.agentId(), decision.getCost(), BigDecimal::add);
                }
                events.add(toEvent(ownerId, decision.getAgent(), request, metadataJson));
            }
            written = usageLedgerWriter.appendAll(events);
        } catch (RuntimeException e) {
            admitted.forEach(admissionGate::release);
            throw e;
        }
        admitted.forEach(admissionGate::confirm);
        log.debug("Usage recorded: ownerId={} events={}", ownerId, written.size());
        return UsageRecordResult.recorded(written);
    }

    private AdmissionDecision admitOne(String ownerId, UsageRecordRequest request, BigDecimal unreservedPending) {
        AdmissionDecision decision = admissionGate.admit(ownerId, request.agentId(), request.costAmount(),
                unreservedPending);
        if (!decision.isDeferred()) {
            return decision;
        }
        Agent agent = new Agent();
        agent.setOwnerId(ownerId);
        agent.setExternalId(request.agentId());
        agent.setAgentName(request.agentId());
        if (agentDao.insertIfAbsent(agent) > 0) {
            log.info("Agent registered on first usage: ownerId={} agentId={}", ownerId, request.agentId());
        }
        return admissionGate.admitAfterCreation(ownerId, request.agentId(), request.costAmount(),
                unreservedPending);
    }

    private UsageEvent toEvent(String ownerId, Agent agent, UsageRecordRequest request, String metadataJson) {
        UsageEvent event = new UsageEvent();
        event.setOwnerId(ownerId);
        event.setAgentId(agent.getId());
        event.setCustomerId(request.customerId());
        event.setEventName(request.eventName());
        event.setVendor(request.vendor());
        event.setModel(request.model());
        event.setCostAmount(request.costAmount());
        event.setInputTokens(request.inputTokens());
        event.setOutputTokens(request.outputTokens());
        event.setTotalTokens(totalTokens(request));
        event.setRequestSignature(request.requestSignature());
        event.setErrorMessage(StringUtils.abbreviate(StringUtils.trimToNull(request.error()), MAX_ERROR_LENGTH));
        event.setMetadataJson(metadataJson);
        event.setOccurredAt(request.occurredAt() == null ? OffsetDateTime.now(clock) : request.occurredAt());
        return event;
    }

    private Long totalTokens(UsageRecordRequest request) {
        if (request.totalTokens() != null) {
            return request.totalTokens();
        }
        if (request.inputTokens() == null && request.outputTokens() == null) {
            return null;
        }
        long input = request.inputTokens() == null ? 0L : request.inputTokens();
        long output = request.outputTokens() == null ? 0L : request.outputTokens();
        return input + output;
    }

    private String toJson(UsageRecordRequest request) {
        if (request.metadata() == null || request.metadata().isEmpty()) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(request.metadata());
        } catch (JsonProcessingException e) {
            throw new BizException(ResponseCode.PARAM_ERROR, "metadata is not valid JSON");
        }
    }
}
