package world.willfrog.agentguard.killswitch.controller;

import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import world.willfrog.agentguard.common.dto.ResponseCode;
import world.willfrog.agentguard.common.dto.ResponseWrapper;
import world.willfrog.agentguard.common.pojo.killswitch.UsageEvent;
import world.willfrog.agentguard.killswitch.dto.AdmissionDenialResponse;
import world.willfrog.agentguard.killswitch.dto.UsageBulkRecordRequest;
import world.willfrog.agentguard.killswitch.dto.UsageRecordRequest;
import world.willfrog.agentguard.killswitch.dto.UsageRecordResponse;
import world.willfrog.agentguard.killswitch.model.AdmissionDecision;
import world.willfrog.agentguard.killswitch.service.UsageRecordResult;
import world.willfrog.agentguard.killswitch.service.UsageRecordService;

import java.math.BigDecimal;

/**
 * 准入拒绝返回 403 + ADMISSION_DENIED，data 中给出机器可读的拒绝码，与参数校验失败（400）区分。
 */
@RestController
@RequestMapping("/api/usage")
public class UsageController {

    private final UsageRecordService usageRecordService;

    public UsageController(UsageRecordService usageRecordService) {
        this.usageRecordService = usageRecordService;
    }

    @PostMapping("/record")
    public ResponseEntity<ResponseWrapper<?>> record(
            @RequestHeader("X-User-Id") String userId,
            @Valid @RequestBody UsageRecordRequest request) {
        return toResponse(usageRecordService.record(userId, request));
    }

    @PostMapping("/record-bulk")
    public ResponseEntity<ResponseWrapper<?>> recordBulk(
            @RequestHeader("X-User-Id") String userId,
            @Valid @RequestBody UsageBulkRecordRequest request) {
        return toResponse(usageRecordService.recordBulk(userId, request.events()));
    }

    private ResponseEntity<ResponseWrapper<?>> toResponse(UsageRecordResult result) {
        if (result.isDenied()) {
            AdmissionDecision denial = result.getDenial();
            AdmissionDenialResponse body = new AdmissionDenialResponse(denial.getDenyCode().name(),
                    denial.getMessage(), denial.getDetails(), result.getDeniedIndex());
            return ResponseEntity.status(HttpStatus.FORBIDDEN)
                    .body(ResponseWrapper.error(ResponseCode.ADMISSION_DENIED, denial.getMessage(), body));
        }
        BigDecimal totalCost = result.getEvents().stream()
                .map(UsageEvent::getCostAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        UsageRecordResponse body = new UsageRecordResponse(
                result.getEvents().stream().map(UsageEvent::getId).toList(),
                result.getEvents().size(),
                totalCost);
        return ResponseEntity.ok(ResponseWrapper.success(body));
    }
}
