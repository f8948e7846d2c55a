package world.willfrog.agentguard.killswitch.controller;

import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;
import world.willfrog.agentguard.common.dto.ResponseWrapper;
import world.willfrog.agentguard.common.pojo.killswitch.TargetType;
import world.willfrog.agentguard.killswitch.config.RateLimitingConfig;
import world.willfrog.agentguard.killswitch.dto.*;
import world.willfrog.agentguard.killswitch.service.KillSwitchControlService;
import world.willfrog.agentguard.killswitch.service.KillSwitchStatusService;
import world.willfrog.agentguard.killswitch.service.RateLimitingService;

import java.util.List;

@RestController
@RequestMapping("/api/killswitch")
public class KillSwitchController {

    private final KillSwitchControlService controlService;
    private final KillSwitchStatusService statusService;
    private final RateLimitingService rateLimitingService;

    public KillSwitchController(KillSwitchControlService controlService,
                                KillSwitchStatusService statusService,
                                RateLimitingService rateLimitingService) {
        this.controlService = controlService;
        this.statusService = statusService;
        this.rateLimitingService = rateLimitingService;
    }

    @PostMapping("/agents/{agentId}/kill")
    public ResponseWrapper<TransitionResponse> killAgent(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable("agentId") String agentId,
            @Valid @RequestBody KillRequest request) {
        rateLimitingService.requirePermit(RateLimitingConfig.CONTROL_LIMITER, userId);
        return ResponseWrapper.success(controlService.kill(userId, agentId, request));
    }

    @PostMapping("/customers/{customerId}/kill")
    public ResponseWrapper<BulkKillResponse> killCustomer(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable("customerId") String customerId,
            @Valid @RequestBody KillRequest request) {
        rateLimitingService.requirePermit(RateLimitingConfig.CONTROL_LIMITER, userId);
        return ResponseWrapper.success(controlService.killCustomer(userId, customerId, request));
    }

    @PostMapping("/agents/{agentId}/pause")
    public ResponseWrapper<TransitionResponse> pauseAgent(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable("agentId") String agentId,
            @Valid @RequestBody PauseRequest request) {
        rateLimitingService.requirePermit(RateLimitingConfig.CONTROL_LIMITER, userId);
        return ResponseWrapper.success(controlService.pause(userId, agentId, request));
    }

    @PostMapping("/agents/{agentId}/revive")
    public ResponseWrapper<TransitionResponse> reviveAgent(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable("agentId") String agentId,
            @Valid @RequestBody(required = false) ReviveRequest request) {
        rateLimitingService.requirePermit(RateLimitingConfig.CONTROL_LIMITER, userId);
        return ResponseWrapper.success(controlService.revive(userId, agentId, request));
    }

    @PostMapping("/emergency-stop")
    public ResponseWrapper<BulkKillResponse> emergencyStop(
            @RequestHeader("X-User-Id") String userId,
            @Valid @RequestBody EmergencyStopRequest request) {
        rateLimitingService.requirePermit(RateLimitingConfig.CONTROL_LIMITER, userId);
        return ResponseWrapper.success(controlService.emergencyStop(userId, request),
                "Emergency stop activated");
    }

    @PostMapping("/emergency-stop/disable")
    public ResponseWrapper<Boolean> disableEmergencyStop(@RequestHeader("X-User-Id") String userId) {
        rateLimitingService.requirePermit(RateLimitingConfig.CONTROL_LIMITER, userId);
        boolean cleared = controlService.disableEmergencyStop(userId);
        return ResponseWrapper.success(cleared, cleared
                ? "Emergency stop disabled, killed agents must be revived individually"
                : "Emergency stop was not active");
    }

    @GetMapping("/status")
    public ResponseWrapper<KillSwitchStatusResponse> status(@RequestHeader("X-User-Id") String userId) {
        return ResponseWrapper.success(statusService.status(userId));
    }

    @GetMapping("/agents/{agentId}/check")
    public ResponseWrapper<AgentCheckResponse> checkAgent(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable("agentId") String agentId) {
        return ResponseWrapper.success(statusService.check(userId, agentId));
    }

    @GetMapping("/agents/{agentId}/spend")
    public ResponseWrapper<AgentSpendResponse> agentSpend(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable("agentId") String agentId) {
        return ResponseWrapper.success(statusService.spend(userId, agentId));
    }

    @GetMapping("/events")
    public ResponseWrapper<List<KillSwitchEventResponse>> events(
            @RequestHeader("X-User-Id") String userId,
            @RequestParam(value = "targetType", required = false) TargetType targetType,
            @RequestParam(value = "targetId", required = false) String targetId,
            @RequestParam(value = "limit", required = false) Integer limit) {
        return ResponseWrapper.success(statusService.events(userId, targetType, targetId, limit));
    }
}
