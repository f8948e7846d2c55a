package world.willfrog.agentguard.killswitch.controller;

import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;
import world.willfrog.agentguard.common.dto.ResponseWrapper;
import world.willfrog.agentguard.killswitch.config.RateLimitingConfig;
import world.willfrog.agentguard.killswitch.dto.TriggerRequest;
import world.willfrog.agentguard.killswitch.dto.TriggerResponse;
import world.willfrog.agentguard.killswitch.service.KillTriggerService;
import world.willfrog.agentguard.killswitch.service.RateLimitingService;

import java.util.List;

@RestController
@RequestMapping("/api/killswitch/triggers")
public class KillTriggerController {

    private final KillTriggerService killTriggerService;
    private final RateLimitingService rateLimitingService;

    public KillTriggerController(KillTriggerService killTriggerService,
                                 RateLimitingService rateLimitingService) {
        this.killTriggerService = killTriggerService;
        this.rateLimitingService = rateLimitingService;
    }

    @PostMapping
    public ResponseWrapper<TriggerResponse> create(
            @RequestHeader("X-User-Id") String userId,
            @Valid @RequestBody TriggerRequest request) {
        rateLimitingService.requirePermit(RateLimitingConfig.CONTROL_LIMITER, userId);
        return ResponseWrapper.success(killTriggerService.create(userId, request));
    }

    @GetMapping
    public ResponseWrapper<List<TriggerResponse>> list(@RequestHeader("X-User-Id") String userId) {
        return ResponseWrapper.success(killTriggerService.list(userId));
    }

    @PutMapping("/{id}")
    public ResponseWrapper<TriggerResponse> update(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable("id") Long id,
            @Valid @RequestBody TriggerRequest request) {
        rateLimitingService.requirePermit(RateLimitingConfig.CONTROL_LIMITER, userId);
        return ResponseWrapper.success(killTriggerService.update(userId, id, request));
    }

    @DeleteMapping("/{id}")
    public ResponseWrapper<Void> delete(
            @RequestHeader("X-User-Id") String userId,
            @PathVariable("id") Long id) {
        rateLimitingService.requirePermit(RateLimitingConfig.CONTROL_LIMITER, userId);
        killTriggerService.delete(userId, id);
        return ResponseWrapper.success(null);
    }
}
