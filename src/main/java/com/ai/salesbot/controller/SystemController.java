package com.ai.salesbot.controller;

import com.ai.salesbot.dto.ApiResponse;
import com.ai.salesbot.dto.HealthSnapshot;
import com.ai.salesbot.entity.SystemConfig;
import com.ai.salesbot.exception.ValidationException;
import com.ai.salesbot.service.CallSessionService;
import com.ai.salesbot.service.SystemConfigService;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/system")
public class SystemController {

    private final SystemConfigService configService;
    private final CallSessionService callSessionService;

    public SystemController(SystemConfigService configService, CallSessionService callSessionService) {
        this.configService = configService;
        this.callSessionService = callSessionService;
    }

    @GetMapping("/config")
    public ApiResponse<List<SystemConfig>> list(@RequestParam(required = false) String category) {
        return ApiResponse.ok(configService.list(category));
    }

    @GetMapping("/config/{name}")
    public ApiResponse<SystemConfig> get(@PathVariable String name) {
        return ApiResponse.ok(configService.get(name));
    }

    @PutMapping("/config/{name}")
    public ApiResponse<SystemConfig> update(@PathVariable String name, @RequestBody Map<String, Object> body) {
        if (!body.containsKey("value") || body.get("value") == null) {
            throw new ValidationException("value is required");
        }
        Object value = body.get("value");
        String raw = value instanceof List
                ? String.join(",", ((List<?>) value).stream().map(String::valueOf).toArray(String[]::new))
                : String.valueOf(value);
        return ApiResponse.ok(configService.update(name, raw), "Configuration updated");
    }

    @GetMapping("/health")
    public ApiResponse<HealthSnapshot> health() {
        return ApiResponse.ok(callSessionService.health());
    }
}
