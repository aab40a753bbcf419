package com.ai.salesbot.controller;

import com.ai.salesbot.dto.ApiResponse;
import com.ai.salesbot.dto.CallLifecycleEvent;
import com.ai.salesbot.dto.CallStats;
import com.ai.salesbot.dto.DateRange;
import com.ai.salesbot.entity.CallSession;
import com.ai.salesbot.service.CallSessionService;
import com.ai.salesbot.utils.CallDirection;
import com.ai.salesbot.utils.CallStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/calls")
public class CallController {

    private static final int MAX_PAGE_SIZE = 100;

    private final CallSessionService callSessionService;

    public CallController(CallSessionService callSessionService) {
        this.callSessionService = callSessionService;
    }

    @PostMapping
    public ResponseEntity<ApiResponse<CallSession>> start(@RequestBody CallLifecycleEvent request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(callSessionService.startCall(request)));
    }

    @PatchMapping("/{callId}")
    public ApiResponse<CallSession> update(@PathVariable String callId, @RequestBody CallLifecycleEvent patch) {
        return ApiResponse.ok(callSessionService.updateCall(callId, patch));
    }

    @PatchMapping("/{callId}/transcript")
    public ApiResponse<CallSession> appendTranscript(@PathVariable String callId, @RequestBody Map<String, String> body) {
        return ApiResponse.ok(callSessionService.appendTranscript(callId, body.get("transcript")));
    }

    @PostMapping("/{callId}/interruptions")
    public ApiResponse<CallSession> interruption(@PathVariable String callId) {
        return ApiResponse.ok(callSessionService.recordInterruption(callId));
    }

    @PostMapping("/{callId}/end")
    public ApiResponse<CallSession> end(@PathVariable String callId, @RequestBody(required = false) CallLifecycleEvent body) {
        CallLifecycleEvent b = body != null ? body : new CallLifecycleEvent();
        return callSessionService.endCall(callId, b.getStatus(), b.getTranscript(), b.getAudioRef(), b.getSatisfaction())
                .map(ApiResponse::ok)
                .orElseGet(() -> ApiResponse.ok(null, "Call not found, nothing to end"));
    }

    @PostMapping("/{callId}/terminate")
    public ApiResponse<CallSession> terminate(@PathVariable String callId) {
        return ApiResponse.ok(callSessionService.terminate(callId), "Call terminated");
    }

    @GetMapping("/active")
    public ApiResponse<List<CallSession>> active() {
        return ApiResponse.ok(callSessionService.listActive());
    }

    @PostMapping("/cleanup")
    public ApiResponse<List<CallSession>> cleanup() {
        List<CallSession> reclaimed = callSessionService.cleanupStuck();
        return ApiResponse.ok(reclaimed, "Cleaned up " + reclaimed.size() + " stuck calls");
    }

    @GetMapping("/stats")
    public ApiResponse<CallStats> stats(@RequestParam(required = false) String startDate,
                                        @RequestParam(required = false) String endDate) {
        return ApiResponse.ok(callSessionService.stats(DateRange.parse(startDate, endDate)));
    }

    @GetMapping("/{callId}")
    public ApiResponse<CallSession> get(@PathVariable String callId) {
        return ApiResponse.ok(callSessionService.get(callId));
    }

    @GetMapping
    public ApiResponse<Page<CallSession>> list(@RequestParam(required = false) String status,
                                               @RequestParam(required = false) String direction,
                                               @RequestParam(required = false) String startDate,
                                               @RequestParam(required = false) String endDate,
                                               @RequestParam(defaultValue = "0") int page,
                                               @RequestParam(defaultValue = "20") int size) {
        PageRequest pageable = PageRequest.of(Math.max(0, page), Math.max(1, Math.min(MAX_PAGE_SIZE, size)),
                Sort.by(Sort.Direction.DESC, "startTime"));
        return ApiResponse.ok(callSessionService.list(CallStatus.fromCode(status), CallDirection.fromCode(direction),
                DateRange.parse(startDate, endDate), pageable));
    }

    @DeleteMapping("/{callId}")
    public ApiResponse<Void> purge(@PathVariable String callId) {
        callSessionService.purge(callId);
        return ApiResponse.ok(null, "Call deleted");
    }
}
