package com.ai.salesbot.controller;

import com.ai.salesbot.dto.AnalyticsView;
import com.ai.salesbot.dto.AnalyticsWrite;
import com.ai.salesbot.dto.ApiResponse;
import com.ai.salesbot.dto.DateRange;
import com.ai.salesbot.dto.FunnelReport;
import com.ai.salesbot.dto.LiveSnapshot;
import com.ai.salesbot.dto.ObjectionStats;
import com.ai.salesbot.dto.QualificationStats;
import com.ai.salesbot.dto.QualityReport;
import com.ai.salesbot.dto.SummaryReport;
import com.ai.salesbot.dto.TalkListenReport;
import com.ai.salesbot.dto.TechniqueStats;
import com.ai.salesbot.exception.ValidationException;
import com.ai.salesbot.service.AnalyticsReportService;
import com.ai.salesbot.service.QualificationService;
import com.ai.salesbot.service.SalesAnalyticsService;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/analytics")
public class AnalyticsController {

    private final SalesAnalyticsService analyticsService;
    private final AnalyticsReportService reportService;
    private final QualificationService qualificationService;

    public AnalyticsController(SalesAnalyticsService analyticsService,
                               AnalyticsReportService reportService,
                               QualificationService qualificationService) {
        this.analyticsService = analyticsService;
        this.reportService = reportService;
        this.qualificationService = qualificationService;
    }

    // ---- per-call recorder ----

    @GetMapping("/calls/{callId}")
    public ApiResponse<AnalyticsView> get(@PathVariable String callId) {
        return ApiResponse.ok(analyticsService.get(callId));
    }

    @PostMapping("/calls/{callId}/objections")
    public ApiResponse<AnalyticsView> objection(@PathVariable String callId, @RequestBody AnalyticsWrite body) {
        return ApiResponse.ok(analyticsService.recordObjection(callId, body.objectionTypeValue()));
    }

    @PostMapping("/calls/{callId}/objections/{index}/resolve")
    public ApiResponse<AnalyticsView> resolve(@PathVariable String callId, @PathVariable int index,
                                              @RequestBody(required = false) AnalyticsWrite body) {
        return ApiResponse.ok(analyticsService.resolveObjection(callId, index, body != null ? body.getTechnique() : null));
    }

    @PostMapping("/calls/{callId}/techniques")
    public ApiResponse<AnalyticsView> technique(@PathVariable String callId, @RequestBody AnalyticsWrite body) {
        return ApiResponse.ok(analyticsService.recordTechnique(callId, body.getTechnique(), body.getStage(),
                Boolean.TRUE.equals(body.getSuccess())));
    }

    @PostMapping("/calls/{callId}/sentiment")
    public ApiResponse<AnalyticsView> sentiment(@PathVariable String callId, @RequestBody AnalyticsWrite body) {
        return ApiResponse.ok(analyticsService.recordSentiment(callId, requireScore(body), body.getText()));
    }

    @PutMapping("/calls/{callId}/sentiment/{index}")
    public ApiResponse<AnalyticsView> correctSentiment(@PathVariable String callId, @PathVariable int index,
                                                       @RequestBody AnalyticsWrite body) {
        return ApiResponse.ok(analyticsService.correctSentimentSample(callId, index, requireScore(body)));
    }

    @PostMapping("/calls/{callId}/talk-time")
    public ApiResponse<AnalyticsView> talkTime(@PathVariable String callId, @RequestBody AnalyticsWrite body) {
        double ai = body.getAiTalkTime() != null ? body.getAiTalkTime() : 0;
        double user = body.getUserTalkTime() != null ? body.getUserTalkTime() : 0;
        return ApiResponse.ok(analyticsService.recordTalkTime(callId, ai, user));
    }

    @PostMapping("/calls/{callId}/key-phrases")
    public ApiResponse<AnalyticsView> keyPhrase(@PathVariable String callId, @RequestBody AnalyticsWrite body) {
        return ApiResponse.ok(analyticsService.recordKeyPhrase(callId, body.getPhrase(), body.getCategory(),
                body.getContext()));
    }

    @PostMapping("/calls/{callId}/stage")
    public ApiResponse<AnalyticsView> stage(@PathVariable String callId, @RequestBody AnalyticsWrite body) {
        return ApiResponse.ok(analyticsService.advanceStage(callId, body.getConversionStage()));
    }

    @PostMapping("/calls/{callId}/outcome")
    public ApiResponse<AnalyticsView> outcome(@PathVariable String callId, @RequestBody AnalyticsWrite body) {
        return ApiResponse.ok(analyticsService.setOutcome(callId, body.getOutcome()));
    }

    // ---- reports ----

    @GetMapping("/funnel")
    public ApiResponse<FunnelReport> funnel(@RequestParam(required = false) String startDate,
                                            @RequestParam(required = false) String endDate) {
        return ApiResponse.ok(reportService.funnel(DateRange.parse(startDate, endDate)));
    }

    @GetMapping("/objections")
    public ApiResponse<List<ObjectionStats>> objections(@RequestParam(required = false) String startDate,
                                                        @RequestParam(required = false) String endDate) {
        return ApiResponse.ok(reportService.objectionAnalysis(DateRange.parse(startDate, endDate)));
    }

    @GetMapping("/techniques")
    public ApiResponse<List<TechniqueStats>> techniques(@RequestParam(required = false) String startDate,
                                                        @RequestParam(required = false) String endDate) {
        return ApiResponse.ok(reportService.techniquePerformance(DateRange.parse(startDate, endDate)));
    }

    @GetMapping("/qualification")
    public ApiResponse<QualificationStats> qualification(@RequestParam(required = false) String startDate,
                                                         @RequestParam(required = false) String endDate) {
        return ApiResponse.ok(qualificationService.stats(DateRange.parse(startDate, endDate)));
    }

    @GetMapping("/quality")
    public ApiResponse<QualityReport> quality(@RequestParam(required = false) String startDate,
                                              @RequestParam(required = false) String endDate) {
        return ApiResponse.ok(reportService.callQuality(DateRange.parse(startDate, endDate)));
    }

    @GetMapping("/talk-listen")
    public ApiResponse<TalkListenReport> talkListen(@RequestParam(required = false) String startDate,
                                                    @RequestParam(required = false) String endDate) {
        return ApiResponse.ok(reportService.talkListen(DateRange.parse(startDate, endDate)));
    }

    @GetMapping("/live")
    public ApiResponse<LiveSnapshot> live() {
        return ApiResponse.ok(reportService.live());
    }

    @GetMapping("/summary")
    public ApiResponse<SummaryReport> summary(@RequestParam(required = false) String startDate,
                                              @RequestParam(required = false) String endDate) {
        return ApiResponse.ok(reportService.summary(DateRange.parse(startDate, endDate)));
    }

    private static double requireScore(AnalyticsWrite body) {
        if (body.getScore() == null) throw new ValidationException("score is required");
        return body.getScore();
    }
}
