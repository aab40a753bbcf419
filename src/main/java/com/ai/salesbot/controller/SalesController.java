package com.ai.salesbot.controller;

import com.ai.salesbot.dto.ApiResponse;
import com.ai.salesbot.dto.HandlerView;
import com.ai.salesbot.dto.ObjectionDetection;
import com.ai.salesbot.dto.ObjectionQuery;
import com.ai.salesbot.dto.QualificationUpdate;
import com.ai.salesbot.dto.ScriptSelectionRequest;
import com.ai.salesbot.dto.ScriptView;
import com.ai.salesbot.dto.TurnRecommendation;
import com.ai.salesbot.dto.UsageFeedback;
import com.ai.salesbot.dto.UtteranceRequest;
import com.ai.salesbot.entity.LeadQualification;
import com.ai.salesbot.entity.Product;
import com.ai.salesbot.exception.ValidationException;
import com.ai.salesbot.service.ConversationOrchestrator;
import com.ai.salesbot.service.ObjectionClassifier;
import com.ai.salesbot.service.ObjectionHandlerService;
import com.ai.salesbot.service.ProductService;
import com.ai.salesbot.service.QualificationService;
import com.ai.salesbot.service.ScriptSelector;
import com.ai.salesbot.utils.HandlerTechnique;
import com.ai.salesbot.utils.Language;
import com.ai.salesbot.utils.ObjectionType;
import com.ai.salesbot.utils.SalesMethod;
import com.ai.salesbot.utils.ScriptType;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.stream.Collectors;

@RestController
@RequestMapping("/api/sales")
public class SalesController {

    private final ObjectionClassifier classifier;
    private final ObjectionHandlerService handlerService;
    private final ScriptSelector scriptSelector;
    private final QualificationService qualificationService;
    private final ConversationOrchestrator orchestrator;
    private final ProductService productService;

    public SalesController(ObjectionClassifier classifier,
                           ObjectionHandlerService handlerService,
                           ScriptSelector scriptSelector,
                           QualificationService qualificationService,
                           ConversationOrchestrator orchestrator,
                           ProductService productService) {
        this.classifier = classifier;
        this.handlerService = handlerService;
        this.scriptSelector = scriptSelector;
        this.qualificationService = qualificationService;
        this.orchestrator = orchestrator;
        this.productService = productService;
    }

    @PostMapping("/objections/detect")
    public ApiResponse<ObjectionDetection> detect(@RequestBody ObjectionQuery query) {
        if (query.getUtterance() == null) throw new ValidationException("utterance is required");
        return ApiResponse.ok(classifier.detect(query.getUtterance(), query.getLanguage()));
    }

    @GetMapping("/objections")
    public ApiResponse<List<HandlerView>> handlers(@RequestParam(required = false) String type,
                                                   @RequestParam(required = false) HandlerTechnique technique,
                                                   @RequestParam(required = false) String language) {
        return ApiResponse.ok(handlerService.listHandlers(ObjectionType.fromCode(type), technique, Language.fromCode(language))
                .stream().map(HandlerView::from).collect(Collectors.toList()));
    }

    @PostMapping("/objections")
    public ResponseEntity<ApiResponse<HandlerView>> createHandler(@RequestBody HandlerView body) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(HandlerView.from(handlerService.create(body.toEntity()))));
    }

    @GetMapping("/objections/{type}/{language}")
    public ApiResponse<HandlerView> bestHandler(@PathVariable String type, @PathVariable String language) {
        return ApiResponse.ok(HandlerView.from(handlerService.getBestHandler(
                requireType(type), Language.fromCode(language))));
    }

    @PostMapping("/objections/{id}/usage")
    public ApiResponse<HandlerView> handlerUsage(@PathVariable Long id, @RequestBody UsageFeedback feedback) {
        return ApiResponse.ok(HandlerView.from(handlerService.recordUsage(id, requireSuccess(feedback))));
    }

    @GetMapping("/scripts")
    public ApiResponse<List<ScriptView>> scripts(@RequestParam(required = false) Long productId,
                                                 @RequestParam(required = false) ScriptType scriptType,
                                                 @RequestParam(required = false) SalesMethod technique,
                                                 @RequestParam(required = false) String language) {
        return ApiResponse.ok(scriptSelector.listScripts(productId, scriptType, technique, Language.fromCode(language))
                .stream().map(ScriptView::from).collect(Collectors.toList()));
    }

    @PostMapping("/scripts")
    public ResponseEntity<ApiResponse<ScriptView>> createScript(@RequestBody ScriptView body) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ApiResponse.ok(ScriptView.from(scriptSelector.create(body.toEntity()))));
    }

    @PostMapping("/scripts/select")
    public ApiResponse<ScriptView> selectScript(@RequestBody ScriptSelectionRequest request) {
        return scriptSelector.select(request)
                .map(s -> ApiResponse.ok(ScriptView.from(s)))
                .orElseGet(() -> ApiResponse.ok(null, "No eligible script"));
    }

    @PostMapping("/scripts/rank")
    public ApiResponse<List<ScriptView>> rankScripts(@RequestBody ScriptSelectionRequest request) {
        return ApiResponse.ok(scriptSelector.rank(request).stream().map(ScriptView::from).collect(Collectors.toList()));
    }

    @PostMapping("/scripts/{id}/usage")
    public ApiResponse<ScriptView> scriptUsage(@PathVariable Long id, @RequestBody UsageFeedback feedback) {
        return ApiResponse.ok(ScriptView.from(scriptSelector.recordUsage(id, requireSuccess(feedback))));
    }

    @GetMapping("/qualification/{callId}")
    public ApiResponse<LeadQualification> qualification(@PathVariable String callId) {
        return ApiResponse.ok(qualificationService.get(callId));
    }

    @PutMapping("/qualification/{callId}")
    public ApiResponse<LeadQualification> updateQualification(@PathVariable String callId,
                                                             @RequestBody QualificationUpdate update) {
        return ApiResponse.ok(qualificationService.updateScore(callId, update));
    }

    @PostMapping("/conversation/{callId}/utterance")
    public ApiResponse<TurnRecommendation> utterance(@PathVariable String callId, @RequestBody UtteranceRequest request) {
        return ApiResponse.ok(orchestrator.processUtterance(callId, request));
    }

    @GetMapping("/products")
    public ApiResponse<List<Product>> products() {
        return ApiResponse.ok(productService.list());
    }

    @PostMapping("/products")
    public ResponseEntity<ApiResponse<Product>> createProduct(@RequestBody Product body) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.ok(productService.create(body)));
    }

    @GetMapping("/products/active")
    public ApiResponse<Product> activeProduct() {
        return ApiResponse.ok(productService.getActive());
    }

    @PostMapping("/products/{id}/activate")
    public ApiResponse<Product> activate(@PathVariable Long id) {
        return ApiResponse.ok(productService.activate(id), "Product activated");
    }

    private static ObjectionType requireType(String type) {
        ObjectionType t = ObjectionType.fromCode(type);
        if (t == null) throw new ValidationException("objection type is required");
        return t;
    }

    private static boolean requireSuccess(UsageFeedback feedback) {
        if (feedback == null || feedback.getSuccess() == null) {
            throw new ValidationException("success is required");
        }
        return feedback.getSuccess();
    }
}
