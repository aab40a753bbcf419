package com.ai.salesbot.config;

import com.ai.salesbot.entity.ConfigRules;
import com.ai.salesbot.entity.ObjectionHandler;
import com.ai.salesbot.entity.Product;
import com.ai.salesbot.entity.SalesScript;
import com.ai.salesbot.entity.ScriptConditions;
import com.ai.salesbot.entity.ScriptVariable;
import com.ai.salesbot.entity.SystemConfig;
import com.ai.salesbot.repository.ObjectionHandlerRepository;
import com.ai.salesbot.repository.ProductRepository;
import com.ai.salesbot.repository.SalesScriptRepository;
import com.ai.salesbot.service.ProductService;
import com.ai.salesbot.service.SystemConfigService;
import com.ai.salesbot.utils.ConfigDataType;
import com.ai.salesbot.utils.HandlerTechnique;
import com.ai.salesbot.utils.Language;
import com.ai.salesbot.utils.ObjectionType;
import com.ai.salesbot.utils.SalesMethod;
import com.ai.salesbot.utils.ScriptStage;
import com.ai.salesbot.utils.ScriptType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Idempotent seeder: a demo product with its scripts, the objection handler catalog and the
 * default operator settings. Each group is only inserted when its table is empty.
 */
@Component
public class DataInitializer {

    private static final Logger log = LoggerFactory.getLogger(DataInitializer.class);

    private final ProductRepository productRepository;
    private final SalesScriptRepository scriptRepository;
    private final ObjectionHandlerRepository handlerRepository;
    private final ProductService productService;
    private final SystemConfigService configService;

    public DataInitializer(ProductRepository productRepository,
                           SalesScriptRepository scriptRepository,
                           ObjectionHandlerRepository handlerRepository,
                           ProductService productService,
                           SystemConfigService configService) {
        this.productRepository = productRepository;
        this.scriptRepository = scriptRepository;
        this.handlerRepository = handlerRepository;
        this.productService = productService;
        this.configService = configService;
    }

    @EventListener(ApplicationReadyEvent.class)
    @Order(1)
    public void seed() {
        if (productRepository.count() == 0) {
            log.info("Seeding products...");
            Product hotel = productRepository.save(Product.builder()
                    .name("Premium Hotel Booking Service")
                    .category("travel")
                    .description("Concierge hotel booking with free cancellation and airport transfer")
                    .price(new BigDecimal("4999.00"))
                    .build());
            productRepository.save(Product.builder()
                    .name("Business Insurance Package")
                    .category("insurance")
                    .description("Liability, property and cyber cover for small businesses")
                    .price(new BigDecimal("15000.00"))
                    .build());
            productService.activate(hotel.getId());
            seedScripts(hotel.getId());
        }
        if (handlerRepository.count() == 0) {
            log.info("Seeding objection handlers...");
            seedHandlers();
        }
        seedConfig();
        log.info("Seed data ready");
    }

    private void seedScripts(Long productId) {
        scriptRepository.saveAll(List.of(
                script(productId, ScriptType.GREETING, SalesMethod.CONSULTATIVE, ScriptStage.PRESENTATION, Language.EN, 5,
                        "Hello! I'm calling from {product_name}. I hope I'm not catching you at a bad time.",
                        null, 120L, Set.of(), Set.of()),
                script(productId, ScriptType.GREETING, SalesMethod.CONSULTATIVE, ScriptStage.PRESENTATION, Language.HI, 5,
                        "Namaste! Main {product_name} se call kar raha hun. Kya abhi baat karne ka sahi samay hai?",
                        null, 120L, Set.of(), Set.of()),
                script(productId, ScriptType.QUALIFICATION, SalesMethod.SPIN, ScriptStage.SITUATION, Language.EN, 4,
                        "Before I tell you about {product_name}, could you tell me how you book hotels today?",
                        null, 600L, Set.of(), Set.of()),
                script(productId, ScriptType.PRESENTATION, SalesMethod.CHALLENGER, ScriptStage.PRESENTATION, Language.EN, 4,
                        "Most travellers overpay for rooms they could cancel for free. {product_name} fixes that.",
                        10, null, Set.of(), Set.of()),
                script(productId, ScriptType.OBJECTION, SalesMethod.CONSULTATIVE, ScriptStage.PRESENTATION, Language.EN, 6,
                        "I hear you on the price. Members usually save more than the fee within two stays.",
                        null, null, Set.of(), Set.of(ObjectionType.PRICE)),
                script(productId, ScriptType.OBJECTION, SalesMethod.CONSULTATIVE, ScriptStage.PRESENTATION, Language.EN, 3,
                        "That's a fair concern. What would you need to hear to feel comfortable moving ahead?",
                        null, null, Set.of(), Set.of()),
                script(productId, ScriptType.CLOSING, SalesMethod.CHALLENGER, ScriptStage.CLOSING, Language.EN, 7,
                        "Shall I reserve {product_name} for you today? The current rate is held until tonight.",
                        20, null, Set.of(), Set.of())
        ));
    }

    private static SalesScript script(Long productId, ScriptType type, SalesMethod method, ScriptStage stage,
                                      Language language, int priority, String content, Integer minScore,
                                      Long maxDuration, Set<String> triggers, Set<ObjectionType> required) {
        return SalesScript.builder()
                .productId(productId)
                .scriptType(type)
                .technique(method)
                .stage(stage)
                .language(language)
                .priority(priority)
                .content(content)
                .conditions(new ScriptConditions(minScore, maxDuration))
                .triggers(new HashSet<>(triggers))
                .requiredObjections(new HashSet<>(required))
                .variables(new ArrayList<>(List.of(ScriptVariable.builder()
                        .name("product_name").type("text").defaultValue("our service")
                        .description("Name of the product").build())))
                .build();
    }

    private void seedHandlers() {
        handlerRepository.saveAll(List.of(
                handler(ObjectionType.PRICE, Language.EN, HandlerTechnique.VALUE_REINFORCEMENT,
                        "I completely understand your concern about the price. Most of our customers save money in the long run.",
                        List.of("What would you consider a fair price?", "What's your budget range?")),
                handler(ObjectionType.PRICE, Language.HI, HandlerTechnique.VALUE_REINFORCEMENT,
                        "Main samajh sakta hun ki aapko price ki chinta hai. Hamare customers long run mein paise bachate hain.",
                        List.of("Aapka budget kitna hai?")),
                handler(ObjectionType.TIMING, Language.EN, HandlerTechnique.EMPATHY_REFRAME,
                        "I understand you need time to think. What specific concerns can I address right now?",
                        List.of("What would help you decide?")),
                handler(ObjectionType.COMPETITION, Language.EN, HandlerTechnique.QUESTION,
                        "It's great that you're comparing options. What made you consider alternatives?",
                        List.of("What do you like about your current provider?")),
                handler(ObjectionType.TRUST, Language.EN, HandlerTechnique.SOCIAL_PROOF,
                        "That's fair. Thousands of customers use us every month, and cancellation is always free.",
                        List.of("Would a written guarantee help?")),
                handler(ObjectionType.AUTHORITY, Language.EN, HandlerTechnique.ALTERNATIVE,
                        "Of course. Would it help if I sent a short summary you can share with them?",
                        List.of("When will you be speaking with them?")),
                handler(ObjectionType.NEED, Language.EN, HandlerTechnique.QUESTION,
                        "Understood. How often do you travel for work or leisure?",
                        List.of("What does a typical trip look like for you?")),
                handler(ObjectionType.BUDGET, Language.EN, HandlerTechnique.ALTERNATIVE,
                        "No problem, we have a lighter plan that fits a tighter budget.",
                        List.of("Would a monthly plan work better?")),
                handler(ObjectionType.URGENCY, Language.EN, HandlerTechnique.URGENCY,
                        "Sure, there's no rush. Just so you know, the current rate is only held this week.",
                        List.of("Should I call you back before it expires?")),
                handler(ObjectionType.OTHER, Language.EN, HandlerTechnique.EMPATHY_REFRAME,
                        "I understand, thank you for your time. May I ask what would make this relevant for you?",
                        List.of())
        ));
    }

    private static ObjectionHandler handler(ObjectionType type, Language language, HandlerTechnique technique,
                                            String response, List<String> followUps) {
        return ObjectionHandler.builder()
                .objectionType(type)
                .language(language)
                .technique(technique)
                .response(response)
                .keywords(new HashSet<>(Set.of(type.getCode())))
                .followUpQuestions(new ArrayList<>(followUps))
                .priority(1)
                .build();
    }

    private void seedConfig() {
        configService.define(config("tts_provider", "voice", ConfigDataType.STRING, "openai",
                "TTS voice provider", ConfigRules.builder().options("openai,azure,google").build()));
        configService.define(config("tts_speed", "voice", ConfigDataType.NUMBER, "1.0",
                "Speech speed multiplier", ConfigRules.builder().min(0.5).max(2.0).build()));
        configService.define(config("supported_languages", "language", ConfigDataType.LIST, "en,hi,mixed",
                "Languages the bot may answer in", ConfigRules.builder().options("en,hi,mixed").build()));
        configService.define(config("max_call_duration", "call", ConfigDataType.NUMBER, "1800",
                "Soft limit for a single call in seconds", ConfigRules.builder().min(60.0).max(7200.0).build()));
        configService.define(config("call_recording_enabled", "call", ConfigDataType.BOOLEAN, "true",
                "Store call audio", new ConfigRules()));
    }

    private static SystemConfig config(String name, String category, ConfigDataType type, String value,
                                       String description, ConfigRules rules) {
        return SystemConfig.builder()
                .name(name)
                .category(category)
                .dataType(type)
                .value(value)
                .description(description)
                .validation(rules)
                .build();
    }
}
