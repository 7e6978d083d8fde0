/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.bedrock.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.bedrock.domain.model.ConversationTurn;
import me.golemcore.bedrock.domain.model.GenerationFailedException;
import me.golemcore.bedrock.domain.model.GenerationOutcome;
import me.golemcore.bedrock.domain.model.GenerationRequest;
import me.golemcore.bedrock.domain.model.InterpretedResult;
import me.golemcore.bedrock.domain.model.InvocationPhase;
import me.golemcore.bedrock.domain.model.LoopAssessment;
import me.golemcore.bedrock.domain.model.ParsedToolCalls;
import me.golemcore.bedrock.domain.model.ProviderEnvelope;
import me.golemcore.bedrock.domain.model.TerminalResponse;
import me.golemcore.bedrock.domain.model.ToolCall;
import me.golemcore.bedrock.infrastructure.config.BedrockProperties;
import me.golemcore.bedrock.infrastructure.config.ModelCatalogService;
import me.golemcore.bedrock.port.inbound.GenerationPort;
import me.golemcore.bedrock.port.outbound.ModelInvocationPort;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Runs one generation request through the pipeline:
 *
 * <pre>
 * START → loop guard ─┬→ TERMINATED_BY_GUARD
 *                     └→ FORMATTING → INVOKING → EXTRACTING → PARSING → DONE
 * </pre>
 *
 * <p>
 * A failure while formatting, invoking or extracting ends the request in
 * {@link InvocationPhase#FAILED}; retries only happen inside the invocation
 * port. Parsing never fails the request: unparseable tool calls stay in the
 * text.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvocationOrchestrator implements GenerationPort {

    private final LoopGuard loopGuard;
    private final TerminalResponseComposer terminalResponseComposer;
    private final ToolInstructionComposer toolInstructionComposer;
    private final RequestFormatter requestFormatter;
    private final ModelInvocationPort modelInvocationPort;
    private final ResponseExtractor responseExtractor;
    private final ToolCallParser toolCallParser;
    private final ModelCatalogService modelCatalog;
    private final BedrockProperties properties;

    @Override
    public CompletableFuture<GenerationOutcome> generate(GenerationRequest request) {
        List<ConversationTurn> messages = request.getMessages();
        log.debug("[Orchestrator] {} with {} turns", InvocationPhase.START, messages != null ? messages.size() : 0);

        LoopAssessment assessment = loopGuard.assess(messages);
        if (assessment.shouldForceTerminate()) {
            TerminalResponse terminal = terminalResponseComposer.compose(messages, assessment);
            log.info("[Orchestrator] {}: skipping model call", InvocationPhase.TERMINATED_BY_GUARD);
            return CompletableFuture.completedFuture(GenerationOutcome.terminated(terminal));
        }

        String model = properties.getModel();
        ProviderEnvelope envelope;
        String systemPrompt;
        try {
            systemPrompt = toolInstructionComposer.compose(request.getSystemPrompt(), request.getToolCatalog());
            envelope = requestFormatter.format(messages, systemPrompt, resolveMaxTokens(request, model),
                    resolveTemperature(request, model), modelCatalog.resolveModelId(model));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(fail(InvocationPhase.FORMATTING, e));
        }

        log.debug("[Orchestrator] {} {}", InvocationPhase.INVOKING, envelope.modelId());
        CompletableFuture<JsonNode> invocation = modelInvocationPort.invoke(envelope);
        CompletableFuture<GenerationOutcome> outcome = invocation.handle((raw, error) -> {
            if (error != null) {
                throw fail(InvocationPhase.INVOKING, unwrap(error));
            }
            InterpretedResult result = interpret(raw, envelope, assessment);
            logCostEstimate(model, messages, systemPrompt, result.getUsageEstimate());
            return GenerationOutcome.completed(result);
        });
        outcome.whenComplete((ignored, error) -> {
            if (outcome.isCancelled()) {
                invocation.cancel(true);
            }
        });
        return outcome;
    }

    @Override
    public Flux<String> generateStream(GenerationRequest request) {
        return Flux.create(sink -> generate(request).whenComplete((outcome, error) -> {
            if (error != null) {
                sink.error(unwrap(error));
            } else {
                sink.next(outcome.text());
                sink.complete();
            }
        }));
    }

    private InterpretedResult interpret(JsonNode raw, ProviderEnvelope envelope, LoopAssessment assessment) {
        String text;
        try {
            text = responseExtractor.extract(raw, envelope.family());
        } catch (RuntimeException e) {
            throw fail(InvocationPhase.EXTRACTING, e);
        }

        List<String> segments = List.of();
        List<ToolCall> toolCalls = List.of();
        try {
            ParsedToolCalls parsed = toolCallParser.parse(text, assessment.searchAlreadyPerformed());
            toolCalls = parsed.toolCalls();
            if (!parsed.remainingText().isBlank()) {
                segments = List.of(parsed.remainingText());
            }
        } catch (RuntimeException e) {
            log.warn("[Orchestrator] Tool-call parsing failed, keeping raw text: {}", e.getMessage());
        }
        if (segments.isEmpty() && toolCalls.isEmpty()) {
            segments = List.of(text);
        }

        InterpretedResult interpreted = InterpretedResult.builder()
                .textSegments(segments)
                .toolCalls(toolCalls)
                .usageEstimate(PromptTemplateEngine.countWords(text))
                .build();
        log.debug("[Orchestrator] {}: {} text segments, {} tool calls", InvocationPhase.DONE,
                interpreted.getTextSegments().size(), interpreted.getToolCalls().size());
        return interpreted;
    }

    private int resolveMaxTokens(GenerationRequest request, String model) {
        if (request.getMaxTokens() != null) {
            return request.getMaxTokens();
        }
        if (properties.getMaxTokens() != null) {
            return properties.getMaxTokens();
        }
        return modelCatalog.getDefaultMaxTokens(model);
    }

    private double resolveTemperature(GenerationRequest request, String model) {
        if (request.getTemperature() != null) {
            return request.getTemperature();
        }
        if (properties.getTemperature() != null) {
            return properties.getTemperature();
        }
        return modelCatalog.getDefaultTemperature(model);
    }

    private void logCostEstimate(String model, List<ConversationTurn> messages, String systemPrompt,
            int outputWords) {
        if (!log.isDebugEnabled() || modelCatalog.findModel(model).isEmpty()) {
            return;
        }
        int inputWords = PromptTemplateEngine.countWords(systemPrompt);
        for (ConversationTurn turn : messages) {
            inputWords += PromptTemplateEngine.countWords(turn.content());
        }
        log.debug("[Orchestrator] Estimated cost for {}: ${} ({} in / {} out words)", model,
                String.format("%.6f", modelCatalog.estimateCost(model, inputWords, outputWords)),
                inputWords, outputWords);
    }

    private GenerationFailedException fail(InvocationPhase phase, Throwable cause) {
        if (cause instanceof GenerationFailedException failed) {
            return failed;
        }
        log.error("[Orchestrator] {} during {}: {}", InvocationPhase.FAILED, phase, cause.getMessage());
        return new GenerationFailedException(phase, "Generation failed during " + phase + ": " + cause.getMessage(),
                cause);
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
