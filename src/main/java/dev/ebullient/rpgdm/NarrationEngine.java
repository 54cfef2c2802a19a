package dev.ebullient.rpgdm;

import java.util.ArrayList;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import dev.ebullient.rpgdm.chat.ContextMessages;
import dev.ebullient.rpgdm.chat.NarrativeGenerator;
import dev.ebullient.rpgdm.chat.ToolRegistry;
import dev.ebullient.rpgdm.chat.ToolResult;
import dev.ebullient.rpgdm.memory.ContextAssembler;
import dev.ebullient.rpgdm.memory.ContextPackage;
import dev.ebullient.rpgdm.model.EventPayload;
import dev.ebullient.rpgdm.model.Session;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;

/**
 * One narration turn: record the player's action, assemble context, ask the generator,
 * run any tools it asks for, and record the narration it finally returns.
 */
@ApplicationScoped
public class NarrationEngine {
    private static final Logger log = Logger.getLogger(NarrationEngine.class);

    @Inject
    SessionLog sessionLog;

    @Inject
    ContextAssembler contextAssembler;

    @Inject
    ToolRegistry toolRegistry;

    @Inject
    Instance<NarrativeGenerator> generator;

    NarrativeGenerator narrativeGenerator;

    @ConfigProperty(name = "rpgdm.narration.max-tool-rounds", defaultValue = "3")
    int maxToolRounds;

    @ConfigProperty(name = "rpgdm.narration.narrator", defaultValue = "DM")
    String narrator;

    public record NarrationResult(String narration, String eventId, ContextPackage context, int toolCalls) {
    }

    /**
     * Record player input and narrate the outcome.
     *
     * @throws NoActiveSceneException if no scene is active
     */
    public NarrationResult narrate(Session session, String player, String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("Empty player input");
        }
        sessionLog.logEvent(session, player, new EventPayload.PlayerAction(input.trim()));
        return continueNarration(session);
    }

    /**
     * Narrate from the current state of the log, e.g. after a roll the player made.
     */
    public NarrationResult continueNarration(Session session) {
        if (session.activeScene().isEmpty()) {
            throw new NoActiveSceneException(session.id(), "narrate");
        }
        NarrativeGenerator activeGenerator = resolveGenerator();
        ContextPackage context = contextAssembler.buildContext(session);
        context.warning().ifPresent(w -> log.infof("%s: narrating with an oversized scene (%s)",
                session.id(), w.message()));

        List<ChatMessage> messages = new ArrayList<>(ContextMessages.toChatMessages(context));
        List<ToolSpecification> tools = toolRegistry.specifications();
        int toolCalls = 0;

        for (int round = 0;; round++) {
            boolean toolsAllowed = round < maxToolRounds;
            AiMessage response = activeGenerator.generate(messages, toolsAllowed ? tools : List.of());

            if (!response.hasToolExecutionRequests()) {
                String narration = response.text() == null ? "" : response.text().trim();
                if (narration.isEmpty()) {
                    throw new IllegalStateException("Narrative generator returned no text");
                }
                String eventId = sessionLog.logEvent(session, narrator, new EventPayload.Narration(narration));
                return new NarrationResult(narration, eventId, context, toolCalls);
            }
            if (!toolsAllowed) {
                throw new IllegalStateException(
                        "Narrative generator kept requesting tools after " + maxToolRounds + " rounds");
            }

            messages.add(response);
            for (ToolExecutionRequest request : response.toolExecutionRequests()) {
                ToolResult result = toolRegistry.execute(session, request);
                sessionLog.logEvent(session, narrator,
                        new EventPayload.ToolCall(request.name(), request.arguments(), result.text()));
                messages.add(ToolExecutionResultMessage.from(request, result.text()));
                toolCalls++;
            }
        }
    }

    private synchronized NarrativeGenerator resolveGenerator() {
        if (narrativeGenerator == null) {
            if (generator == null || !generator.isResolvable()) {
                throw new IllegalStateException("No NarrativeGenerator is configured");
            }
            narrativeGenerator = generator.get();
        }
        return narrativeGenerator;
    }
}
