package dev.ebullient.rpgdm.chat;

import java.util.List;

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;

/**
 * The text-generation service. Given the assembled context it answers with
 * narrative text or with tool execution requests.
 * <p>
 * Implementations never touch the session log; everything they produce is
 * recorded by {@link dev.ebullient.rpgdm.NarrationEngine}.
 */
@FunctionalInterface
public interface NarrativeGenerator {

    AiMessage generate(List<ChatMessage> messages, List<ToolSpecification> tools);
}
