package dev.ebullient.rpgdm.chat;

import java.util.ArrayList;
import java.util.List;

import dev.ebullient.rpgdm.memory.ContextBlock;
import dev.ebullient.rpgdm.memory.ContextLayer;
import dev.ebullient.rpgdm.memory.ContextPackage;
import dev.ebullient.rpgdm.memory.ContextRenderer;
import dev.ebullient.rpgdm.model.Event;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;

/**
 * Maps a {@link ContextPackage} onto chat messages.
 * <p>
 * Older material (summaries and recent scenes) becomes a single "story so far"
 * user message. Events of the current scene become one message each: player actions
 * are user turns, narration is an assistant turn, everything else is reported to the
 * narrator as a user turn.
 */
public class ContextMessages {

    private ContextMessages() {
    }

    public static List<ChatMessage> toChatMessages(ContextPackage context) {
        return toChatMessages(null, context);
    }

    /**
     * @param instructions optional system prompt, placed first
     */
    public static List<ChatMessage> toChatMessages(String instructions, ContextPackage context) {
        List<ChatMessage> messages = new ArrayList<>();
        if (instructions != null && !instructions.isBlank()) {
            messages.add(SystemMessage.from(instructions));
        }

        List<ContextBlock> history = context.blocks().stream()
                .filter(b -> b.layer() != ContextLayer.CURRENT_SCENE)
                .toList();
        if (!history.isEmpty()) {
            ContextPackage earlier = new ContextPackage(history, context.consumed(), context.budget(),
                    context.warning());
            messages.add(UserMessage.from("# Story so far\n\n" + ContextRenderer.render(earlier)));
        }

        for (ContextBlock block : context.blocks(ContextLayer.CURRENT_SCENE)) {
            messages.add(toMessage(block.event()));
        }
        return messages;
    }

    static ChatMessage toMessage(Event event) {
        return switch (event.type()) {
            case PLAYER_ACTION -> UserMessage.from(event.payload().describe());
            case NARRATION -> AiMessage.from(event.payload().describe());
            default -> UserMessage.from(event.render());
        };
    }
}
