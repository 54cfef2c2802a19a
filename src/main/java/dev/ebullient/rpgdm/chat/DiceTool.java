package dev.ebullient.rpgdm.chat;

import java.util.List;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.JsonNode;

import dev.ebullient.rpgdm.DiceService;
import dev.ebullient.rpgdm.SessionLog;
import dev.ebullient.rpgdm.model.RollResult;
import dev.ebullient.rpgdm.model.Session;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;

/**
 * Lets the narrator roll dice. Every roll is recorded in the active scene.
 */
@ApplicationScoped
public class DiceTool implements GameTool {

    public static final String NAME = "roll_dice";

    @Inject
    DiceService dice;

    @Inject
    SessionLog sessionLog;

    private final ToolSpecification specification = ToolSpecification.builder()
            .name(NAME)
            .description("""
                    Roll dice using standard notation and record the result in the journal.
                    Examples: d20, 2d6+3, 4d6kh3 (keep highest 3), 2d20kl1 (keep lowest),
                    d20adv / d20dis (advantage / disadvantage), 6#4d6kh3 (six separate rolls).
                    Returns the rolled values and totals.
                    """)
            .parameters(JsonObjectSchema.builder()
                    .addStringProperty("notation", "Dice notation to roll")
                    .addStringProperty("actor", "Who is rolling, e.g. the player character or an NPC")
                    .addStringProperty("reason", "What the roll is for")
                    .required("notation")
                    .build())
            .build();

    @Override
    public ToolSpecification specification() {
        return specification;
    }

    @Override
    public String execute(Session session, JsonNode arguments) {
        String notation = arguments.path("notation").asText("");
        if (notation.isBlank()) {
            throw new IllegalArgumentException("notation is required");
        }
        String actor = arguments.path("actor").asText("");
        List<RollResult> results = dice.roll(notation);
        for (RollResult result : results) {
            sessionLog.logRoll(session, actor.isBlank() ? null : actor, result);
        }
        String reason = arguments.path("reason").asText("");
        return results.stream()
                .map(RollResult::toJournalEntry)
                .collect(Collectors.joining("\n", reason.isBlank() ? "" : reason + ":\n", ""));
    }
}
