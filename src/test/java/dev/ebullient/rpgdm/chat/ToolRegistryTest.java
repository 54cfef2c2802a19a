package dev.ebullient.rpgdm.chat;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;

import dev.ebullient.rpgdm.SessionFixtures;
import dev.ebullient.rpgdm.SessionLog;
import dev.ebullient.rpgdm.dice.ScriptedRandomSource;
import dev.ebullient.rpgdm.model.Event;
import dev.ebullient.rpgdm.model.EventPayload;
import dev.ebullient.rpgdm.model.EventType;
import dev.ebullient.rpgdm.model.Session;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;

class ToolRegistryTest {

    @TempDir
    Path tempDir;

    SessionLog sessionLog;
    Session session;
    ToolRegistry registry;

    @BeforeEach
    void setUp() {
        sessionLog = SessionFixtures.sessionLog(tempDir);
        session = sessionLog.createSession("tools");
        sessionLog.startScene(session, "Courtyard", "Keep", List.of("Aria"));
        DiceTool diceTool = ChatFixtures.diceTool(
                SessionFixtures.diceService(new ScriptedRandomSource(3, 5, 6, 6, 6, 1)), sessionLog);
        registry = ChatFixtures.registry(diceTool);
    }

    @Test
    void diceToolRollsAndRecords() {
        ToolResult result = registry.execute(session,
                request("roll_dice", "{\"notation\": \"2d6\", \"actor\": \"Aria\", \"reason\": \"Climb the wall\"}"));

        assertFalse(result.error());
        assertEquals("Climb the wall:\n**Roll** 2d6: Rolled 2d6: [3, 5] = 8 → **8**", result.text());

        Event event = session.activeScene().orElseThrow().events().get(0);
        assertEquals(EventType.DICE_ROLL, event.type());
        assertEquals("Aria", event.actor());
        assertEquals(8, ((EventPayload.DiceRoll) event.payload()).total());
    }

    @Test
    void diceToolRecordsEachRepetition() {
        ToolResult result = registry.execute(session, request("roll_dice", "{\"notation\": \"2#2d6\"}"));

        assertEquals(2, result.text().lines().count());
        assertEquals(2, session.eventCount());
        assertNull(session.activeScene().orElseThrow().events().get(0).actor());
    }

    @Test
    void problemsComeBackAsErrors() {
        ToolResult unknown = registry.execute(session, request("cast_spell", "{}"));
        assertTrue(unknown.error());
        assertEquals("Error: unknown tool cast_spell", unknown.text());

        ToolResult badJson = registry.execute(session, request("roll_dice", "{notation"));
        assertTrue(badJson.error());
        assertTrue(badJson.text().startsWith("Error: arguments are not valid JSON"));

        ToolResult missing = registry.execute(session, request("roll_dice", ""));
        assertEquals("Error: notation is required", missing.text());

        ToolResult invalid = registry.execute(session, request("roll_dice", "{\"notation\": \"3d6kh5\"}"));
        assertTrue(invalid.error());
        assertTrue(invalid.text().contains("3d6kh5"), invalid.text());

        assertEquals(0, session.eventCount());
    }

    @Test
    void toolFailsWithoutActiveScene() {
        sessionLog.endScene(session, null);
        ToolResult result = registry.execute(session, request("roll_dice", "{\"notation\": \"d6\"}"));
        assertTrue(result.error());
        assertTrue(result.text().contains("no active scene"), result.text());
    }

    @Test
    void registrationIsValidated() {
        assertThrows(IllegalArgumentException.class, () -> registry.register(new EchoTool("roll_dice")));
        assertThrows(IllegalArgumentException.class, () -> registry.register(new EchoTool("has spaces")));
        assertThrows(IllegalArgumentException.class, () -> registry.register(new EchoTool("")));
        assertThrows(IllegalArgumentException.class, () -> registry.register(new EchoTool("x".repeat(65))));
        assertThrows(IllegalArgumentException.class, () -> registry.register(new BareTool(ToolSpecification.builder()
                .name("undocumented")
                .parameters(JsonObjectSchema.builder().build())
                .build())));
        assertThrows(IllegalArgumentException.class, () -> registry.register(new BareTool(ToolSpecification.builder()
                .name("no_schema")
                .description("Has no parameter schema")
                .build())));

        registry.register(new EchoTool("echo"));
        assertEquals(List.of("echo", "roll_dice"),
                registry.specifications().stream().map(ToolSpecification::name).toList());
        assertTrue(registry.tool("echo").isPresent());
        assertTrue(registry.tool("missing").isEmpty());
    }

    @Test
    void argumentsReachTheTool() {
        registry.register(new EchoTool("echo"));
        assertEquals("hello", registry.execute(session, request("echo", "{\"text\": \"hello\"}")).text());
        assertEquals("", registry.execute(session, request("echo", null)).text());
    }

    static ToolExecutionRequest request(String name, String arguments) {
        return ToolExecutionRequest.builder()
                .id("call-" + name)
                .name(name)
                .arguments(arguments)
                .build();
    }

    static class EchoTool implements GameTool {
        final ToolSpecification specification;

        EchoTool(String name) {
            specification = ToolSpecification.builder()
                    .name(name)
                    .description("Echo the text argument")
                    .parameters(JsonObjectSchema.builder()
                            .addStringProperty("text")
                            .build())
                    .build();
        }

        @Override
        public ToolSpecification specification() {
            return specification;
        }

        @Override
        public String execute(Session session, JsonNode arguments) {
            return arguments.path("text").asText("");
        }
    }

    record BareTool(ToolSpecification specification) implements GameTool {
        @Override
        public String execute(Session session, JsonNode arguments) {
            return "";
        }
    }
}
