package dev.ebullient.rpgdm.chat;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import org.jboss.logging.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import dev.ebullient.rpgdm.model.Session;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;

/**
 * Explicit name → tool mapping. Tools are checked when they are registered, not when
 * the narrator first calls them.
 */
@Singleton
public class ToolRegistry {
    private static final Logger log = Logger.getLogger(ToolRegistry.class);

    private static final Pattern TOOL_NAME = Pattern.compile("[a-zA-Z0-9_-]{1,64}");

    private final Map<String, GameTool> tools = new ConcurrentHashMap<>();

    @Inject
    Instance<GameTool> discovered;

    @Inject
    ObjectMapper objectMapper;

    @PostConstruct
    void registerDiscovered() {
        discovered.forEach(this::register);
    }

    /**
     * @throws IllegalArgumentException if the tool has no usable specification
     *         or its name is already taken
     */
    public void register(GameTool tool) {
        ToolSpecification spec = tool.specification();
        if (spec == null) {
            throw new IllegalArgumentException("Tool " + tool.getClass().getSimpleName() + " has no specification");
        }
        if (spec.name() == null || !TOOL_NAME.matcher(spec.name()).matches()) {
            throw new IllegalArgumentException("Invalid tool name: " + spec.name());
        }
        if (spec.description() == null || spec.description().isBlank()) {
            throw new IllegalArgumentException("Tool " + spec.name() + " needs a description");
        }
        if (spec.parameters() == null) {
            throw new IllegalArgumentException("Tool " + spec.name() + " needs a parameter schema");
        }
        GameTool existing = tools.putIfAbsent(spec.name(), tool);
        if (existing != null) {
            throw new IllegalArgumentException("Tool already registered: " + spec.name());
        }
        log.infof("Registered tool %s", spec.name());
    }

    public Optional<GameTool> tool(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public List<ToolSpecification> specifications() {
        return tools.values().stream()
                .map(GameTool::specification)
                .sorted((a, b) -> a.name().compareTo(b.name()))
                .toList();
    }

    /**
     * Run a tool call from the narrator. Problems the narrator can correct (unknown
     * tool, bad arguments) come back as an error result instead of an exception.
     */
    public ToolResult execute(Session session, ToolExecutionRequest request) {
        GameTool tool = tools.get(request.name());
        if (tool == null) {
            log.warnf("%s: unknown tool requested: %s", session.id(), request.name());
            return ToolResult.failure("unknown tool " + request.name());
        }
        JsonNode arguments;
        try {
            String raw = request.arguments();
            arguments = raw == null || raw.isBlank()
                    ? objectMapper.createObjectNode()
                    : objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            return ToolResult.failure("arguments are not valid JSON: " + e.getOriginalMessage());
        }
        try {
            log.debugf("%s: %s(%s)", session.id(), request.name(), request.arguments());
            return ToolResult.success(tool.execute(session, arguments));
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.debugf("%s: %s failed: %s", session.id(), request.name(), e.getMessage());
            return ToolResult.failure(e.getMessage());
        }
    }
}
