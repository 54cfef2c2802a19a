package dev.ebullient.rpgdm.chat;

import com.fasterxml.jackson.databind.JsonNode;

import dev.ebullient.rpgdm.model.Session;
import dev.langchain4j.agent.tool.ToolSpecification;

/**
 * A capability the narrator may call. Tools are registered with the {@link ToolRegistry}.
 */
public interface GameTool {

    ToolSpecification specification();

    /**
     * @param arguments parsed arguments; an empty object when none were sent
     * @return text handed back to the narrator
     * @throws IllegalArgumentException for arguments the tool cannot use
     */
    String execute(Session session, JsonNode arguments);
}
