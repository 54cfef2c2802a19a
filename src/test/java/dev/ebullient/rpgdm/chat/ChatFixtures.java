package dev.ebullient.rpgdm.chat;

import com.fasterxml.jackson.databind.ObjectMapper;

import dev.ebullient.rpgdm.DiceService;
import dev.ebullient.rpgdm.SessionLog;

public class ChatFixtures {

    public static DiceTool diceTool(DiceService dice, SessionLog sessionLog) {
        DiceTool tool = new DiceTool();
        tool.dice = dice;
        tool.sessionLog = sessionLog;
        return tool;
    }

    public static ToolRegistry registry(GameTool... tools) {
        ToolRegistry registry = new ToolRegistry();
        registry.objectMapper = new ObjectMapper();
        for (GameTool tool : tools) {
            registry.register(tool);
        }
        return registry;
    }
}
