package dev.ebullient.rpgdm.chat;

public record ToolResult(String text, boolean error) {

    public static ToolResult success(String text) {
        return new ToolResult(text, false);
    }

    public static ToolResult failure(String message) {
        return new ToolResult("Error: " + message, true);
    }
}
