package dev.ebullient.rpgdm.memory;

import java.util.List;

/**
 * Renders a {@link ContextPackage} as markdown for a prompt.
 */
public class ContextRenderer {

    public static final String EMPTY = "No events yet.";

    private ContextRenderer() {
    }

    public static String render(ContextPackage context) {
        if (context.isEmpty()) {
            return EMPTY;
        }
        StringBuilder sb = new StringBuilder();
        List<ContextBlock> summaries = context.blocks(ContextLayer.SUMMARIES);
        if (!summaries.isEmpty()) {
            sb.append("## Earlier Events\n");
            summaries.forEach(b -> sb.append(b.text()).append('\n'));
        }
        String sceneId = null;
        for (ContextBlock block : context.blocks()) {
            if (block.isSummary()) {
                continue;
            }
            if (!block.sceneId().equals(sceneId)) {
                sceneId = block.sceneId();
                if (!sb.isEmpty()) {
                    sb.append('\n');
                }
                sb.append("## ").append(block.sceneTitle());
                if (block.layer() == ContextLayer.CURRENT_SCENE) {
                    sb.append(" (current)");
                }
                sb.append('\n');
                if (block.location() != null && !block.location().isBlank()) {
                    sb.append("Location: ").append(block.location()).append('\n');
                }
            }
            sb.append(block.text()).append('\n');
        }
        return sb.toString().trim();
    }
}
