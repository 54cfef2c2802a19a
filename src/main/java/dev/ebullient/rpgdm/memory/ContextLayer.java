package dev.ebullient.rpgdm.memory;

/**
 * Selection tiers, in the order the assembler fills them.
 */
public enum ContextLayer {
    /** Every event of the active scene; never trimmed. */
    CURRENT_SCENE,
    /** Whole, recently ended scenes. */
    RECENT_SCENES,
    /** One summary line per older scene. */
    SUMMARIES
}
