package org.pragmatica.fsfmt.trivia;

/**
 * Where trivia is emitted relative to its anchor.
 */
public enum Placement {
    BEFORE,
    AFTER,
    /**
     * Replaces the canonical rendering of the anchor, used for literal spellings.
     */
    ITSELF
}
