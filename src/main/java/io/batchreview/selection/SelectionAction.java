package io.batchreview.selection;

import java.util.Locale;

public enum SelectionAction {
    /** Flip one item and move the anchor to it. */
    TOGGLE,
    /** Union the span between the anchor and the clicked item. */
    RANGE,
    /** Move the anchor only. */
    ANCHOR,
    /** Select or deselect every member of the clicked item's chain. */
    CHAIN;

    /**
     * Maps a pointer interaction onto an action. Shift wins over Ctrl/Cmd; a checkbox behaves
     * like Ctrl/Cmd; a bare row click only moves the anchor.
     */
    public static SelectionAction fromModifiers(boolean shift, boolean toggleModifier, boolean checkbox) {
        if (shift) {
            return RANGE;
        }
        if (toggleModifier || checkbox) {
            return TOGGLE;
        }
        return ANCHOR;
    }

    public static SelectionAction fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Selection action is required");
        }
        String value = raw.trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "toggle" -> TOGGLE;
            case "range" -> RANGE;
            case "anchor", "click" -> ANCHOR;
            case "chain" -> CHAIN;
            default -> throw new IllegalArgumentException("Unknown selection action: " + raw);
        };
    }
}
