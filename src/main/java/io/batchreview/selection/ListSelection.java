package io.batchreview.selection;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

public record ListSelection(Set<String> selected, String anchor) {
    private static final ListSelection EMPTY = new ListSelection(Set.of(), null);

    public ListSelection {
        selected = Collections.unmodifiableSet(new LinkedHashSet<>(selected));
    }

    public static ListSelection empty() {
        return EMPTY;
    }

    public boolean isSelected(String restId) {
        return selected.contains(restId);
    }
}
