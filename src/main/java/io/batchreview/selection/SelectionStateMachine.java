package io.batchreview.selection;

import io.batchreview.model.ChainInfo;
import io.batchreview.model.QueueKind;
import io.batchreview.model.ReviewItem;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Multi-select state of the two queues, kept apart from any rendering code.
 *
 * <p>Each list has a selected set and an anchor. The anchor is stored by restId and is dropped
 * as soon as it no longer resolves in the list, so a range never spans a stale position.
 * Selected ids that leave the list are pruned as well. Not thread-safe; the orchestration core
 * drives it from its owner thread.
 */
public final class SelectionStateMachine {
    private final Map<QueueKind, State> states;

    public SelectionStateMachine() {
        this.states = new EnumMap<>(QueueKind.class);
        for (QueueKind kind : QueueKind.values()) {
            states.put(kind, new State());
        }
    }

    /**
     * Applies one click.
     *
     * @param list   current contents of {@code event.list()}
     * @param chains chain info by restId; missing entries read as standalone
     * @return whether the selected set or the anchor changed
     */
    public boolean apply(SelectionEvent event, List<ReviewItem> list, Map<String, ChainInfo> chains) {
        List<String> ids = ids(list);
        int index = resolveIndex(ids, event);
        if (index < 0) {
            return false;
        }
        State state = states.get(event.list());
        String clicked = ids.get(index);
        Set<String> before = new LinkedHashSet<>(state.selected);
        String anchorBefore = state.anchor;
        switch (event.action()) {
            case TOGGLE -> {
                if (!state.selected.remove(clicked)) {
                    state.selected.add(clicked);
                }
                state.anchor = clicked;
            }
            case RANGE -> {
                int anchorIndex = state.anchor == null ? -1 : ids.indexOf(state.anchor);
                int start = Math.max(anchorIndex, 0);
                int from = Math.min(start, index);
                int to = Math.max(start, index);
                state.selected.addAll(ids.subList(from, to + 1));
                if (anchorIndex < 0) {
                    state.anchor = clicked;
                }
            }
            case ANCHOR -> state.anchor = clicked;
            case CHAIN -> {
                List<String> members = chainMembers(list, chains, clicked);
                if (!members.isEmpty()) {
                    if (state.selected.containsAll(members)) {
                        members.forEach(state.selected::remove);
                    } else {
                        state.selected.addAll(members);
                    }
                }
                state.anchor = clicked;
            }
        }
        return !before.equals(state.selected) || !Objects.equals(anchorBefore, state.anchor);
    }

    public void selectAll(QueueKind kind, List<ReviewItem> list) {
        State state = states.get(kind);
        state.selected.clear();
        state.selected.addAll(ids(list));
    }

    public void selectNone(QueueKind kind) {
        states.get(kind).selected.clear();
    }

    /**
     * Re-validates one list's state after its membership or order changed.
     *
     * @return whether anything was pruned
     */
    public boolean onListChanged(QueueKind kind, List<ReviewItem> list) {
        State state = states.get(kind);
        Set<String> present = new LinkedHashSet<>(ids(list));
        boolean changed = state.selected.retainAll(present);
        if (state.anchor != null && !present.contains(state.anchor)) {
            state.anchor = null;
            changed = true;
        }
        return changed;
    }

    public Set<String> selected(QueueKind kind) {
        return Set.copyOf(states.get(kind).selected);
    }

    /**
     * Selected ids of {@code kind} in list order.
     */
    public List<String> selectedInOrder(QueueKind kind, List<ReviewItem> list) {
        State state = states.get(kind);
        List<String> out = new ArrayList<>();
        for (ReviewItem item : list) {
            if (state.selected.contains(item.restId())) {
                out.add(item.restId());
            }
        }
        return out;
    }

    public String anchor(QueueKind kind) {
        return states.get(kind).anchor;
    }

    public SelectionSnapshot snapshot() {
        return new SelectionSnapshot(view(QueueKind.INCOMING), view(QueueKind.BATCH));
    }

    private ListSelection view(QueueKind kind) {
        State state = states.get(kind);
        return new ListSelection(state.selected, state.anchor);
    }

    private static int resolveIndex(List<String> ids, SelectionEvent event) {
        int index = event.index();
        if (index >= 0 && index < ids.size() && ids.get(index).equals(event.restId())) {
            return index;
        }
        return ids.indexOf(event.restId());
    }

    private static List<String> chainMembers(List<ReviewItem> list, Map<String, ChainInfo> chains, String clicked) {
        ChainInfo own = chains.get(clicked);
        List<String> out = new ArrayList<>();
        if (own == null || !own.inChain() || own.chainBaseId() == null) {
            return out;
        }
        for (ReviewItem item : list) {
            ChainInfo info = chains.get(item.restId());
            if (info != null && info.inChain() && own.chainBaseId().equals(info.chainBaseId())) {
                out.add(item.restId());
            }
        }
        return out;
    }

    private static List<String> ids(List<ReviewItem> list) {
        List<String> out = new ArrayList<>(list.size());
        for (ReviewItem item : list) {
            out.add(item.restId());
        }
        return out;
    }

    private static final class State {
        private final Set<String> selected = new LinkedHashSet<>();
        private String anchor;
    }
}
