package com.sheetfunctions.docs.expansion;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Expanded text per formula name for one build. Each name moves from {@link State#UNEXPANDED} through
 * {@link State#EXPANDING} to {@link State#EXPANDED} or {@link State#FAILED}, and can be expanded at
 * most once. Not thread-safe; a build owns its cache.
 */
public final class ExpansionCache {

    public enum State {
        UNEXPANDED,
        EXPANDING,
        EXPANDED,
        FAILED
    }

    private final Map<String, State> states = new HashMap<>();
    private final Map<String, String> expanded = new LinkedHashMap<>();

    public State stateOf(String name) {
        return states.getOrDefault(Objects.requireNonNull(name, "name"), State.UNEXPANDED);
    }

    public Optional<String> get(String name) {
        return Optional.ofNullable(expanded.get(name));
    }

    public void markExpanding(String name) {
        State state = stateOf(name);
        if (state != State.UNEXPANDED) {
            throw new IllegalStateException("Cannot start expanding " + name + " in state " + state);
        }
        states.put(name, State.EXPANDING);
    }

    public void complete(String name, String text) {
        Objects.requireNonNull(text, "text");
        State state = stateOf(name);
        if (state != State.EXPANDING) {
            throw new IllegalStateException("Cannot complete " + name + " in state " + state);
        }
        states.put(name, State.EXPANDED);
        expanded.put(name, text);
    }

    public void fail(String name) {
        State state = stateOf(name);
        if (state == State.EXPANDED) {
            throw new IllegalStateException("Cannot fail already expanded formula " + name);
        }
        states.put(name, State.FAILED);
    }

    /** Number of formulas expanded so far. */
    public int expansionCount() {
        return expanded.size();
    }

    /** Expanded texts in completion order. */
    public Map<String, String> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(expanded));
    }
}
