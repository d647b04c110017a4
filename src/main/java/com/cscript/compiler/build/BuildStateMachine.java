package com.cscript.compiler.build;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tracks the phase of a build and rejects out-of-order transitions.
 * {@link BuildState#FAILED} is reachable from every non-terminal state.
 */
public class BuildStateMachine {

    private static final Map<BuildState, Set<BuildState>> TRANSITIONS = Map.of(
            BuildState.IDLE, EnumSet.of(BuildState.LOWERED),
            BuildState.LOWERED, EnumSet.of(BuildState.PROFILING_BUILT, BuildState.FINAL_BUILT),
            // the final build may follow directly when the profiling run timed out
            BuildState.PROFILING_BUILT, EnumSet.of(BuildState.PROFILING_RUN, BuildState.FINAL_BUILT),
            BuildState.PROFILING_RUN, EnumSet.of(BuildState.FINAL_BUILT),
            BuildState.FINAL_BUILT, EnumSet.of(BuildState.DONE));

    private BuildState current = BuildState.IDLE;
    private final List<BuildState> history = new ArrayList<>(List.of(BuildState.IDLE));

    public BuildState getCurrent() {
        return current;
    }

    public List<BuildState> getHistory() {
        return List.copyOf(history);
    }

    public boolean canTransitionTo(BuildState next) {
        if (current.isTerminal()) {
            return false;
        }
        return next == BuildState.FAILED || TRANSITIONS.getOrDefault(current, Set.of()).contains(next);
    }

    public void transitionTo(BuildState next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException("Illegal build transition " + current + " -> " + next);
        }
        current = next;
        history.add(next);
    }

    public void fail() {
        transitionTo(BuildState.FAILED);
    }
}
