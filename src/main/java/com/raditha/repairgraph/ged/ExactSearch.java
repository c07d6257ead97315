package com.raditha.repairgraph.ged;

import com.raditha.repairgraph.ged.SearchSpace.Child;
import com.raditha.repairgraph.ged.SearchSpace.State;

import java.util.ArrayList;
import java.util.List;

/**
 * Depth-first branch and bound over every candidate at every level. Used when the requested beam
 * is at least as wide as the whole mapping space, so the answer it returns is the true distance.
 */
final class ExactSearch {

    private static final int DEADLINE_CHECK_INTERVAL = 256;

    private final SearchSpace space;
    private final Deadline deadline;
    private int best;
    private long expansions;
    private boolean interrupted;

    private ExactSearch(SearchSpace space, int incumbent, Deadline deadline) {
        this.space = space;
        this.best = incumbent;
        this.deadline = deadline;
    }

    /**
     * @param cost     the optimal cost, or the best cost seen when not complete
     * @param complete false when the deadline stopped the search
     */
    record Outcome(int cost, boolean complete) {
    }

    static Outcome run(SearchSpace space, int incumbent, Deadline deadline) {
        ExactSearch search = new ExactSearch(space, incumbent, deadline);
        search.expand(space.root());
        return new Outcome(search.best, !search.interrupted);
    }

    private void expand(State state) {
        if (++expansions % DEADLINE_CHECK_INTERVAL == 0 && deadline.expired()) {
            interrupted = true;
            return;
        }
        if (state.level == space.levels()) {
            best = Math.min(best, state.f());
            return;
        }
        List<Child> children = new ArrayList<>();
        for (int candidate : space.candidates(state, true)) {
            Child child = space.score(state, 0, candidate);
            if (child.f() < best) {
                children.add(child);
            }
        }
        children.sort(Child.RANKING);
        for (Child child : children) {
            if (child.f() >= best) {
                break;
            }
            expand(space.extend(state, child));
            if (interrupted) {
                return;
            }
        }
    }
}
