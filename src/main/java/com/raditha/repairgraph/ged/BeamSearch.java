package com.raditha.repairgraph.ged;

import com.raditha.repairgraph.ged.SearchSpace.Child;
import com.raditha.repairgraph.ged.SearchSpace.State;

import java.util.ArrayList;
import java.util.List;

/**
 * Level-by-level beam search over partial mappings.
 * <p>
 * Every level scores all extensions of the current beam, ranks them by f then h, and materializes
 * only the best {@code width}. Extensions that cannot beat the incumbent are dropped before ranking.
 */
final class BeamSearch {

    private BeamSearch() {
    }

    /**
     * @param best        cheapest complete mapping found, or null if every extension was pruned
     * @param frontier    best partial mapping at the level where the deadline was hit
     * @param interrupted true when the deadline expired before the last level
     */
    record Run(State best, State frontier, boolean interrupted) {
    }

    static Run run(SearchSpace space, State start, int width, int incumbent, Deadline deadline) {
        List<State> beam = List.of(start);
        for (int level = start.level; level < space.levels(); level++) {
            if (deadline.expired()) {
                return new Run(null, beam.get(0), true);
            }
            List<Child> children = new ArrayList<>();
            for (int i = 0; i < beam.size(); i++) {
                State state = beam.get(i);
                for (int candidate : space.candidates(state, false)) {
                    Child child = space.score(state, i, candidate);
                    if (child.f() < incumbent) {
                        children.add(child);
                    }
                }
            }
            if (children.isEmpty()) {
                return new Run(null, null, false);
            }
            children.sort(Child.RANKING);
            List<State> next = new ArrayList<>(Math.min(width, children.size()));
            for (int i = 0; i < width && i < children.size(); i++) {
                Child child = children.get(i);
                next.add(space.extend(beam.get(child.parent()), child));
            }
            beam = next;
        }
        return new Run(beam.get(0), null, false);
    }

    /**
     * Finish a partial mapping greedily, one best-ranked extension per level, with no deadline.
     */
    static State complete(SearchSpace space, State partial) {
        return run(space, partial, 1, Integer.MAX_VALUE, Deadline.none()).best();
    }
}
