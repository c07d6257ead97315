package com.raditha.repairgraph.ged;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Maps graph size to beam width: wide beams for small graphs, narrow ones for large graphs.
 * The size is the larger node count of the two graphs being compared.
 * <p>
 * Written as a comma separated list of {@code limit:width} steps, a graph with fewer than
 * {@code limit} nodes getting that width, plus a {@code *:width} fallback, for example
 * {@code 20:100,50:50,100:20,201:10,*:1}.
 */
public final class BeamWidthPolicy {

    /**
     * Graphs with fewer than {@code belowNodes} nodes get {@code width}.
     */
    public record Step(int belowNodes, int width) {
        public Step {
            if (belowNodes < 1) {
                throw new IllegalArgumentException("Step limit must be positive: " + belowNodes);
            }
            if (width < 1) {
                throw new IllegalArgumentException("Beam width must be at least 1: " + width);
            }
        }
    }

    private static final BeamWidthPolicy DEFAULTS = new BeamWidthPolicy(List.of(
            new Step(20, 100),
            new Step(50, 50),
            new Step(100, 20),
            new Step(201, 10)), 1);

    private final List<Step> steps;
    private final int fallbackWidth;

    public BeamWidthPolicy(List<Step> steps, int fallbackWidth) {
        if (fallbackWidth < 1) {
            throw new IllegalArgumentException("Fallback beam width must be at least 1: " + fallbackWidth);
        }
        List<Step> sorted = new ArrayList<>(steps);
        sorted.sort(Comparator.comparingInt(Step::belowNodes));
        this.steps = List.copyOf(sorted);
        this.fallbackWidth = fallbackWidth;
    }

    public static BeamWidthPolicy defaults() {
        return DEFAULTS;
    }

    /**
     * A policy that always answers the same width.
     */
    public static BeamWidthPolicy fixed(int width) {
        return new BeamWidthPolicy(List.of(), width);
    }

    public static BeamWidthPolicy parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Empty beam width policy");
        }
        List<Step> steps = new ArrayList<>();
        int fallback = -1;
        for (String part : text.split(",")) {
            String[] pair = part.trim().split(":");
            if (pair.length != 2) {
                throw new IllegalArgumentException("Malformed beam width step '" + part.trim() + "' in " + text);
            }
            try {
                int width = Integer.parseInt(pair[1].trim());
                if (pair[0].trim().equals("*")) {
                    fallback = width;
                } else {
                    steps.add(new Step(Integer.parseInt(pair[0].trim()), width));
                }
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Malformed beam width step '" + part.trim() + "' in " + text, e);
            }
        }
        if (fallback < 0) {
            throw new IllegalArgumentException("Beam width policy needs a '*:width' fallback: " + text);
        }
        return new BeamWidthPolicy(steps, fallback);
    }

    public int widthFor(int nodeCount) {
        for (Step step : steps) {
            if (nodeCount < step.belowNodes()) {
                return step.width();
            }
        }
        return fallbackWidth;
    }

    public List<Step> steps() {
        return steps;
    }

    public int fallbackWidth() {
        return fallbackWidth;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BeamWidthPolicy other && steps.equals(other.steps) && fallbackWidth == other.fallbackWidth;
    }

    @Override
    public int hashCode() {
        return 31 * steps.hashCode() + fallbackWidth;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Step step : steps) {
            sb.append(step.belowNodes()).append(':').append(step.width()).append(',');
        }
        return sb.append("*:").append(fallbackWidth).toString();
    }
}
