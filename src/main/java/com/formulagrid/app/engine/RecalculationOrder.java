package com.formulagrid.app.engine;

import com.formulagrid.app.exceptions.CircularReferenceException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

/**
 * Depth-first walk over the "dependents" direction that lists every cell reachable from a
 * start cell, start included, so that each cell comes before all cells depending on it.
 * Runs on an explicit stack; a dependent that is already on the current path is a cycle.
 */
final class RecalculationOrder {

    private RecalculationOrder() {
    }

    /**
     * @param start            the changed cell
     * @param directDependents cells that directly read a given cell
     * @return the start cell followed by its transitive dependents, in evaluation order
     * @throws CircularReferenceException if the walk runs into a cell on its own path
     */
    static List<String> compute(String start, Function<String, ? extends Collection<String>> directDependents) {
        LinkedList<String> order = new LinkedList<>();
        Set<String> visited = new HashSet<>();
        // Insertion-ordered, so it doubles as the current path for error messages
        Set<String> onPath = new LinkedHashSet<>();
        Deque<Frame> stack = new ArrayDeque<>();

        visited.add(start);
        onPath.add(start);
        stack.push(new Frame(start, directDependents.apply(start).iterator()));

        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (frame.remaining.hasNext()) {
                String next = frame.remaining.next();
                if (onPath.contains(next)) {
                    throw new CircularReferenceException("Circular dependency: " + describeCycle(onPath, next));
                }
                if (visited.add(next)) {
                    onPath.add(next);
                    stack.push(new Frame(next, directDependents.apply(next).iterator()));
                }
            } else {
                stack.pop();
                onPath.remove(frame.cell);
                order.addFirst(frame.cell);
            }
        }
        return order;
    }

    private static String describeCycle(Set<String> path, String repeated) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (String cell : path) {
            inCycle |= cell.equals(repeated);
            if (inCycle) {
                cycle.add(cell);
            }
        }
        cycle.add(repeated);
        return String.join(" -> ", cycle);
    }

    private static final class Frame {
        private final String cell;
        private final Iterator<String> remaining;

        Frame(String cell, Iterator<String> remaining) {
            this.cell = cell;
            this.remaining = remaining;
        }
    }
}
