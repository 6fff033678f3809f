package com.agl.grammar.regular;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.Iterator;
import java.util.Objects;

/**
 * Graph checks a randomly built {@link RegularGrammar} has to pass before it is used. All
 * traversals run on explicit stacks and queues, so deep or cyclic graphs cannot exhaust the call
 * stack. The exit marker is never treated as a node.
 */
public final class StructuralValidator {

    /** Distance reported when no exit can be reached. */
    public static final int UNREACHABLE = Integer.MAX_VALUE;

    private final RegularGrammar grammar;

    public StructuralValidator(RegularGrammar grammar) {
        this.grammar = Objects.requireNonNull(grammar, "grammar");
    }

    /** Every state can be reached from state 0. */
    public boolean isConnected() {
        int n = grammar.stateCount();
        if (n == 0) {
            return false;
        }
        boolean[] visited = new boolean[n];
        Deque<Integer> queue = new ArrayDeque<>();
        visited[0] = true;
        queue.add(0);
        int seen = 1;
        while (!queue.isEmpty()) {
            for (int next : grammar.state(queue.poll()).destinations()) {
                if (!visited[next]) {
                    visited[next] = true;
                    seen++;
                    queue.add(next);
                }
            }
        }
        return seen == n;
    }

    public boolean hasExit() {
        for (RegularGrammar.State state : grammar.states()) {
            if (state.offersExit()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Depth-first search from state 0 that reports a cycle as soon as an edge leads back to a state
     * on the current path. Self-loops count.
     */
    public boolean hasCycle() {
        int n = grammar.stateCount();
        if (n == 0) {
            return false;
        }
        boolean[] onPath = new boolean[n];
        boolean[] done = new boolean[n];
        Deque<Integer> path = new ArrayDeque<>();
        Deque<Iterator<Integer>> pending = new ArrayDeque<>();
        path.push(0);
        pending.push(grammar.state(0).destinations().iterator());
        onPath[0] = true;
        while (!path.isEmpty()) {
            Iterator<Integer> successors = pending.peek();
            if (successors.hasNext()) {
                int next = successors.next();
                if (onPath[next]) {
                    return true;
                }
                if (!done[next]) {
                    onPath[next] = true;
                    path.push(next);
                    pending.push(grammar.state(next).destinations().iterator());
                }
            } else {
                int finished = path.pop();
                pending.pop();
                onPath[finished] = false;
                done[finished] = true;
            }
        }
        return false;
    }

    /**
     * Fewest symbol-emitting steps from {@code start} to a state offering the exit, or
     * {@link #UNREACHABLE}. Breadth-first, with a fresh visited set per call.
     */
    public int shortestPathThrough(int start) {
        int n = grammar.stateCount();
        if (start < 0 || start >= n) {
            throw new IndexOutOfBoundsException("no state " + start + " among " + n);
        }
        int[] distance = new int[n];
        Arrays.fill(distance, -1);
        Deque<Integer> queue = new ArrayDeque<>();
        distance[start] = 0;
        queue.add(start);
        while (!queue.isEmpty()) {
            int current = queue.poll();
            RegularGrammar.State state = grammar.state(current);
            if (state.offersExit()) {
                return distance[current];
            }
            for (int next : state.destinations()) {
                if (distance[next] < 0) {
                    distance[next] = distance[current] + 1;
                    queue.add(next);
                }
            }
        }
        return UNREACHABLE;
    }

    public int shortestPathThrough() {
        return shortestPathThrough(0);
    }

    /** Some state can never get to an exit. */
    public boolean hasDeadCycle() {
        for (int i = 0; i < grammar.stateCount(); i++) {
            if (shortestPathThrough(i) == UNREACHABLE) {
                return true;
            }
        }
        return false;
    }

    /** All four invariants a usable grammar has to satisfy. */
    public boolean isAcceptable(int minPathLength) {
        if (!isConnected() || !hasExit()) {
            return false;
        }
        int shortest = shortestPathThrough(0);
        return shortest != UNREACHABLE && shortest >= minPathLength && !hasDeadCycle();
    }
}
