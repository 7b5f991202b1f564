package org.automatacourse.regex.nfa;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Walks an NFA fragment depth-first from its entry and writes its {@link NfaTable}.
 * <p>
 * Ids are handed out in the order states are first seen, starting at 1: the
 * entry first, then each edge target at the moment its edge is followed.
 * Arena indices identify states, so a state reached again through a cycle or
 * a second parent keeps its id and is not expanded twice. The walk keeps its
 * own stack of frames, so pattern length is not bounded by the thread stack.
 */
public final class NfaTableExtractor {
    private final StateArena arena;
    private final int[] ids;
    private final boolean[] visited;
    private final Deque<Frame> stack = new ArrayDeque<>();
    private final NfaTable.Builder table = NfaTable.builder();
    private int stateCount;

    private NfaTableExtractor(StateArena arena) {
        this.arena = arena;
        this.ids = new int[arena.size()];
        this.visited = new boolean[arena.size()];
    }

    public static NfaTable extract(Fragment fragment) {
        NfaTableExtractor extractor = new NfaTableExtractor(fragment.getArena());
        extractor.table.startingState(extractor.idOf(fragment.getEntry()));
        extractor.walk(fragment.getEntry());
        return extractor.table.build();
    }

    private void walk(int entry) {
        enter(entry);
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            if (!frame.edges.hasNext()) {
                stack.pop();
                continue;
            }
            Edge edge = frame.edges.next();
            // the target's id is taken before its own edges are walked
            table.transition(frame.id, edge.column, idOf(edge.target));
            enter(edge.target);
        }
    }

    private void enter(int index) {
        if (visited[index]) {
            return;
        }
        visited[index] = true;

        State state = arena.get(index);
        int id = idOf(index);
        table.transition(id, NfaTable.EPSILON_CLOSURE, id);
        if (state.isAccepting()) {
            table.acceptingState(id);
        }
        stack.push(new Frame(id, edgesOf(state).iterator()));
    }

    private static List<Edge> edgesOf(State state) {
        List<Edge> edges = new ArrayList<>();
        for (Map.Entry<Integer, List<Integer>> symbolEdges : state.getTransitions().entrySet()) {
            String column = symbolEdges.getKey() == StateArena.EPSILON
                    ? NfaTable.EPSILON_CLOSURE
                    : NfaTable.symbolOf(symbolEdges.getKey());
            for (int target : symbolEdges.getValue()) {
                edges.add(new Edge(column, target));
            }
        }
        return edges;
    }

    private int idOf(int index) {
        if (ids[index] == 0) {
            ids[index] = ++stateCount;
        }
        return ids[index];
    }

    private static final class Frame {
        private final int id;
        private final Iterator<Edge> edges;

        Frame(int id, Iterator<Edge> edges) {
            this.id = id;
            this.edges = edges;
        }
    }

    private static final class Edge {
        private final String column;
        private final int target;

        Edge(String column, int target) {
            this.column = column;
            this.target = target;
        }
    }
}
