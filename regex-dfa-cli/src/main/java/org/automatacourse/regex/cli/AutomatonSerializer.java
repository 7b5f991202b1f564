package org.automatacourse.regex.cli;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.automatacourse.regex.dfa.DfaTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Serializes a DFA transition table to JSON. States are numbered from 1 in
 * table order; consecutive code points leading to the same state are merged
 * into one range.
 */
public class AutomatonSerializer {
    private static final Logger LOG = LoggerFactory.getLogger(AutomatonSerializer.class);

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public static class TransitionEntry {
        @JsonProperty("curr_state")
        private int currState;

        @JsonProperty("range_start")
        private int rangeStart;

        @JsonProperty("range_end")
        private int rangeEnd;

        @JsonProperty("next_state")
        private int nextState;

        public TransitionEntry() {}

        public TransitionEntry(int currState, int rangeStart, int rangeEnd, int nextState) {
            this.currState = currState;
            this.rangeStart = rangeStart;
            this.rangeEnd = rangeEnd;
            this.nextState = nextState;
        }

        public int getCurrState() { return currState; }
        public int getRangeStart() { return rangeStart; }
        public int getRangeEnd() { return rangeEnd; }
        public int getNextState() { return nextState; }
    }

    public static class AutomatonJson {
        @JsonProperty("_comment")
        private String comment;

        @JsonProperty("start_state")
        private int startState;

        @JsonProperty("match_states")
        private List<Integer> matchStates;

        @JsonProperty("transition_table")
        private List<TransitionEntry> transitionTable;

        public AutomatonJson() {}

        public AutomatonJson(String comment, int startState, List<Integer> matchStates,
                             List<TransitionEntry> transitionTable) {
            this.comment = comment;
            this.startState = startState;
            this.matchStates = matchStates;
            this.transitionTable = transitionTable;
        }

        public String getComment() { return comment; }
        public int getStartState() { return startState; }
        public List<Integer> getMatchStates() { return matchStates; }
        public List<TransitionEntry> getTransitionTable() { return transitionTable; }
    }

    public static AutomatonJson toJson(DfaTable dfa, String regex) {
        Map<String, Integer> stateMap = new HashMap<>();
        for (String label : dfa.getTable().keySet()) {
            stateMap.put(label, stateMap.size() + 1);
        }

        int startState = stateMap.get(dfa.getStartingState());

        List<Integer> matchStates = new ArrayList<>();
        for (String label : dfa.getAcceptingStates()) {
            matchStates.add(stateMap.get(label));
        }
        matchStates.sort(null);

        List<TransitionEntry> transitionTable = new ArrayList<>();
        for (Map.Entry<String, ? extends Map<String, String>> row : dfa.getTable().entrySet()) {
            int currState = stateMap.get(row.getKey());
            SortedMap<Integer, Integer> byCodePoint = new TreeMap<>();
            for (Map.Entry<String, String> transition : row.getValue().entrySet()) {
                byCodePoint.put(transition.getKey().codePointAt(0), stateMap.get(transition.getValue()));
            }
            addRanges(currState, byCodePoint, transitionTable);
        }

        transitionTable.sort((a, b) -> {
            if (a.currState != b.currState) {
                return Integer.compare(a.currState, b.currState);
            }
            return Integer.compare(a.rangeStart, b.rangeStart);
        });

        String comment = "This corresponds to the regular expression '" + regex + "'";
        return new AutomatonJson(comment, startState, matchStates, transitionTable);
    }

    public static String serializeToString(DfaTable dfa, String regex) throws JsonProcessingException {
        return MAPPER.writeValueAsString(toJson(dfa, regex));
    }

    public static void serializeToJson(DfaTable dfa, String regex, File file) throws IOException {
        MAPPER.writeValue(file, toJson(dfa, regex));
        LOG.info("Automaton serialized to {}", file);
    }

    private static void addRanges(int currState, SortedMap<Integer, Integer> byCodePoint,
                                  List<TransitionEntry> out) {
        int rangeStart = -1;
        int rangeEnd = -1;
        int nextState = -1;
        for (Map.Entry<Integer, Integer> entry : byCodePoint.entrySet()) {
            int codePoint = entry.getKey();
            int target = entry.getValue();
            if (rangeStart >= 0 && codePoint == rangeEnd + 1 && target == nextState) {
                rangeEnd = codePoint;
                continue;
            }
            if (rangeStart >= 0) {
                out.add(new TransitionEntry(currState, rangeStart, rangeEnd, nextState));
            }
            rangeStart = codePoint;
            rangeEnd = codePoint;
            nextState = target;
        }
        if (rangeStart >= 0) {
            out.add(new TransitionEntry(currState, rangeStart, rangeEnd, nextState));
        }
    }
}
