/*
 * @LICENSE@
 */

/**
 * NFA: Nondeterministic Finite Automata, Thompson style, index based.
 */
package org.tnfa.regex;

import static org.tnfa.regex.Misc.LS;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

final class NFA {

    private static final Logger logger = Logger.getLogger("org.tnfa.regex");
    private static final Level level = Level.FINER;

    /**
     * Symbol of a state which has only free (epsilon) transitions.
     */
    static final char EPSILON = '\0';

    /**
     * Edge target meaning "no such edge".
     */
    static final int NONE = -1;

    /**
     * Implementation notes:
     * <p>
     * States refer to each other by their index in the state list, never by
     * reference. A state with a letter symbol has exactly one (labeled) edge,
     * the <code>first</code> one. An epsilon state has up to two free edges.
     * <p>
     * The accepting state is always the last state in the list: every rule of
     * the parser leaves the terminal placeholder of the sub-automaton it built
     * in the last slot. <code>accepting()</code> depends on this, and so does
     * the {@link DotRenderer}. The constructor asserts it.
     * <p>
     * An NFA without any states is the automaton for the empty expression; it
     * accepts only the empty string.
     */
    static final class State {

        final char symbol;
        final int first;
        final int second;

        State(char symbol, int first, int second) {
            this.symbol = symbol;
            this.first = first;
            this.second = second;
        }

        boolean isEpsilon() {
            return symbol == EPSILON;
        }

        boolean hasFirst() {
            return first != NONE;
        }

        boolean hasSecond() {
            return second != NONE;
        }

        @Override
        public String toString() {
            StringBuilder sb = new StringBuilder();
            sb.append('{')
              .append(isEpsilon() ? "eps" : String.valueOf(symbol)).append(',')
              .append(first).append(',')
              .append(second)
              .append('}');
            return sb.toString();
        }
    }

    final String pattern;
    private final List<State> states;
    private final int initial;

    NFA(String pattern, List<State> states, int initial) {
        this.pattern = pattern;
        this.states = Collections.unmodifiableList(states);
        this.initial = initial;
        assert wellFormed() : this;
        logger.log(level, "nfa: " + this, this);
    }

    /*
     * last state is the accepting one, it is a bare placeholder, and every edge
     * lands inside the list.
     */
    private boolean wellFormed() {
        if (states.isEmpty()) {
            return initial == 0;
        }
        if (initial < 0 || initial >= states.size()) return false;
        State accept = states.get(states.size() - 1);
        if (!accept.isEpsilon() || accept.hasFirst() || accept.hasSecond()) {
            return false;
        }
        for (State s : states) {
            if (s.first < NONE || s.first >= states.size()) return false;
            if (s.second < NONE || s.second >= states.size()) return false;
            if (!s.isEpsilon() && (!s.hasFirst() || s.hasSecond())) return false;
        }
        return true;
    }

    boolean isEmpty() {
        return states.isEmpty();
    }

    int size() {
        return states.size();
    }

    State state(int i) {
        return states.get(i);
    }

    List<State> states() {
        return states;
    }

    int initial() {
        return initial;
    }

    int accepting() {
        assert !isEmpty();
        return states.size() - 1;
    }

    /**
     * Epsilon closure of a set of states: the seeds plus everything reachable
     * from them over free transitions. Letter states are included but not
     * expanded. Uses an explicit worklist; each state is pushed at most once,
     * so epsilon cycles (nested stars) terminate.
     *
     * @param seeds
     *            the state indices to start from; not modified.
     * @return a new set, never larger than {@link #size()}.
     */
    BitSet closure(BitSet seeds) {
        final BitSet ret = new BitSet(states.size());
        final Deque<Integer> work = new ArrayDeque<Integer>();
        for (int s = seeds.nextSetBit(0); s >= 0; s = seeds.nextSetBit(s + 1)) {
            push(s, ret, work);
        }
        while (!work.isEmpty()) {
            State state = states.get(work.pop());
            if (!state.isEpsilon()) continue;
            if (state.hasFirst()) push(state.first, ret, work);
            if (state.hasSecond()) push(state.second, ret, work);
        }
        return ret;
    }

    private static void push(int s, BitSet visited, Deque<Integer> work) {
        if (!visited.get(s)) {
            visited.set(s);
            work.push(s);
        }
    }

    BitSet closure(int seed) {
        BitSet seeds = new BitSet(states.size());
        seeds.set(seed);
        return closure(seeds);
    }

    /**
     * Follows every labeled edge matching <code>c</code> out of
     * <code>frontier</code>. The result is not closed.
     */
    BitSet step(BitSet frontier, char c) {
        final BitSet ret = new BitSet(states.size());
        for (int s = frontier.nextSetBit(0); s >= 0; s = frontier.nextSetBit(s + 1)) {
            State state = states.get(s);
            if (!state.isEpsilon() && state.symbol == c) {
                ret.set(state.first);
            }
        }
        return ret;
    }

    /* (non-Javadoc)
     * @see java.lang.Object#toString()
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("Pattern=").append(pattern).append(LS)
          .append("init=").append(initial).append(LS);
        for (int i = 0; i < states.size(); ++i) {
            sb.append(i).append(':').append(states.get(i)).append(LS);
        }
        return sb.toString();
    }
}
