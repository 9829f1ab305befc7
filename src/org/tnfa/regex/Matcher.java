/*
 * @LICENSE@
 */
package org.tnfa.regex;

import java.util.BitSet;

/**
 * Decides whether a whole input is in the language of a {@link Pattern}, by
 * simulating its NFA on the set of all states alive at once (no
 * backtracking). Analog to {@link java.util.regex.Matcher#matches()}. Like the
 * standard Matcher, instances of this class are <em>not</em> thread safe; the
 * Pattern they were created from is.
 * <p>
 * The input {@value Pattern#EMPTY_STRING} stands for the empty string.
 */
public final class Matcher {

    private final Pattern pattern;
    private final NFA nfa;
    private CharSequence csq;
    private BitSet frontier = new BitSet();

    Matcher(Pattern pattern, CharSequence csq) {
        this.pattern = pattern;
        this.nfa = pattern.nfa;
        reset(csq);
    }

    public Pattern pattern() {
        return pattern;
    }

    public Matcher reset(CharSequence csq) {
        if (csq == null) throw new NullPointerException("input");
        this.csq = Pattern.EMPTY_STRING.contentEquals(csq) ? "" : csq;
        frontier = new BitSet();
        return this;
    }

    /**
     * Runs the NFA over the entire input.
     *
     * @return true iff the accepting state is alive after the last character.
     */
    public boolean matches() {
        if (nfa.isEmpty()) {
            frontier = new BitSet();
            return csq.length() == 0;
        }
        BitSet current = nfa.closure(nfa.initial());
        for (int i = 0; i < csq.length() && !current.isEmpty(); ++i) {
            current = nfa.closure(nfa.step(current, csq.charAt(i)));
        }
        frontier = current;
        return current.get(nfa.accepting());
    }

    /**
     * The state indices alive after the last {@link #matches()} run; empty
     * before the first run, after a {@link #reset(CharSequence)}, and when the
     * input died part way through.
     *
     * @return a copy of the frontier.
     */
    public BitSet frontier() {
        return (BitSet) frontier.clone();
    }

    @Override
    public String toString() {
        return "Matcher[pattern=" + pattern + ",input=" + csq + "]";
    }
}
