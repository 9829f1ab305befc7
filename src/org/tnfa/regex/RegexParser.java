/* @LICENSE@
 */

package org.tnfa.regex;

import static org.tnfa.regex.Misc.isLetter;
import static org.tnfa.regex.NFA.EPSILON;
import static org.tnfa.regex.NFA.NONE;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.PatternSyntaxException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Recursive descent parser which builds the {@link NFA} while it parses
 * (Thompson's construction). The grammar:
 * <blockquote><pre>
 *  exp    := term [ '|' exp ]
 *  term   := factor [ term ]
 *  factor := letter [ '*' ] | '(' exp ')' [ '*' ]
 *  letter := 'A' .. 'Z' | 'a' .. 'z'
 * </pre></blockquote>
 * Every rule appends the states of the sub-automaton it recognized to the
 * arena and returns the index of its entry state. The terminal placeholder of
 * that sub-automaton is then always the last slot in the arena, so the next
 * free index is just the arena size. Alternation and star append their
 * fork/loop and join states only after the operands exist, and rewire the
 * operands' terminals in place.
 * <p>
 * Instances are single use per call to {@link #parse(String)} and not thread
 * safe.
 */
final class RegexParser {

    private static final Logger logger = Logger.getLogger("org.tnfa.regex");
    private static final Level level = Level.FINER;

    private static final int EOX = -1;  // end of expression

    /*
     * mutable twin of NFA.State, only lives during construction
     */
    private static final class Slot {
        final char symbol;
        int first;
        int second;

        Slot(char symbol, int first, int second) {
            this.symbol = symbol;
            this.first = first;
            this.second = second;
        }
    }

    private String regex;
    private int iNext;      // next char to scan
    private final List<Slot> arena = new ArrayList<Slot>();

    private void init(String regex) {
        this.regex = regex;
        iNext = 0;
        arena.clear();
    }

    NFA parse(String regex) {
        init(regex);
        logger.log(level, "regex: " + regex);
        if (regex.length() == 0) {
            return new NFA(regex, new ArrayList<NFA.State>(), 0);
        }
        final int start = regex();
        final List<NFA.State> states = new ArrayList<NFA.State>(arena.size());
        for (Slot slot : arena) {
            states.add(new NFA.State(slot.symbol, slot.first, slot.second));
        }
        return new NFA(regex, states, start);
    }

    private int regex() {
        final int start = exp();
        final int c = peek();
        switch(c) {
        case EOX:
            break;
        case ')':
            throw syntaxError("unbalanced parenthesis", iNext);
        default:
            throw unexpected(c, iNext);
        }
        return start;
    }

    /*
     * exp := term [ '|' exp ]
     * Alternatives are scanned in a loop and folded right to left, which
     * numbers the fork/join slots as the right recursive rule would. Only
     * parenthesis nesting costs stack depth.
     */
    private int exp() {
        final List<Integer> starts = new ArrayList<Integer>();
        final List<Integer> ends = new ArrayList<Integer>();
        starts.add(term());
        ends.add(last());
        while (peek() == '|') {
            next();
            starts.add(term());
            ends.add(last());
        }

        int altStart = starts.get(starts.size() - 1);
        int altEnd = ends.get(ends.size() - 1);
        for (int i = starts.size() - 2; i >= 0; --i) {
            final int fork = arena.size();
            final int join = fork + 1;
            rewire(ends.get(i), join, NONE);
            rewire(altEnd, join, NONE);
            append(EPSILON, starts.get(i), altStart);
            append(EPSILON, NONE, NONE);
            altStart = fork;
            altEnd = join;
        }
        return altStart;
    }

    // term := factor [ term ]
    private int term() {
        final int start = factor();
        while (startsFactor(peek())) {
            final int end = last();
            rewire(end, factor(), NONE);
        }
        return start;
    }

    // factor := letter [ '*' ] | '(' exp ')' [ '*' ]
    private int factor() {
        final int at = iNext;
        final int c = next();
        int start;
        if (c == '(') {
            start = exp();
            final int close = next();
            if (close == EOX) {
                throw syntaxError("unbalanced parenthesis", at);
            } else if (close != ')') {
                throw unexpected(close, iNext - 1);
            }
        } else if (isLetter(c)) {
            start = arena.size();
            append((char) c, start + 1, NONE);
            append(EPSILON, NONE, NONE);
        } else {
            throw missingFactor(c, at);
        }

        if (peek() == '*') {
            next();
            final int end = last();
            final int loop = arena.size();
            final int exit = loop + 1;
            rewire(end, start, exit);
            append(EPSILON, start, exit);
            append(EPSILON, NONE, NONE);
            start = loop;
            if (peek() == '*') {
                throw syntaxError("repeated '*'", iNext);
            }
        }
        return start;
    }

    private PatternSyntaxException missingFactor(int c, int at) {
        switch(c) {
        case EOX:
            if (at > 0 && regex.charAt(at - 1) == '|') {
                return syntaxError("empty alternative", at);
            }
            return syntaxError("unexpected end of expression", at);
        case ')':
            if (at > 0 && regex.charAt(at - 1) == '(') {
                return syntaxError("empty group", at);
            }
            return syntaxError("empty alternative", at);
        case '|':
            return syntaxError("empty alternative", at);
        case '*':
            return syntaxError("dangling meta character '*'", at);
        default:
            return unexpected(c, at);
        }
    }

    private static boolean startsFactor(int c) {
        return c == '(' || isLetter(c);
    }

    /*
     * terminal placeholders are fresh (no edges) until rewired exactly once
     */
    private void rewire(int i, int first, int second) {
        final Slot slot = arena.get(i);
        assert slot.symbol == EPSILON && slot.first == NONE && slot.second == NONE
            : "rewiring a non-terminal slot: " + i;
        slot.first = first;
        slot.second = second;
    }

    private void append(char symbol, int first, int second) {
        arena.add(new Slot(symbol, first, second));
    }

    private int last() {
        return arena.size() - 1;
    }

    private int peek() {
        return iNext < regex.length() ? regex.charAt(iNext) : EOX;
    }

    private int next() {
        final int c = peek();
        if (c != EOX) ++iNext;
        return c;
    }

    private PatternSyntaxException unexpected(int c, int at) {
        return syntaxError("illegal character '" + (char) c + "'", at);
    }

    private PatternSyntaxException syntaxError(String msg, int at) {
        return new PatternSyntaxException(msg, regex, at);
    }
}
