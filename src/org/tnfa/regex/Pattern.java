/*
 * @LICENSE@
 */

package org.tnfa.regex;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * A compiled representation of a regular expression; analog to the
 * {@link java.util.regex.Pattern} class. Like the Pattern class of the standard
 * library, instances of this Pattern class are immutable and thread safe: any
 * number of {@link Matcher}s and {@link #toDot()} calls may use one instance
 * concurrently.
 * <p>
 * The accepted syntax is deliberately tiny:
 * <ul>
 * <li><strong>Letters</strong> <code>A-Z</code> and <code>a-z</code> match
 * themselves. Nothing else is a literal; digits, whitespace and escapes are
 * syntax errors.</li>
 * <li><strong>Concatenation</strong> by juxtaposition: <code>ab</code>.</li>
 * <li><strong>Alternation</strong>: <code>a|b</code>, lowest precedence.</li>
 * <li><strong>Kleene star</strong>: <code>a*</code>, <code>(ab)*</code>. At
 * most one star per factor.</li>
 * <li><strong>Grouping</strong> with parenthesis, which only affects
 * precedence (there are no capturing groups).</li>
 * </ul>
 * The empty expression is legal and matches only the empty string. Matching is
 * always against the whole input, and the input {@value #EMPTY_STRING} is read
 * as the empty string.
 */
public final class Pattern {

    private static final Logger logger = Logger.getLogger("org.tnfa.regex");
    private static final Level level = Level.FINEST;

    /**
     * Input text standing for the empty string.
     */
    public static final String EMPTY_STRING = "$";

    final String regex;
    final NFA nfa;

    private Pattern(String regex, NFA nfa) {
        this.regex = regex;
        this.nfa = nfa;
        logger.log(level, "states: " + nfa.size());
    }

    /**
     * Compiles the expression into a Thompson NFA.
     *
     * @param regex
     *            the regular expression to be compiled.
     * @return the pattern.
     * @throws java.util.regex.PatternSyntaxException
     *             if the expression is not in the grammar.
     */
    public static Pattern compile(String regex) {
        if (regex == null) throw new NullPointerException("regex");
        return new Pattern(regex, new RegexParser().parse(regex));
    }

    public Matcher matcher(CharSequence csq) {
        return new Matcher(this, csq);
    }

    /**
     * @param input
     *            the whole input, or {@value #EMPTY_STRING} for the empty
     *            string.
     * @return true if the input is in the language of this pattern.
     */
    public boolean accepts(CharSequence input) {
        return matcher(input).matches();
    }

    public static boolean matches(String regex, CharSequence input) {
        return Pattern.compile(regex).accepts(input);
    }

    /**
     * The NFA in GraphViz dot notation. See {@link DotRenderer}.
     */
    public String toDot() {
        return DotRenderer.render(nfa);
    }

    /**
     * @return the number of NFA states, 0 for the empty expression.
     */
    public int stateCount() {
        return nfa.size();
    }

    public String pattern() {
        return regex;
    }

    @Override
    public String toString() {
        return regex;
    }

    /**
     * For testability: the NFA of a Pattern instance.
     */
    static NFA NFAfor(Pattern p) {
        return p.nfa;
    }
}
