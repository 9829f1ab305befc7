/*
 * @LICENSE@
 */

/**
 * <h3><b>tnfa</b> - Thompson NFA construction and simulation for a minimal
 * regular expression language.</h3>
 * <p>
 * An expression over the letters <code>A-Z a-z</code> with concatenation,
 * alternation (<code>|</code>), Kleene star (<code>*</code>) and grouping is
 * {@linkplain org.tnfa.regex.Pattern#compile(String) compiled} in a single
 * recursive descent pass into a nondeterministic finite automaton, following
 * Thompson's construction. States live in one list and refer to each other by
 * index only.
 * <p>
 * Matching {@linkplain org.tnfa.regex.Matcher simulates} the automaton on
 * sets of states: start from the epsilon closure of the initial state, follow
 * every labeled arc matching the next character, close again, and accept if
 * the accepting state survives the whole input. Time is linear in the input
 * times the automaton size; there is no backtracking, so no pathological
 * patterns.
 * <p>
 * The automaton can be exported in GraphViz dot notation with
 * {@link org.tnfa.regex.Pattern#toDot()}, and {@link org.tnfa.regex.Shell}
 * wraps all of it in a small interactive command loop.
 * <h4>References:</h4>
 * <ul>
 * <li>Ken Thompson, "Regular expression search algorithm", CACM 11(6),
 * 1968.</li>
 * <li>Russ Cox, <a href="http://swtch.com/~rsc/regexp/regexp1.html">Regular
 * Expression Matching Can Be Simple And Fast</a>.</li>
 * </ul>
 */
package org.tnfa.regex;
