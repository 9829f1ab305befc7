/* @LICENSE@
 */
package org.tnfa.regex;

/**
 * Formats an {@link NFA} as a GraphViz digraph, left to right. Node 0 is an
 * invisible origin with an arc to the initial state; state <i>i</i> is node
 * <i>i</i>+1 and the last one is drawn as the accepting double circle. Free
 * transitions are labeled with an epsilon entity. Lines end with
 * <code>'\n'</code> regardless of platform, and there is no newline after the
 * closing brace.
 */
final class DotRenderer {

    private DotRenderer() {
    } // never instantiated

    static final String EPSILON_LABEL = "&epsilon;";

    static String render(NFA nfa) {
        final StringBuilder sb = new StringBuilder();
        sb.append("digraph {\n")
          .append("\trankdir = LR\n")
          .append("\tnode [shape = circle, style = filled, fillcolor = gray93]\n")
          .append('\t').append(nfa.isEmpty() ? 1 : nfa.size())
          .append(" [shape = doublecircle]\n")
          .append("\t0 [style = invisible]\n")
          .append("\t0 -> ").append(nfa.initial() + 1).append('\n');

        for (int i = 0; i < nfa.size(); ++i) {
            final NFA.State state = nfa.state(i);
            if (state.hasFirst()) arc(sb, i, state.first, state);
            if (state.hasSecond()) arc(sb, i, state.second, state);
        }
        return sb.append('}').toString();
    }

    private static void arc(StringBuilder sb, int from, int to, NFA.State state) {
        sb.append('\t').append(from + 1)
          .append(" -> ").append(to + 1)
          .append(" [label=\"")
          .append(state.isEpsilon() ? EPSILON_LABEL : String.valueOf(state.symbol))
          .append("\"]\n");
    }
}
