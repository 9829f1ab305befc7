/* @LICENSE@  
 */

package org.tnfa.regex;

public class DotRendererTestCase extends AbstractRxTestCase {

    private static final String HEAD = 
        "digraph {\n" +
        "\trankdir = LR\n" +
        "\tnode [shape = circle, style = filled, fillcolor = gray93]\n";
    
    public static void main(String[] args) {
        junit.textui.TestRunner.run(DotRendererTestCase.class);
    }

    public DotRendererTestCase(String name) {
        super(name);
    }

    public void testEmpty() {
        assertEquals(HEAD +
            "\t1 [shape = doublecircle]\n" +
            "\t0 [style = invisible]\n" +
            "\t0 -> 1\n" +
            "}", Pattern.compile("").toDot());
    }

    public void testLetter() {
        assertEquals(HEAD +
            "\t2 [shape = doublecircle]\n" +
            "\t0 [style = invisible]\n" +
            "\t0 -> 1\n" +
            "\t1 -> 2 [label=\"a\"]\n" +
            "}", Pattern.compile("a").toDot());
    }

    public void testAlt() {
        assertEquals(HEAD +
            "\t6 [shape = doublecircle]\n" +
            "\t0 [style = invisible]\n" +
            "\t0 -> 5\n" +
            "\t1 -> 2 [label=\"a\"]\n" +
            "\t2 -> 6 [label=\"&epsilon;\"]\n" +
            "\t3 -> 4 [label=\"b\"]\n" +
            "\t4 -> 6 [label=\"&epsilon;\"]\n" +
            "\t5 -> 1 [label=\"&epsilon;\"]\n" +
            "\t5 -> 3 [label=\"&epsilon;\"]\n" +
            "}", Pattern.compile("a|b").toDot());
    }

    public void testStar() {
        assertEquals(HEAD +
            "\t4 [shape = doublecircle]\n" +
            "\t0 [style = invisible]\n" +
            "\t0 -> 3\n" +
            "\t1 -> 2 [label=\"a\"]\n" +
            "\t2 -> 1 [label=\"&epsilon;\"]\n" +
            "\t2 -> 4 [label=\"&epsilon;\"]\n" +
            "\t3 -> 1 [label=\"&epsilon;\"]\n" +
            "\t3 -> 4 [label=\"&epsilon;\"]\n" +
            "}", Pattern.compile("a*").toDot());
    }

    public void testUpperCaseLabel() {
        String dot = Pattern.compile("aB").toDot();
        assertTrue(dot, dot.contains("\t1 -> 2 [label=\"a\"]\n"));
        assertTrue(dot, dot.contains("\t2 -> 3 [label=\"&epsilon;\"]\n"));
        assertTrue(dot, dot.contains("\t3 -> 4 [label=\"B\"]\n"));
    }

    public void testOneArcLinePerEdge() {
        Pattern p = Pattern.compile("(ab|c)*d");
        NFA nfa = Pattern.NFAfor(p);
        int edges = 0;
        for (NFA.State s : nfa.states()) {
            if (s.hasFirst()) ++edges;
            if (s.hasSecond()) ++edges;
        }
        String dot = p.toDot();
        assertEquals(edges, dot.split("\\[label=").length - 1);
        assertTrue(dot.endsWith("]\n}"));
    }

    public void testRenderDoesNotMutate() {
        Pattern p = Pattern.compile("(a|b)*abb");
        String[] inputs = {"abb", "aabb", "babb", "ab", "$", "abba"};
        boolean[] before = new boolean[inputs.length];
        for (int i = 0; i < inputs.length; ++i) before[i] = p.accepts(inputs[i]);
        String first = p.toDot();
        String second = p.toDot();
        assertEquals(first, second);
        for (int i = 0; i < inputs.length; ++i) {
            assertEquals(inputs[i], before[i], p.accepts(inputs[i]));
        }
    }
}
