package com.repo.cccp.report;

import com.repo.cccp.metrics.ControlTree;
import com.repo.cccp.metrics.ControlTreeBuilder;
import org.junit.jupiter.api.Test;

import static com.repo.cccp.syntax.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

class ControlTreeGraphGeneratorTest {

    private final ControlTreeGraphGenerator generator = new ControlTreeGraphGenerator();

    @Test
    void testGeneratesNodesAndEdges() {
        ControlTree tree = new ControlTreeBuilder().build(module(
                forLoop(1, "i", call("range", num(10)), assign(2, store("x"), name("i")))));

        String dot = generator.generateDot("loop.py", tree);

        assertTrue(dot.startsWith("digraph \"loop.py\" {"));
        assertTrue(dot.contains("n0 [label=\"Module@0\\npd=0 bd=0 mpi=0\""));
        assertTrue(dot.contains("n1 [label=\"For@1\\npd=2 bd=0 mpi=2\""));
        assertTrue(dot.contains("n2 [label=\"Assign@2\\npd=4 bd=1 mpi=3\"];"));
        assertTrue(dot.contains("n0 -> n1;"));
        assertTrue(dot.contains("n1 -> n2;"));
        assertTrue(dot.trim().endsWith("}"));
    }

    @Test
    void testEscapesName() {
        String dot = generator.generateDot("say \"hi\".py", new ControlTreeBuilder().build(module()));
        assertTrue(dot.startsWith("digraph \"say \\\"hi\\\".py\" {"));
    }
}
