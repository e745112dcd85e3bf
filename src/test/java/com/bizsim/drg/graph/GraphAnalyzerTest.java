package com.bizsim.drg.graph;

import com.bizsim.drg.CostModels;
import com.bizsim.drg.api.Formula;
import com.bizsim.drg.model.ModelRegistry;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.*;

public class GraphAnalyzerTest {

    private static final Formula ZERO = deps -> 0.0;

    private static EvaluationPlan plan(ModelRegistry r) {
        return GraphAnalyzer.analyze(DependencyGraphBuilder.build(r));
    }

    @Test
    public void testCostModelHasTwoCyclicGroupsOnSuccessiveLevels() {
        EvaluationPlan p = plan(CostModels.registry());
        DependencyGraph g = p.graph();
        assertEquals(5, p.groupCount());
        assertEquals(2, p.cyclicGroupCount());
        assertEquals(3, p.levelCount());
        assertEquals(3, p.levelSize(0));

        EvaluationGroup production = p.group(p.groupOf(g.index("Production.co2Cost")));
        EvaluationGroup logistics = p.group(p.groupOf(g.index("Logistics.ecoFees")));
        assertTrue(production.isCyclic());
        assertTrue(logistics.isCyclic());
        assertEquals(List.of("Production.disposalCost", "Production.co2Cost"), production.identities());
        assertEquals(List.of("Logistics.logisticsCost", "Logistics.ecoFees"), logistics.identities());
        assertEquals(1, production.level());
        assertEquals(2, logistics.level());
        assertSame(production, p.group(p.groupOf(g.index("Production.disposalCost"))));

        EvaluationGroup energy = p.group(p.groupOf(g.index("Production.energyCost")));
        assertTrue(energy.isInput());
        assertFalse(energy.isCyclic());
        assertEquals(0, energy.level());
    }

    @Test
    public void testGroupIdsOrderedByLevelThenDeclaration() {
        EvaluationPlan p = plan(CostModels.registry());
        int previousLevel = -1;
        for (int id = 0; id < p.groupCount(); id++) {
            EvaluationGroup grp = p.group(id);
            assertEquals(id, grp.id());
            assertTrue(grp.level() >= previousLevel);
            previousLevel = grp.level();
        }
        assertEquals(List.of("Production.materialCost"), p.group(0).identities());
        assertEquals(List.of("Logistics.transportCost"), p.group(2).identities());
    }

    @Test
    public void testPredecessorsAndSuccessors() {
        EvaluationPlan p = plan(CostModels.registry());
        int production = p.groupOf(p.graph().index("Production.co2Cost"));
        int logistics = p.groupOf(p.graph().index("Logistics.ecoFees"));
        assertArrayEquals(new int[] { 0, 1 }, p.predecessors(production));
        assertArrayEquals(new int[] { logistics }, p.successors(production));
        assertArrayEquals(new int[] { 2, production }, p.predecessors(logistics));
        assertEquals(0, p.successors(logistics).length);
    }

    @Test
    public void testAcyclicChainLevels() {
        ModelRegistry r = ModelRegistry.builder("m", "1")
                .defineBlock("A")
                .defineCalculated("A", "d", ZERO, "c")
                .defineCalculated("A", "c", ZERO, "b", "x")
                .defineCalculated("A", "b", ZERO, "x")
                .defineInput("A", "x", 1)
                .seal();
        EvaluationPlan p = plan(r);
        DependencyGraph g = p.graph();
        assertEquals(0, p.cyclicGroupCount());
        assertEquals(4, p.levelCount());
        assertEquals(0, p.group(p.groupOf(g.index("A.x"))).level());
        assertEquals(1, p.group(p.groupOf(g.index("A.b"))).level());
        assertEquals(2, p.group(p.groupOf(g.index("A.c"))).level());
        assertEquals(3, p.group(p.groupOf(g.index("A.d"))).level());
    }

    @Test
    public void testSelfLoopIsSingleMemberCyclicGroup() {
        ModelRegistry r = ModelRegistry.builder("m", "1")
                .defineBlock("A")
                .defineInput("A", "x", 1)
                .defineCalculated("A", "s", ZERO, "x", "s")
                .seal();
        EvaluationPlan p = plan(r);
        EvaluationGroup s = p.group(p.groupOf(p.graph().index("A.s")));
        assertTrue(s.isCyclic());
        assertEquals(1, s.memberCount());
        assertEquals(1, p.cyclicGroupCount());
    }

    @Test
    public void testCrossBlockCycleMergesIntoOneGroup() {
        ModelRegistry r = ModelRegistry.builder("m", "1")
                .defineBlock("A")
                .defineBlock("B")
                .defineCalculated("A", "p", ZERO, "B.q")
                .defineCalculated("B", "q", ZERO, "C.r")
                .defineBlock("C")
                .defineCalculated("C", "r", ZERO, "A.p")
                .seal();
        EvaluationPlan p = plan(r);
        assertEquals(1, p.groupCount());
        assertEquals(List.of("A.p", "B.q", "C.r"), p.group(0).identities());
        assertTrue(p.group(0).isCyclic());
        assertEquals(0, p.group(0).level());
    }

    @Test
    public void testIndependentBranchesShareALevel() {
        ModelRegistry r = ModelRegistry.builder("m", "1")
                .defineBlock("A")
                .defineInput("A", "x", 1)
                .defineCalculated("A", "left", ZERO, "x")
                .defineCalculated("A", "right", ZERO, "x")
                .defineCalculated("A", "join", ZERO, "left", "right")
                .seal();
        EvaluationPlan p = plan(r);
        assertEquals(3, p.levelCount());
        assertEquals(2, p.levelSize(1));
        assertEquals(1, p.levelSize(2));
    }

    @Test
    public void testDeepChainDoesNotOverflow() {
        ModelRegistry.Builder b = ModelRegistry.builder("deep", "1").defineBlock("A").defineInput("A", "n0", 1);
        for (int i = 1; i < 20_000; i++)
            b.defineCalculated("A", "n" + i, ZERO, "n" + (i - 1));
        EvaluationPlan p = plan(b.seal());
        assertEquals(20_000, p.levelCount());
        assertEquals(0, p.cyclicGroupCount());
    }
}
