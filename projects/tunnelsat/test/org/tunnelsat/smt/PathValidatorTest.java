package org.tunnelsat.smt;

import org.junit.Test;
import org.tunnelsat.datamodel.Action;
import org.tunnelsat.datamodel.Step;
import org.tunnelsat.datamodel.TunnelNetwork;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class PathValidatorTest {

    private final TunnelNetwork _tunnel = TestNetworks.tunnel();

    @Test
    public void acceptsTunnel() {
        List<Step> path = Arrays.asList(
                new Step(Action.PUSH_AB, 0, 1, 0, 1),
                new Step(Action.TRANSMIT_B, 1, 2, 1, 1),
                new Step(Action.POP_AB, 2, 3, 1, 0));
        assertTrue(new PathValidator(_tunnel, 3).validate(path).isEmpty());
    }

    @Test
    public void rejectsWrongLength() {
        List<Step> path = Arrays.asList(
                new Step(Action.PUSH_AB, 0, 1, 0, 1),
                new Step(Action.TRANSMIT_B, 1, 2, 1, 1),
                new Step(Action.POP_AB, 2, 3, 1, 0));
        List<String> violations = new PathValidator(_tunnel, 4).validate(path);
        assertEquals(Collections.singletonList("Expected 4 steps but got 3"), violations);
    }

    @Test
    public void rejectsMissingCapability() {
        // a --> b only transmits B, not A
        List<Step> path = Arrays.asList(
                new Step(Action.TRANSMIT_A, 0, 1, 0, 0),
                new Step(Action.TRANSMIT_A, 1, 2, 0, 0),
                new Step(Action.TRANSMIT_A, 2, 3, 0, 0));
        List<String> violations = new PathValidator(_tunnel, 3).validate(path);
        assertEquals(3, violations.size());
        assertTrue(violations.get(0).endsWith("is not offered by the network"));
    }

    @Test
    public void rejectsBrokenChainAndRevisit() {
        List<Step> path = Arrays.asList(
                new Step(Action.PUSH_AB, 0, 1, 0, 1),
                new Step(Action.TRANSMIT_B, 2, 1, 1, 1),
                new Step(Action.POP_AB, 2, 3, 1, 0));
        List<String> violations = new PathValidator(_tunnel, 3).validate(path);
        assertTrue(violations.contains("Step 1 (transmit_B: b -> a) does not start where step 0 ended"));
        assertTrue(violations.contains("Step 1 (transmit_B: b -> a) revisits a"));
    }

    @Test
    public void rejectsStackMisuse() {
        // pops with nothing pushed, and ends with the wrong height
        List<Step> path = Arrays.asList(
                new Step(Action.TRANSMIT_A, 0, 1, 0, 0),
                new Step(Action.POP_AB, 1, 3, 0, 0));
        List<String> violations = new PathValidator(_tunnel, 2).validate(path);
        assertTrue(violations.contains("Step 1 (pop_AB: a -> d) needs B on top but finds A"));
        assertTrue(violations.contains("Step 1 (pop_AB: a -> d) pops the last symbol of the stack"));
    }

    @Test
    public void rejectsOverflow() {
        List<Step> path = Arrays.asList(
                new Step(Action.PUSH_AB, 0, 1, 0, 1));
        List<String> violations = new PathValidator(_tunnel, 1).validate(path);
        assertTrue(violations.contains("Step 0 (push_AB: s -> a) overflows a stack of 1 cells"));
        assertTrue(violations.contains("Path ends with stack [A, B] instead of [A]"));
    }
}
