package org.tunnelsat.smt;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Model;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import org.junit.Test;
import org.tunnelsat.common.TunnelSatException;
import org.tunnelsat.datamodel.Action;
import org.tunnelsat.datamodel.StackSymbol;
import org.tunnelsat.datamodel.Step;
import org.tunnelsat.datamodel.TunnelNetwork;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class PathDecoderTest {

    private static Model solve(Encoder enc, BoolExpr... facts) {
        Solver solver = enc.getCtx().mkSolver();
        solver.add(facts);
        assertEquals(Status.SATISFIABLE, solver.check());
        return solver.getModel();
    }

    private static List<Step> decode(TunnelNetwork network, int length) {
        try (Encoder enc = new Encoder(network, length)) {
            Model m = solve(enc, enc.getFormula());
            return new PathDecoder(enc.getVariables(), network, length, true).decode(m);
        }
    }

    @Test
    public void decodesTunnel() {
        List<Step> path = decode(TestNetworks.tunnel(), 3);
        assertEquals(Arrays.asList(
                new Step(Action.PUSH_AB, 0, 1, 0, 1),
                new Step(Action.TRANSMIT_B, 1, 2, 1, 1),
                new Step(Action.POP_AB, 2, 3, 1, 0)), path);
    }

    @Test
    public void decodesNestedTunnel() {
        TunnelNetwork network = TestNetworks.nestedTunnel();
        List<Step> path = decode(network, 4);
        assertEquals(4, path.size());
        assertEquals(Action.PUSH_AB, path.get(0).getAction());
        assertEquals(Action.PUSH_BA, path.get(1).getAction());
        assertEquals(Action.POP_BA, path.get(2).getAction());
        assertEquals(Action.POP_AB, path.get(3).getAction());
        assertEquals(2, path.get(1).getTargetHeight());
    }

    @Test
    public void decodedPathChainsAndKeepsStackDiscipline() {
        TunnelNetwork network = TestNetworks.twoRoutes();
        for (int length : new int[]{2, 3}) {
            List<Step> path = decode(network, length);
            int stackSize = Encoder.stackSize(length);

            assertEquals(length, path.size());
            assertEquals(network.getInitialNode(), path.get(0).getSource());
            assertEquals(network.getFinalNode(), path.get(length - 1).getTarget());
            for (int i = 0; i < path.size(); i++) {
                Step step = path.get(i);
                if (i + 1 < path.size()) {
                    assertEquals(step.getTarget(), path.get(i + 1).getSource());
                    assertEquals(step.getTargetHeight(), path.get(i + 1).getSourceHeight());
                }
                int delta = step.getTargetHeight() - step.getSourceHeight();
                assertTrue(Math.abs(delta) <= 1);
                assertEquals(step.getAction().getHeightDelta(), delta);
                assertTrue(step.getTargetHeight() < stackSize);
                assertTrue(step.getTargetHeight() >= 0);
            }
        }
    }

    /*
     * A hand-made model with both s and d at position 0 at height 0.
     */
    private static Model ambiguousModel(Encoder enc) {
        VariableGenerator vars = enc.getVariables();
        return solve(enc,
                vars.pathVar(0, 0, 0),
                vars.pathVar(1, 0, 0),
                vars.pathVar(1, 1, 0),
                vars.symbolVar(StackSymbol.A, 0, 0),
                vars.symbolVar(StackSymbol.A, 1, 0));
    }

    @Test
    public void lenientDecodingKeepsFirstCandidate() {
        TunnelNetwork network = TestNetworks.transmitPair();
        try (Encoder enc = new Encoder(network, 1)) {
            Model m = ambiguousModel(enc);
            List<Step> path = new PathDecoder(enc.getVariables(), network, 1, false).decode(m);
            assertEquals(Arrays.asList(new Step(Action.TRANSMIT_A, 0, 1, 0, 0)), path);
        }
    }

    @Test(expected = TunnelSatException.class)
    public void strictDecodingRejectsSeveralCandidates() {
        TunnelNetwork network = TestNetworks.transmitPair();
        try (Encoder enc = new Encoder(network, 1)) {
            Model m = ambiguousModel(enc);
            new PathDecoder(enc.getVariables(), network, 1, true).decode(m);
        }
    }

    @Test(expected = TunnelSatException.class)
    public void strictDecodingRejectsEmptyTopCell() {
        TunnelNetwork network = TestNetworks.transmitPair();
        try (Encoder enc = new Encoder(network, 1)) {
            VariableGenerator vars = enc.getVariables();
            Model m = solve(enc, vars.pathVar(0, 0, 0), vars.pathVar(1, 1, 0));
            new PathDecoder(vars, network, 1, true).decode(m);
        }
    }

    /*
     * Only the start of a one-move path: nothing holds at position 1.
     */
    private static Model missingStateModel(Encoder enc) {
        VariableGenerator vars = enc.getVariables();
        return solve(enc, vars.pathVar(0, 0, 0), vars.symbolVar(StackSymbol.A, 0, 0));
    }

    @Test
    public void lenientDecodingRepeatsPreviousStateWhenNoneHolds() {
        TunnelNetwork network = TestNetworks.transmitPair();
        try (Encoder enc = new Encoder(network, 1)) {
            Model m = missingStateModel(enc);
            List<Step> path = new PathDecoder(enc.getVariables(), network, 1, false).decode(m);
            assertEquals(Arrays.asList(new Step(Action.TRANSMIT_A, 0, 0, 0, 0)), path);
            assertFalse(new PathValidator(network, 1).validate(path).isEmpty());
        }
    }

    @Test(expected = TunnelSatException.class)
    public void strictDecodingRejectsMissingState() {
        TunnelNetwork network = TestNetworks.transmitPair();
        try (Encoder enc = new Encoder(network, 1)) {
            Model m = missingStateModel(enc);
            new PathDecoder(enc.getVariables(), network, 1, true).decode(m);
        }
    }

    /*
     * s at height 0 then d at height 2 on a path of 4 moves.
     */
    private static Model heightJumpModel(Encoder enc) {
        VariableGenerator vars = enc.getVariables();
        return solve(enc,
                vars.pathVar(0, 0, 0),
                vars.pathVar(1, 1, 2),
                vars.symbolVar(StackSymbol.A, 0, 0));
    }

    @Test
    public void lenientDecodingReadsHeightJumpAsTransmit() {
        TunnelNetwork network = TestNetworks.transmitPair();
        try (Encoder enc = new Encoder(network, 4)) {
            Model m = heightJumpModel(enc);
            List<Step> path = new PathDecoder(enc.getVariables(), network, 4, false).decode(m);
            assertEquals(4, path.size());
            assertEquals(new Step(Action.TRANSMIT_A, 0, 1, 0, 2), path.get(0));
            assertEquals(1, path.get(3).getSource());
            assertEquals(1, path.get(3).getTarget());
        }
    }

    @Test(expected = TunnelSatException.class)
    public void strictDecodingRejectsHeightJump() {
        TunnelNetwork network = TestNetworks.transmitPair();
        try (Encoder enc = new Encoder(network, 4)) {
            Model m = heightJumpModel(enc);
            new PathDecoder(enc.getVariables(), network, 4, true).decode(m);
        }
    }
}
