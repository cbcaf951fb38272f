package org.tunnelsat.smt;


import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Model;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import org.tunnelsat.common.TunnelSatException;
import org.tunnelsat.datamodel.Step;
import org.tunnelsat.datamodel.TunnelNetwork;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;


/**
 * <p>Builds the symbolic encoding of the bounded tunnel path problem for one
 * network and one path length.</p>
 *
 * <p>The encoding is the conjunction of four sub-formulas: the boundary
 * constraints, the uniqueness of the state at each position, the simple-path
 * constraint and the validity of every transition. Each encoder owns its own
 * Z3 context, so it must be closed once the result has been extracted.</p>
 */
public class Encoder implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(Encoder.class.getName());

    private final TunnelNetwork _network;

    private final int _length;

    private final int _stackSize;

    private final EncoderSettings _settings;

    private final Context _ctx;

    private final VariableGenerator _vars;

    private BoolExpr _formula;

    private int _numConstraints;

    public Encoder(TunnelNetwork network, int length) {
        this(network, length, new EncoderSettings());
    }

    public Encoder(TunnelNetwork network, int length, EncoderSettings settings) {
        if (length < 0) {
            throw new TunnelSatException("Path length must be non-negative, got " + length);
        }
        _network = network;
        _length = length;
        _stackSize = stackSize(length);
        _settings = settings;

        Map<String, String> cfg = new HashMap<>();
        cfg.put("model", "true");
        _ctx = new Context(cfg);
        _vars = new VariableGenerator(_ctx);
    }

    /**
     * Number of stack cells needed for a path of {@code length} moves: a
     * balanced path can push at most on half of its moves.
     */
    public static int stackSize(int length) {
        return length / 2 + 1;
    }

    // Symbolic boolean negation
    BoolExpr Not(BoolExpr e) {
        return _ctx.mkNot(e);
    }

    // Symbolic boolean disjunction
    BoolExpr Or(BoolExpr... vals) {
        return _ctx.mkOr(vals);
    }

    BoolExpr Or(List<BoolExpr> vals) {
        return _ctx.mkOr(vals.toArray(new BoolExpr[0]));
    }

    // Symbolic boolean conjunction
    BoolExpr And(BoolExpr... vals) {
        return _ctx.mkAnd(vals);
    }

    BoolExpr And(List<BoolExpr> vals) {
        return _ctx.mkAnd(vals.toArray(new BoolExpr[0]));
    }

    // Symbolic boolean implication
    BoolExpr Implies(BoolExpr e1, BoolExpr e2) {
        return _ctx.mkImplies(e1, e2);
    }

    // Symbolic boolean equivalence
    BoolExpr Eq(BoolExpr e1, BoolExpr e2) {
        return _ctx.mkEq(e1, e2);
    }

    /**
     * <p>Builds the complete reduction. Calling it again rebuilds the same
     * formula over the same variables.</p>
     */
    public BoolExpr computeEncoding() {
        List<PathConstraint> parts = Arrays.asList(
                new BoundaryConstraints(this),
                new UniquenessConstraint(this),
                new SimplePathConstraint(this),
                new TransitionConstraint(this));

        _numConstraints = 0;
        List<BoolExpr> subFormulas = new ArrayList<>();
        for (PathConstraint part : parts) {
            List<BoolExpr> constraints = part.constraints();
            _numConstraints += constraints.size();
            subFormulas.add(And(constraints));
            LOGGER.fine(part.getClass().getSimpleName() + ": " + constraints.size()
                    + " constraints");
        }
        _formula = And(subFormulas);

        LOGGER.fine("Encoded length " + _length + " over " + _network.getNumNodes()
                + " nodes: " + _vars.getAllVariables().size() + " variables, "
                + _numConstraints + " constraints");
        return _formula;
    }

    /**
     * <p>Checks the encoding with Z3. When a path exists the model is decoded
     * into steps, which are then validated against the network, and the stack
     * trace is rendered if the settings ask for it.</p>
     *
     * @return A VerificationResult describing the outcome of the check.
     */
    public VerificationResult verify() {
        BoolExpr formula = getFormula();

        Solver solver = _ctx.mkSolver();
        solver.add(formula);

        long start = System.currentTimeMillis();
        Status status = solver.check();
        long time = System.currentTimeMillis() - start;

        VerificationStats stats = new VerificationStats(_network.getNumNodes(),
                _network.getEdges().size(), _stackSize, _vars.getAllVariables().size(),
                _numConstraints, time);

        if (status == Status.UNSATISFIABLE) {
            LOGGER.info("No tunnel path of length " + _length + " (" + time + " ms)");
            return new VerificationResult(false, _length, Collections.emptyList(),
                    Collections.emptyList(), null, stats);
        } else if (status == Status.UNKNOWN) {
            throw new TunnelSatException("ERROR: satisfiability unknown: "
                    + solver.getReasonUnknown());
        }

        LOGGER.info("Found tunnel path of length " + _length + " (" + time + " ms)");
        Model m = solver.getModel();

        List<Step> path = new PathDecoder(_vars, _network, _length,
                _settings.getStrictDecoding()).decode(m);

        List<String> violations = Collections.emptyList();
        if (_settings.getValidatePath()) {
            violations = new PathValidator(_network, _length).validate(path);
            for (String v : violations) {
                LOGGER.warning("Decoded path is invalid: " + v);
            }
        }

        String trace = null;
        if (_settings.getRenderTrace()) {
            trace = new TraceRenderer(_vars, _network, _length).render(m).getText();
        }

        return new VerificationResult(true, _length, path, violations, trace, stats);
    }

    @Override
    public void close() {
        _ctx.close();
    }

    /*
     * Getters and setters
     */

    public BoolExpr getFormula() {
        if (_formula == null) {
            computeEncoding();
        }
        return _formula;
    }

    Context getCtx() {
        return _ctx;
    }

    public VariableGenerator getVariables() {
        return _vars;
    }

    public TunnelNetwork getNetwork() {
        return _network;
    }

    public int getLength() {
        return _length;
    }

    public int getStackSize() {
        return _stackSize;
    }

    int getNumConstraints() {
        return _numConstraints;
    }
}
