package org.tunnelsat.smt;

import com.microsoft.z3.BoolExpr;
import org.tunnelsat.datamodel.Action;
import org.tunnelsat.datamodel.NetworkEdge;
import org.tunnelsat.datamodel.StackSymbol;

import java.util.ArrayList;
import java.util.List;


/**
 * <p>Constrains every move between two consecutive positions to be a move
 * the network actually offers, with a stack update matching the action:</p>
 *
 * <ul>
 *     <li>a transmit keeps the height and the whole stack;</li>
 *     <li>a push raises the height by one, keeps the cells below and writes
 *     the pushed symbol on the new top, provided the new top still fits;</li>
 *     <li>a pop lowers the height by one, needs the popped symbol on top and
 *     the revealed symbol just below it.</li>
 * </ul>
 *
 * <p>The constraint is stated per source state: if the path is at
 * {@code (u, h)} at position {@code pos}, then position {@code pos + 1} is
 * one of the states reachable through an outgoing edge of {@code u}. Together
 * with the uniqueness constraint this rules out every other successor,
 * including nodes {@code u} has no edge to.</p>
 *
 * <p>Cell well-formedness is stated here too, for every position: a cell holds
 * at most one symbol, and the stack of a path at height {@code h} fills
 * exactly the cells {@code 0..h}.</p>
 */
class TransitionConstraint extends PathConstraint {

    TransitionConstraint(Encoder enc) {
        super(enc);
    }

    @Override
    List<BoolExpr> constraints() {
        List<BoolExpr> constraints = new ArrayList<>();
        for (int pos = 0; pos <= _length; pos++) {
            addStackShape(constraints, pos);
        }
        for (int pos = 0; pos < _length; pos++) {
            for (int u = 0; u < _network.getNumNodes(); u++) {
                for (int h = 0; h < _stackSize; h++) {
                    List<BoolExpr> moves = new ArrayList<>();
                    for (NetworkEdge edge : _network.getOutgoingEdges(u)) {
                        for (Action a : edge.getActions()) {
                            BoolExpr move = move(edge.getTarget(), a, pos, h);
                            if (move != null) {
                                moves.add(move);
                            }
                        }
                    }
                    // no move available means (u, h) cannot occur at pos
                    constraints.add(_enc.Implies(_vars.pathVar(u, pos, h), _enc.Or(moves)));
                }
            }
        }
        return constraints;
    }

    /*
     * The successor state and stack update for taking action a towards node
     * target from height h at position pos, or null when the resulting height
     * falls outside the stack.
     */
    private BoolExpr move(int target, Action a, int pos, int h) {
        int next = h + a.getHeightDelta();
        if (next < 0 || next >= _stackSize) {
            return null;
        }
        List<BoolExpr> conj = new ArrayList<>();
        conj.add(_vars.pathVar(target, pos + 1, next));
        conj.add(_vars.symbolVar(a.getTopBefore(), pos, h));
        conj.add(_vars.symbolVar(a.getTopAfter(), pos + 1, next));
        int kept = Math.min(h, next);
        for (int k = 0; k <= kept; k++) {
            conj.add(sameCell(pos, k));
        }
        return _enc.And(conj);
    }

    private void addStackShape(List<BoolExpr> constraints, int pos) {
        for (int h = 0; h < _stackSize; h++) {
            constraints.add(_enc.Not(_enc.And(
                    _vars.symbolVar(StackSymbol.A, pos, h),
                    _vars.symbolVar(StackSymbol.B, pos, h))));
        }
        for (int n = 0; n < _network.getNumNodes(); n++) {
            for (int h = 0; h < _stackSize; h++) {
                List<BoolExpr> shape = new ArrayList<>();
                for (int k = 0; k < _stackSize; k++) {
                    shape.add(k <= h ? filledCell(pos, k) : emptyCell(pos, k));
                }
                constraints.add(_enc.Implies(_vars.pathVar(n, pos, h), _enc.And(shape)));
            }
        }
    }

    private BoolExpr filledCell(int pos, int k) {
        return _enc.Or(_vars.symbolVar(StackSymbol.A, pos, k),
                _vars.symbolVar(StackSymbol.B, pos, k));
    }

    private BoolExpr emptyCell(int pos, int k) {
        return _enc.And(_enc.Not(_vars.symbolVar(StackSymbol.A, pos, k)),
                _enc.Not(_vars.symbolVar(StackSymbol.B, pos, k)));
    }

    private BoolExpr sameCell(int pos, int k) {
        return _enc.And(
                _enc.Eq(_vars.symbolVar(StackSymbol.A, pos, k),
                        _vars.symbolVar(StackSymbol.A, pos + 1, k)),
                _enc.Eq(_vars.symbolVar(StackSymbol.B, pos, k),
                        _vars.symbolVar(StackSymbol.B, pos + 1, k)));
    }

}
