package org.tunnelsat.smt;

import com.microsoft.z3.BoolExpr;
import org.tunnelsat.datamodel.StackSymbol;

import java.util.ArrayList;
import java.util.List;


/**
 * <p>Pins the first and last positions of the path: the path starts on the
 * initial node and ends on the final node, both times at height 0 with the
 * stack holding exactly {@code [A]}.</p>
 */
class BoundaryConstraints extends PathConstraint {

    BoundaryConstraints(Encoder enc) {
        super(enc);
    }

    @Override
    List<BoolExpr> constraints() {
        List<BoolExpr> constraints = new ArrayList<>();
        addEndpoint(constraints, _network.getInitialNode(), 0);
        addEndpoint(constraints, _network.getFinalNode(), _length);
        return constraints;
    }

    private void addEndpoint(List<BoolExpr> constraints, int node, int pos) {
        constraints.add(_vars.pathVar(node, pos, 0));
        for (int n = 0; n < _network.getNumNodes(); n++) {
            for (int h = 0; h < _stackSize; h++) {
                if (n == node && h == 0) {
                    continue;
                }
                constraints.add(_enc.Not(_vars.pathVar(n, pos, h)));
            }
        }

        constraints.add(_vars.symbolVar(StackSymbol.A, pos, 0));
        constraints.add(_enc.Not(_vars.symbolVar(StackSymbol.B, pos, 0)));
        for (int h = 1; h < _stackSize; h++) {
            constraints.add(_enc.Not(_vars.symbolVar(StackSymbol.A, pos, h)));
            constraints.add(_enc.Not(_vars.symbolVar(StackSymbol.B, pos, h)));
        }
    }

}
