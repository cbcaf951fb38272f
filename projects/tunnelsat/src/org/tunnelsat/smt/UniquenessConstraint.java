package org.tunnelsat.smt;

import com.microsoft.z3.BoolExpr;
import org.tunnelsat.smt.utils.EncoderUtils;

import java.util.ArrayList;
import java.util.List;


/**
 * Exactly one (node, height) pair holds at every position of the path.
 */
class UniquenessConstraint extends PathConstraint {

    UniquenessConstraint(Encoder enc) {
        super(enc);
    }

    @Override
    List<BoolExpr> constraints() {
        List<BoolExpr> constraints = new ArrayList<>();
        for (int pos = 0; pos <= _length; pos++) {
            List<BoolExpr> states = new ArrayList<>();
            for (int n = 0; n < _network.getNumNodes(); n++) {
                for (int h = 0; h < _stackSize; h++) {
                    states.add(_vars.pathVar(n, pos, h));
                }
            }
            constraints.add(_enc.Or(states));
            constraints.addAll(EncoderUtils.pairwiseExclusive(_enc.getCtx(), states));
        }
        return constraints;
    }

}
