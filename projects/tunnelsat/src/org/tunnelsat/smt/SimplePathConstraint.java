package org.tunnelsat.smt;

import com.microsoft.z3.BoolExpr;
import org.tunnelsat.smt.utils.EncoderUtils;

import java.util.ArrayList;
import java.util.List;


/**
 * No node is visited at two different positions, whatever the stack height.
 */
class SimplePathConstraint extends PathConstraint {

    SimplePathConstraint(Encoder enc) {
        super(enc);
    }

    @Override
    List<BoolExpr> constraints() {
        List<BoolExpr> constraints = new ArrayList<>();
        for (int n = 0; n < _network.getNumNodes(); n++) {
            // node n is somewhere on the path at position pos
            List<BoolExpr> visits = new ArrayList<>();
            for (int pos = 0; pos <= _length; pos++) {
                List<BoolExpr> heights = new ArrayList<>();
                for (int h = 0; h < _stackSize; h++) {
                    heights.add(_vars.pathVar(n, pos, h));
                }
                visits.add(_enc.Or(heights));
            }
            constraints.addAll(EncoderUtils.pairwiseExclusive(_enc.getCtx(), visits));
        }
        return constraints;
    }

}
