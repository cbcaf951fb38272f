package org.tunnelsat.smt;

import com.microsoft.z3.BoolExpr;
import org.tunnelsat.datamodel.TunnelNetwork;

import java.util.List;


/**
 * One sub-formula of the reduction, kept as the list of its conjuncts.
 */
abstract class PathConstraint {

    protected final Encoder _enc;

    protected final VariableGenerator _vars;

    protected final TunnelNetwork _network;

    protected final int _length;

    protected final int _stackSize;

    PathConstraint(Encoder enc) {
        _enc = enc;
        _vars = enc.getVariables();
        _network = enc.getNetwork();
        _length = enc.getLength();
        _stackSize = enc.getStackSize();
    }

    abstract List<BoolExpr> constraints();

}
