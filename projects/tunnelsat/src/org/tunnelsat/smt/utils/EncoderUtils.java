package org.tunnelsat.smt.utils;


import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Model;

import java.util.ArrayList;
import java.util.List;

public class EncoderUtils {

    /**
     * The constraints {@code not (x_i and x_j)} for every pair {@code i < j}.
     */
    public static List<BoolExpr> pairwiseExclusive(Context ctx, List<BoolExpr> exprs) {
        List<BoolExpr> acc = new ArrayList<>();
        for (int i = 0; i < exprs.size(); i++) {
            for (int j = i + 1; j < exprs.size(); j++) {
                acc.add(ctx.mkNot(ctx.mkAnd(exprs.get(i), exprs.get(j))));
            }
        }
        return acc;
    }

    /**
     * Value of a proposition in a model; propositions the model leaves
     * unconstrained count as false.
     */
    public static boolean isTrue(Model m, BoolExpr e) {
        return m.evaluate(e, true).isTrue();
    }

}
