package org.tunnelsat.smt;

import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import org.tunnelsat.datamodel.StackSymbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;


/**
 * <p>Hands out the boolean variables of the reduction.</p>
 *
 * <p>Variables are named after their key, and the name is the cache key, so
 * asking twice for the same (node, position, height) or (symbol, position,
 * height) always returns the very same proposition. Keys are expected to be in
 * range; nothing here checks them.</p>
 */
public class VariableGenerator {

    private final Context _ctx;

    private final Map<String, BoolExpr> _variables;

    private final List<BoolExpr> _allVariables;

    VariableGenerator(Context ctx) {
        _ctx = ctx;
        _variables = new HashMap<>();
        _allVariables = new ArrayList<>();
    }

    /**
     * True iff the path is at {@code node} at position {@code pos} with its
     * stack top at {@code height}.
     */
    public BoolExpr pathVar(int node, int pos, int height) {
        return var("path_" + node + "_" + pos + "_" + height);
    }

    /**
     * True iff the stack cell {@code height} holds {@code symbol} at position
     * {@code pos}.
     */
    public BoolExpr symbolVar(StackSymbol symbol, int pos, int height) {
        return var("stack-" + symbol + "_" + pos + "_" + height);
    }

    private BoolExpr var(String name) {
        BoolExpr e = _variables.get(name);
        if (e == null) {
            e = _ctx.mkBoolConst(name);
            _variables.put(name, e);
            _allVariables.add(e);
        }
        return e;
    }

    public List<BoolExpr> getAllVariables() {
        return Collections.unmodifiableList(_allVariables);
    }

}
