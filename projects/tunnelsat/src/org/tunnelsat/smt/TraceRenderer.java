package org.tunnelsat.smt;

import com.microsoft.z3.Model;
import org.tunnelsat.datamodel.StackSymbol;
import org.tunnelsat.datamodel.TunnelNetwork;
import org.tunnelsat.smt.utils.EncoderUtils;

import java.util.ArrayList;
import java.util.List;


/**
 * <p>Prints the state and the stack held by a model at every position, for
 * instance:</p>
 *
 * <pre>
 * At pos 1:
 * State: (a,1)
 * Stack: |A|B|
 * </pre>
 *
 * <p>Cells print as {@code A}, {@code B}, {@code X} when both symbols are set,
 * or a blank when empty. Positions with no state or several states, and
 * stacks with a conflict or a filled cell above an empty one, are flagged
 * with a warning line. Rendering never fails.</p>
 */
public class TraceRenderer {

    private final VariableGenerator _vars;

    private final TunnelNetwork _network;

    private final int _bound;

    private final int _stackSize;

    public TraceRenderer(VariableGenerator vars, TunnelNetwork network, int bound) {
        _vars = vars;
        _network = network;
        _bound = bound;
        _stackSize = Encoder.stackSize(bound);
    }

    public TraceReport render(Model m) {
        StringBuilder sb = new StringBuilder();
        List<String> warnings = new ArrayList<>();
        for (int pos = 0; pos <= _bound; pos++) {
            sb.append("At pos ").append(pos).append(":\n");
            renderState(m, pos, sb, warnings);
            renderStack(m, pos, sb, warnings);
        }
        return new TraceReport(sb.toString(), warnings);
    }

    private void renderState(Model m, int pos, StringBuilder sb, List<String> warnings) {
        sb.append("State:");
        int numSeen = 0;
        for (int n = 0; n < _network.getNumNodes(); n++) {
            for (int h = 0; h < _stackSize; h++) {
                if (EncoderUtils.isTrue(m, _vars.pathVar(n, pos, h))) {
                    sb.append(" (").append(_network.getNodeName(n)).append(",").append(h)
                      .append(")");
                    numSeen++;
                }
            }
        }
        if (numSeen == 0) {
            sb.append(" none\n");
            warn("No node at position " + pos, sb, warnings);
        } else {
            sb.append("\n");
            if (numSeen > 1) {
                warn(numSeen + " (node,height) pairs at position " + pos, sb, warnings);
            }
        }
    }

    private void renderStack(Model m, int pos, StringBuilder sb, List<String> warnings) {
        sb.append("Stack: ");
        boolean illDefined = false;
        boolean aboveTop = false;
        for (int h = 0; h < _stackSize; h++) {
            boolean a = EncoderUtils.isTrue(m, _vars.symbolVar(StackSymbol.A, pos, h));
            boolean b = EncoderUtils.isTrue(m, _vars.symbolVar(StackSymbol.B, pos, h));
            if (a && b) {
                sb.append("|X");
                illDefined = true;
            } else if (a || b) {
                sb.append(a ? "|A" : "|B");
                if (aboveTop) {
                    illDefined = true;
                }
            } else {
                sb.append("| ");
                aboveTop = true;
            }
        }
        sb.append("|\n");
        if (illDefined) {
            warn("Ill-defined stack at position " + pos, sb, warnings);
        }
    }

    private static void warn(String msg, StringBuilder sb, List<String> warnings) {
        sb.append("Warning: ").append(msg).append("\n");
        warnings.add(msg);
    }

}
