package org.tunnelsat.smt;

import com.microsoft.z3.Model;
import org.tunnelsat.common.TunnelSatException;
import org.tunnelsat.datamodel.Action;
import org.tunnelsat.datamodel.StackSymbol;
import org.tunnelsat.datamodel.Step;
import org.tunnelsat.datamodel.TunnelNetwork;
import org.tunnelsat.smt.utils.EncoderUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;


/**
 * <p>Reads the path out of a model of the encoding.</p>
 *
 * <p>For every position the decoder scans the (node, height) pairs in node
 * then height order and keeps the first one set in the model. The height
 * difference between two consecutive positions gives the kind of move, and
 * the symbols on top of the stack before and after give the action.</p>
 *
 * <p>Models of the full encoding always have exactly one state per position
 * and one symbol per filled cell. When a model does not, a strict decoder
 * throws. A lenient one logs a warning and still returns {@code length}
 * steps: it keeps the first candidate of an ambiguous position, repeats the
 * previous state (the initial node at height 0 for position 0) when a
 * position has none, and reads a height jump of more than one as a transmit
 * of the source top. The resulting path is then flagged by the
 * {@link PathValidator}.</p>
 */
public class PathDecoder {

    private static final Logger LOGGER = Logger.getLogger(PathDecoder.class.getName());

    private final VariableGenerator _vars;

    private final TunnelNetwork _network;

    private final int _length;

    private final int _stackSize;

    private final boolean _strict;

    public PathDecoder(VariableGenerator vars, TunnelNetwork network, int length,
            boolean strict) {
        _vars = vars;
        _network = network;
        _length = length;
        _stackSize = Encoder.stackSize(length);
        _strict = strict;
    }

    /**
     * Decodes the {@code length} steps of the path held in {@code m}.
     */
    public List<Step> decode(Model m) {
        List<Step> path = new ArrayList<>(_length);
        int[] src = locate(m, 0, new int[]{_network.getInitialNode(), 0});
        for (int pos = 0; pos < _length; pos++) {
            int[] tgt = locate(m, pos + 1, src);
            Action action = classify(m, pos, src[1], tgt[1]);
            path.add(new Step(action, src[0], tgt[0], src[1], tgt[1]));
            src = tgt;
        }
        return path;
    }

    /*
     * The (node, height) pair at position pos, or fallback when none holds.
     */
    private int[] locate(Model m, int pos, int[] fallback) {
        int[] found = null;
        int count = 0;
        for (int n = 0; n < _network.getNumNodes(); n++) {
            for (int h = 0; h < _stackSize; h++) {
                if (EncoderUtils.isTrue(m, _vars.pathVar(n, pos, h))) {
                    count++;
                    if (found == null) {
                        found = new int[]{n, h};
                    }
                }
            }
        }
        if (found == null) {
            String msg = "No node at position " + pos
                    + ": the model does not describe a path of length " + _length;
            if (_strict) {
                throw new TunnelSatException(msg);
            }
            LOGGER.warning(msg + ", keeping (" + _network.getNodeName(fallback[0]) + ","
                    + fallback[1] + ")");
            return new int[]{fallback[0], fallback[1]};
        }
        if (count > 1) {
            String msg = count + " (node,height) pairs hold at position " + pos;
            if (_strict) {
                throw new TunnelSatException(msg);
            }
            LOGGER.warning(msg + ", keeping (" + _network.getNodeName(found[0]) + ","
                    + found[1] + ")");
        }
        return found;
    }

    private Action classify(Model m, int pos, int srcHeight, int tgtHeight) {
        int delta = tgtHeight - srcHeight;
        switch (delta) {
            case 0:
                return Action.transmit(symbolAt(m, pos, srcHeight));
            case 1:
                return Action.push(symbolAt(m, pos, srcHeight),
                        symbolAt(m, pos + 1, tgtHeight));
            case -1:
                return Action.pop(symbolAt(m, pos + 1, tgtHeight),
                        symbolAt(m, pos, srcHeight));
            default:
                String msg = "Stack height jumps from " + srcHeight + " to " + tgtHeight
                        + " between positions " + pos + " and " + (pos + 1);
                if (_strict) {
                    throw new TunnelSatException(msg);
                }
                LOGGER.warning(msg + ", reading it as a transmit");
                return Action.transmit(symbolAt(m, pos, srcHeight));
        }
    }

    /*
     * The symbol held by a cell. A cell that is empty or holds both symbols is
     * read as A if A is set and B otherwise.
     */
    private StackSymbol symbolAt(Model m, int pos, int height) {
        boolean a = EncoderUtils.isTrue(m, _vars.symbolVar(StackSymbol.A, pos, height));
        boolean b = EncoderUtils.isTrue(m, _vars.symbolVar(StackSymbol.B, pos, height));
        if (a != b) {
            return a ? StackSymbol.A : StackSymbol.B;
        }
        String msg = "Stack cell " + height + " at position " + pos
                + (a ? " holds both symbols" : " is empty");
        if (_strict) {
            throw new TunnelSatException(msg);
        }
        LOGGER.warning(msg);
        return a ? StackSymbol.A : StackSymbol.B;
    }

}
