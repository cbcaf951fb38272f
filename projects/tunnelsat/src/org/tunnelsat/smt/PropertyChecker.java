package org.tunnelsat.smt;


import org.tunnelsat.common.TunnelSatException;
import org.tunnelsat.datamodel.TunnelNetwork;

import java.util.logging.Logger;

public class PropertyChecker {

    private static final Logger LOGGER = Logger.getLogger(PropertyChecker.class.getName());

    /**
     * Looks for a simple tunnel path of exactly {@code bound} moves.
     */
    public static VerificationResult computeTunnelPath(TunnelNetwork network, int bound,
            EncoderSettings settings) {
        if (bound < 0) {
            throw new TunnelSatException("Bound must be non-negative, got " + bound);
        }
        try (Encoder enc = new Encoder(network, bound, settings)) {
            enc.computeEncoding();
            return enc.verify();
        }
    }

    /**
     * <p>Tries every bound from 0 to {@code maxBound} and stops at the first one
     * with a path. When no bound works, the result for {@code maxBound} is
     * returned.</p>
     */
    public static VerificationResult computeShortestTunnelPath(TunnelNetwork network,
            int maxBound, EncoderSettings settings) {
        if (maxBound < 0) {
            throw new TunnelSatException("Bound must be non-negative, got " + maxBound);
        }
        VerificationResult res = null;
        for (int bound = 0; bound <= maxBound; bound++) {
            res = computeTunnelPath(network, bound, settings);
            if (res.getSatisfiable()) {
                LOGGER.info("Shortest tunnel path has length " + bound);
                return res;
            }
        }
        LOGGER.info("No tunnel path of length at most " + maxBound);
        return res;
    }

}
