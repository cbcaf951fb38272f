package org.tunnelsat.common.plugin;

import org.tunnelsat.datamodel.TunnelNetwork;
import org.tunnelsat.datamodel.answers.AnswerElement;

/**
 * Entry points the question plugins use to query a loaded network.
 */
public interface ITunnelSat {

    TunnelNetwork getNetwork();

    /**
     * Looks for a simple tunnel path of exactly {@code bound} moves.
     */
    AnswerElement smtTunnelPath(int bound, boolean strictDecoding, boolean renderTrace);

    /**
     * Looks for the smallest bound in {@code [0, maxBound]} admitting a simple tunnel path.
     */
    AnswerElement smtShortestTunnelPath(int maxBound, boolean strictDecoding,
            boolean renderTrace);

}
