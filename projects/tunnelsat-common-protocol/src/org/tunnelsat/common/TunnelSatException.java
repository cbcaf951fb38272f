package org.tunnelsat.common;


/**
 * Thrown whenever tunnelsat cannot carry on with a request: malformed input,
 * an inconclusive solver answer, or a model that cannot be turned into a path.
 */
public class TunnelSatException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public TunnelSatException(String msg) {
        super(msg);
    }

    public TunnelSatException(String msg, Throwable cause) {
        super(msg, cause);
    }

}
