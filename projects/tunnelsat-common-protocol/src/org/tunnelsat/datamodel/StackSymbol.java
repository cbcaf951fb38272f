package org.tunnelsat.datamodel;


/**
 * The two symbols a tunnel stack cell may hold.
 */
public enum StackSymbol {
    A,
    B
}
