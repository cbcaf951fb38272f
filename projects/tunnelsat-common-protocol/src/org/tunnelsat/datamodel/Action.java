package org.tunnelsat.datamodel;

import java.util.Locale;


/**
 * <p>The labelled moves available on a network edge.</p>
 *
 * <p>{@code TRANSMIT_X} forwards with {@code X} on top of the stack and leaves
 * the stack untouched. {@code PUSH_XY} requires {@code X} on top and pushes
 * {@code Y} above it. {@code POP_XY} requires the stack to end with
 * {@code X Y}, removes {@code Y} and leaves {@code X} on top, so that
 * {@code POP_XY} undoes {@code PUSH_XY}.</p>
 */
public enum Action {
    TRANSMIT_A(Kind.TRANSMIT, StackSymbol.A, null),
    TRANSMIT_B(Kind.TRANSMIT, StackSymbol.B, null),
    PUSH_AA(Kind.PUSH, StackSymbol.A, StackSymbol.A),
    PUSH_AB(Kind.PUSH, StackSymbol.A, StackSymbol.B),
    PUSH_BA(Kind.PUSH, StackSymbol.B, StackSymbol.A),
    PUSH_BB(Kind.PUSH, StackSymbol.B, StackSymbol.B),
    POP_AA(Kind.POP, StackSymbol.A, StackSymbol.A),
    POP_AB(Kind.POP, StackSymbol.A, StackSymbol.B),
    POP_BA(Kind.POP, StackSymbol.B, StackSymbol.A),
    POP_BB(Kind.POP, StackSymbol.B, StackSymbol.B);

    public enum Kind {
        TRANSMIT(0),
        PUSH(1),
        POP(-1);

        private final int _heightDelta;

        Kind(int heightDelta) {
            _heightDelta = heightDelta;
        }

        public int getHeightDelta() {
            return _heightDelta;
        }
    }

    private final Kind _kind;

    private final StackSymbol _lower;

    private final StackSymbol _upper;

    Action(Kind kind, StackSymbol lower, StackSymbol upper) {
        _kind = kind;
        _lower = lower;
        _upper = upper;
    }

    public static Action transmit(StackSymbol top) {
        return top == StackSymbol.A ? TRANSMIT_A : TRANSMIT_B;
    }

    public static Action push(StackSymbol top, StackSymbol pushed) {
        return find(Kind.PUSH, top, pushed);
    }

    public static Action pop(StackSymbol revealed, StackSymbol popped) {
        return find(Kind.POP, revealed, popped);
    }

    private static Action find(Kind kind, StackSymbol lower, StackSymbol upper) {
        for (Action a : values()) {
            if (a._kind == kind && a._lower == lower && a._upper == upper) {
                return a;
            }
        }
        throw new IllegalArgumentException("No " + kind + " action for " + lower + "," + upper);
    }

    public Kind getKind() {
        return _kind;
    }

    /**
     * Symbol on top of the stack before the move.
     */
    public StackSymbol getTopBefore() {
        switch (_kind) {
            case POP:
                return _upper;
            default:
                return _lower;
        }
    }

    /**
     * Symbol on top of the stack after the move.
     */
    public StackSymbol getTopAfter() {
        switch (_kind) {
            case PUSH:
                return _upper;
            default:
                return _lower;
        }
    }

    public int getHeightDelta() {
        return _kind.getHeightDelta();
    }

    @Override
    public String toString() {
        String s = _kind.name().toLowerCase(Locale.ROOT) + "_" + _lower;
        return _upper == null ? s : s + _upper;
    }
}
