package com.lucidityplatform.common.flux;

/**
 * Accumulates fractional flux and emits whole-point deltas once the accumulated value
 * reaches ±1. Emitted amounts are subtracted so the residual always stays in (-1, 1).
 */
public final class ResidualCarry {

    /** Absorbs floating-point error such as 0.1 * 10 == 0.9999999999999999. */
    public static final double EPSILON = 1e-6;

    private ResidualCarry() {}

    public static Carry accumulate(double residual, double flux) {
        double next = residual + flux;
        int delta = 0;
        if (next >= 1.0 - EPSILON) {
            delta = (int) Math.floor(next + EPSILON);
        } else if (next <= -1.0 + EPSILON) {
            delta = (int) Math.ceil(next - EPSILON);
        }
        return new Carry(delta, next - delta);
    }

    public record Carry(int delta, double residual) {}
}
