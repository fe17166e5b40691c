package com.lucidityplatform.common.flux;

import java.util.Objects;

/**
 * Per-actor passive flux state. Not thread-safe; owned by the tick pipeline.
 */
public final class FluxTracker {

    private double residual;
    private String roomId;
    private int    cadencesInRoom;

    public double residual() {
        return residual;
    }

    public String roomId() {
        return roomId;
    }

    public int cadencesInRoom() {
        return cadencesInRoom;
    }

    /** Records one cadence in {@code currentRoomId}; a room change resets the count to 1. */
    public int enterCadence(String currentRoomId) {
        if (Objects.equals(roomId, currentRoomId)) {
            cadencesInRoom++;
        } else {
            roomId = currentRoomId;
            cadencesInRoom = 1;
        }
        return cadencesInRoom;
    }

    /** Adds {@code flux} to the residual and returns the whole-point delta to apply. */
    public int accumulate(double flux) {
        ResidualCarry.Carry carry = ResidualCarry.accumulate(residual, flux);
        residual = carry.residual();
        return carry.delta();
    }

    /** Returns an emitted delta that could not be applied to the residual. */
    public void restore(int delta) {
        residual += delta;
    }
}
