package com.sandcastle.sandbox;

/**
 * Bytes collected from a runtime for one unit of work.
 *
 * @param unit         the command the bytes belong to
 * @param stdout       everything written to stdout since the unit was sent
 * @param stderr       everything written to stderr since the unit was sent
 * @param end          why collection stopped
 * @param runtimeError true when the runtime reported an unhandled error for the unit
 * @param overflowed   true when either stream exceeded the capture limit and was cut
 */
public record RawCapture(
    String unit,
    byte[] stdout,
    byte[] stderr,
    End end,
    boolean runtimeError,
    boolean overflowed
) {
    public enum End {
        /** Both streams carried the unit's completion record. */
        COMPLETED,
        /** The deadline passed first. */
        DEADLINE,
        /** The process went away, or the handle was terminated. */
        END_OF_STREAM
    }
}
