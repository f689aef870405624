package org.hexroute.core.hex;

/**
 * Immutable world-space position.
 *
 * <p>Hex layouts place cells on the x/z plane; {@code y} carries height for hosts that
 * need it and is ignored by hex conversion.</p>
 */
public record WorldPosition(double x, double y, double z) {
}
