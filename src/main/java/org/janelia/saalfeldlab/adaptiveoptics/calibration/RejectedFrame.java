package org.janelia.saalfeldlab.adaptiveoptics.calibration;

/**
 * A calibration frame whose unwrapped phase contained too many 2&pi; tears to
 * be decomposed.
 */
public class RejectedFrame {

	public final int frame;
	public final int actuator;
	public final double pokeValue;
	public final int discontinuities;

	public RejectedFrame(final int frame, final int actuator, final double pokeValue, final int discontinuities) {

		this.frame = frame;
		this.actuator = actuator;
		this.pokeValue = pokeValue;
		this.discontinuities = discontinuities;
	}

	@Override
	public String toString() {
		return String.format("frame %d (actuator %d, poke %.4f): %d discontinuities", frame, actuator, pokeValue, discontinuities);
	}
}
