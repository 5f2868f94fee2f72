package org.janelia.saalfeldlab.adaptiveoptics.calibration;

/**
 * Modal response measured while one actuator was held at a poke value.
 */
public class PokeResponseSample {

	public final int actuator;
	public final double pokeValue;
	public final double[] modes;

	public PokeResponseSample(final int actuator, final double pokeValue, final double[] modes) {

		this.actuator = actuator;
		this.pokeValue = pokeValue;
		this.modes = modes;
	}
}
