package org.janelia.saalfeldlab.adaptiveoptics;

/**
 * Calibration was aborted because an actuator did not yield enough valid poke
 * samples to fit its modal response.
 */
public class CalibrationException extends AdaptiveOpticsException {

	private static final long serialVersionUID = -4412339851207635260L;

	private final int actuator;

	public CalibrationException(final int actuator, final String message) {
		super(message);
		this.actuator = actuator;
	}

	/**
	 * @return the zero-based index of the actuator that failed
	 */
	public int getActuator() {
		return actuator;
	}
}
