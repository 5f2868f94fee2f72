package org.janelia.saalfeldlab.adaptiveoptics;

/**
 * Thrown when an operation needs a region of interest, pupil mask, carrier
 * filter or control matrix that has not been set up yet.
 */
public class ConfigurationException extends AdaptiveOpticsException {

	private static final long serialVersionUID = 5126907421538350381L;

	public ConfigurationException(final String message) {
		super(message);
	}
}
