package org.janelia.saalfeldlab.adaptiveoptics;

/**
 * Base class of all failures raised by the wavefront sensing and mirror
 * calibration pipeline.
 */
public class AdaptiveOpticsException extends RuntimeException {

	private static final long serialVersionUID = -2218473611850947205L;

	public AdaptiveOpticsException(final String message) {
		super(message);
	}

	public AdaptiveOpticsException(final String message, final Throwable cause) {
		super(message, cause);
	}
}
