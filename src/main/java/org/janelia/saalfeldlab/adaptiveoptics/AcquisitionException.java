package org.janelia.saalfeldlab.adaptiveoptics;

/**
 * A camera error that is not a timeout. These are never retried.
 */
public class AcquisitionException extends AdaptiveOpticsException {

	private static final long serialVersionUID = -6713092785307331127L;

	public AcquisitionException(final String message, final Throwable cause) {
		super(message, cause);
	}
}
