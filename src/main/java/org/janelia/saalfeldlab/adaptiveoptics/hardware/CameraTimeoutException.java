package org.janelia.saalfeldlab.adaptiveoptics.hardware;

/**
 * The camera did not deliver a frame in time. Acquisition may be retried.
 */
public class CameraTimeoutException extends Exception {

	private static final long serialVersionUID = 2958391102674516031L;

	public CameraTimeoutException(final String message) {
		super(message);
	}
}
