package org.janelia.saalfeldlab.adaptiveoptics.hardware;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;

public interface Camera {

	/**
	 * Triggers one exposure and returns the full 2-D frame.
	 *
	 * @throws CameraTimeoutException if no frame arrived in time
	 */
	RandomAccessibleInterval<? extends RealType<?>> triggerAndCapture() throws CameraTimeoutException;

	/**
	 * @param seconds exposure time
	 */
	void setExposureTime(double seconds);
}
