package org.janelia.saalfeldlab.adaptiveoptics.calibration;

import java.util.List;

import org.apache.commons.math3.linear.RealMatrix;

/**
 * Everything a poke calibration run produced. The response, intercept and
 * p-value matrices are modes x actuators; columns of excluded actuators are
 * zero.
 */
public class CalibrationResult {

	public final ControlMatrix controlMatrix;
	public final RealMatrix response;
	public final RealMatrix intercepts;
	public final RealMatrix pValues;
	public final List<RejectedFrame> rejected;

	public CalibrationResult(
			final ControlMatrix controlMatrix,
			final RealMatrix response,
			final RealMatrix intercepts,
			final RealMatrix pValues,
			final List<RejectedFrame> rejected) {

		this.controlMatrix = controlMatrix;
		this.response = response;
		this.intercepts = intercepts;
		this.pValues = pValues;
		this.rejected = rejected;
	}
}
