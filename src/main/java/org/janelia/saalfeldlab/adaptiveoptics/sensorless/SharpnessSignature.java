package org.janelia.saalfeldlab.adaptiveoptics.sensorless;

/**
 * Straight line fit of log ring RMS against ring index. The slope is the
 * sharpness metric; steeper negative slopes mean less high frequency content.
 */
public class SharpnessSignature {

	public final double slope;
	public final double intercept;
	public final double r;
	public final double logP;
	public final double stdErr;

	public SharpnessSignature(final double slope, final double intercept, final double r, final double logP, final double stdErr) {

		this.slope = slope;
		this.intercept = intercept;
		this.r = r;
		this.logP = logP;
		this.stdErr = stdErr;
	}

	public double[] toArray() {
		return new double[]{slope, intercept, r, logP, stdErr};
	}

	@Override
	public String toString() {
		return String.format("slope=%.6g intercept=%.6g r=%.4f log(p)=%.4f stderr=%.4g", slope, intercept, r, logP, stdErr);
	}
}
