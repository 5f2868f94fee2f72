package org.janelia.saalfeldlab.adaptiveoptics.calibration;

import org.janelia.saalfeldlab.adaptiveoptics.DimensionMismatchException;

/**
 * Detects unwrapping failures by counting pixels whose mixed second
 * difference exceeds 2&pi;, ignoring a three pixel rim at the pupil edge.
 */
public class DiscontinuityCheck {

	public static final double DEFAULT_FRACTION = 0.001;

	static final int EDGE_MARGIN = 3;

	private DiscontinuityCheck() {}

	public static int count(final double[] phase, final int side) {

		if (phase.length != side * side)
			throw DimensionMismatchException.of("phase pixel count", (long)side * side, phase.length);

		final double half = side / 2.0;
		final double limit = half - EDGE_MARGIN;
		int n = 0;
		for (int y = 0; y < side - 1; y++) {
			final double cy = y - half;
			for (int x = 0; x < side - 1; x++) {
				final double cx = x - half;
				if (Math.sqrt(cx * cx + cy * cy) >= limit)
					continue;

				final int i = y * side + x;
				final double d = phase[i + side + 1] - phase[i + side] - phase[i + 1] + phase[i];
				if (Math.abs(d) > 2 * Math.PI)
					n++;
			}
		}
		return n;
	}

	/**
	 * @param fraction tolerated share of the total pixel count
	 */
	public static boolean exceeds(final int discontinuities, final int side, final double fraction) {
		return discontinuities > (double)side * side * fraction;
	}
}
