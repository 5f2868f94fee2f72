package org.janelia.saalfeldlab.adaptiveoptics.fourier;

import org.janelia.saalfeldlab.adaptiveoptics.DimensionMismatchException;

/**
 * Soft-edged spectral window isolating the first order of an interferogram.
 * Weights are stored in the centred frequency convention, together with the
 * refined carrier peak they were built around.
 */
public class CarrierFilter {

	public final int side;

	/** refined carrier peak, centred convention */
	public final int peakX;
	public final int peakY;

	/** whether the peak had to be searched in the unshifted spectrum */
	public final boolean shifted;

	private static final double TIE_TOLERANCE = 1e-9;

	private final double[] weights;

	public CarrierFilter(final int side, final double[] weights, final int peakX, final int peakY, final boolean shifted) {

		if (weights.length != side * side)
			throw DimensionMismatchException.of("filter size", (long)side * side, weights.length);

		this.side = side;
		this.weights = weights;
		this.peakX = peakX;
		this.peakY = peakY;
		this.shifted = shifted;
	}

	public double weight(final int x, final int y) {
		return weights[y * side + x];
	}

	public double[] weights() {
		return weights.clone();
	}

	/**
	 * Weighted centroid of the window, measured on the circle around the
	 * stored peak so that windows wrapping across the spectrum edge are
	 * handled, rounded to the nearest pixel.
	 *
	 * @return {x, y} in the centred convention
	 */
	public int[] centroid() {

		final int half = side / 2;
		double sx = 0;
		double sy = 0;
		double mass = 0;
		for (int y = 0; y < side; y++) {
			final int dy = Math.floorMod(y - peakY + half, side) - half;
			for (int x = 0; x < side; x++) {
				final double w = weights[y * side + x];
				if (w == 0)
					continue;

				final int dx = Math.floorMod(x - peakX + half, side) - half;
				sx += w * dx;
				sy += w * dy;
				mass += w;
			}
		}

		if (mass == 0)
			return new int[]{peakX, peakY};

		return new int[]{
				Math.floorMod(peakX + roundHalfUp(sx / mass), side),
				Math.floorMod(peakY + roundHalfUp(sy / mass), side)};
	}

	/**
	 * Even-width windows put the centroid exactly between two pixels; values
	 * within rounding noise of such a tie go up.
	 */
	private static int roundHalfUp(final double value) {
		return (int)Math.floor(value + 0.5 + TIE_TOLERANCE);
	}

	/**
	 * Multiplies a centred complex spectrum by the window.
	 *
	 * @return a new, filtered spectrum
	 */
	public double[] apply(final double[] centredSpectrum) {

		if (centredSpectrum.length != 2 * weights.length)
			throw DimensionMismatchException.of("spectrum size", 2L * weights.length, centredSpectrum.length);

		final double[] out = new double[centredSpectrum.length];
		for (int i = 0; i < weights.length; i++) {
			out[2 * i] = centredSpectrum[2 * i] * weights[i];
			out[2 * i + 1] = centredSpectrum[2 * i + 1] * weights[i];
		}
		return out;
	}

	@Override
	public String toString() {
		return String.format("CarrierFilter(side=%d, peak=(%d, %d), shifted=%b)", side, peakX, peakY, shifted);
	}
}
