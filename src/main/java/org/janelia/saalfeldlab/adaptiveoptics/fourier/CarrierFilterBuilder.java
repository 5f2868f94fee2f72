package org.janelia.saalfeldlab.adaptiveoptics.fourier;

import org.janelia.saalfeldlab.adaptiveoptics.FilterConstructionException;
import org.janelia.saalfeldlab.adaptiveoptics.Images;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;

/**
 * Locates the carrier fringe frequency of an interferogram and builds the
 * {@link CarrierFilter} around it.
 */
public class CarrierFilterBuilder {

	private static final Logger LOG = LoggerFactory.getLogger(CarrierFilterBuilder.class);

	/** filter diameter and minimum peak distance to the spectrum edge, relative to the image side */
	public static final double FILTER_FRACTION = 5.0 / 16.0;

	public static final int REFINE_WINDOW = 50;
	public static final int REFINE_ITERATIONS = 10;

	/** log-magnitude below (max - threshold) is ignored during refinement */
	public static final double LOG_THRESHOLD = 5.0;

	private static final double[] REFINE_WEIGHTS = refinementWeights(REFINE_WINDOW);

	private CarrierFilterBuilder() {}

	public static CarrierFilter build(final RandomAccessibleInterval<? extends RealType<?>> image) {

		final int side = Images.squareSide(image);
		return build(Images.toArray(image), side, side / 8);
	}

	public static CarrierFilter build(final RandomAccessibleInterval<? extends RealType<?>> image, final int region) {
		return build(Images.toArray(image), Images.squareSide(image), region);
	}

	/**
	 * @param image row-major square image
	 * @param side image side length
	 * @param region half width of the square around zero frequency excluded from the peak search
	 */
	public static CarrierFilter build(final double[] image, final int side, final int region) {

		if (region < 0)
			throw new IllegalArgumentException("DC exclusion region must not be negative, got " + region);

		final double[] magnitude = Fourier.magnitude(Fourier.centredSpectrum(image, side));

		final int c = side / 2;
		for (int y = Math.max(0, c - region); y < Math.min(side, c + region); y++)
			for (int x = Math.max(0, c - region); x < Math.min(side, c + region); x++)
				magnitude[y * side + x] = 1e-5;

		double[] searched = magnitude;
		int peak = Fourier.argmax(searched);
		int px = peak % side;
		int py = peak / side;

		final int minDistance = (int)(side * FILTER_FRACTION);
		final int edgeDistance = Math.min(Math.min(px, py), Math.min(side - px, side - py));
		final boolean shifted = edgeDistance - edgeDistance % 2 < minDistance;
		if (shifted) {
			// carrier close to Nyquist, search the unshifted spectrum instead
			searched = Fourier.roll(magnitude, side, 1, -(side / 2), -(side / 2));
			peak = Fourier.argmax(searched);
			px = peak % side;
			py = peak / side;
		}

		LOG.debug("carrier candidate ({}, {}), shifted={}", px, py, shifted);

		final int[] refined = refine(searched, side, px, py);

		final int diameter = minDistance;
		double[] weights = window(side, diameter, refined[0], refined[1]);
		int peakX = refined[0];
		int peakY = refined[1];
		if (shifted) {
			weights = Fourier.roll(weights, side, 1, side / 2, side / 2);
			peakX = Math.floorMod(peakX + side / 2, side);
			peakY = Math.floorMod(peakY + side / 2, side);
		}

		final CarrierFilter filter = new CarrierFilter(side, weights, peakX, peakY, shifted);
		LOG.info("built {}", filter);
		return filter;
	}

	/**
	 * Moves the peak estimate to the rounded centroid of the thresholded,
	 * weighted log-magnitude window around it, {@value #REFINE_ITERATIONS}
	 * times.
	 */
	static int[] refine(final double[] magnitude, final int side, final int startX, final int startY) {

		final int half = REFINE_WINDOW / 2;
		final double[] window = new double[REFINE_WINDOW * REFINE_WINDOW];

		int px = startX;
		int py = startY;
		for (int iteration = 0; iteration < REFINE_ITERATIONS; iteration++) {

			if (px - half < 0 || py - half < 0 || px + half > side || py + half > side)
				throw new FilterConstructionException(String.format(
						"fringe spacing too fine: carrier peak (%d, %d) is within %d px of the %d x %d spectrum edge, "
								+ "make the interferometer fringes coarser",
						px, py, half, side, side));

			double max = Double.NEGATIVE_INFINITY;
			for (int j = 0; j < REFINE_WINDOW; j++)
				for (int i = 0; i < REFINE_WINDOW; i++) {
					final double v = Math.log(magnitude[(py - half + j) * side + px - half + i]);
					window[j * REFINE_WINDOW + i] = v;
					max = Math.max(max, v);
				}

			final double threshold = max - LOG_THRESHOLD;
			double mass = 0;
			double sj = 0;
			double si = 0;
			for (int j = 0; j < REFINE_WINDOW; j++)
				for (int i = 0; i < REFINE_WINDOW; i++) {
					final int k = j * REFINE_WINDOW + i;
					final double v = window[k] < threshold ? 0 : window[k] * REFINE_WEIGHTS[k];
					mass += v;
					sj += j * v;
					si += i * v;
				}

			if (mass == 0 || Double.isNaN(mass))
				throw new FilterConstructionException(String.format(
						"no carrier signal around (%d, %d), check fringe contrast", px, py));

			px = px - half + (int)Math.rint(si / mass);
			py = py - half + (int)Math.rint(sj / mass);
		}

		return new int[]{px, py};
	}

	/**
	 * Outer product of a sampled Gaussian (standard deviation equal to the
	 * window length) with itself, keeping only values above its value at
	 * {@code (half - 1, size - 1)}.
	 */
	static double[] refinementWeights(final int size) {

		final double[] g = new double[size];
		final double centre = (size - 1) / 2.0;
		for (int n = 0; n < size; n++) {
			final double d = (n - centre) / size;
			g[n] = Math.exp(-0.5 * d * d);
		}

		final double cut = g[size / 2 - 1] * g[size - 1];
		final double[] w = new double[size * size];
		for (int j = 0; j < size; j++)
			for (int i = 0; i < size; i++) {
				final double v = g[j] * g[i];
				w[j * size + i] = v > cut ? v : 0;
			}

		return w;
	}

	/**
	 * sin² profile of length {@code diameter}, outer-producted and placed
	 * around {@code (cx, cy)}; placement wraps around the spectrum edges.
	 */
	static double[] window(final int side, final int diameter, final int cx, final int cy) {

		final double[] profile = new double[diameter];
		for (int k = 0; k < diameter; k++) {
			final double s = diameter > 1 ? Math.sin(Math.PI * k / (diameter - 1)) : 0;
			profile[k] = s * s;
		}

		final double[] w = new double[side * side];
		final int y0 = cy - diameter / 2;
		final int x0 = cx - diameter / 2;
		for (int j = 0; j < diameter; j++) {
			final int y = Math.floorMod(y0 + j, side);
			for (int i = 0; i < diameter; i++) {
				final int x = Math.floorMod(x0 + i, side);
				w[y * side + x] = profile[j] * profile[i];
			}
		}
		return w;
	}
}
