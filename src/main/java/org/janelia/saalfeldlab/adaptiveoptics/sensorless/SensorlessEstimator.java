package org.janelia.saalfeldlab.adaptiveoptics.sensorless;

import java.util.Arrays;

import org.apache.commons.math3.fitting.PolynomialCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;
import org.janelia.saalfeldlab.adaptiveoptics.DimensionMismatchException;
import org.janelia.saalfeldlab.adaptiveoptics.Images;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import net.imglib2.view.Views;

/**
 * Estimates the amplitude of an aberration mode from a series of images
 * taken with known bias amplitudes of that mode applied: each component of
 * the {@link SharpnessSignature} follows a parabola whose vertex sits at the
 * bias cancelling the aberration. The estimate is the mean vertex over all
 * signature components, or over the slope alone with {@link #slopeOnly}.
 */
public class SensorlessEstimator {

	private static final Logger LOG = LoggerFactory.getLogger(SensorlessEstimator.class);

	/** relative size below which the quadratic coefficient counts as zero */
	static final double DEGENERATE = 1e-10;

	private static final String[] COMPONENTS = {"slope", "intercept", "r", "log(p)", "stderr"};

	private final FourierMetric metric;

	private boolean slopeOnly = false;

	public SensorlessEstimator(final FourierMetric metric) {
		this.metric = metric;
	}

	public SensorlessEstimator slopeOnly(final boolean slopeOnly) {
		this.slopeOnly = slopeOnly;
		return this;
	}

	/**
	 * Vertex {@code -a1 / (2 a2)} of the least squares parabola through
	 * {@code (amplitudes[i], metrics[i])}.
	 */
	public static double vertex(final double[] amplitudes, final double[] metrics) {

		final double v = fitVertex(amplitudes, metrics);
		if (Double.isNaN(v))
			throw new IllegalArgumentException("metric does not depend quadratically on the applied amplitude");

		return v;
	}

	/**
	 * @return the vertex, or NaN if the parabola is flat
	 */
	private static double fitVertex(final double[] amplitudes, final double[] metrics) {

		if (amplitudes.length != metrics.length)
			throw DimensionMismatchException.of("number of metric values", amplitudes.length, metrics.length);
		if (amplitudes.length < 3)
			throw new IllegalArgumentException("a quadratic fit needs at least 3 points, got " + amplitudes.length);

		final WeightedObservedPoints points = new WeightedObservedPoints();
		for (int i = 0; i < amplitudes.length; i++)
			points.add(amplitudes[i], metrics[i]);

		final double[] a = PolynomialCurveFitter.create(2).fit(points.toList());
		if (Math.abs(a[2]) <= DEGENERATE * Math.max(Math.abs(a[0]), Math.abs(a[1])))
			return Double.NaN;

		return -a[1] / (2 * a[2]);
	}

	/**
	 * @param stack images as an x, y, frame image
	 * @param amplitudes bias amplitude of each frame, or of each frame in one
	 *   repeat when the stack holds several consecutive repeats of the series
	 * @return the mean vertex over all repeats and signature components
	 */
	public <T extends RealType<T>> double estimateAmplitude(final RandomAccessibleInterval<T> stack, final double[] amplitudes) {

		checkStack(stack);
		return estimateAmplitude(signatures(stack, 0, (int)stack.dimension(2)), amplitudes, slopeOnly);
	}

	/**
	 * Mean vertex of a single precomputed metric over all repeats.
	 */
	public static double estimateAmplitude(final double[] metrics, final double[] amplitudes) {

		final double amplitude = meanVertex(metrics, amplitudes, true);
		LOG.info("Estimated amplitude {}", amplitude);
		return amplitude;
	}

	/**
	 * Mean vertex over all repeats of every signature component, or of the
	 * slope only. Components that are not finite in every frame, or whose
	 * parabola is flat, are left out.
	 */
	public static double estimateAmplitude(
			final SharpnessSignature[] signatures,
			final double[] amplitudes,
			final boolean slopeOnly) {

		final int numComponents = slopeOnly ? 1 : COMPONENTS.length;
		double sum = 0;
		int used = 0;
		for (int c = 0; c < numComponents; c++) {
			final double[] metrics = new double[signatures.length];
			for (int f = 0; f < signatures.length; f++)
				metrics[f] = signatures[f].toArray()[c];

			final double v = meanVertex(metrics, amplitudes, slopeOnly);
			if (Double.isNaN(v) || Double.isInfinite(v)) {
				LOG.warn("Signature component {} gives no vertex, leaving it out", COMPONENTS[c]);
				continue;
			}
			LOG.debug("Signature component {} vertex {}", COMPONENTS[c], v);
			sum += v;
			used++;
		}

		if (used == 0)
			throw new IllegalArgumentException("no signature component depends quadratically on the applied amplitude");

		final double amplitude = sum / used;
		LOG.info("Estimated amplitude {} from {} signature component(s)", amplitude, used);
		return amplitude;
	}

	/**
	 * Mean vertex over consecutive repeats of the bias series. With
	 * {@code strict}, a flat parabola is an error; otherwise the result is
	 * NaN, as it is for metrics that are not finite.
	 */
	private static double meanVertex(final double[] metrics, final double[] amplitudes, final boolean strict) {

		if (amplitudes.length == 0 || metrics.length % amplitudes.length != 0)
			throw new DimensionMismatchException(String.format(
					"%d frames are not a whole number of repeats of %d bias amplitudes", metrics.length, amplitudes.length));

		if (!strict)
			for (final double m : metrics)
				if (Double.isNaN(m) || Double.isInfinite(m))
					return Double.NaN;

		final int repeats = metrics.length / amplitudes.length;
		double sum = 0;
		for (int r = 0; r < repeats; r++) {
			final double[] repeat = Arrays.copyOfRange(metrics, r * amplitudes.length, (r + 1) * amplitudes.length);
			final double v = strict ? vertex(amplitudes, repeat) : fitVertex(amplitudes, repeat);
			if (Double.isNaN(v))
				return Double.NaN;

			sum += v;
		}
		return sum / repeats;
	}

	/**
	 * Estimates several modes from one stack. Frames are grouped by mode,
	 * in the order of {@code nollModes}, in equal consecutive groups.
	 *
	 * @param applied modal amplitudes applied to each frame, one row per frame
	 * @param nollModes the mode biased in each group
	 * @return coefficients of length {@code applied[0].length}, zero for
	 *   modes not estimated
	 */
	public <T extends RealType<T>> double[] estimateModes(
			final RandomAccessibleInterval<T> stack,
			final double[][] applied,
			final int[] nollModes) {

		checkStack(stack);
		final int numFrames = (int)stack.dimension(2);
		if (applied.length != numFrames)
			throw DimensionMismatchException.of("rows of applied amplitudes", numFrames, applied.length);
		if (nollModes.length == 0 || numFrames % nollModes.length != 0)
			throw new DimensionMismatchException(String.format(
					"%d frames cannot be split into %d equal mode groups", numFrames, nollModes.length));

		final int group = numFrames / nollModes.length;
		final double[] coefficients = new double[applied.length == 0 ? 0 : applied[0].length];
		for (int i = 0; i < nollModes.length; i++) {
			final int mode = nollModes[i];
			if (mode < 1 || mode > coefficients.length)
				throw new IllegalArgumentException("Noll mode " + mode + " outside applied amplitude vector");

			final double[] amplitudes = new double[group];
			for (int f = 0; f < group; f++)
				amplitudes[f] = applied[i * group + f][mode - 1];

			final int period = seriesLength(amplitudes);
			LOG.info("Estimating Zernike mode {} ({}/{})", mode, i + 1, nollModes.length);
			coefficients[mode - 1] = estimateAmplitude(
					signatures(stack, i * group, group),
					Arrays.copyOf(amplitudes, period),
					slopeOnly);
		}
		return coefficients;
	}

	/**
	 * Length of the shortest bias series (at least 3 frames) that the
	 * amplitudes repeat, or all of them if they do not repeat.
	 */
	static int seriesLength(final double[] amplitudes) {

		for (int period = 3; period < amplitudes.length; period++) {
			if (amplitudes.length % period != 0)
				continue;

			boolean repeats = true;
			for (int f = period; f < amplitudes.length && repeats; f++)
				repeats = amplitudes[f] == amplitudes[f % period];

			if (repeats)
				return period;
		}
		return amplitudes.length;
	}

	private static void checkStack(final RandomAccessibleInterval<?> stack) {

		if (stack.numDimensions() != 3)
			throw DimensionMismatchException.of("image stack dimensions", 3, stack.numDimensions());
	}

	private <T extends RealType<T>> SharpnessSignature[] signatures(final RandomAccessibleInterval<T> stack, final int first, final int count) {

		final SharpnessSignature[] signatures = new SharpnessSignature[count];
		for (int f = 0; f < count; f++) {
			final RandomAccessibleInterval<T> frame = Views.hyperSlice(stack, 2, first + f);
			signatures[f] = metric.measure(Images.toArray(frame), Images.squareSide(frame));
		}
		return signatures;
	}
}
