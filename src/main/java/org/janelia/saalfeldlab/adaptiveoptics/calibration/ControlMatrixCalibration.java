package org.janelia.saalfeldlab.adaptiveoptics.calibration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.janelia.saalfeldlab.adaptiveoptics.DimensionMismatchException;
import org.janelia.saalfeldlab.adaptiveoptics.Images;
import org.janelia.saalfeldlab.adaptiveoptics.PupilMask;
import org.janelia.saalfeldlab.adaptiveoptics.fourier.CarrierFilter;
import org.janelia.saalfeldlab.adaptiveoptics.fourier.PhaseUnwrapper;
import org.janelia.saalfeldlab.adaptiveoptics.zernike.ModalDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;
import net.imglib2.view.Views;

/**
 * Builds a control matrix from a poke stack: every actuator is driven
 * through the same sequence of poke values while an interferogram is taken
 * at each step, frames ordered actuator-major.
 */
public class ControlMatrixCalibration {

	private static final Logger LOG = LoggerFactory.getLogger(ControlMatrixCalibration.class);

	private final CarrierFilter filter;
	private final PupilMask mask;

	private double discontinuityFraction = DiscontinuityCheck.DEFAULT_FRACTION;
	private double cutoff = ControlMatrix.DEFAULT_CUTOFF;
	private int resizeDimension = ModalDecomposition.DEFAULT_RESIZE;

	public ControlMatrixCalibration(final CarrierFilter filter, final PupilMask mask) {

		if (filter.side != mask.side)
			throw DimensionMismatchException.of("filter side vs. mask side", mask.side, filter.side);

		this.filter = filter;
		this.mask = mask;
	}

	public ControlMatrixCalibration discontinuityFraction(final double discontinuityFraction) {
		this.discontinuityFraction = discontinuityFraction;
		return this;
	}

	public ControlMatrixCalibration cutoff(final double cutoff) {
		this.cutoff = cutoff;
		return this;
	}

	public ControlMatrixCalibration resizeDimension(final int resizeDimension) {
		this.resizeDimension = resizeDimension;
		return this;
	}

	/**
	 * @param stack interferograms as an x, y, frame image; frame
	 *   {@code a * pokeSteps.length + s} shows actuator {@code a} at poke step {@code s}
	 * @param included actuators to calibrate, or {@code null} for all
	 */
	public <T extends RealType<T>> CalibrationResult calibrate(
			final RandomAccessibleInterval<T> stack,
			final int numActuators,
			final int numModes,
			final double[] pokeSteps,
			final boolean[] included) {

		if (stack.numDimensions() != 3)
			throw DimensionMismatchException.of("image stack dimensions", 3, stack.numDimensions());
		if (stack.dimension(0) != mask.side || stack.dimension(1) != mask.side)
			throw new DimensionMismatchException(String.format(
					"stack frames are %d x %d, pupil is %d x %d",
					stack.dimension(0), stack.dimension(1), mask.side, mask.side));

		final long numFrames = stack.dimension(2);
		checkArguments(numActuators, numModes, pokeSteps, included, numFrames);

		final int side = mask.side;
		final RealMatrix response = new Array2DRowRealMatrix(numModes, numActuators);
		final RealMatrix intercepts = new Array2DRowRealMatrix(numModes, numActuators);
		final RealMatrix pValues = new Array2DRowRealMatrix(numModes, numActuators);
		final List<RejectedFrame> rejected = new ArrayList<>();

		for (int a = 0; a < numActuators; a++) {
			if (!isIncluded(included, a)) {
				LOG.info("Actuator {} is not in the pupil, skipping", a);
				continue;
			}

			final List<PokeResponseSample> samples = new ArrayList<>();
			for (int s = 0; s < pokeSteps.length; s++) {
				final int frame = a * pokeSteps.length + s;
				final double[] image = Images.toArray(Views.hyperSlice(stack, 2, frame));
				final double[] phase = PhaseUnwrapper.unwrap(image, side, filter, mask);

				final int discontinuities = DiscontinuityCheck.count(phase, side);
				if (DiscontinuityCheck.exceeds(discontinuities, side, discontinuityFraction)) {
					LOG.warn("Unwrapped frame {}/{} contains {} discontinuities, skipping", frame + 1, numFrames, discontinuities);
					rejected.add(new RejectedFrame(frame, a, pokeSteps[s], discontinuities));
					continue;
				}

				LOG.debug("Decomposing frame {}/{}", frame + 1, numFrames);
				samples.add(new PokeResponseSample(
						a,
						pokeSteps[s],
						ModalDecomposition.decompose(phase, side, numModes, resizeDimension)));
			}

			// fails before the frames of later actuators are processed
			store(ActuatorResponse.fit(a, samples, numModes), response, intercepts, pValues);
		}

		return invert(response, intercepts, pValues, rejected);
	}

	/**
	 * Fits the response of every included actuator and inverts the response
	 * matrix.
	 */
	public CalibrationResult fit(
			final List<PokeResponseSample> samples,
			final List<RejectedFrame> rejected,
			final int numActuators,
			final int numModes,
			final boolean[] included) {

		if (included != null && included.length != numActuators)
			throw DimensionMismatchException.of("actuator inclusion mask length", numActuators, included.length);

		final RealMatrix response = new Array2DRowRealMatrix(numModes, numActuators);
		final RealMatrix intercepts = new Array2DRowRealMatrix(numModes, numActuators);
		final RealMatrix pValues = new Array2DRowRealMatrix(numModes, numActuators);

		for (int a = 0; a < numActuators; a++) {
			if (!isIncluded(included, a)) {
				LOG.info("Actuator {} is not in the pupil, skipping", a);
				continue;
			}

			final List<PokeResponseSample> actuatorSamples = new ArrayList<>();
			for (final PokeResponseSample sample : samples)
				if (sample.actuator == a)
					actuatorSamples.add(sample);

			store(ActuatorResponse.fit(a, actuatorSamples, numModes), response, intercepts, pValues);
		}

		return invert(response, intercepts, pValues, rejected);
	}

	private static void store(
			final ActuatorResponse fit,
			final RealMatrix response,
			final RealMatrix intercepts,
			final RealMatrix pValues) {

		response.setColumn(fit.actuator, fit.slopes);
		intercepts.setColumn(fit.actuator, fit.intercepts);
		pValues.setColumn(fit.actuator, fit.pValues);
	}

	private CalibrationResult invert(
			final RealMatrix response,
			final RealMatrix intercepts,
			final RealMatrix pValues,
			final List<RejectedFrame> rejected) {

		LOG.info("Computing control matrix ({} modes x {} actuators, cutoff {})",
				response.getRowDimension(), response.getColumnDimension(), cutoff);
		final ControlMatrix controlMatrix = ControlMatrix.pseudoInverse(response, cutoff);
		LOG.info("Control matrix computed");

		return new CalibrationResult(controlMatrix, response, intercepts, pValues, Collections.unmodifiableList(new ArrayList<>(rejected)));
	}

	private static boolean isIncluded(final boolean[] included, final int actuator) {
		return included == null || included[actuator];
	}

	private static void checkArguments(
			final int numActuators,
			final int numModes,
			final double[] pokeSteps,
			final boolean[] included,
			final long numFrames) {

		if (numActuators <= 0)
			throw new IllegalArgumentException("number of actuators must be positive, got " + numActuators);
		if (numModes <= 0)
			throw new IllegalArgumentException("number of modes must be positive, got " + numModes);
		if (pokeSteps.length == 0)
			throw new IllegalArgumentException("poke sequence is empty");
		if (included != null && included.length != numActuators)
			throw DimensionMismatchException.of("actuator inclusion mask length", numActuators, included.length);
		if (numFrames != (long)numActuators * pokeSteps.length)
			throw DimensionMismatchException.of("number of calibration frames", (long)numActuators * pokeSteps.length, numFrames);
	}
}
