package org.janelia.saalfeldlab.adaptiveoptics.correction;

import java.util.Arrays;

import org.janelia.saalfeldlab.adaptiveoptics.AdaptiveOpticsException;
import org.janelia.saalfeldlab.adaptiveoptics.DimensionMismatchException;
import org.janelia.saalfeldlab.adaptiveoptics.Images;
import org.janelia.saalfeldlab.adaptiveoptics.calibration.ControlMatrix;
import org.janelia.saalfeldlab.adaptiveoptics.hardware.DeformableMirror;
import org.janelia.saalfeldlab.adaptiveoptics.zernike.ModalDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Iteratively measures the wavefront and drives the mirror against the
 * measured modes, keeping the actuator state with the lowest residual RMS.
 */
public class ClosedLoopCorrector {

	private static final Logger LOG = LoggerFactory.getLogger(ClosedLoopCorrector.class);

	public enum State {
		IDLE, MEASURING, CORRECTING, DONE
	}

	private final WavefrontSensor sensor;
	private final DeformableMirror mirror;
	private final ControlMatrix controlMatrix;

	private double restPosition = ControlMatrix.DEFAULT_OFFSET;
	private long settleDelayMillis = 1000;
	private int resizeDimension = ModalDecomposition.DEFAULT_RESIZE;

	private State state = State.IDLE;

	public ClosedLoopCorrector(final WavefrontSensor sensor, final DeformableMirror mirror, final ControlMatrix controlMatrix) {

		if (controlMatrix.numActuators() != mirror.numActuators())
			throw DimensionMismatchException.of("control matrix actuator count", mirror.numActuators(), controlMatrix.numActuators());

		this.sensor = sensor;
		this.mirror = mirror;
		this.controlMatrix = controlMatrix;
	}

	public ClosedLoopCorrector restPosition(final double restPosition) {
		this.restPosition = restPosition;
		return this;
	}

	public ClosedLoopCorrector settleDelayMillis(final long settleDelayMillis) {
		this.settleDelayMillis = settleDelayMillis;
		return this;
	}

	public ClosedLoopCorrector resizeDimension(final int resizeDimension) {
		this.resizeDimension = resizeDimension;
		return this;
	}

	public State getState() {
		return state;
	}

	/**
	 * Corrects all modes above the first {@code excludedModes} Noll modes.
	 */
	public Correction correct(final int iterations, final int excludedModes) {
		return correct(iterations, lowOrderExcluded(controlMatrix.numModes(), excludedModes));
	}

	/**
	 * @param iterations fixed iteration budget
	 * @param corrected per Noll mode (index j - 1), whether it is corrected
	 */
	public Correction correct(final int iterations, final boolean[] corrected) {

		if (iterations < 0)
			throw new IllegalArgumentException("iterations must not be negative, got " + iterations);
		if (corrected.length != controlMatrix.numModes())
			throw DimensionMismatchException.of("corrected mode mask length", controlMatrix.numModes(), corrected.length);

		final int numActuators = mirror.numActuators();
		final double[] rmsHistory = new double[iterations + 1];

		final double[] rest = new double[numActuators];
		Arrays.fill(rest, restPosition);
		mirror.apply(rest);

		state = State.MEASURING;
		ArrayImg<DoubleType, DoubleArray> phase = sensor.measurePhase();
		double[] best = rest;
		double bestRms = Images.rms(phase);
		int bestIteration = -1;
		rmsHistory[0] = bestRms;
		LOG.info("Initial RMS wavefront error {}", bestRms);

		for (int i = 0; i < iterations; i++) {
			state = State.CORRECTING;
			final double[] modes = ModalDecomposition.decompose(
					Images.data(phase),
					Images.squareSide(phase),
					controlMatrix.numModes(),
					resizeDimension);
			for (int k = 0; k < modes.length; k++)
				if (!corrected[k])
					modes[k] = 0;

			// correct the latest residual around the best command so far
			final double[] candidate = controlMatrix.actuatorCommand(modes, best, numActuators);
			mirror.apply(candidate);
			settle();

			state = State.MEASURING;
			phase = sensor.measurePhase();
			final double rms = Images.rms(phase);
			rmsHistory[i + 1] = rms;

			if (rms < bestRms) {
				best = candidate.clone();
				bestRms = rms;
				bestIteration = i;
				LOG.info("Iteration {}: RMS wavefront error improved to {}", i, rms);
			} else
				LOG.info("Iteration {}: RMS wavefront error {} no better than {}", i, rms, bestRms);
		}

		mirror.apply(best);
		state = State.DONE;
		return new Correction(best, bestRms, bestIteration, rmsHistory);
	}

	/**
	 * Mode mask that leaves out Noll modes 1 to {@code excluded}.
	 */
	public static boolean[] lowOrderExcluded(final int numModes, final int excluded) {

		final boolean[] corrected = new boolean[numModes];
		for (int k = Math.max(0, excluded); k < numModes; k++)
			corrected[k] = true;

		return corrected;
	}

	private void settle() {

		if (settleDelayMillis <= 0)
			return;

		try {
			Thread.sleep(settleDelayMillis);
		} catch (final InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new AdaptiveOpticsException("interrupted while waiting for the mirror to settle", e);
		}
	}
}
