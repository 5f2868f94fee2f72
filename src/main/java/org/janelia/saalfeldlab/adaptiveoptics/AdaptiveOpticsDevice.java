package org.janelia.saalfeldlab.adaptiveoptics;

import java.io.IOException;
import java.util.Arrays;

import org.janelia.saalfeldlab.adaptiveoptics.calibration.CalibrationResult;
import org.janelia.saalfeldlab.adaptiveoptics.calibration.ControlMatrix;
import org.janelia.saalfeldlab.adaptiveoptics.calibration.ControlMatrixCalibration;
import org.janelia.saalfeldlab.adaptiveoptics.correction.ClosedLoopCorrector;
import org.janelia.saalfeldlab.adaptiveoptics.correction.Correction;
import org.janelia.saalfeldlab.adaptiveoptics.fourier.CarrierFilter;
import org.janelia.saalfeldlab.adaptiveoptics.fourier.CarrierFilterBuilder;
import org.janelia.saalfeldlab.adaptiveoptics.fourier.PhaseUnwrapper;
import org.janelia.saalfeldlab.adaptiveoptics.hardware.Camera;
import org.janelia.saalfeldlab.adaptiveoptics.hardware.CameraTimeoutException;
import org.janelia.saalfeldlab.adaptiveoptics.hardware.DeformableMirror;
import org.janelia.saalfeldlab.adaptiveoptics.io.ArtifactStore;
import org.janelia.saalfeldlab.adaptiveoptics.sensorless.FourierMetric;
import org.janelia.saalfeldlab.adaptiveoptics.sensorless.SensorlessEstimator;
import org.janelia.saalfeldlab.adaptiveoptics.zernike.ModalDecomposition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;

/**
 * Interferometric wavefront sensor and deformable mirror driven together.
 * All operations block and must not be called concurrently.
 */
public class AdaptiveOpticsDevice {

	private static final Logger LOG = LoggerFactory.getLogger(AdaptiveOpticsDevice.class);

	private final Camera camera;
	private final DeformableMirror mirror;
	private final AdaptiveOpticsContext context;
	private final AdaptiveOpticsParameters parameters;

	private final int numActuators;

	public AdaptiveOpticsDevice(final Camera camera, final DeformableMirror mirror, final AdaptiveOpticsParameters parameters) {
		this(camera, mirror, new AdaptiveOpticsContext(mirror.numActuators()), parameters);
	}

	public AdaptiveOpticsDevice(
			final Camera camera,
			final DeformableMirror mirror,
			final AdaptiveOpticsContext context,
			final AdaptiveOpticsParameters parameters) {

		this.camera = camera;
		this.mirror = mirror;
		this.context = context;
		this.parameters = parameters;

		numActuators = mirror.numActuators();
		if (context.numActuators() != numActuators)
			throw DimensionMismatchException.of("context actuator count", numActuators, context.numActuators());
	}

	public int numActuators() {
		return numActuators;
	}

	public AdaptiveOpticsContext getContext() {
		return context;
	}

	public AdaptiveOpticsParameters getParameters() {
		return parameters;
	}

	public void setRegionOfInterest(final int y0, final int x0, final int radius) {

		context.setRegionOfInterest(new RegionOfInterest(y0, x0, radius));
		LOG.info("Region of interest set to {}", context.getRegionOfInterest());
	}

	public RegionOfInterest getRegionOfInterest() {
		return context.getRegionOfInterest();
	}

	public PupilMask makeMask(final int radius) {

		final PupilMask mask = PupilMask.create(radius);
		context.setMask(mask);
		return mask;
	}

	public ControlMatrix getControlMatrix() {
		return context.getControlMatrix();
	}

	public void setControlMatrix(final ControlMatrix controlMatrix) {
		context.setControlMatrix(controlMatrix);
	}

	public CarrierFilter getFilter() {
		return context.getFilter();
	}

	public CarrierFilter buildFilter(final RandomAccessibleInterval<? extends RealType<?>> sample) {
		return buildFilter(sample, Images.squareSide(sample) / 8);
	}

	/**
	 * @param region half width of the excluded zero-frequency square
	 */
	public CarrierFilter buildFilter(final RandomAccessibleInterval<? extends RealType<?>> sample, final int region) {

		context.getRegionOfInterest();
		final CarrierFilter filter = CarrierFilterBuilder.build(sample, region);
		context.setFilter(filter);
		LOG.info("Built {}", filter);
		return filter;
	}

	/**
	 * Sends actuator values to the mirror, clamped to [0, 1].
	 *
	 * @return the values sent
	 */
	public double[] send(final double[] values) {

		if (values.length != numActuators)
			throw DimensionMismatchException.of("actuator vector length", numActuators, values.length);

		final double[] clamped = new double[values.length];
		for (int i = 0; i < values.length; i++)
			clamped[i] = ControlMatrix.clamp(values[i]);

		LOG.debug("Sending pattern to mirror");
		mirror.apply(clamped);
		return clamped;
	}

	/**
	 * Moves every actuator to the rest position.
	 */
	public void reset() {

		final double[] rest = new double[numActuators];
		Arrays.fill(rest, parameters.restPosition);
		send(rest);
	}

	/**
	 * Triggers the camera until a frame arrives. Timeouts are retried after
	 * a fixed backoff, for as long as it takes; any other camera failure is
	 * reported as an {@link AcquisitionException}.
	 */
	public RandomAccessibleInterval<? extends RealType<?>> acquireRaw() {

		while (true) {
			try {
				return camera.triggerAndCapture();
			} catch (final CameraTimeoutException e) {
				LOG.info("Camera timed out ({}), retrying in {} ms", e.getMessage(), parameters.timeoutBackoffMillis);
				sleep(parameters.timeoutBackoffMillis);
			} catch (final RuntimeException e) {
				throw new AcquisitionException("camera acquisition failed: " + e.getMessage(), e);
			}
		}
	}

	/**
	 * A frame cropped to the region of interest with everything outside the
	 * pupil set to zero.
	 */
	public ArrayImg<DoubleType, DoubleArray> acquire() {

		final RegionOfInterest roi = context.getRegionOfInterest();
		if (!context.hasMask())
			context.setMask(PupilMask.create(roi.radius));

		final double[] cropped = Images.crop(acquireRaw(), roi);
		return Images.wrap(context.getMask().apply(cropped), roi.side());
	}

	/**
	 * Unwraps an interferogram of the pupil. The carrier filter is built
	 * from this interferogram if there is none yet.
	 */
	public ArrayImg<DoubleType, DoubleArray> unwrap(final RandomAccessibleInterval<? extends RealType<?>> interferogram) {

		context.getRegionOfInterest();
		final int side = Images.squareSide(interferogram);
		if (!context.hasMask())
			context.setMask(PupilMask.create((side + 1) / 2));
		if (!context.hasFilter())
			buildFilter(interferogram);

		return PhaseUnwrapper.unwrap(interferogram, context.getFilter(), context.getMask());
	}

	public ArrayImg<DoubleType, DoubleArray> unwrap() {
		return unwrap(acquire());
	}

	public double[] decompose(final RandomAccessibleInterval<? extends RealType<?>> phase, final int numModes) {
		return ModalDecomposition.decompose(phase, numModes, parameters.resizeDimension);
	}

	/**
	 * Acquires and unwraps one interferogram. If no carrier filter exists, a
	 * separate frame is acquired first to build it.
	 */
	public ArrayImg<DoubleType, DoubleArray> acquireUnwrappedPhase() {

		context.getRegionOfInterest();
		if (!context.hasFilter())
			buildFilter(acquire());

		final ArrayImg<DoubleType, DoubleArray> phase = unwrap(acquire());
		LOG.debug("Phase unwrapped");
		return phase;
	}

	public double[] measureModes(final int numModes) {
		return decompose(acquireUnwrappedPhase(), numModes);
	}

	/**
	 * RMS deviation of the measured wavefront from flat, over the whole
	 * cropped frame.
	 */
	public double rmsError() {
		return Images.rms(acquireUnwrappedPhase());
	}

	/**
	 * Computes the control matrix from a poke stack and installs it.
	 *
	 * @param stack cropped interferograms, x, y, frame; actuator-major
	 * @param included actuators inside the pupil, or {@code null} for all
	 */
	public <T extends RealType<T>> CalibrationResult createControlMatrix(
			final RandomAccessibleInterval<T> stack,
			final int numModes,
			final double[] pokeSteps,
			final boolean[] included) {

		final CalibrationResult result = computeControlMatrix(stack, numModes, pokeSteps, included);
		context.setControlMatrix(result.controlMatrix);
		return result;
	}

	private <T extends RealType<T>> CalibrationResult computeControlMatrix(
			final RandomAccessibleInterval<T> stack,
			final int numModes,
			final double[] pokeSteps,
			final boolean[] included) {

		context.getRegionOfInterest();
		if (stack.numDimensions() != 3)
			throw DimensionMismatchException.of("image stack dimensions", 3, stack.numDimensions());
		if (!context.hasMask())
			context.setMask(PupilMask.create((int)((stack.dimension(0) + 1) / 2)));
		if (!context.hasFilter())
			buildFilter(Views.hyperSlice(stack, 2, 0));

		final CalibrationResult result = new ControlMatrixCalibration(context.getFilter(), context.getMask())
				.discontinuityFraction(parameters.discontinuityFraction)
				.cutoff(parameters.pseudoInverseCutoff)
				.resizeDimension(parameters.resizeDimension)
				.calibrate(stack, numActuators, numModes, pokeSteps, included);

		if (!result.rejected.isEmpty())
			LOG.warn("{} calibration frames rejected", result.rejected.size());

		return result;
	}

	public CalibrationResult calibrate(final ArtifactStore store) throws IOException {
		return calibrate(store, null);
	}

	/**
	 * Pokes every actuator through the configured poke range, computes the
	 * control matrix and flattens the system aberration with it. The control
	 * matrix and system flat are installed together once the flatten has
	 * succeeded; if any step fails, the context keeps its previous state.
	 *
	 * @param store receives the poke stack and control matrix, may be {@code null}
	 * @param included actuators inside the pupil, or {@code null} for all
	 */
	public CalibrationResult calibrate(final ArtifactStore store, final boolean[] included) throws IOException {

		camera.setExposureTime(parameters.calibrationExposure);
		final RegionOfInterest roi = context.getRegionOfInterest();

		final ArrayImg<DoubleType, DoubleArray> test = acquire();
		if (!context.hasFilter()) {
			LOG.info("Constructing Fourier filter");
			buildFilter(test);
		}

		final double[] pokeSteps = parameters.pokeSteps();
		final int side = roi.side();
		final int numFrames = numActuators * pokeSteps.length;
		final ArrayImg<DoubleType, DoubleArray> stack = ArrayImgs.doubles(side, side, numFrames);
		final double[] stackData = Images.data(stack);

		final double[] values = new double[numActuators];
		for (int a = 0; a < numActuators; a++) {
			for (int s = 0; s < pokeSteps.length; s++) {
				final int frame = a * pokeSteps.length + s;
				Arrays.fill(values, parameters.restPosition);
				values[a] = pokeSteps[s];
				send(values);

				final double[] image = Images.data(acquire());
				System.arraycopy(image, 0, stackData, frame * side * side, side * side);
				LOG.info("Frame {}/{} captured", frame + 1, numFrames);
			}
		}
		reset();

		if (store != null)
			store.saveImageStack(stack);

		LOG.info("Computing control matrix");
		final CalibrationResult result = computeControlMatrix(stack, parameters.calibrationModes, pokeSteps, included);
		LOG.info("Control matrix computed");

		if (store != null)
			store.saveControlMatrix(result.controlMatrix);

		final Correction systemFlat = flatten(result.controlMatrix, parameters.systemFlattenIterations, parameters.systemFlattenExcludedModes);
		context.setControlMatrix(result.controlMatrix);
		context.setSystemFlat(systemFlat.command);
		return result;
	}

	public Correction flatten(final int iterations) {
		return flatten(iterations, parameters.flattenExcludedModes);
	}

	/**
	 * Closed-loop correction of all but the first {@code excludedModes}
	 * Noll modes. Leaves the mirror at the best state found.
	 */
	public Correction flatten(final int iterations, final int excludedModes) {
		return flatten(context.getControlMatrix(), iterations, excludedModes);
	}

	private Correction flatten(final ControlMatrix controlMatrix, final int iterations, final int excludedModes) {

		context.getRegionOfInterest();
		if (!context.hasFilter())
			buildFilter(acquire());

		final ClosedLoopCorrector corrector = new ClosedLoopCorrector(this::acquireUnwrappedPhase, mirror, controlMatrix)
				.restPosition(parameters.restPosition)
				.settleDelayMillis(parameters.settleDelayMillis)
				.resizeDimension(parameters.resizeDimension);

		final Correction correction = corrector.correct(iterations, excludedModes);
		LOG.info("Flattened: {}", correction);
		return correction;
	}

	/**
	 * Drives the mirror to produce the given modal correction around
	 * {@code offset}, or around the rest position if {@code offset} is null.
	 *
	 * @return the actuator values sent
	 */
	public double[] setPhase(final double[] modes, final double[] offset) {

		final double[] base;
		if (offset == null) {
			base = new double[numActuators];
			Arrays.fill(base, parameters.restPosition);
		} else
			base = offset;

		return send(context.getControlMatrix().actuatorCommand(modes, base, numActuators));
	}

	public double[][] assessCharacter() {
		return assessCharacter(numActuators);
	}

	/**
	 * Applies each of the first {@code numModes} modes at unit amplitude and
	 * records the measured change of all modes.
	 *
	 * @return assay[measured][applied]
	 */
	public double[][] assessCharacter(final int numModes) {

		final double[][] assay = new double[numModes][numModes];
		final double[] applied = new double[numModes];
		for (int j = 0; j < numModes; j++) {
			reset();
			final double[] before = measureModes(numModes);

			applied[j] = 1;
			setPhase(applied, null);
			LOG.info("Applying Zernike mode {}/{}", j + 1, numModes);
			final double[] after = measureModes(numModes);
			for (int i = 0; i < numModes; i++)
				assay[i][j] = after[i] - before[i];

			applied[j] = 0;
		}
		reset();
		return assay;
	}

	/**
	 * Estimates modal amplitudes from image sharpness alone.
	 *
	 * @see SensorlessEstimator#estimateModes
	 */
	public <T extends RealType<T>> double[] sensorlessModes(
			final RandomAccessibleInterval<T> stack,
			final double[][] applied,
			final int[] nollModes) {

		final FourierMetric metric = new FourierMetric(
				parameters.numericalAperture,
				parameters.wavelength,
				parameters.pixelSize,
				parameters.ringCount);
		return new SensorlessEstimator(metric)
				.slopeOnly(parameters.sensorlessSlopeOnly)
				.estimateModes(stack, applied, nollModes);
	}

	private static void sleep(final long millis) {

		try {
			Thread.sleep(millis);
		} catch (final InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new AcquisitionException("interrupted while waiting to retry acquisition", e);
		}
	}
}
