package org.janelia.saalfeldlab.adaptiveoptics;

import org.janelia.saalfeldlab.adaptiveoptics.calibration.ControlMatrix;
import org.janelia.saalfeldlab.adaptiveoptics.fourier.CarrierFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * State shared by calibration and correction for one mirror: region of
 * interest, pupil mask, carrier filter, control matrix and the system flat.
 * Setters clear whatever was derived from the state they replace. Not
 * thread safe.
 */
public class AdaptiveOpticsContext {

	private static final Logger LOG = LoggerFactory.getLogger(AdaptiveOpticsContext.class);

	private final int numActuators;

	private RegionOfInterest roi;
	private PupilMask mask;
	private CarrierFilter filter;
	private ControlMatrix controlMatrix;
	private double[] systemFlat;

	public AdaptiveOpticsContext(final int numActuators) {

		if (numActuators <= 0)
			throw new IllegalArgumentException("number of actuators must be positive, got " + numActuators);

		this.numActuators = numActuators;
	}

	public int numActuators() {
		return numActuators;
	}

	/**
	 * Rebuilds the pupil mask and clears the carrier filter. A changed radius
	 * also clears the control matrix and the system flat.
	 */
	public void setRegionOfInterest(final RegionOfInterest roi) {

		if (this.roi != null && this.roi.radius != roi.radius && controlMatrix != null) {
			LOG.info("Pupil radius changed from {} to {}, discarding control matrix", this.roi.radius, roi.radius);
			controlMatrix = null;
			systemFlat = null;
		}

		this.roi = roi;
		setMask(PupilMask.create(roi.radius));
	}

	public RegionOfInterest getRegionOfInterest() {

		if (roi == null)
			throw new ConfigurationException("no region of interest selected");

		return roi;
	}

	public boolean hasRegionOfInterest() {
		return roi != null;
	}

	/**
	 * Replaces the pupil mask and clears the carrier filter.
	 */
	public void setMask(final PupilMask mask) {

		this.mask = mask;
		filter = null;
	}

	public PupilMask getMask() {

		if (mask == null)
			throw new ConfigurationException("no pupil mask, select a region of interest first");

		return mask;
	}

	public boolean hasMask() {
		return mask != null;
	}

	public void setFilter(final CarrierFilter filter) {

		if (mask != null && filter.side != mask.side)
			throw DimensionMismatchException.of("carrier filter side", mask.side, filter.side);

		this.filter = filter;
	}

	public CarrierFilter getFilter() {

		if (filter == null)
			throw new ConfigurationException("no Fourier filter, build one from a sample interferogram first");

		return filter;
	}

	public boolean hasFilter() {
		return filter != null;
	}

	public void setControlMatrix(final ControlMatrix controlMatrix) {

		if (controlMatrix.numActuators() != numActuators)
			throw DimensionMismatchException.of("control matrix actuator count", numActuators, controlMatrix.numActuators());

		this.controlMatrix = controlMatrix;
	}

	public ControlMatrix getControlMatrix() {

		if (controlMatrix == null)
			throw new ConfigurationException("no control matrix, calibrate the mirror first");

		return controlMatrix;
	}

	public boolean hasControlMatrix() {
		return controlMatrix != null;
	}

	public void setSystemFlat(final double[] systemFlat) {

		if (systemFlat.length != numActuators)
			throw DimensionMismatchException.of("system flat length", numActuators, systemFlat.length);

		this.systemFlat = systemFlat.clone();
	}

	public double[] getSystemFlat() {

		if (systemFlat == null)
			throw new ConfigurationException("no system flat, calibrate the mirror first");

		return systemFlat.clone();
	}

	public boolean hasSystemFlat() {
		return systemFlat != null;
	}
}
