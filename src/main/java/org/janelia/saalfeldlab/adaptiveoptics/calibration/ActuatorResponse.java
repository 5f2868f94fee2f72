package org.janelia.saalfeldlab.adaptiveoptics.calibration;

import java.util.List;

import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.janelia.saalfeldlab.adaptiveoptics.CalibrationException;

/**
 * Per-mode least squares lines of modal amplitude against poke value for
 * one actuator.
 */
public class ActuatorResponse {

	public final int actuator;
	public final int numSamples;

	public final double[] slopes;
	public final double[] intercepts;
	public final double[] rValues;
	public final double[] pValues;
	public final double[] stdErrs;

	private ActuatorResponse(final int actuator, final int numSamples, final int numModes) {

		this.actuator = actuator;
		this.numSamples = numSamples;
		slopes = new double[numModes];
		intercepts = new double[numModes];
		rValues = new double[numModes];
		pValues = new double[numModes];
		stdErrs = new double[numModes];
	}

	/**
	 * @param samples retained samples of this actuator, each with at least {@code numModes} coefficients
	 * @throws CalibrationException if fewer than two samples are given
	 */
	public static ActuatorResponse fit(final int actuator, final List<PokeResponseSample> samples, final int numModes) {

		if (samples.size() < 2)
			throw new CalibrationException(actuator, String.format(
					"not enough valid poke samples to fit a slope for actuator %d: %d retained",
					actuator, samples.size()));

		final ActuatorResponse response = new ActuatorResponse(actuator, samples.size(), numModes);
		for (int k = 0; k < numModes; k++) {
			final SimpleRegression regression = new SimpleRegression();
			for (final PokeResponseSample sample : samples)
				regression.addData(sample.pokeValue, sample.modes[k]);

			response.slopes[k] = regression.getSlope();
			response.intercepts[k] = regression.getIntercept();
			response.rValues[k] = regression.getR();
			response.pValues[k] = regression.getSignificance();
			response.stdErrs[k] = regression.getSlopeStdErr();
		}
		return response;
	}
}
