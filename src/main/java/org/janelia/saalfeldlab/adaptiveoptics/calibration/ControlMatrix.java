package org.janelia.saalfeldlab.adaptiveoptics.calibration;

import java.util.Arrays;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.SingularValueDecomposition;
import org.janelia.saalfeldlab.adaptiveoptics.DimensionMismatchException;

/**
 * Linear map from Zernike coefficients to actuator deltas, shaped
 * actuators x modes.
 */
public class ControlMatrix {

	public static final double DEFAULT_CUTOFF = 0.005;
	public static final double DEFAULT_OFFSET = 0.5;

	private final RealMatrix matrix;

	public ControlMatrix(final RealMatrix matrix) {
		this.matrix = matrix.copy();
	}

	public static ControlMatrix fromArray(final double[][] data) {

		if (data.length == 0 || data[0].length == 0)
			throw new DimensionMismatchException("control matrix must not be empty");

		return new ControlMatrix(new Array2DRowRealMatrix(data));
	}

	/**
	 * Moore-Penrose pseudo-inverse of a modes x actuators response matrix;
	 * singular values not above {@code cutoff} times the largest one are
	 * treated as zero.
	 */
	public static ControlMatrix pseudoInverse(final RealMatrix response, final double cutoff) {

		final SingularValueDecomposition svd = new SingularValueDecomposition(response);
		final double[] s = svd.getSingularValues();
		final double threshold = cutoff * (s.length == 0 ? 0 : s[0]);

		final double[] inverse = new double[s.length];
		for (int i = 0; i < s.length; i++)
			inverse[i] = s[i] > threshold && s[i] > 0 ? 1.0 / s[i] : 0;

		final RealMatrix v = svd.getV();
		final RealMatrix ut = svd.getUT();
		for (int i = 0; i < s.length; i++)
			v.setColumnVector(i, v.getColumnVector(i).mapMultiply(inverse[i]));

		return new ControlMatrix(v.multiply(ut));
	}

	public int numActuators() {
		return matrix.getRowDimension();
	}

	public int numModes() {
		return matrix.getColumnDimension();
	}

	public RealMatrix getMatrix() {
		return matrix.copy();
	}

	public double[][] getData() {
		return matrix.getData();
	}

	/**
	 * Truncates or zero-pads {@code modes} to the mode dimension of this
	 * matrix.
	 */
	public double[] fit(final double[] modes) {
		return Arrays.copyOf(modes, numModes());
	}

	/**
	 * @return control matrix times the fitted modal vector
	 */
	public double[] delta(final double[] modes) {
		return matrix.operate(new ArrayRealVector(fit(modes), false)).toArray();
	}

	public double[] actuatorCommand(final double[] modes, final int expectedActuators) {

		final double[] offset = new double[numActuators()];
		Arrays.fill(offset, DEFAULT_OFFSET);
		return actuatorCommand(modes, offset, expectedActuators);
	}

	/**
	 * Actuator positions that compensate the given modal error:
	 * {@code offset - C z}, clamped to [0, 1].
	 */
	public double[] actuatorCommand(final double[] modes, final double[] offset, final int expectedActuators) {

		final double[] delta = delta(modes);
		if (delta.length != expectedActuators)
			throw DimensionMismatchException.of("control matrix actuator count", expectedActuators, delta.length);
		if (offset.length != delta.length)
			throw DimensionMismatchException.of("actuator offset length", delta.length, offset.length);

		final double[] command = new double[delta.length];
		for (int i = 0; i < command.length; i++)
			command[i] = clamp(offset[i] - delta[i]);

		return command;
	}

	public static double clamp(final double value) {
		return Math.max(0, Math.min(1, value));
	}

	@Override
	public String toString() {
		return String.format("ControlMatrix[%d actuators x %d modes]", numActuators(), numModes());
	}
}
