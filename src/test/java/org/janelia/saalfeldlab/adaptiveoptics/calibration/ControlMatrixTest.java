package org.janelia.saalfeldlab.adaptiveoptics.calibration;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.RealMatrix;
import org.janelia.saalfeldlab.adaptiveoptics.DimensionMismatchException;
import org.junit.Test;

public class ControlMatrixTest {

	private static final double[][] C = {
			{0.1, 0.2, 0.0},
			{0.0, -0.3, 0.5},
			{1.0, 0.0, 0.0},
			{0.0, 0.0, 0.0}};

	@Test
	public void testZeroModesGiveOffset() {

		final ControlMatrix matrix = ControlMatrix.fromArray(C);
		assertArrayEquals(new double[]{0.5, 0.5, 0.5, 0.5}, matrix.actuatorCommand(new double[3], 4), 0);
	}

	@Test
	public void testCommand() {

		final ControlMatrix matrix = ControlMatrix.fromArray(C);
		final double[] command = matrix.actuatorCommand(new double[]{1, 1, 0.2}, new double[]{0.5, 0.5, 0.5, 0.2}, 4);
		assertArrayEquals(new double[]{0.2, 0.7, 0.0, 0.2}, command, 1e-12);
	}

	@Test
	public void testClamps() {

		final ControlMatrix matrix = ControlMatrix.fromArray(C);
		final double[] command = matrix.actuatorCommand(new double[]{-10, 10, 0}, 4);
		assertArrayEquals(new double[]{0.0, 1.0, 1.0, 0.5}, command, 0);
	}

	@Test
	public void testTruncatesAndPads() {

		final ControlMatrix matrix = ControlMatrix.fromArray(C);
		assertArrayEquals(
				matrix.actuatorCommand(new double[]{0.3, -0.2, 0.1}, 4),
				matrix.actuatorCommand(new double[]{0.3, -0.2, 0.1, 7, 8, 9}, 4),
				0);
		assertArrayEquals(
				matrix.actuatorCommand(new double[]{0.3, 0, 0}, 4),
				matrix.actuatorCommand(new double[]{0.3}, 4),
				0);
	}

	@Test(expected = DimensionMismatchException.class)
	public void testActuatorMismatch() {
		ControlMatrix.fromArray(C).actuatorCommand(new double[3], 5);
	}

	@Test
	public void testPseudoInverseOfFullRank() {

		final RealMatrix response = new Array2DRowRealMatrix(new double[][]{
				{2, 0},
				{0, 4},
				{1, 1}});
		final RealMatrix inverse = ControlMatrix.pseudoInverse(response, ControlMatrix.DEFAULT_CUTOFF).getMatrix();

		assertEquals(2, inverse.getRowDimension());
		assertEquals(3, inverse.getColumnDimension());

		final RealMatrix identity = inverse.multiply(response);
		for (int i = 0; i < 2; i++)
			for (int j = 0; j < 2; j++)
				assertEquals(i == j ? 1 : 0, identity.getEntry(i, j), 1e-12);
	}

	@Test
	public void testCutoffDropsSmallSingularValues() {

		final RealMatrix response = new Array2DRowRealMatrix(new double[][]{
				{1, 0},
				{0, 0.001}});
		final double[][] inverse = ControlMatrix.pseudoInverse(response, 0.005).getData();

		assertEquals(1.0, inverse[0][0], 1e-12);
		assertEquals(0.0, inverse[1][1], 0);

		final double[][] kept = ControlMatrix.pseudoInverse(response, 0.0005).getData();
		assertEquals(1000.0, kept[1][1], 1e-6);
	}

	@Test
	public void testPseudoInverseOfZero() {

		final double[][] inverse = ControlMatrix.pseudoInverse(new Array2DRowRealMatrix(3, 2), 0.005).getData();
		for (final double[] row : inverse)
			for (final double v : row)
				assertEquals(0, v, 0);
	}
}
