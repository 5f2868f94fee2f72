package org.janelia.saalfeldlab.adaptiveoptics.fourier;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import java.util.Arrays;
import java.util.Random;

import org.junit.Test;

public class FourierTest {

	@Test
	public void testTukey() {

		final double[] w = Fourier.tukey(11, 0.1);
		assertEquals(0.0, w[0], 1e-12);
		assertEquals(0.0, w[10], 1e-12);
		for (int i = 1; i < 10; i++)
			assertEquals(1.0, w[i], 1e-12);

		// alpha = 0.5, m = 9: a quarter of the window tapers on each side
		final double[] v = Fourier.tukey(9, 0.5);
		assertArrayEquals(new double[]{0, 0.5, 1, 1, 1, 1, 1, 0.5, 0}, v, 1e-12);
	}

	@Test
	public void testShiftsInvert() {

		final Random random = new Random(7);
		for (final int side : new int[]{8, 9}) {
			final double[] a = new double[2 * side * side];
			for (int i = 0; i < a.length; i++)
				a[i] = random.nextDouble();

			assertArrayEquals(a, Fourier.ifftShift(Fourier.fftShift(a, side), side), 0);
		}
	}

	@Test
	public void testFftShiftCentresZeroFrequency() {

		final int side = 16;
		final double[] constant = new double[side * side];
		Arrays.fill(constant, 1);

		final double[] spectrum = Fourier.fftShift(Fourier.forward(constant, side), side);
		final double[] magnitude = Fourier.magnitude(spectrum);
		assertEquals(side * side, magnitude[side / 2 * side + side / 2], 1e-9);
		assertEquals(side / 2 * side + side / 2, Fourier.argmax(magnitude));
	}

	@Test
	public void testInverseRoundTrip() {

		final int side = 12;
		final Random random = new Random(3);
		final double[] real = new double[side * side];
		for (int i = 0; i < real.length; i++)
			real[i] = random.nextGaussian();

		final double[] c = Fourier.forward(real, side);
		Fourier.inverse(c, side);
		for (int i = 0; i < real.length; i++) {
			assertEquals(real[i], c[2 * i], 1e-10);
			assertEquals(0, c[2 * i + 1], 1e-10);
		}
	}

	@Test
	public void testRoll() {

		final double[] a = {1, 2, 3, 4, 5, 6, 7, 8, 9};
		assertArrayEquals(new double[]{9, 7, 8, 3, 1, 2, 6, 4, 5}, Fourier.roll(a, 3, 1, 1, 1), 0);
	}

	@Test
	public void testArgmaxFirstOccurrence() {
		assertEquals(1, Fourier.argmax(new double[]{0, 5, 2, 5}));
	}
}
