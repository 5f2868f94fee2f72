package org.janelia.saalfeldlab.adaptiveoptics.zernike;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import java.util.Arrays;

import org.janelia.saalfeldlab.adaptiveoptics.SyntheticImages;
import org.junit.Test;

public class ModalDecompositionTest {

	@Test
	public void testBinnedSize() {

		assertEquals(128, ModalDecomposition.binnedSize(256, 128));
		assertEquals(128, ModalDecomposition.binnedSize(128, 128));
		assertEquals(100, ModalDecomposition.binnedSize(100, 128));
		assertEquals(127, ModalDecomposition.binnedSize(254, 128));
		assertEquals(100, ModalDecomposition.binnedSize(300, 128));
		// 262 = 2 * 131: the only small divisor is 2, so bin by 2
		assertEquals(131, ModalDecomposition.binnedSize(262, 128));
	}

	@Test
	public void testBlockAverage() {

		final double[] image = {
				1, 3, 0, 0,
				5, 7, 0, 4,
				2, 2, 1, 1,
				2, 2, 1, 1};
		assertArrayEquals(new double[]{4, 1, 2, 1}, ModalDecomposition.bin(image, 4, 2), 1e-12);
	}

	@Test
	public void testTrapezoid() {

		final double[] ones = new double[9];
		Arrays.fill(ones, 1);
		assertEquals(4.0, ModalDecomposition.trapz2(ones, 3), 1e-12);
	}

	@Test
	public void testDefocusOnly() {

		final int side = 128;
		final double[] z = ModalDecomposition.decompose(SyntheticImages.zernikePhase(side, 0, 0, 0, 1.5), side, 15, 128);

		int largest = 0;
		for (int i = 1; i < z.length; i++)
			if (Math.abs(z[i]) > Math.abs(z[largest]))
				largest = i;

		assertEquals(Zernike.DEFOCUS - 1, largest);
		assertEquals(1.5, z[Zernike.DEFOCUS - 1], 0.05);
		for (int i = 0; i < z.length; i++)
			if (i != Zernike.DEFOCUS - 1)
				assertEquals("Z" + (i + 1), 0, z[i], 0.05);
	}

	@Test
	public void testBinnedDecomposition() {

		final int side = 256;
		final double[] z = ModalDecomposition.decompose(SyntheticImages.zernikePhase(side, 0, 0, 0, 0, -0.7, 0, 0.4), side, 8, 128);
		assertEquals(-0.7, z[4], 0.03);
		assertEquals(0.4, z[6], 0.03);
		assertEquals(0, z[3], 0.03);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRejectsNoModes() {
		ModalDecomposition.decompose(new double[16], 4, 0, 128);
	}
}
