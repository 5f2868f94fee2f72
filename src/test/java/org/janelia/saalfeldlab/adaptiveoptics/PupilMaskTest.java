package org.janelia.saalfeldlab.adaptiveoptics;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

public class PupilMaskTest {

	@Test
	public void testCountApproximatesDiskArea() {

		for (final int r : new int[]{10, 32, 64, 100}) {
			final PupilMask mask = PupilMask.create(r);
			assertEquals(2 * r, mask.side);
			assertEquals(1.0, mask.count() / (Math.PI * r * r), 0.03);
		}
	}

	@Test
	public void testPointSymmetric() {

		for (final int r : new int[]{1, 4, 17}) {
			final PupilMask mask = PupilMask.create(r);
			final int last = mask.side - 1;
			for (int y = 0; y < mask.side; y++)
				for (int x = 0; x < mask.side; x++) {
					assertEquals(mask.contains(x, y), mask.contains(last - x, last - y));
					assertEquals(mask.contains(x, y), mask.contains(y, x));
				}
		}
	}

	@Test
	public void testDeterministic() {

		final PupilMask a = PupilMask.create(12);
		final PupilMask b = PupilMask.create(12);
		for (int i = 0; i < a.side * a.side; i++)
			assertEquals(a.contains(i), b.contains(i));
	}

	@Test
	public void testCentreInsideCornerOutside() {

		final PupilMask mask = PupilMask.create(8);
		assertTrue(mask.contains(7, 7));
		assertTrue(mask.contains(8, 8));
		assertFalse(mask.contains(0, 0));
		assertFalse(mask.contains(15, 15));
		// the rim touches every edge of the grid
		assertTrue(mask.contains(0, 7));
		assertTrue(mask.contains(15, 8));
		assertTrue(mask.contains(8, 0));
		assertTrue(mask.contains(7, 15));
	}

	@Test
	public void testApplyZeroesOutside() {

		final PupilMask mask = PupilMask.create(4);
		final double[] image = new double[64];
		Arrays.fill(image, 3.0);
		mask.apply(image);

		for (int i = 0; i < image.length; i++)
			assertEquals(mask.contains(i) ? 3.0 : 0.0, image[i], 0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void testRejectsZeroRadius() {
		PupilMask.create(0);
	}

	@Test(expected = DimensionMismatchException.class)
	public void testApplyWrongSize() {
		PupilMask.create(4).apply(new double[10]);
	}
}
