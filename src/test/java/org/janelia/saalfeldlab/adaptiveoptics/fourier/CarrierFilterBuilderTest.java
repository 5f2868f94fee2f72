package org.janelia.saalfeldlab.adaptiveoptics.fourier;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.janelia.saalfeldlab.adaptiveoptics.FilterConstructionException;
import org.janelia.saalfeldlab.adaptiveoptics.SyntheticImages;
import org.junit.Test;

public class CarrierFilterBuilderTest {

	private static void assertCarrier(final CarrierFilter filter, final int kx, final int ky) {

		final int c = filter.side / 2;
		final int s = SyntheticImages.sign(filter, kx);
		assertEquals(s * kx, filter.peakX - c, 2);
		assertEquals(s * ky, filter.peakY - c, 2);
	}

	@Test
	public void testLocatesCarrier() {

		final int side = 128;
		final CarrierFilter filter = CarrierFilterBuilder.build(SyntheticImages.fringes(side, 20, -22, null), side, side / 8);

		assertFalse(filter.shifted);
		assertCarrier(filter, 20, -22);
	}

	@Test
	public void testLocatesCarrierNearNyquist() {

		final int side = 128;
		final CarrierFilter filter = CarrierFilterBuilder.build(SyntheticImages.fringes(side, 50, 40, null), side, side / 8);

		assertTrue(filter.shifted);
		assertCarrier(filter, 50, 40);
	}

	@Test
	public void testWindowAroundPeak() {

		final int side = 128;
		final CarrierFilter filter = CarrierFilterBuilder.build(SyntheticImages.fringes(side, 24, 20, null), side, side / 8);
		final int diameter = (int)(side * CarrierFilterBuilder.FILTER_FRACTION);

		assertEquals(1.0, filter.weight(filter.peakX, filter.peakY), 0.01);
		assertEquals(0.0, filter.weight(side / 2, side / 2), 0);

		int nonZeroColumns = 0;
		for (int x = 0; x < side; x++)
			if (filter.weight(x, filter.peakY) > 0)
				nonZeroColumns++;
		assertTrue(nonZeroColumns <= diameter);

		final int[] centroid = filter.centroid();
		assertEquals(filter.peakX, centroid[0]);
		assertEquals(filter.peakY, centroid[1]);
	}

	@Test
	public void testRefinementWeights() {

		final double[] w = CarrierFilterBuilder.refinementWeights(50);
		assertTrue(w[25 * 50 + 25] > 0);
		assertEquals(w[24 * 50 + 24], w[25 * 50 + 25], 1e-12);
		assertEquals(0, w[0], 0);
	}

	@Test
	public void testFringesTooFine() {

		final int side = 128;
		try {
			CarrierFilterBuilder.build(SyntheticImages.fringes(side, 60, 0, null), side, side / 8);
			fail("expected FilterConstructionException");
		} catch (final FilterConstructionException e) {
			assertTrue(e.getMessage().contains("fringe spacing too fine"));
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void testNegativeRegion() {
		CarrierFilterBuilder.build(new double[64], 8, -1);
	}
}
