package org.janelia.saalfeldlab.adaptiveoptics.calibration;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.janelia.saalfeldlab.adaptiveoptics.SyntheticImages;
import org.junit.Test;

public class DiscontinuityCheckTest {

	@Test
	public void testSmoothPhaseHasNone() {

		final int side = 64;
		assertEquals(0, DiscontinuityCheck.count(SyntheticImages.zernikePhase(side, 0, 3, 0, 5, 2), side));
	}

	@Test
	public void testSpikeCountsFourTimes() {

		final int side = 64;
		final double[] phase = new double[side * side];
		phase[32 * side + 30] = 4 * Math.PI;
		assertEquals(4, DiscontinuityCheck.count(phase, side));
	}

	@Test
	public void testRimIgnored() {

		final int side = 64;
		final double[] phase = new double[side * side];
		// 31 px from the centre, inside the three pixel rim
		phase[32 * side + 1] = 4 * Math.PI;
		assertEquals(0, DiscontinuityCheck.count(phase, side));
	}

	@Test
	public void testThreshold() {

		// 64 * 64 * 0.001 = 4.096
		assertFalse(DiscontinuityCheck.exceeds(4, 64, 0.001));
		assertTrue(DiscontinuityCheck.exceeds(5, 64, 0.001));
		assertTrue(DiscontinuityCheck.exceeds(1, 64, 0));
	}
}
