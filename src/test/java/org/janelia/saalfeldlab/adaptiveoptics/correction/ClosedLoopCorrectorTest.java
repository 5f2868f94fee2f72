package org.janelia.saalfeldlab.adaptiveoptics.correction;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.janelia.saalfeldlab.adaptiveoptics.DimensionMismatchException;
import org.janelia.saalfeldlab.adaptiveoptics.Images;
import org.janelia.saalfeldlab.adaptiveoptics.SyntheticImages;
import org.janelia.saalfeldlab.adaptiveoptics.calibration.ControlMatrix;
import org.janelia.saalfeldlab.adaptiveoptics.hardware.DeformableMirror;
import org.junit.Test;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;

public class ClosedLoopCorrectorTest {

	private static final int SIDE = 64;

	/** actuator 0 compensates defocus, actuator 1 tip */
	private static final double[][] CONTROL = {
			{0, 0, 0, 0.1, 0, 0},
			{0, 0.2, 0, 0, 0, 0},
			{0, 0, 0, 0, 0, 0}};

	private static class RecordingMirror implements DeformableMirror {

		final List<double[]> sent = new ArrayList<>();
		final int numActuators;

		RecordingMirror(final int numActuators) {
			this.numActuators = numActuators;
		}

		@Override
		public int numActuators() {
			return numActuators;
		}

		@Override
		public void apply(final double[] values) {
			sent.add(values.clone());
		}
	}

	/**
	 * Replays defocus-only phase maps.
	 */
	private static WavefrontSensor defocusSequence(final double... defocus) {

		final Deque<ArrayImg<DoubleType, DoubleArray>> phases = new ArrayDeque<>();
		for (final double d : defocus)
			phases.add(Images.wrap(SyntheticImages.zernikePhase(SIDE, 0.0, 0.5, 0.0, d), SIDE));

		return phases::removeFirst;
	}

	@Test
	public void testKeepsBestIteration() {

		final RecordingMirror mirror = new RecordingMirror(3);
		final ClosedLoopCorrector corrector = new ClosedLoopCorrector(
				defocusSequence(2.0, 1.0, 1.5, 0.5),
				mirror,
				ControlMatrix.fromArray(CONTROL)).settleDelayMillis(0);

		assertEquals(ClosedLoopCorrector.State.IDLE, corrector.getState());
		final Correction correction = corrector.correct(3, 3);
		assertEquals(ClosedLoopCorrector.State.DONE, corrector.getState());

		assertEquals(2, correction.bestIteration);
		assertEquals(4, correction.rmsHistory.length);
		assertTrue(correction.rmsHistory[3] < correction.rmsHistory[1]);
		assertTrue(correction.rmsHistory[2] > correction.rmsHistory[1]);
		assertEquals(correction.rmsHistory[3], correction.rms, 0);

		// rest, three candidates, final best
		assertEquals(5, mirror.sent.size());
		assertArrayEquals(new double[]{0.5, 0.5, 0.5}, mirror.sent.get(0), 0);
		assertArrayEquals(correction.command, mirror.sent.get(4), 0);

		// defocus driven through 0.1 per unit around the best command so far; tip is excluded
		assertEquals(0.5 - 0.2, mirror.sent.get(1)[0], 0.01);
		assertEquals(0.3 - 0.1, mirror.sent.get(2)[0], 0.01);
		// iteration 1 made things worse, iteration 2 starts again from iteration 0
		assertEquals(0.3 - 0.15, mirror.sent.get(3)[0], 0.01);
		assertEquals(0.15, correction.command[0], 0.02);
		assertEquals(0.5, correction.command[1], 0);
		assertEquals(0.5, correction.command[2], 0);
	}

	@Test
	public void testNoImprovementKeepsRest() {

		final RecordingMirror mirror = new RecordingMirror(3);
		final Correction correction = new ClosedLoopCorrector(
				defocusSequence(1.0, 1.0, 2.0),
				mirror,
				ControlMatrix.fromArray(CONTROL)).settleDelayMillis(0).correct(2, 3);

		assertEquals(-1, correction.bestIteration);
		assertArrayEquals(new double[]{0.5, 0.5, 0.5}, correction.command, 0);
		assertArrayEquals(new double[]{0.5, 0.5, 0.5}, mirror.sent.get(mirror.sent.size() - 1), 0);
	}

	@Test
	public void testModeMask() {

		final RecordingMirror mirror = new RecordingMirror(3);
		final boolean[] tipOnly = new boolean[6];
		tipOnly[1] = true;

		final Correction correction = new ClosedLoopCorrector(
				defocusSequence(2.0, 0.0),
				mirror,
				ControlMatrix.fromArray(CONTROL)).settleDelayMillis(0).correct(1, tipOnly);

		assertEquals(0, correction.bestIteration);
		assertEquals(0.5, correction.command[0], 0);
		assertEquals(0.5 - 0.2 * 0.5, correction.command[1], 0.01);
	}

	@Test
	public void testLowOrderExcluded() {
		assertArrayEquals(new boolean[]{false, false, false, true, true}, ClosedLoopCorrector.lowOrderExcluded(5, 3));
	}

	@Test(expected = DimensionMismatchException.class)
	public void testActuatorMismatch() {
		new ClosedLoopCorrector(defocusSequence(), new RecordingMirror(4), ControlMatrix.fromArray(CONTROL));
	}
}
