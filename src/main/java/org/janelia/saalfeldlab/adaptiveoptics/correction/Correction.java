package org.janelia.saalfeldlab.adaptiveoptics.correction;

/**
 * Outcome of a closed-loop run. {@code bestIteration} is -1 when no
 * iteration improved on the rest position.
 */
public class Correction {

	public final double[] command;
	public final double rms;
	public final int bestIteration;

	/** RMS before the first iteration, then after each iteration */
	public final double[] rmsHistory;

	public Correction(final double[] command, final double rms, final int bestIteration, final double[] rmsHistory) {

		this.command = command;
		this.rms = rms;
		this.bestIteration = bestIteration;
		this.rmsHistory = rmsHistory;
	}

	@Override
	public String toString() {
		return String.format("Correction[rms=%.5f, iteration=%d of %d]", rms, bestIteration, rmsHistory.length - 1);
	}
}
