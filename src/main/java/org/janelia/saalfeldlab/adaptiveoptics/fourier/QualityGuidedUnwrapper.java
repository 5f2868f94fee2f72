package org.janelia.saalfeldlab.adaptiveoptics.fourier;

import java.util.Arrays;
import java.util.Comparator;

import org.janelia.saalfeldlab.adaptiveoptics.DimensionMismatchException;
import org.janelia.saalfeldlab.adaptiveoptics.PupilMask;

/**
 * Two-dimensional phase unwrapping by reliability-sorted region merging.
 * <p>
 * Every pixel gets a reliability from the wrapped second differences in its
 * 3x3 neighbourhood. Pixel pairs (edges) are processed from the most to the
 * least reliable; each edge merges the two groups it joins, shifting the
 * smaller group by the multiple of 2π that makes the pair continuous. Only
 * pixels inside the mask take part, so the unwrap never crosses the pupil
 * boundary.
 *
 * See M. A. Herráez et al., "Fast two-dimensional phase-unwrapping algorithm
 * based on sorting by reliability following a noncontinuous path",
 * Applied Optics 41 (2002).
 */
public class QualityGuidedUnwrapper {

	private static final double TWO_PI = 2 * Math.PI;

	private QualityGuidedUnwrapper() {}

	public static double wrap(final double phase) {
		return phase - TWO_PI * Math.rint(phase / TWO_PI);
	}

	/**
	 * @param wrapped row-major wrapped phase in (-π, π]
	 * @param side side length
	 * @param mask pixels to unwrap, all others are returned as zero
	 * @return the unwrapped phase
	 */
	public static double[] unwrap(final double[] wrapped, final int side, final PupilMask mask) {

		if (mask.side != side)
			throw DimensionMismatchException.of("mask side", side, mask.side);
		if (wrapped.length != side * side)
			throw DimensionMismatchException.of("phase pixel count", (long)side * side, wrapped.length);

		final int n = side * side;
		final double[] reliability = reliability(wrapped, side, mask);

		// edges: 2 * p to the right neighbour, 2 * p + 1 to the one below
		int numEdges = 0;
		final int[] edgeBuffer = new int[2 * n];
		for (int y = 0; y < side; y++)
			for (int x = 0; x < side; x++) {
				final int p = y * side + x;
				if (!mask.contains(p))
					continue;
				if (x + 1 < side && mask.contains(p + 1))
					edgeBuffer[numEdges++] = 2 * p;
				if (y + 1 < side && mask.contains(p + side))
					edgeBuffer[numEdges++] = 2 * p + 1;
			}

		final Integer[] edges = new Integer[numEdges];
		for (int i = 0; i < numEdges; i++)
			edges[i] = edgeBuffer[i];

		Arrays.sort(edges, Comparator.comparingDouble((Integer e) -> -edgeReliability(e, side, reliability)));

		final double[] u = wrapped.clone();
		final int[] group = new int[n];
		final int[] next = new int[n];
		final int[] tail = new int[n];
		final int[] size = new int[n];
		for (int p = 0; p < n; p++) {
			group[p] = p;
			next[p] = -1;
			tail[p] = p;
			size[p] = 1;
		}

		for (final int e : edges) {

			final int p = e / 2;
			final int q = (e & 1) == 0 ? p + 1 : p + side;
			final int gp = group[p];
			final int gq = group[q];
			if (gp == gq)
				continue;

			// shift that makes q continuous with p
			final double shift = TWO_PI * Math.rint((u[p] + wrap(wrapped[q] - wrapped[p]) - u[q]) / TWO_PI);
			if (size[gp] >= size[gq])
				merge(gq, gp, shift, u, group, next, tail, size);
			else
				merge(gp, gq, -shift, u, group, next, tail, size);
		}

		for (int p = 0; p < n; p++)
			if (!mask.contains(p))
				u[p] = 0;

		return u;
	}

	private static void merge(
			final int small,
			final int big,
			final double shift,
			final double[] u,
			final int[] group,
			final int[] next,
			final int[] tail,
			final int[] size) {

		for (int i = small; i != -1; i = next[i]) {
			u[i] += shift;
			group[i] = big;
		}
		next[tail[big]] = small;
		tail[big] = tail[small];
		size[big] += size[small];
	}

	private static double edgeReliability(final int edge, final int side, final double[] reliability) {

		final int p = edge / 2;
		final int q = (edge & 1) == 0 ? p + 1 : p + side;
		return reliability[p] + reliability[q];
	}

	/**
	 * Negative second-difference magnitude; pixels on the image or mask
	 * border are least reliable.
	 */
	static double[] reliability(final double[] w, final int side, final PupilMask mask) {

		final double[] r = new double[side * side];
		Arrays.fill(r, Double.NEGATIVE_INFINITY);
		for (int y = 1; y < side - 1; y++)
			for (int x = 1; x < side - 1; x++) {

				final int p = y * side + x;
				if (!neighbourhoodInside(p, side, mask))
					continue;

				final double c = w[p];
				final double h = wrap(w[p - 1] - c) - wrap(c - w[p + 1]);
				final double v = wrap(w[p - side] - c) - wrap(c - w[p + side]);
				final double d1 = wrap(w[p - side - 1] - c) - wrap(c - w[p + side + 1]);
				final double d2 = wrap(w[p - side + 1] - c) - wrap(c - w[p + side - 1]);
				r[p] = -Math.sqrt(h * h + v * v + d1 * d1 + d2 * d2);
			}

		return r;
	}

	private static boolean neighbourhoodInside(final int p, final int side, final PupilMask mask) {

		for (int dy = -side; dy <= side; dy += side)
			for (int dx = -1; dx <= 1; dx++)
				if (!mask.contains(p + dy + dx))
					return false;

		return true;
	}
}
