package org.janelia.saalfeldlab.adaptiveoptics.zernike;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Zernike polynomials indexed by Noll mode number, normalised so that the
 * mean square of every mode over the unit pupil is one, sampled on square
 * grids whose inscribed circle is the pupil.
 */
public class Zernike {

	public static final int PISTON = 1;
	public static final int TIP = 2;
	public static final int TILT = 3;
	public static final int DEFOCUS = 4;

	private static final Map<Long, double[]> CACHE = new ConcurrentHashMap<>();

	private Zernike() {}

	/**
	 * @return {n, m} radial order and signed azimuthal frequency of Noll mode j
	 */
	public static int[] nollToNM(final int j) {

		if (j < 1)
			throw new IllegalArgumentException("Noll index starts at 1, got " + j);

		final int n = (int)((-1.0 + Math.sqrt(8.0 * (j - 1) + 1)) / 2.0);
		final int p = j - n * (n + 1) / 2;
		final int k = n % 2;
		int m = ((p + k) / 2) * 2 - k;
		if (m != 0 && j % 2 != 0)
			m = -m;

		return new int[]{n, m};
	}

	public static double radial(final int n, final int m, final double r) {

		final int am = Math.abs(m);
		double sum = 0;
		for (int i = 0; i <= (n - am) / 2; i++) {
			final double c = (i % 2 == 0 ? 1 : -1) * factorial(n - i)
					/ (factorial(i) * factorial((n + am) / 2 - i) * factorial((n - am) / 2 - i));
			sum += c * Math.pow(r, n - 2 * i);
		}
		return sum;
	}

	/**
	 * Value of Noll mode {@code j} at polar pupil coordinates.
	 */
	public static double value(final int j, final double r, final double theta) {

		final int[] nm = nollToNM(j);
		final int n = nm[0];
		final int m = nm[1];
		if (m == 0)
			return Math.sqrt(n + 1) * radial(n, 0, r);
		else if (m > 0)
			return Math.sqrt(2 * (n + 1)) * radial(n, m, r) * Math.cos(m * theta);
		else
			return Math.sqrt(2 * (n + 1)) * radial(n, -m, r) * Math.sin(-m * theta);
	}

	/**
	 * Mode {@code j} sampled at the pixel centres of a {@code size x size}
	 * grid, zero outside the unit circle. The returned array is shared and
	 * must not be modified.
	 */
	public static double[] basis(final int j, final int size) {
		return CACHE.computeIfAbsent(((long)j << 32) | size, key -> sample(j, size));
	}

	private static double[] sample(final int j, final int size) {

		final double[] z = new double[size * size];
		final double half = size / 2.0;
		for (int y = 0; y < size; y++) {
			final double cy = (y - half + 0.5) / half;
			for (int x = 0; x < size; x++) {
				final double cx = (x - half + 0.5) / half;
				final double r = Math.sqrt(cx * cx + cy * cy);
				if (r <= 1.0)
					z[y * size + x] = value(j, r, Math.atan2(cy, cx));
			}
		}
		return z;
	}

	private static double factorial(final int n) {

		double f = 1;
		for (int i = 2; i <= n; i++)
			f *= i;

		return f;
	}
}
