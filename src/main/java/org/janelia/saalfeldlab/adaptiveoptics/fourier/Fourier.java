package org.janelia.saalfeldlab.adaptiveoptics.fourier;

import java.util.Arrays;

import org.jtransforms.fft.DoubleFFT_2D;

/**
 * Discrete Fourier helpers for square images stored as flat row-major arrays.
 * <p>
 * Complex data is interleaved ({@code re, im}) with {@code 2 * side} doubles
 * per row. The forward transform is unscaled, the inverse is scaled by
 * {@code 1 / side²}. Spectra are "centred" after {@link #fftShift}: the zero
 * frequency then sits at {@code (side / 2, side / 2)}.
 */
public class Fourier {

	public static final double TUKEY_ALPHA = 0.1;

	private Fourier() {}

	/**
	 * Symmetric tapered cosine window of length {@code m}. The fraction
	 * {@code alpha} of the window is tapered.
	 */
	public static double[] tukey(final int m, final double alpha) {

		final double[] w = new double[m];
		if (m <= 1 || alpha <= 0) {
			Arrays.fill(w, 1.0);
			return w;
		}

		final int width = (int)Math.floor(alpha * (m - 1) / 2.0);
		for (int n = 0; n < m; n++) {
			if (n <= width)
				w[n] = 0.5 * (1 + Math.cos(Math.PI * (-1 + 2.0 * n / alpha / (m - 1))));
			else if (n >= m - width - 1)
				w[n] = 0.5 * (1 + Math.cos(Math.PI * (-2.0 / alpha + 1 + 2.0 * n / alpha / (m - 1))));
			else
				w[n] = 1.0;
		}
		return w;
	}

	/**
	 * Multiplies the image by the separable 2-D Tukey window with 10% taper
	 * and returns the windowed copy.
	 */
	public static double[] tukeyWindow(final double[] image, final int side) {

		final double[] w = tukey(side, TUKEY_ALPHA);
		final double[] out = new double[side * side];
		for (int y = 0; y < side; y++)
			for (int x = 0; x < side; x++)
				out[y * side + x] = image[y * side + x] * w[y] * w[x];

		return out;
	}

	public static double[] forward(final double[] real, final int side) {

		final double[] c = new double[2 * side * side];
		for (int i = 0; i < real.length; i++)
			c[2 * i] = real[i];

		new DoubleFFT_2D(side, side).complexForward(c);
		return c;
	}

	public static void inverse(final double[] complex, final int side) {
		new DoubleFFT_2D(side, side).complexInverse(complex, true);
	}

	/**
	 * Centred spectrum of the Tukey-windowed image.
	 */
	public static double[] centredSpectrum(final double[] image, final int side) {
		return fftShift(forward(tukeyWindow(image, side), side), side);
	}

	/**
	 * Circular shift: the element at {@code (y, x)} moves to
	 * {@code (y + dy, x + dx)} modulo the side length.
	 *
	 * @param components 1 for real data, 2 for interleaved complex data
	 */
	public static double[] roll(final double[] a, final int side, final int components, final int dy, final int dx) {

		final double[] out = new double[a.length];
		for (int y = 0; y < side; y++) {
			final int ty = Math.floorMod(y + dy, side);
			for (int x = 0; x < side; x++) {
				final int tx = Math.floorMod(x + dx, side);
				final int src = (y * side + x) * components;
				final int dst = (ty * side + tx) * components;
				for (int k = 0; k < components; k++)
					out[dst + k] = a[src + k];
			}
		}
		return out;
	}

	public static double[] fftShift(final double[] complex, final int side) {
		return roll(complex, side, 2, side / 2, side / 2);
	}

	public static double[] ifftShift(final double[] complex, final int side) {
		return roll(complex, side, 2, -(side / 2), -(side / 2));
	}

	public static double[] magnitude(final double[] complex) {

		final double[] m = new double[complex.length / 2];
		for (int i = 0; i < m.length; i++)
			m[i] = Math.hypot(complex[2 * i], complex[2 * i + 1]);

		return m;
	}

	public static double[] power(final double[] complex) {

		final double[] p = new double[complex.length / 2];
		for (int i = 0; i < p.length; i++) {
			final double re = complex[2 * i];
			final double im = complex[2 * i + 1];
			p[i] = re * re + im * im;
		}
		return p;
	}

	/**
	 * Index of the first maximum in row-major order.
	 */
	public static int argmax(final double[] a) {

		int best = 0;
		for (int i = 1; i < a.length; i++)
			if (a[i] > a[best])
				best = i;

		return best;
	}
}
