package org.janelia.saalfeldlab.adaptiveoptics.zernike;

import org.janelia.saalfeldlab.adaptiveoptics.Images;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;

/**
 * Projects an unwrapped phase map onto the Noll-ordered Zernike modes.
 */
public class ModalDecomposition {

	public static final int DEFAULT_RESIZE = 128;

	private ModalDecomposition() {}

	public static double[] decompose(final RandomAccessibleInterval<? extends RealType<?>> phase, final int numModes) {
		return decompose(phase, numModes, DEFAULT_RESIZE);
	}

	public static double[] decompose(final RandomAccessibleInterval<? extends RealType<?>> phase, final int numModes, final int resize) {
		return decompose(Images.toArray(phase), Images.squareSide(phase), numModes, resize);
	}

	/**
	 * @param phase row-major unwrapped phase
	 * @param side side length of the phase map
	 * @param numModes number of Noll modes, starting at piston
	 * @param resize target side of the block-averaged map
	 * @return coefficient i - 1 belongs to Noll mode i
	 */
	public static double[] decompose(final double[] phase, final int side, final int numModes, final int resize) {

		if (numModes <= 0)
			throw new IllegalArgumentException("number of modes must be positive, got " + numModes);
		if (resize <= 0)
			throw new IllegalArgumentException("resize dimension must be positive, got " + resize);

		final int size = binnedSize(side, resize);
		final double[] binned = bin(phase, side, size);

		final double pupilPixels = countNonZero(Zernike.basis(Zernike.PISTON, size));
		final double[] product = new double[size * size];
		final double[] coefficients = new double[numModes];
		for (int j = 1; j <= numModes; j++) {
			final double[] z = Zernike.basis(j, size);
			for (int i = 0; i < product.length; i++)
				product[i] = binned[i] * z[i];

			coefficients[j - 1] = trapz2(product, size) / pupilPixels;
		}
		return coefficients;
	}

	/**
	 * Largest divisor of {@code side} not above {@code target}; if that is
	 * smaller than the binning factor it implies, the binning factor itself.
	 */
	public static int binnedSize(final int side, final int target) {

		int size = Math.min(target, side);
		while (side % size != 0)
			size--;

		if (size < side / size)
			size = side / size;

		return size;
	}

	/**
	 * Block average of a square image down to {@code size x size};
	 * {@code size} must divide the side.
	 */
	public static double[] bin(final double[] image, final int side, final int size) {

		if (size == side)
			return image;

		final int f = side / size;
		final double norm = 1.0 / (f * f);
		final double[] out = new double[size * size];
		for (int y = 0; y < side; y++)
			for (int x = 0; x < side; x++)
				out[(y / f) * size + x / f] += image[y * side + x] * norm;

		return out;
	}

	/**
	 * Trapezoidal integral along rows, then along the resulting column, with
	 * unit spacing.
	 */
	static double trapz2(final double[] f, final int size) {

		double total = 0;
		for (int y = 0; y < size; y++) {
			double row = 0;
			for (int x = 0; x < size; x++)
				row += f[y * size + x];
			if (size > 1)
				row -= 0.5 * (f[y * size] + f[y * size + size - 1]);

			total += (y == 0 || y == size - 1) && size > 1 ? 0.5 * row : row;
		}
		return total;
	}

	private static int countNonZero(final double[] a) {

		int n = 0;
		for (final double v : a)
			if (v != 0)
				n++;

		return n;
	}
}
