package org.janelia.saalfeldlab.adaptiveoptics;

/**
 * Circular region of interest on a square grid of side {@code 2 * radius}.
 * Pixel {@code (x, y)} is inside when its offset from the grid centre,
 * {@code (x - radius + 0.5, y - radius + 0.5)}, is shorter than the radius,
 * so the mask is symmetric under 180° rotation and shares its centre with
 * the Zernike sampling grid.
 */
public class PupilMask {

	public final int radius;
	public final int side;

	private final boolean[] inside;
	private final int count;

	private PupilMask(final int radius) {

		this.radius = radius;
		this.side = 2 * radius;
		this.inside = new boolean[side * side];

		final double r2 = (double)radius * radius;
		int n = 0;
		for (int y = 0; y < side; y++) {
			final double dy = y - radius + 0.5;
			for (int x = 0; x < side; x++) {
				final double dx = x - radius + 0.5;
				if (dx * dx + dy * dy < r2) {
					inside[y * side + x] = true;
					n++;
				}
			}
		}
		count = n;
	}

	public static PupilMask create(final int radius) {

		if (radius <= 0)
			throw new IllegalArgumentException("mask radius must be positive, got " + radius);

		return new PupilMask(radius);
	}

	public boolean contains(final int x, final int y) {
		return inside[y * side + x];
	}

	public boolean contains(final int index) {
		return inside[index];
	}

	/**
	 * @return the number of pixels inside the pupil
	 */
	public int count() {
		return count;
	}

	/**
	 * Zeroes every pixel outside the pupil, in place.
	 */
	public double[] apply(final double[] image) {

		if (image.length != inside.length)
			throw DimensionMismatchException.of("masked pixel count", inside.length, image.length);

		for (int i = 0; i < image.length; i++)
			if (!inside[i])
				image[i] = 0;

		return image;
	}

}
