package org.janelia.saalfeldlab.adaptiveoptics;

import net.imglib2.Cursor;
import net.imglib2.FinalInterval;
import net.imglib2.Interval;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

/**
 * Conversions between imglib2 images and the flat, row-major
 * {@code double[]} arrays the spectral code works on. Index {@code y * side + x}
 * addresses row {@code y}, column {@code x}.
 */
public class Images {

	private Images() {}

	public static int squareSide(final Interval image) {

		if (image.numDimensions() != 2)
			throw DimensionMismatchException.of("image dimensions", 2, image.numDimensions());

		final long w = image.dimension(0);
		final long h = image.dimension(1);
		if (w != h)
			throw new DimensionMismatchException(String.format("image is not square: %d x %d", w, h));

		return (int)w;
	}

	public static double[] toArray(final RandomAccessibleInterval<? extends RealType<?>> image) {

		final int side = squareSide(image);
		final double[] data = new double[side * side];
		final Cursor<? extends RealType<?>> c = Views.flatIterable(image).cursor();
		int i = 0;
		while (c.hasNext())
			data[i++] = c.next().getRealDouble();

		return data;
	}

	public static ArrayImg<DoubleType, DoubleArray> wrap(final double[] data, final int side) {

		if (data.length != side * side)
			throw DimensionMismatchException.of("pixel count", (long)side * side, data.length);

		return ArrayImgs.doubles(data, side, side);
	}

	/**
	 * The backing array of an image created by {@link #wrap}.
	 */
	public static double[] data(final ArrayImg<DoubleType, DoubleArray> image) {
		return image.update(null).getCurrentStorageArray();
	}

	/**
	 * Cuts the square {@code [x0 - r, x0 + r) x [y0 - r, y0 + r)} out of a raw
	 * camera frame.
	 */
	public static double[] crop(
			final RandomAccessibleInterval<? extends RealType<?>> image,
			final RegionOfInterest roi) {

		final Interval crop = new FinalInterval(
				new long[]{roi.x0 - roi.radius, roi.y0 - roi.radius},
				new long[]{roi.x0 + roi.radius - 1, roi.y0 + roi.radius - 1});

		if (image.numDimensions() != 2 || !Intervals.contains(image, crop))
			throw new DimensionMismatchException(String.format(
					"region of interest %s exceeds image bounds %s", roi, Intervals.toString(image)));

		return toArray(Views.interval(image, crop));
	}

	/**
	 * Root mean square deviation of a phase map from a flat (zero) wavefront,
	 * over every pixel of the map.
	 */
	public static double rms(final double[] phase) {

		double sum = 0;
		for (final double p : phase)
			sum += p * p;

		return Math.sqrt(sum / phase.length);
	}

	public static double rms(final RandomAccessibleInterval<? extends RealType<?>> phase) {
		return rms(toArray(phase));
	}
}
