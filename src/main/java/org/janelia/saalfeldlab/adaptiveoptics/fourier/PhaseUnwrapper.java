package org.janelia.saalfeldlab.adaptiveoptics.fourier;

import org.janelia.saalfeldlab.adaptiveoptics.DimensionMismatchException;
import org.janelia.saalfeldlab.adaptiveoptics.Images;
import org.janelia.saalfeldlab.adaptiveoptics.PupilMask;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Recovers the continuous wavefront phase from an off-axis interferogram:
 * the first order is cut out of the spectrum with a {@link CarrierFilter},
 * moved to zero frequency, transformed back and unwrapped inside the pupil.
 */
public class PhaseUnwrapper {

	private static final double TWO_PI = 2 * Math.PI;

	private PhaseUnwrapper() {}

	public static ArrayImg<DoubleType, DoubleArray> unwrap(
			final RandomAccessibleInterval<? extends RealType<?>> interferogram,
			final CarrierFilter filter,
			final PupilMask mask) {

		final int side = Images.squareSide(interferogram);
		return Images.wrap(unwrap(Images.toArray(interferogram), side, filter, mask), side);
	}

	/**
	 * @return the unwrapped phase, zero outside the pupil. Inside the pupil it
	 *         equals the wrapped phase modulo 2π; the multiple of 2π closest to
	 *         its mean has been removed.
	 */
	public static double[] unwrap(final double[] interferogram, final int side, final CarrierFilter filter, final PupilMask mask) {

		if (mask.side != side)
			throw DimensionMismatchException.of("pupil mask side", side, mask.side);

		final double[] wrapped = mask.apply(wrappedPhase(interferogram, side, filter));
		final double[] phase = QualityGuidedUnwrapper.unwrap(wrapped, side, mask);

		double mean = 0;
		for (int i = 0; i < phase.length; i++)
			if (mask.contains(i))
				mean += phase[i];
		mean /= Math.max(1, mask.count());

		final double offset = TWO_PI * Math.rint(mean / TWO_PI);
		for (int i = 0; i < phase.length; i++)
			phase[i] = mask.contains(i) ? phase[i] - offset : 0;

		return phase;
	}

	/**
	 * Demodulated phase in (-π, π] over the whole image.
	 */
	public static double[] wrappedPhase(final double[] interferogram, final int side, final CarrierFilter filter) {

		if (filter.side != side)
			throw DimensionMismatchException.of("carrier filter side", side, filter.side);
		if (interferogram.length != side * side)
			throw DimensionMismatchException.of("interferogram pixel count", (long)side * side, interferogram.length);

		final double[] filtered = filter.apply(Fourier.centredSpectrum(interferogram, side));

		// centre the carrier to remove the tilt it would leave after demodulation
		final int[] centroid = filter.centroid();
		final int dx = centroid[0] - side / 2;
		final int dy = centroid[1] - side / 2;
		final double[] field = Fourier.ifftShift(Fourier.roll(filtered, side, 2, -dy, -dx), side);
		Fourier.inverse(field, side);

		final double[] phase = new double[side * side];
		for (int i = 0; i < phase.length; i++)
			phase[i] = Math.atan2(field[2 * i + 1], field[2 * i]);

		return phase;
	}
}
