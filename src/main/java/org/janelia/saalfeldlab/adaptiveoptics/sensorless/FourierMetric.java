package org.janelia.saalfeldlab.adaptiveoptics.sensorless;

import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.janelia.saalfeldlab.adaptiveoptics.DimensionMismatchException;
import org.janelia.saalfeldlab.adaptiveoptics.Images;
import org.janelia.saalfeldlab.adaptiveoptics.fourier.Fourier;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;

/**
 * Image sharpness from the radial fall-off of the power spectrum inside the
 * diffraction-limited pass band.
 */
public class FourierMetric {

	public static final double DEFAULT_NA = 1.1;
	public static final double DEFAULT_WAVELENGTH = 500e-9;
	public static final double DEFAULT_PIXEL_SIZE = 0.1193e-6;
	public static final int DEFAULT_RING_COUNT = 100;

	/** inner edge of the first ring relative to the cutoff radius */
	public static final double INNER_FRACTION = 0.1;

	public final double numericalAperture;
	public final double wavelength;
	public final double pixelSize;
	public final int ringCount;

	public FourierMetric() {
		this(DEFAULT_NA, DEFAULT_WAVELENGTH, DEFAULT_PIXEL_SIZE, DEFAULT_RING_COUNT);
	}

	/**
	 * @param wavelength in meters
	 * @param pixelSize sample pixel size in meters
	 */
	public FourierMetric(final double numericalAperture, final double wavelength, final double pixelSize, final int ringCount) {

		if (numericalAperture <= 0 || wavelength <= 0 || pixelSize <= 0)
			throw new IllegalArgumentException("numerical aperture, wavelength and pixel size must be positive");
		if (ringCount < 1)
			throw new IllegalArgumentException("ring count must be positive, got " + ringCount);

		this.numericalAperture = numericalAperture;
		this.wavelength = wavelength;
		this.pixelSize = pixelSize;
		this.ringCount = ringCount;
	}

	/**
	 * Rayleigh cutoff frequency expressed as a radius in pixels of the
	 * centred spectrum of a {@code side x side} image.
	 */
	public double cutoffRadius(final int side) {

		final double rayleighFrequency = 2 * numericalAperture / (1.22 * wavelength);
		final double nyquist = 1 / (2 * pixelSize);
		return rayleighFrequency / nyquist * side / 2.0;
	}

	public SharpnessSignature measure(final RandomAccessibleInterval<? extends RealType<?>> image) {
		return measure(Images.toArray(image), Images.squareSide(image));
	}

	public SharpnessSignature measure(final double[] image, final int side) {

		if (image.length != side * side)
			throw DimensionMismatchException.of("image pixel count", (long)side * side, image.length);

		final double[] rms = ringRms(Fourier.power(Fourier.centredSpectrum(image, side)), side);

		final SimpleRegression regression = new SimpleRegression();
		for (int i = 0; i < rms.length; i++)
			if (rms[i] > 0)
				regression.addData(i, Math.log(rms[i]));

		if (regression.getN() < 3)
			throw new IllegalArgumentException(String.format(
					"only %d non-empty frequency rings inside cutoff radius %.2f px", regression.getN(), cutoffRadius(side)));

		return new SharpnessSignature(
				regression.getSlope(),
				regression.getIntercept(),
				regression.getR(),
				Math.log(regression.getSignificance()),
				regression.getSlopeStdErr());
	}

	/**
	 * RMS of the power spectrum in each of {@link #ringCount} equal width
	 * rings between {@link #INNER_FRACTION} and 1 times the cutoff radius.
	 * Empty rings report 0.
	 */
	double[] ringRms(final double[] power, final int side) {

		final double outer = cutoffRadius(side);
		final double inner = INNER_FRACTION * outer;
		final double width = (outer - inner) / ringCount;

		final double[] sum = new double[ringCount];
		final int[] count = new int[ringCount];
		final int c = side / 2;
		for (int y = 0; y < side; y++) {
			final double dy = y - c;
			for (int x = 0; x < side; x++) {
				final double dx = x - c;
				final double d = Math.sqrt(dx * dx + dy * dy);
				if (d < inner || d >= outer)
					continue;

				final int ring = Math.min(ringCount - 1, (int)((d - inner) / width));
				sum[ring] += power[y * side + x];
				count[ring]++;
			}
		}

		final double[] rms = new double[ringCount];
		for (int i = 0; i < ringCount; i++)
			if (count[i] > 0)
				rms[i] = Math.sqrt(sum[i] / count[i]);

		return rms;
	}
}
