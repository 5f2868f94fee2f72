package org.janelia.saalfeldlab.adaptiveoptics;

import org.janelia.saalfeldlab.adaptiveoptics.fourier.CarrierFilter;
import org.janelia.saalfeldlab.adaptiveoptics.zernike.Zernike;

/**
 * Interferograms, phase maps and blurred spots for tests.
 */
public class SyntheticImages {

	private SyntheticImages() {}

	/**
	 * @param coefficients amplitude of Noll mode j at index j - 1
	 */
	public static double[] zernikePhase(final int side, final double... coefficients) {

		final double[] phase = new double[side * side];
		for (int j = 1; j <= coefficients.length; j++) {
			if (coefficients[j - 1] == 0)
				continue;

			final double[] z = Zernike.basis(j, side);
			for (int i = 0; i < phase.length; i++)
				phase[i] += coefficients[j - 1] * z[i];
		}
		return phase;
	}

	/**
	 * {@code 1 + cos(2π (kx x + ky y) / side + phase)}
	 */
	public static double[] fringes(final int side, final int kx, final int ky, final double[] phase) {

		final double[] image = new double[side * side];
		for (int y = 0; y < side; y++)
			for (int x = 0; x < side; x++) {
				final int i = y * side + x;
				final double p = phase == null ? 0 : phase[i];
				image[i] = 1 + Math.cos(2 * Math.PI * (kx * x + ky * y) / side + p);
			}

		return image;
	}

	public static double[] maskedFringes(final PupilMask mask, final int kx, final int ky, final double[] phase) {
		return mask.apply(fringes(mask.side, kx, ky, phase));
	}

	/**
	 * +1 if the filter sits on the {@code +k} carrier, -1 if on its mirror
	 * image; demodulation at {@code -k} returns the negated phase.
	 */
	public static int sign(final CarrierFilter filter, final int kx) {
		return Integer.signum(filter.peakX - filter.side / 2) == Integer.signum(kx) ? 1 : -1;
	}

	/**
	 * Centred Gaussian spot with variance {@code sigma2} in pixels².
	 */
	public static double[] spot(final int side, final double sigma2) {

		final double[] image = new double[side * side];
		final double c = side / 2;
		for (int y = 0; y < side; y++)
			for (int x = 0; x < side; x++) {
				final double dx = x - c;
				final double dy = y - c;
				image[y * side + x] = Math.exp(-(dx * dx + dy * dy) / (2 * sigma2));
			}

		return image;
	}
}
