package org.janelia.saalfeldlab.adaptiveoptics;

/**
 * Pupil position and radius on the camera, in pixels.
 */
public class RegionOfInterest {

	public final int y0;
	public final int x0;
	public final int radius;

	public RegionOfInterest(final int y0, final int x0, final int radius) {

		if (radius <= 0)
			throw new IllegalArgumentException("radius must be positive, got " + radius);

		this.y0 = y0;
		this.x0 = x0;
		this.radius = radius;
	}

	public int side() {
		return 2 * radius;
	}

	@Override
	public boolean equals(final Object o) {

		if (!(o instanceof RegionOfInterest))
			return false;

		final RegionOfInterest other = (RegionOfInterest)o;
		return y0 == other.y0 && x0 == other.x0 && radius == other.radius;
	}

	@Override
	public int hashCode() {
		return 31 * (31 * y0 + x0) + radius;
	}

	@Override
	public String toString() {
		return String.format("(y0=%d, x0=%d, radius=%d)", y0, x0, radius);
	}
}
