package org.janelia.saalfeldlab.adaptiveoptics;

public class DimensionMismatchException extends AdaptiveOpticsException {

	private static final long serialVersionUID = 8470317727001856921L;

	public DimensionMismatchException(final String message) {
		super(message);
	}

	public static DimensionMismatchException of(final String what, final long expected, final long actual) {
		return new DimensionMismatchException(String.format("%s: expected %d, got %d", what, expected, actual));
	}
}
