package org.janelia.saalfeldlab.adaptiveoptics;

/**
 * The carrier peak could not be refined or the filter could not be placed,
 * usually because the interferometer fringes are too fine for the current
 * region of interest.
 */
public class FilterConstructionException extends AdaptiveOpticsException {

	private static final long serialVersionUID = 2952285086340613329L;

	public FilterConstructionException(final String message) {
		super(message);
	}
}
