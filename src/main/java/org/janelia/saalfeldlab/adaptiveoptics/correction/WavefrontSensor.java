package org.janelia.saalfeldlab.adaptiveoptics.correction;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Source of unwrapped, pupil-masked phase maps of the current wavefront.
 */
public interface WavefrontSensor {

	ArrayImg<DoubleType, DoubleArray> measurePhase();
}
