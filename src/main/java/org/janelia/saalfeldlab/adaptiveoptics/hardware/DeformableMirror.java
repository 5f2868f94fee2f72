package org.janelia.saalfeldlab.adaptiveoptics.hardware;

public interface DeformableMirror {

	int numActuators();

	/**
	 * @param values one value in [0, 1] per actuator
	 */
	void apply(double[] values);
}
