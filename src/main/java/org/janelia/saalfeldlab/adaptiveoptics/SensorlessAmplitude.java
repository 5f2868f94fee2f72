package org.janelia.saalfeldlab.adaptiveoptics;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.concurrent.Callable;

import org.janelia.saalfeldlab.adaptiveoptics.io.ArtifactStore;
import org.janelia.saalfeldlab.adaptiveoptics.sensorless.FourierMetric;
import org.janelia.saalfeldlab.adaptiveoptics.sensorless.SensorlessEstimator;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
	name = "sensorless-amplitude",
	mixinStandardHelpOptions = true,
	version = "0.1",
	description = "Estimates the amplitude of one aberration mode from images taken with known bias amplitudes.")
public class SensorlessAmplitude implements Callable<Integer> {

	@Option(names = {"-i", "--input-root"}, description = "N5 root", required = true)
	private String inputRoot;

	@Option(names = {"-d", "--dataset"}, description = "Image stack dataset (x, y, frame)", required = true)
	private String dataset;

	@Option(names = {"-a", "--amplitudes"}, split = ",", required = true,
			description = "Comma-separated bias amplitudes of one series; the stack may hold several consecutive series")
	private double[] amplitudes;

	@Option(names = {"--na"}, description = "Numerical aperture, default from parameters")
	private Double numericalAperture;

	@Option(names = {"--wavelength"}, description = "Wavelength in meters, default from parameters")
	private Double wavelength;

	@Option(names = {"--pixel-size"}, description = "Pixel size in meters, default from parameters")
	private Double pixelSize;

	@Option(names = {"--rings"}, description = "Number of frequency rings, default from parameters")
	private Integer ringCount;

	@Option(names = {"--slope-only"}, description = "Fit the signature slope only instead of averaging all signature components")
	private Boolean slopeOnly;

	@Option(names = {"-p", "--parameters"}, description = "Parameter JSON file")
	private String parametersPath;

	public static void main(String[] args) {
		int exitCode = new CommandLine(new SensorlessAmplitude()).execute(args);
		System.exit(exitCode);
	}

	@Override
	public Integer call() throws Exception {

		final AdaptiveOpticsParameters parameters = parametersPath == null
				? new AdaptiveOpticsParameters()
				: AdaptiveOpticsParameters.load(Paths.get(parametersPath));

		final FourierMetric metric = new FourierMetric(
				numericalAperture == null ? parameters.numericalAperture : numericalAperture,
				wavelength == null ? parameters.wavelength : wavelength,
				pixelSize == null ? parameters.pixelSize : pixelSize,
				ringCount == null ? parameters.ringCount : ringCount);

		System.out.println("Estimating amplitude with:");
		System.out.println("  - Input: " + inputRoot + " : " + dataset);
		System.out.println("  - Amplitudes: " + Arrays.toString(amplitudes));
		System.out.println("  - Cutoff: NA " + metric.numericalAperture + ", wavelength " + metric.wavelength + ", pixel size " + metric.pixelSize);

		final ArrayImg<DoubleType, DoubleArray> stack = new ArtifactStore(inputRoot).loadImage(dataset);
		if (stack.numDimensions() != 3)
			throw DimensionMismatchException.of("image stack dimensions", 3, stack.numDimensions());

		final double amplitude = new SensorlessEstimator(metric)
				.slopeOnly(slopeOnly == null ? parameters.sensorlessSlopeOnly : slopeOnly)
				.estimateAmplitude(stack, amplitudes);
		System.out.println("amplitude: " + amplitude);
		return 0;
	}
}
