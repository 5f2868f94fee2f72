package org.janelia.saalfeldlab.adaptiveoptics;

import java.nio.file.Paths;
import java.util.Arrays;
import java.util.concurrent.Callable;

import org.janelia.saalfeldlab.adaptiveoptics.calibration.CalibrationResult;
import org.janelia.saalfeldlab.adaptiveoptics.calibration.ControlMatrixCalibration;
import org.janelia.saalfeldlab.adaptiveoptics.calibration.RejectedFrame;
import org.janelia.saalfeldlab.adaptiveoptics.fourier.CarrierFilter;
import org.janelia.saalfeldlab.adaptiveoptics.fourier.CarrierFilterBuilder;
import org.janelia.saalfeldlab.adaptiveoptics.io.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.view.Views;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
	name = "create-control-matrix",
	mixinStandardHelpOptions = true,
	version = "0.1",
	description = "Computes a deformable mirror control matrix from a saved poke image stack.")
public class CreateControlMatrix implements Callable<Integer> {

	private static final Logger LOG = LoggerFactory.getLogger(CreateControlMatrix.class);

	@Option(names = {"-i", "--input-root"}, description = "N5 root containing the poke stack", required = true)
	private String inputRoot;

	@Option(names = {"-d", "--dataset"}, description = "Poke stack dataset (x, y, frame), default: " + ArtifactStore.IMAGE_STACK)
	private String dataset = ArtifactStore.IMAGE_STACK;

	@Option(names = {"-o", "--output-root"}, description = "N5 root for the control matrix, default: the input root")
	private String outputRoot;

	@Option(names = {"--matrix-dataset"}, description = "Control matrix dataset, default: " + ArtifactStore.CONTROL_MATRIX)
	private String matrixDataset = ArtifactStore.CONTROL_MATRIX;

	@Option(names = {"-a", "--num-actuators"}, description = "Number of mirror actuators", required = true)
	private int numActuators;

	@Option(names = {"-m", "--num-modes"}, description = "Number of Zernike modes, default from parameters")
	private Integer numModes;

	@Option(names = {"-x", "--exclude"}, split = ",", description = "Comma-separated actuators outside the pupil (zero-indexed)")
	private int[] excluded = new int[0];

	@Option(names = {"-p", "--parameters"}, description = "Parameter JSON file")
	private String parametersPath;

	public static void main(String[] args) {
		int exitCode = new CommandLine(new CreateControlMatrix()).execute(args);
		System.exit(exitCode);
	}

	@Override
	public Integer call() throws Exception {

		final AdaptiveOpticsParameters parameters = parametersPath == null
				? new AdaptiveOpticsParameters()
				: AdaptiveOpticsParameters.load(Paths.get(parametersPath));
		final int modes = numModes == null ? parameters.calibrationModes : numModes;
		final double[] pokeSteps = parameters.pokeSteps();

		final boolean[] included = new boolean[numActuators];
		Arrays.fill(included, true);
		for (final int a : excluded) {
			if (a < 0 || a >= numActuators)
				throw new IllegalArgumentException("excluded actuator " + a + " out of range [0, " + numActuators + ")");
			included[a] = false;
		}

		System.out.println("Creating control matrix with:");
		System.out.println("  - Input: " + inputRoot + " : " + dataset);
		System.out.println("  - Actuators: " + numActuators);
		System.out.println("  - Modes: " + modes);
		System.out.println("  - Poke steps: " + Arrays.toString(pokeSteps));

		final ArrayImg<DoubleType, DoubleArray> stack = new ArtifactStore(inputRoot).loadImage(dataset);
		if (stack.numDimensions() != 3)
			throw DimensionMismatchException.of("poke stack dimensions", 3, stack.numDimensions());

		final PupilMask mask = PupilMask.create((int)(stack.dimension(0) / 2));
		LOG.info("Building Fourier filter from first frame");
		final CarrierFilter filter = CarrierFilterBuilder.build(Views.hyperSlice(stack, 2, 0));

		final CalibrationResult result = new ControlMatrixCalibration(filter, mask)
				.discontinuityFraction(parameters.discontinuityFraction)
				.cutoff(parameters.pseudoInverseCutoff)
				.resizeDimension(parameters.resizeDimension)
				.calibrate(stack, numActuators, modes, pokeSteps, included);

		System.out.println("");
		System.out.println(result.controlMatrix);
		System.out.println("rejected frames: " + result.rejected.size());
		for (final RejectedFrame frame : result.rejected)
			System.out.println("  " + frame);

		final ArtifactStore output = new ArtifactStore(outputRoot == null ? inputRoot : outputRoot);
		output.saveControlMatrix(matrixDataset, result.controlMatrix);
		System.out.println("saved to " + output.getBasePath() + " : " + matrixDataset);
		return 0;
	}
}
