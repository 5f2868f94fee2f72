package org.janelia.saalfeldlab.adaptiveoptics;

import java.nio.file.Paths;
import java.util.concurrent.Callable;

import org.janelia.saalfeldlab.adaptiveoptics.fourier.CarrierFilter;
import org.janelia.saalfeldlab.adaptiveoptics.fourier.CarrierFilterBuilder;
import org.janelia.saalfeldlab.adaptiveoptics.fourier.PhaseUnwrapper;
import org.janelia.saalfeldlab.adaptiveoptics.io.ArtifactStore;
import org.janelia.saalfeldlab.adaptiveoptics.zernike.ModalDecomposition;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
	name = "measure-modes",
	mixinStandardHelpOptions = true,
	version = "0.1",
	description = "Unwraps a saved interferogram of the pupil and prints its Zernike coefficients.")
public class MeasureModes implements Callable<Integer> {

	@Option(names = {"-i", "--input-root"}, description = "N5 root", required = true)
	private String inputRoot;

	@Option(names = {"-d", "--dataset"}, description = "Interferogram dataset, square and cropped to the pupil", required = true)
	private String dataset;

	@Option(names = {"-n", "--num-modes"}, description = "Number of Zernike modes, default: 10")
	private int numModes = 10;

	@Option(names = {"--region"}, description = "Half width of the excluded zero-frequency region, default: side / 8")
	private Integer region;

	@Option(names = {"-o", "--phase-dataset"}, description = "Optional dataset to save the unwrapped phase to")
	private String phaseDataset;

	@Option(names = {"-p", "--parameters"}, description = "Parameter JSON file")
	private String parametersPath;

	public static void main(String[] args) {
		int exitCode = new CommandLine(new MeasureModes()).execute(args);
		System.exit(exitCode);
	}

	@Override
	public Integer call() throws Exception {

		final AdaptiveOpticsParameters parameters = parametersPath == null
				? new AdaptiveOpticsParameters()
				: AdaptiveOpticsParameters.load(Paths.get(parametersPath));

		final ArtifactStore store = new ArtifactStore(inputRoot);
		final ArrayImg<DoubleType, DoubleArray> interferogram = store.loadImage(dataset);
		final int side = Images.squareSide(interferogram);

		final PupilMask mask = PupilMask.create(side / 2);
		final CarrierFilter filter = CarrierFilterBuilder.build(interferogram, region == null ? side / 8 : region);
		System.out.println(filter);

		final ArrayImg<DoubleType, DoubleArray> phase = PhaseUnwrapper.unwrap(
				Images.wrap(mask.apply(Images.toArray(interferogram)), side),
				filter,
				mask);
		final double[] coefficients = ModalDecomposition.decompose(phase, numModes, parameters.resizeDimension);

		for (int j = 1; j <= coefficients.length; j++)
			System.out.println(String.format("Z%-3d %12.6f", j, coefficients[j - 1]));
		System.out.println(String.format("RMS  %12.6f", Images.rms(phase)));

		if (phaseDataset != null)
			store.saveImage(phaseDataset, phase);

		return 0;
	}
}
