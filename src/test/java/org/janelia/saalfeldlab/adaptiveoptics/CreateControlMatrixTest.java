package org.janelia.saalfeldlab.adaptiveoptics;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

import java.io.File;
import java.io.IOException;

import org.janelia.saalfeldlab.adaptiveoptics.calibration.ControlMatrix;
import org.janelia.saalfeldlab.adaptiveoptics.io.ArtifactStore;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;
import picocli.CommandLine;

public class CreateControlMatrixTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private String root;
	private String parameters;

	@Before
	public void writePokeStack() throws IOException {

		final AdaptiveOpticsParameters p = new AdaptiveOpticsParameters();
		p.numPokeSteps = 3;
		final File parameterFile = folder.newFile("parameters.json");
		p.save(parameterFile.toPath());
		parameters = parameterFile.getAbsolutePath();

		final PupilMask mask = PupilMask.create(64);
		final int side = mask.side;
		final double[] pokes = p.pokeSteps();
		final ArrayImg<DoubleType, DoubleArray> stack = ArrayImgs.doubles(side, side, 2 * pokes.length);
		final double[] data = Images.data(stack);
		for (int a = 0; a < 2; a++)
			for (int s = 0; s < pokes.length; s++) {
				final double[] modes = new double[5];
				modes[a == 0 ? 3 : 4] = 2 * (pokes[s] - 0.5);
				final double[] frame = SyntheticImages.maskedFringes(mask, 20, 20, SyntheticImages.zernikePhase(side, modes));
				System.arraycopy(frame, 0, data, (a * pokes.length + s) * side * side, side * side);
			}

		root = new File(folder.getRoot(), "pokes.n5").getAbsolutePath();
		new ArtifactStore(root).saveImageStack(stack);
	}

	@Test
	public void testWritesControlMatrix() throws IOException {

		final int exitCode = new CommandLine(new CreateControlMatrix()).execute(
				"-i", root,
				"-a", "2",
				"-m", "6",
				"-p", parameters);

		assertEquals(0, exitCode);
		final ControlMatrix matrix = new ArtifactStore(root).loadControlMatrix();
		assertEquals(2, matrix.numActuators());
		assertEquals(6, matrix.numModes());
		assertEquals(0.5, Math.abs(matrix.getData()[0][3]), 0.1);
	}

	@Test
	public void testExcludedActuatorOutOfRange() {

		final int exitCode = new CommandLine(new CreateControlMatrix()).execute(
				"-i", root,
				"-a", "2",
				"-x", "5",
				"-p", parameters);

		assertNotEquals(0, exitCode);
	}
}
