package org.janelia.saalfeldlab.adaptiveoptics;

import static org.junit.Assert.assertEquals;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class AdaptiveOpticsParametersTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testPokeSteps() {

		final double[] steps = new AdaptiveOpticsParameters().pokeSteps();
		assertEquals(10, steps.length);
		assertEquals(0.25, steps[0], 1e-12);
		assertEquals(0.75, steps[9], 1e-12);
		assertEquals(0.5 / 9, steps[1] - steps[0], 1e-12);
	}

	@Test
	public void testRoundTrip() throws IOException {

		final AdaptiveOpticsParameters parameters = new AdaptiveOpticsParameters();
		parameters.pseudoInverseCutoff = 0.01;
		parameters.calibrationModes = 20;
		parameters.wavelength = 633e-9;

		final Path path = folder.newFile("parameters.json").toPath();
		parameters.save(path);
		final AdaptiveOpticsParameters loaded = AdaptiveOpticsParameters.load(path);

		assertEquals(0.01, loaded.pseudoInverseCutoff, 0);
		assertEquals(20, loaded.calibrationModes);
		assertEquals(633e-9, loaded.wavelength, 0);
		assertEquals(0.001, loaded.discontinuityFraction, 0);
	}

	@Test
	public void testMissingFieldsKeepDefaults() throws IOException {

		final Path path = folder.newFile("partial.json").toPath();
		Files.write(path, "{ \"numPokeSteps\": 5, \"restPosition\": 0.4 }".getBytes(StandardCharsets.UTF_8));
		final AdaptiveOpticsParameters loaded = AdaptiveOpticsParameters.load(path);

		assertEquals(5, loaded.numPokeSteps);
		assertEquals(0.4, loaded.restPosition, 0);
		assertEquals(69, loaded.calibrationModes);
		assertEquals(1000, loaded.settleDelayMillis);
	}

	@Test(expected = IOException.class)
	public void testMalformed() throws IOException {

		final Path path = folder.newFile("broken.json").toPath();
		Files.write(path, "{ numPokeSteps: [".getBytes(StandardCharsets.UTF_8));
		AdaptiveOpticsParameters.load(path);
	}
}
