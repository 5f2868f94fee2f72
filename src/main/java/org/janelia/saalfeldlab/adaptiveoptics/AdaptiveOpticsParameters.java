package org.janelia.saalfeldlab.adaptiveoptics;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

/**
 * Tunable constants of calibration, correction and sensorless estimation.
 * Fields missing from a JSON file keep their defaults.
 */
public class AdaptiveOpticsParameters {

	private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

	/** share of pixels whose second difference may exceed 2π before a calibration frame is rejected */
	public double discontinuityFraction = 0.001;

	/** singular values below this fraction of the largest are dropped from the pseudo-inverse */
	public double pseudoInverseCutoff = 0.005;

	public int resizeDimension = 128;

	/** mirror rest position, also the default command offset */
	public double restPosition = 0.5;

	public long settleDelayMillis = 1000;
	public long timeoutBackoffMillis = 1000;

	/** camera exposure during calibration, seconds */
	public double calibrationExposure = 0.1;
	public double pokeMin = 0.25;
	public double pokeMax = 0.75;
	public int numPokeSteps = 10;
	public int calibrationModes = 69;

	public int systemFlattenIterations = 25;
	public int systemFlattenExcludedModes = 4;
	public int flattenExcludedModes = 3;

	public double numericalAperture = 1.1;

	/** meters */
	public double wavelength = 500e-9;

	/** meters */
	public double pixelSize = 0.1193e-6;

	public int ringCount = 100;

	/** estimate sensorless amplitudes from the signature slope instead of all signature components */
	public boolean sensorlessSlopeOnly = false;

	/**
	 * Poke values from {@link #pokeMin} to {@link #pokeMax}, inclusive, in
	 * {@link #numPokeSteps} equal steps.
	 */
	public double[] pokeSteps() {

		if (numPokeSteps < 1)
			throw new IllegalArgumentException("number of poke steps must be positive, got " + numPokeSteps);

		final double[] steps = new double[numPokeSteps];
		if (numPokeSteps == 1) {
			steps[0] = pokeMin;
			return steps;
		}

		final double step = (pokeMax - pokeMin) / (numPokeSteps - 1);
		for (int i = 0; i < numPokeSteps; i++)
			steps[i] = pokeMin + i * step;

		return steps;
	}

	public static AdaptiveOpticsParameters load(final Path path) throws IOException {

		try (final Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			final AdaptiveOpticsParameters parameters = GSON.fromJson(reader, AdaptiveOpticsParameters.class);
			if (parameters == null)
				throw new IOException("empty parameter file " + path);

			return parameters;
		} catch (final JsonParseException e) {
			throw new IOException("could not parse parameter file " + path, e);
		}
	}

	public void save(final Path path) throws IOException {

		try (final Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
			GSON.toJson(this, writer);
		}
	}

	public String toJson() {
		return GSON.toJson(this);
	}

	@Override
	public String toString() {
		return toJson();
	}
}
