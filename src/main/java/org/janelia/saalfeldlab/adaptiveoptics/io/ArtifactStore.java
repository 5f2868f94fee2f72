package org.janelia.saalfeldlab.adaptiveoptics.io;

import java.io.IOException;

import org.janelia.saalfeldlab.adaptiveoptics.DimensionMismatchException;
import org.janelia.saalfeldlab.adaptiveoptics.Images;
import org.janelia.saalfeldlab.adaptiveoptics.calibration.ControlMatrix;
import org.janelia.saalfeldlab.n5.GzipCompression;
import org.janelia.saalfeldlab.n5.N5FSReader;
import org.janelia.saalfeldlab.n5.N5FSWriter;
import org.janelia.saalfeldlab.n5.N5Reader;
import org.janelia.saalfeldlab.n5.N5Writer;
import org.janelia.saalfeldlab.n5.imglib2.N5Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.NativeType;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

/**
 * Image stacks and control matrices in an N5 container on the file system.
 * Everything is stored as FLOAT64. A control matrix is a 2-D dataset with
 * modes along x and actuators along y.
 */
public class ArtifactStore {

	private static final Logger LOG = LoggerFactory.getLogger(ArtifactStore.class);

	public static final String IMAGE_STACK = "image_stack_cropped";
	public static final String CONTROL_MATRIX = "control_matrix";

	public static final String NUM_ACTUATORS_KEY = "numActuators";
	public static final String NUM_MODES_KEY = "numModes";

	private static final int BLOCK_SIZE = 64;

	private final String basePath;

	public ArtifactStore(final String basePath) {
		this.basePath = basePath;
	}

	public String getBasePath() {
		return basePath;
	}

	public <T extends RealType<T>> void saveImageStack(final RandomAccessibleInterval<T> stack) throws IOException {
		saveImage(IMAGE_STACK, stack);
	}

	public ArrayImg<DoubleType, DoubleArray> loadImageStack() throws IOException {
		return loadImage(IMAGE_STACK);
	}

	/**
	 * Saves an image of any dimensionality as a FLOAT64 dataset.
	 */
	public <T extends RealType<T>> void saveImage(final String dataset, final RandomAccessibleInterval<T> image) throws IOException {

		final ArrayImg<DoubleType, DoubleArray> copy = copy(image);
		final int[] blockSize = new int[copy.numDimensions()];
		for (int d = 0; d < blockSize.length; d++)
			blockSize[d] = (int)Math.min(BLOCK_SIZE, copy.dimension(d));

		final N5Writer n5 = new N5FSWriter(basePath);
		N5Utils.save(copy, n5, dataset, blockSize, new GzipCompression());
		LOG.info("Saved {} {} to {}", dataset, Intervals.toString(copy), basePath);
	}

	public ArrayImg<DoubleType, DoubleArray> loadImage(final String dataset) throws IOException {

		final N5Reader n5 = new N5FSReader(basePath);
		if (!n5.datasetExists(dataset))
			throw new IOException("no dataset " + dataset + " in " + basePath);

		return ArtifactStore.<DoubleType>read(n5, dataset);
	}

	public void saveControlMatrix(final ControlMatrix matrix) throws IOException {
		saveControlMatrix(CONTROL_MATRIX, matrix);
	}

	public void saveControlMatrix(final String dataset, final ControlMatrix matrix) throws IOException {

		final int numActuators = matrix.numActuators();
		final int numModes = matrix.numModes();
		final double[] data = new double[numActuators * numModes];
		final double[][] rows = matrix.getData();
		for (int a = 0; a < numActuators; a++)
			System.arraycopy(rows[a], 0, data, a * numModes, numModes);

		final N5Writer n5 = new N5FSWriter(basePath);
		N5Utils.save(
				ArrayImgs.doubles(data, numModes, numActuators),
				n5,
				dataset,
				new int[]{numModes, numActuators},
				new GzipCompression());
		n5.setAttribute(dataset, NUM_ACTUATORS_KEY, numActuators);
		n5.setAttribute(dataset, NUM_MODES_KEY, numModes);
		LOG.info("Saved {} to {}/{}", matrix, basePath, dataset);
	}

	public ControlMatrix loadControlMatrix() throws IOException {
		return loadControlMatrix(CONTROL_MATRIX);
	}

	public ControlMatrix loadControlMatrix(final String dataset) throws IOException {

		final N5Reader n5 = new N5FSReader(basePath);
		if (!n5.datasetExists(dataset))
			throw new IOException("no control matrix " + dataset + " in " + basePath);

		final Integer numActuators = n5.getAttribute(dataset, NUM_ACTUATORS_KEY, Integer.class);
		final Integer numModes = n5.getAttribute(dataset, NUM_MODES_KEY, Integer.class);

		final ArrayImg<DoubleType, DoubleArray> img = ArtifactStore.<DoubleType>read(n5, dataset);
		if (img.numDimensions() != 2)
			throw DimensionMismatchException.of("control matrix dimensions", 2, img.numDimensions());
		if (numModes != null && img.dimension(0) != numModes)
			throw DimensionMismatchException.of("stored mode count", numModes, img.dimension(0));
		if (numActuators != null && img.dimension(1) != numActuators)
			throw DimensionMismatchException.of("stored actuator count", numActuators, img.dimension(1));

		final int cols = (int)img.dimension(0);
		final int rows = (int)img.dimension(1);
		final double[] data = Images.data(img);
		final double[][] matrix = new double[rows][cols];
		for (int a = 0; a < rows; a++)
			System.arraycopy(data, a * cols, matrix[a], 0, cols);

		return ControlMatrix.fromArray(matrix);
	}

	/**
	 * Reads a dataset of any real type. The type parameter only satisfies
	 * {@link N5Utils#open}; pixels are accessed as {@link RealType}.
	 */
	private static <T extends NativeType<T> & RealType<T>> ArrayImg<DoubleType, DoubleArray> read(final N5Reader n5, final String dataset) {

		final RandomAccessibleInterval<T> img = N5Utils.open(n5, dataset);
		return copy(img);
	}

	private static ArrayImg<DoubleType, DoubleArray> copy(final RandomAccessibleInterval<? extends RealType<?>> image) {

		final ArrayImg<DoubleType, DoubleArray> copy = ArrayImgs.doubles(Intervals.dimensionsAsLongArray(image));
		final Cursor<? extends RealType<?>> src = Views.flatIterable(image).cursor();
		final Cursor<DoubleType> dst = copy.cursor();
		while (dst.hasNext())
			dst.next().set(src.next().getRealDouble());

		return copy;
	}
}
