package org.janelia.saalfeldlab.adaptiveoptics;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import org.junit.Test;

import net.imglib2.img.array.ArrayImgs;

public class ImagesTest {

	@Test
	public void testCrop() {

		final double[] raw = new double[20 * 20];
		for (int y = 0; y < 20; y++)
			for (int x = 0; x < 20; x++)
				raw[y * 20 + x] = x + 100 * y;

		final double[] cropped = Images.crop(ArrayImgs.doubles(raw, 20, 20), new RegionOfInterest(10, 8, 4));
		assertEquals(64, cropped.length);
		assertEquals(4 + 100 * 6, cropped[0], 0);
		assertEquals(11 + 100 * 13, cropped[63], 0);
		assertEquals(8 + 100 * 10, cropped[4 * 8 + 4], 0);
	}

	@Test(expected = DimensionMismatchException.class)
	public void testCropOutOfBounds() {
		Images.crop(ArrayImgs.doubles(20, 20), new RegionOfInterest(10, 3, 4));
	}

	@Test(expected = DimensionMismatchException.class)
	public void testNotSquare() {
		Images.squareSide(ArrayImgs.doubles(20, 21));
	}

	@Test
	public void testToArrayRowMajor() {

		final double[] data = {1, 2, 3, 4};
		assertArrayEquals(data, Images.toArray(ArrayImgs.doubles(data.clone(), 2, 2)), 0);
	}

	@Test
	public void testRms() {
		assertEquals(2.5, Images.rms(new double[]{3, -4, 0, 0}), 1e-12);
		assertEquals(0.0, Images.rms(new double[16]), 0);
	}
}
