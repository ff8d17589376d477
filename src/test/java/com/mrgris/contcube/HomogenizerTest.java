package com.mrgris.contcube;

import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.mrgris.contcube.image.BeamShape;
import com.mrgris.contcube.image.FitsFixtures;
import com.mrgris.contcube.image.FitsImage;

class HomogenizerTest {

	@TempDir
	Path tmp;

	// name may be absolute
	String write(String name, BeamShape beam, float[] data) throws Exception {
		String p = tmp.resolve(name).toString();
		FitsFixtures.write(p, beam, FitsFixtures.FREQ0, data);
		return p;
	}

	@Test
	void convolvedImageCarriesTheCommonBeam() throws Exception {
		BeamShape common = new BeamShape(2, 1, 0);
		String src = write("a-0000-image.fits", new BeamShape(1, 1, 0), FitsFixtures.pointSource(1.));
		String dst = ImageNaming.homogenized(src);

		assertEquals(Homogenizer.Outcome.CONVOLVED, new Homogenizer(0).homogenizeImage(src, dst, common));
		FitsImage out = FitsImage.read(dst);
		assertTrue(out.beam().matches(common));
		// the point source is spread, so its peak drops relative to the input's units
		int center = (FitsFixtures.SIZE / 2) * FitsFixtures.SIZE + FitsFixtures.SIZE / 2;
		assertTrue(out.data[center + FitsFixtures.SIZE] > 0);
		assertEquals(0., out.data[center + 1], 1e-6);
	}

	static final int GRID = 128;
	static final double GRID_ARCSEC = 0.25;

	/** {major, minor, pa} of a positive blob centered on the grid, from its second moments */
	static double[] measuredBeam(float[] data) {
		double sum = 0, ee = 0, en = 0, nn = 0;
		for (int y = 0; y < GRID; y++) {
			for (int x = 0; x < GRID; x++) {
				double v = data[y * GRID + x];
				double east = -(x - GRID / 2) * GRID_ARCSEC;
				double north = (y - GRID / 2) * GRID_ARCSEC;
				sum += v;
				ee += v * east * east;
				en += v * east * north;
				nn += v * north * north;
			}
		}
		ee /= sum;
		en /= sum;
		nn /= sum;
		double mean = .5 * (ee + nn);
		double disc = Math.hypot(.5 * (nn - ee), en);
		double fwhmPerSigma = Math.sqrt(8. * Math.log(2.));
		return new double[] {
				fwhmPerSigma * Math.sqrt(mean + disc),
				fwhmPerSigma * Math.sqrt(mean - disc),
				Math.toDegrees(.5 * Math.atan2(2 * en, nn - ee))};
	}

	void assertConvolvesTo(BeamShape nativeBeam, BeamShape common) throws Exception {
		String src = tmp.resolve("g-0000-image.fits").toString();
		FitsFixtures.image(GRID, GRID_ARCSEC, nativeBeam, FitsFixtures.FREQ0,
				FitsFixtures.gaussianSource(GRID, GRID_ARCSEC, nativeBeam)).write(src);
		String dst = ImageNaming.homogenized(src);

		assertEquals(Homogenizer.Outcome.CONVOLVED, new Homogenizer(0).homogenizeImage(src, dst, common));
		float[] out = FitsImage.read(dst).data;
		double[] measured = measuredBeam(out);
		assertEquals(common.major, measured[0], 0.02);
		assertEquals(common.minor, measured[1], 0.02);
		assertEquals(common.pa, measured[2], 0.5);
		// still 1 Jy, now in the common beam
		assertEquals(1., out[(GRID / 2) * GRID + GRID / 2], 0.01);
	}

	@Test
	void convolvedSourceTakesTheCommonBeamShape() throws Exception {
		assertConvolvesTo(new BeamShape(3, 2, 10), new BeamShape(6, 4, 40));
	}

	@Test
	void convolvedSourceTakesARotatedCommonBeam() throws Exception {
		assertConvolvesTo(new BeamShape(3, 2, -60), new BeamShape(5, 4, -20));
	}

	@Test
	void matchingBeamIsPassedThrough() throws Exception {
		BeamShape common = new BeamShape(2, 1, 0);
		float[] data = FitsFixtures.noise(5L, 1.);
		String src = write("b-0000-image.fits", new BeamShape(2, 1, 0), data);
		String dst = ImageNaming.homogenized(src);

		assertEquals(Homogenizer.Outcome.PASSED, new Homogenizer(0).homogenizeImage(src, dst, common));
		FitsImage out = FitsImage.read(dst);
		assertArrayEquals(data, out.data);
		assertTrue(out.beam().matches(common));
	}

	@Test
	void commonBeamTooSmallIsAnError() throws Exception {
		String src = write("c-0000-image.fits", new BeamShape(3, 3, 0), FitsFixtures.noise(6L, 1.));
		assertThrows(BeamMismatchError.class,
				() -> new Homogenizer(0).homogenizeImage(src, ImageNaming.homogenized(src), new BeamShape(2, 1, 0)));
	}

	@Test
	void imageWithoutPixelScaleIsNotConvolved() throws Exception {
		String src = tmp.resolve("e-0000-image.fits").toString();
		FitsFixtures.writeWithoutAxes(src, new BeamShape(1, 1, 0), FitsFixtures.pointSource(1.));
		String dst = ImageNaming.homogenized(src);
		assertThrows(IOException.class, () -> new Homogenizer(0).homogenizeImage(src, dst, new BeamShape(2, 1, 0)));
		assertFalse(new File(dst).exists());
	}

	@Test
	void beamOverCutoffIsBlanked() throws Exception {
		String src = write("d-0000-image.fits", new BeamShape(30, 20, 0), FitsFixtures.noise(7L, 1.));
		String dst = ImageNaming.homogenized(src);
		assertEquals(Homogenizer.Outcome.BLANKED, new Homogenizer(25).homogenizeImage(src, dst, new BeamShape(2, 1, 0)));
		for (float v : FitsImage.read(dst).data) {
			assertTrue(Float.isNaN(v));
		}
	}

	@Test
	void imageSetPointsAtHomogenizedFiles() throws Exception {
		String prefix = tmp.resolve("image.f.contcube.beam00").toString();
		ImageSet is = new ImageSet("beam00", "x.ms", prefix, 2);
		List<String> images = new ArrayList<>();
		List<String> psfs = new ArrayList<>();
		List<String> models = new ArrayList<>();
		for (int c = 0; c < 2; c++) {
			images.add(write(ImageNaming.channelImage(prefix, c, Polarization.I, false),
					new BeamShape(1, 1, 0), FitsFixtures.noise(c, 1.)));
			psfs.add(write(ImageNaming.auxiliary(prefix, c, Polarization.I, false, AuxiliaryKind.PSF),
					new BeamShape(1, 1, 0), FitsFixtures.pointSource(1.)));
			models.add(ImageNaming.auxiliary(prefix, c, Polarization.I, false, AuxiliaryKind.MODEL));
		}
		is.addImages(Polarization.I, images);
		is.addAuxiliary(Polarization.I, AuxiliaryKind.PSF, psfs);
		is.addAuxiliary(Polarization.I, AuxiliaryKind.MODEL, models);

		CommonBeam common = new CommonBeam("f".repeat(64), new BeamShape(2, 2, 0), 2);
		ImageSet out = new Homogenizer(0).homogenize(is, common);

		assertTrue(out.homogenized);
		assertFalse(is.homogenized);
		for (int c = 0; c < 2; c++) {
			assertEquals(ImageNaming.homogenized(images.get(c)), out.images(Polarization.I).get(c));
			assertEquals(ImageNaming.homogenized(psfs.get(c)), out.auxiliary(Polarization.I, AuxiliaryKind.PSF).get(c));
			assertTrue(FitsImage.readBeam(out.images(Polarization.I).get(c)).matches(common.shape()));
		}
		assertEquals(models, out.auxiliary(Polarization.I, AuxiliaryKind.MODEL));
		// the originals are still owned, for cleanup
		assertTrue(out.ownedFiles().containsAll(images));
		assertTrue(out.ownedFiles().containsAll(psfs));
		assertEquals(images, is.images(Polarization.I));
	}
}
