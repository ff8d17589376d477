package com.mrgris.contcube.image;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.mrgris.contcube.BeamMetadataError;

class FitsImageTest {

	@TempDir
	Path tmp;

	@Test
	void readsBackWhatWasWritten() throws Exception {
		String path = tmp.resolve("chan.fits").toString();
		float[] data = FitsFixtures.noise(1L, 1.);
		FitsFixtures.write(path, new BeamShape(2, 1, 30), 801e6, data);

		FitsImage img = FitsImage.read(path);
		assertArrayEquals(new int[] {16, 16, 1, 1}, img.shape);
		assertArrayEquals(data, img.data);
		assertEquals(3, img.spectralAxis());
		assertEquals(801e6, img.world(3, 0), 1e-3);
		assertEquals(-0.5, img.pixelScale()[0], 1e-9);

		BeamShape b = img.beam();
		assertEquals(2, b.major, 1e-6);
		assertEquals(1, b.minor, 1e-6);
		assertEquals(30, b.pa, 1e-6);
	}

	@Test
	void missingPixelScaleIsAnError() throws Exception {
		String path = tmp.resolve("noaxes.fits").toString();
		FitsFixtures.writeWithoutAxes(path, new BeamShape(1, 1, 0), FitsFixtures.noise(3L, 1.));
		IOException e = assertThrows(IOException.class, () -> FitsImage.read(path).pixelScale());
		assertTrue(e.getMessage().contains("CDELT1"), e.getMessage());
	}

	@Test
	void missingBeamKeywordsAreReported() throws Exception {
		String path = tmp.resolve("nobeam.fits").toString();
		FitsFixtures.write(path, null, 800e6, FitsFixtures.noise(2L, 1.));
		BeamMetadataError e = assertThrows(BeamMetadataError.class, () -> FitsImage.readBeam(path));
		assertTrue(e.getMessage().contains("BMAJ"));
	}

	@Test
	void unreadableFileIsBeamMetadataError() {
		assertThrows(BeamMetadataError.class, () -> FitsImage.readBeam(tmp.resolve("absent.fits").toString()));
	}

	@Test
	void derivedImageKeepsKeywordsButNotSourceUpdates() throws Exception {
		String src = tmp.resolve("src.fits").toString();
		FitsFixtures.write(src, new BeamShape(2, 1, 0), 800e6, FitsFixtures.noise(3L, 1.));
		FitsImage img = FitsImage.read(src);

		FitsImage copy = img.withData(img.data.clone());
		copy.setBeam(new BeamShape(4, 3, 10));
		String dst = tmp.resolve("dst.fits").toString();
		copy.write(dst);

		assertEquals(2, FitsImage.readBeam(src).major, 1e-6);
		BeamShape b = FitsImage.readBeam(dst);
		assertEquals(4, b.major, 1e-6);
		assertEquals(3, b.minor, 1e-6);
		assertEquals("FREQ", FitsImage.readHeader(dst).getStringValue("CTYPE3"));
	}
}
