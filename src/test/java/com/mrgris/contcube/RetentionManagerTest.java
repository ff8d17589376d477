package com.mrgris.contcube;

import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RetentionManagerTest {

	@TempDir
	Path tmp;

	ImageSet homogenizedSet() throws Exception {
		String prefix = tmp.resolve("image.f.contcube.beam00").toString();
		ImageSet is = new ImageSet("beam00", "x.ms", prefix, 2);
		List<String> images = new ArrayList<>();
		List<String> psfs = new ArrayList<>();
		Map<String, String> replacements = new HashMap<>();
		for (int c = 0; c < 2; c++) {
			images.add(touch(ImageNaming.channelImage(prefix, c, Polarization.I, false)));
			psfs.add(touch(ImageNaming.auxiliary(prefix, c, Polarization.I, false, AuxiliaryKind.PSF)));
			touch(ImageNaming.auxiliary(prefix, c, Polarization.I, false, AuxiliaryKind.RESIDUAL));
		}
		is.addImages(Polarization.I, images);
		is.addAuxiliary(Polarization.I, AuxiliaryKind.PSF, psfs);
		List<String> residuals = new ArrayList<>();
		for (int c = 0; c < 2; c++) {
			residuals.add(ImageNaming.auxiliary(prefix, c, Polarization.I, false, AuxiliaryKind.RESIDUAL));
		}
		is.addAuxiliary(Polarization.I, AuxiliaryKind.RESIDUAL, residuals);
		for (String p : images) {
			replacements.put(p, touch(ImageNaming.homogenized(p)));
		}
		for (String p : psfs) {
			replacements.put(p, touch(ImageNaming.homogenized(p)));
		}
		return is.withHomogenized(replacements);
	}

	static String touch(String path) throws Exception {
		Files.write(new File(path).toPath(), new byte[] {1});
		return path;
	}

	int filesLeft() throws Exception {
		try (Stream<Path> s = Files.list(tmp)) {
			return (int)s.count();
		}
	}

	@Test
	void keepsEverythingWithoutPurge() throws Exception {
		ImageSet is = homogenizedSet();
		CleanupReport r = new RetentionManager(false).cleanup(is);
		assertFalse(r.purged);
		assertEquals(10, filesLeft());
	}

	@Test
	void purgeDeletesRawHomogenizedAndAuxiliary() throws Exception {
		ImageSet is = homogenizedSet();
		assertEquals(10, is.ownedFiles().size());
		File cube = new File(touch(ImageNaming.cube(is.outputPrefix, Polarization.I)));

		CleanupReport r = new RetentionManager(true).cleanup(is);
		assertTrue(r.purged);
		assertEquals(10, r.deleted);
		assertTrue(r.missing.isEmpty());
		assertTrue(cube.exists());
		assertEquals(1, filesLeft());
	}

	@Test
	void secondPurgeOnlyWarns() throws Exception {
		ImageSet is = homogenizedSet();
		RetentionManager rm = new RetentionManager(true);
		rm.cleanup(is);
		CleanupReport again = rm.cleanup(is);
		assertEquals(0, again.deleted);
		assertEquals(10, again.missing.size());
	}
}
