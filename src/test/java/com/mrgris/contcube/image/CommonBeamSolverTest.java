package com.mrgris.contcube.image;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

class CommonBeamSolverTest {

	@Test
	void largestBeamWinsWhenItCoversTheRest() {
		BeamShape a = new BeamShape(1, 1, 0);
		BeamShape b = new BeamShape(2, 1, 0);
		assertEquals(b, CommonBeamSolver.commonBeam(Arrays.asList(a, b, a)));
	}

	@Test
	void singleBeamIsItsOwnCommonBeam() {
		BeamShape b = new BeamShape(3, 2, 45);
		assertEquals(b, CommonBeamSolver.commonBeam(Arrays.asList(b)));
	}

	@Test
	void crossedBeamsGiveNearCircle() {
		BeamShape ns = new BeamShape(2, 1, 0);
		BeamShape ew = new BeamShape(2, 1, 90);
		BeamShape cb = CommonBeamSolver.commonBeam(Arrays.asList(ns, ew));
		assertTrue(cb.dominates(ns));
		assertTrue(cb.dominates(ew));
		// the circle of diameter 2 is the smallest cover
		assertEquals(2, cb.major, 0.05);
		assertEquals(2, cb.minor, 0.05);
	}

	@Test
	void emptyInputRejected() {
		assertThrows(IllegalArgumentException.class, () -> CommonBeamSolver.commonBeam(new ArrayList<>()));
	}

	@Test
	void commonBeamDominatesRandomBeams() {
		Random r = new Random(20240607L);
		for (int trial = 0; trial < 50; trial++) {
			int n = 1 + r.nextInt(6);
			List<BeamShape> beams = new ArrayList<>();
			for (int i = 0; i < n; i++) {
				double major = 5 + 20 * r.nextDouble();
				double minor = major * (0.3 + 0.7 * r.nextDouble());
				beams.add(new BeamShape(major, minor, -90 + 180 * r.nextDouble()));
			}
			BeamShape cb = CommonBeamSolver.commonBeam(beams);
			for (BeamShape b : beams) {
				assertTrue(cb.dominates(b), () -> cb + " does not cover " + b);
				assertTrue(cb.major >= b.major * (1 - 1e-6));
				assertTrue(cb.minor >= b.minor * (1 - 1e-6));
			}
		}
	}

	@Test
	void commonBeamIsNotMuchLargerThanNeeded() {
		Random r = new Random(7L);
		for (int trial = 0; trial < 20; trial++) {
			List<BeamShape> beams = new ArrayList<>();
			for (int i = 0; i < 4; i++) {
				double major = 10 + 2 * r.nextDouble();
				beams.add(new BeamShape(major, major * 0.6, 180 * r.nextDouble()));
			}
			BeamShape cb = CommonBeamSolver.commonBeam(beams);
			double maxMajor = 0;
			for (BeamShape b : beams) {
				maxMajor = Math.max(maxMajor, b.major);
			}
			assertTrue(cb.major <= 1.5 * maxMajor, cb.toString());
		}
	}
}
