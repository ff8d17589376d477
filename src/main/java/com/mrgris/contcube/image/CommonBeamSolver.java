package com.mrgris.contcube.image;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Ordering;

/**
 * Smallest beam that every input beam can be convolved up to.
 *
 * If the largest-area input already dominates the rest it is returned as is. Otherwise the
 * minimum-area ellipse enclosing all the input half-power contours is found with Khachiyan's
 * algorithm and then grown in small steps until it dominates every input.
 */
public class CommonBeamSolver {

	private static final Logger LOG = LoggerFactory.getLogger(CommonBeamSolver.class);

	static final int EDGE_POINTS = 180;
	static final double MVEE_TOLERANCE = 1e-5;
	static final int MVEE_MAX_ITER = 20000;
	static final double GROWTH_STEP = 5e-4;
	static final int MAX_GROWTH_STEPS = 20000;

	static final Ordering<BeamShape> BY_AREA = new Ordering<BeamShape>() {
		@Override
		public int compare(BeamShape a, BeamShape b) {
			return Double.compare(a.area(), b.area());
		}
	};

	public static BeamShape commonBeam(List<BeamShape> beams) {
		if (beams.isEmpty()) {
			throw new IllegalArgumentException("no beams");
		}
		BeamShape largest = BY_AREA.max(beams);
		if (dominatesAll(largest, beams)) {
			return largest;
		}

		BeamShape candidate = BeamShape.fromQuadratic(enclosingEllipse(beams));
		int steps = 0;
		while (!dominatesAll(candidate, beams)) {
			if (++steps > MAX_GROWTH_STEPS) {
				throw new IllegalStateException("common beam did not converge from " + candidate);
			}
			candidate = candidate.scaled(1. + GROWTH_STEP);
		}
		LOG.debug("enclosing ellipse grown {} steps to {}", steps, candidate);
		return candidate;
	}

	public static boolean dominatesAll(BeamShape common, Collection<BeamShape> beams) {
		for (BeamShape b : beams) {
			if (!common.dominates(b)) {
				return false;
			}
		}
		return true;
	}

	// all contours are centered on the origin, so the enclosing ellipse is too and the
	// centered form of the iteration applies
	static double[] enclosingEllipse(List<BeamShape> beams) {
		int n = beams.size() * EDGE_POINTS;
		double[] px = new double[n];
		double[] py = new double[n];
		int k = 0;
		for (BeamShape b : beams) {
			double th = Math.toRadians(b.pa);
			double ux = Math.sin(th), uy = Math.cos(th);
			double vx = Math.cos(th), vy = -Math.sin(th);
			for (int i = 0; i < EDGE_POINTS; i++) {
				double t = 2. * Math.PI * i / EDGE_POINTS;
				double ca = b.major * Math.cos(t);
				double sb = b.minor * Math.sin(t);
				px[k] = ca * ux + sb * vx;
				py[k] = ca * uy + sb * vy;
				k++;
			}
		}

		double[] u = new double[n];
		Arrays.fill(u, 1. / n);
		double[] x = new double[3];
		for (int iter = 0; iter < MVEE_MAX_ITER; iter++) {
			x[0] = x[1] = x[2] = 0;
			for (int i = 0; i < n; i++) {
				x[0] += u[i] * px[i] * px[i];
				x[1] += u[i] * px[i] * py[i];
				x[2] += u[i] * py[i] * py[i];
			}
			double det = x[0] * x[2] - x[1] * x[1];
			int j = 0;
			double mMax = -1;
			for (int i = 0; i < n; i++) {
				double m = (x[2] * px[i] * px[i] - 2 * x[1] * px[i] * py[i] + x[0] * py[i] * py[i]) / det;
				if (m > mMax) {
					mMax = m;
					j = i;
				}
			}
			double step = (mMax / 2. - 1.) / (mMax - 1.);
			if (step < MVEE_TOLERANCE) {
				break;
			}
			for (int i = 0; i < n; i++) {
				u[i] *= (1. - step);
			}
			u[j] += step;
		}
		// ellipse is {p : p' (2X)^-1 p <= 1}
		return new double[] {2 * x[0], 2 * x[1], 2 * x[2]};
	}

}
