package com.mrgris.contcube.image;

import java.util.Objects;

import org.apache.beam.sdk.coders.DefaultCoder;
import org.apache.beam.sdk.extensions.avro.coders.AvroCoder;

/**
 * Elliptical gaussian resolution element. Axes are full widths at half maximum in arcsec,
 * position angle in degrees east of north.
 *
 * <p>Comparisons are done on the quadratic form C = a^2 u u' + b^2 v v', with u the unit
 * vector along the major axis in (east, north) coordinates. Convolving two gaussians adds
 * their quadratic forms, so beam A can be convolved up to beam B iff B - A is positive
 * semi-definite.
 */
@DefaultCoder(AvroCoder.class)
public class BeamShape {

	// relative to the larger beam's major axis squared
	public static final double TOLERANCE = 1e-7;

	public double major;
	public double minor;
	public double pa;

	// for deserialization
	public BeamShape() {}

	public BeamShape(double major, double minor, double pa) {
		if (!(major > 0) || !(minor > 0) || minor > major * (1 + TOLERANCE)) {
			throw new IllegalArgumentException(String.format("invalid beam %.4f x %.4f", major, minor));
		}
		this.major = major;
		this.minor = Math.min(minor, major);
		this.pa = pa;
	}

	public static BeamShape fromDegrees(double bmaj, double bmin, double bpa) {
		return new BeamShape(bmaj * 3600., bmin * 3600., bpa);
	}

	public double majorDegrees() {
		return major / 3600.;
	}

	public double minorDegrees() {
		return minor / 3600.;
	}

	public double area() {
		return Math.PI / (4. * Math.log(2.)) * major * minor;
	}

	/** {xx, xy, yy} with x pointing east, y north */
	public double[] quadratic() {
		return quadratic(major, minor, pa);
	}

	static double[] quadratic(double a, double b, double paDeg) {
		double th = Math.toRadians(paDeg);
		double s = Math.sin(th);
		double c = Math.cos(th);
		double a2 = a * a;
		double b2 = b * b;
		return new double[] {a2 * s * s + b2 * c * c, (a2 - b2) * s * c, a2 * c * c + b2 * s * s};
	}

	/** eigenvalues {largest, smallest} of a symmetric 2x2 form */
	static double[] eigenvalues(double[] q) {
		double mean = .5 * (q[0] + q[2]);
		double disc = Math.hypot(.5 * (q[0] - q[2]), q[1]);
		return new double[] {mean + disc, mean - disc};
	}

	static double orientation(double[] q) {
		double paDeg = Math.toDegrees(.5 * Math.atan2(2. * q[1], q[2] - q[0]));
		if (paDeg <= -90.) {
			paDeg += 180.;
		} else if (paDeg > 90.) {
			paDeg -= 180.;
		}
		return paDeg;
	}

	public static BeamShape fromQuadratic(double[] q) {
		double[] ev = eigenvalues(q);
		double a = Math.sqrt(ev[0]);
		double b = Math.sqrt(Math.max(ev[1], 0));
		double paDeg = (a - b <= TOLERANCE * a ? 0. : orientation(q));
		return new BeamShape(a, b, paDeg);
	}

	static double[] difference(double[] a, double[] b) {
		return new double[] {a[0] - b[0], a[1] - b[1], a[2] - b[2]};
	}

	/** true if every input this beam can be convolved (never deconvolved) to reach it */
	public boolean dominates(BeamShape other) {
		double scale = Math.max(major, other.major);
		double[] ev = eigenvalues(difference(quadratic(), other.quadratic()));
		return ev[1] >= -TOLERANCE * scale * scale;
	}

	public boolean matches(BeamShape other) {
		double scale = Math.max(major, other.major);
		double[] ev = eigenvalues(difference(quadratic(), other.quadratic()));
		double tol = TOLERANCE * scale * scale;
		return Math.abs(ev[0]) <= tol && Math.abs(ev[1]) <= tol;
	}

	public BeamShape scaled(double factor) {
		return new BeamShape(major * factor, minor * factor, pa);
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof BeamShape) {
			BeamShape b = (BeamShape)o;
			return major == b.major && minor == b.minor && pa == b.pa;
		} else {
			return false;
		}
	}

	@Override
	public int hashCode() {
		return Objects.hash(major, minor, pa);
	}

	@Override
	public String toString() {
		return String.format("%.3f\" x %.3f\" pa %.2f", major, minor, pa);
	}
}
