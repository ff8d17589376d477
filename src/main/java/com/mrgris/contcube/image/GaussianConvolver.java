package com.mrgris.contcube.image;

import com.mrgris.contcube.BeamMismatchError;

/**
 * Convolves a plane from its native beam up to a target beam.
 *
 * The kernel is the gaussian whose quadratic form is target - native. Output is in Jy/beam
 * of the target beam, so the normalized kernel sum is scaled by the ratio of beam areas.
 */
public class GaussianConvolver {

	static final double FWHM_TO_SIGMA = 1. / Math.sqrt(8. * Math.log(2.));
	// kernel support, in sigma
	static final double TRUNCATE = 4.;
	// floor on the kernel variance along its narrow axis, in pixels^2; a kernel that only
	// stretches the beam along one axis is degenerate across it
	static final double MIN_VARIANCE_PX = 0.05 * 0.05;

	final double[] kernelForm;
	final double fluxScale;

	GaussianConvolver(double[] kernelForm, double fluxScale) {
		this.kernelForm = kernelForm;
		this.fluxScale = fluxScale;
	}

	/**
	 * @return null if the native beam already matches the target
	 * @throws BeamMismatchError if reaching the target would require deconvolution
	 */
	public static GaussianConvolver between(BeamShape nativeBeam, BeamShape target, String image) throws BeamMismatchError {
		if (target.matches(nativeBeam)) {
			return null;
		}
		if (!target.dominates(nativeBeam)) {
			throw new BeamMismatchError(image, nativeBeam, target);
		}
		double[] k = BeamShape.difference(target.quadratic(), nativeBeam.quadratic());
		double[] ev = BeamShape.eigenvalues(k);
		if (ev[1] < 0) {
			// within tolerance of a one-dimensional kernel
			k = BeamShape.quadratic(Math.sqrt(ev[0]), 0, BeamShape.orientation(k));
		}
		return new GaussianConvolver(k, target.area() / nativeBeam.area());
	}

	/**
	 * @param plane row-major, width varies fastest
	 * @param scale pixel spacing {x, y} in arcsec, signed as in CDELT1/CDELT2
	 */
	public float[] convolve(float[] plane, int width, int height, double[] scale) {
		double[][] kernel = kernel(scale);
		int rx = (kernel[0].length - 1) / 2;
		int ry = (kernel.length - 1) / 2;

		float[] out = new float[plane.length];
		for (int y = 0; y < height; y++) {
			for (int x = 0; x < width; x++) {
				float center = plane[y * width + x];
				if (Float.isNaN(center)) {
					out[y * width + x] = Float.NaN;
					continue;
				}
				double sum = 0;
				double wsum = 0;
				for (int j = -ry; j <= ry; j++) {
					int yy = y + j;
					if (yy < 0 || yy >= height) {
						continue;
					}
					for (int i = -rx; i <= rx; i++) {
						int xx = x + i;
						if (xx < 0 || xx >= width) {
							continue;
						}
						float v = plane[yy * width + xx];
						if (Float.isNaN(v)) {
							continue;
						}
						double w = kernel[j + ry][i + rx];
						sum += w * v;
						wsum += w;
					}
				}
				// renormalize over the part of the kernel that landed on valid pixels
				out[y * width + x] = (float)(wsum > 0 ? fluxScale * sum / wsum : Float.NaN);
			}
		}
		return out;
	}

	/** kernel weights indexed [dy][dx], not normalized */
	double[][] kernel(double[] scale) {
		double sx = Math.abs(scale[0]);
		double sy = Math.abs(scale[1]);
		double floor = MIN_VARIANCE_PX * Math.min(sx, sy) * Math.min(sx, sy);

		// covariance in arcsec^2, (east, north)
		double f2 = FWHM_TO_SIGMA * FWHM_TO_SIGMA;
		double cxx = kernelForm[0] * f2 + floor;
		double cxy = kernelForm[1] * f2;
		double cyy = kernelForm[2] * f2 + floor;
		double det = cxx * cyy - cxy * cxy;
		double ixx = cyy / det, ixy = -cxy / det, iyy = cxx / det;

		int rx = (int)Math.ceil(TRUNCATE * Math.sqrt(cxx) / sx);
		int ry = (int)Math.ceil(TRUNCATE * Math.sqrt(cyy) / sy);
		double[][] k = new double[2 * ry + 1][2 * rx + 1];
		for (int j = -ry; j <= ry; j++) {
			for (int i = -rx; i <= rx; i++) {
				double e = i * scale[0];
				double n = j * scale[1];
				k[j + ry][i + rx] = Math.exp(-.5 * (ixx * e * e + 2 * ixy * e * n + iyy * n * n));
			}
		}
		return k;
	}

}
