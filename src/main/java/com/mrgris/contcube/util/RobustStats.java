package com.mrgris.contcube.util;

import com.google.common.math.Quantiles;

public class RobustStats {

	// scales the median absolute deviation to a gaussian standard deviation
	public static final double MAD_TO_STD = 1.482602218505602;

	/** median absolute deviation as a standard deviation, ignoring NaNs; NaN if nothing is finite */
	public static double madStd(float[] values) {
		double[] finite = finite(values);
		if (finite.length == 0) {
			return Double.NaN;
		}
		double median = Quantiles.median().computeInPlace(finite.clone());
		for (int i = 0; i < finite.length; i++) {
			finite[i] = Math.abs(finite[i] - median);
		}
		return MAD_TO_STD * Quantiles.median().computeInPlace(finite);
	}

	static double[] finite(float[] values) {
		int n = 0;
		for (float v : values) {
			if (!Float.isNaN(v) && !Float.isInfinite(v)) {
				n++;
			}
		}
		double[] out = new double[n];
		int k = 0;
		for (float v : values) {
			if (!Float.isNaN(v) && !Float.isInfinite(v)) {
				out[k++] = v;
			}
		}
		return out;
	}

}
