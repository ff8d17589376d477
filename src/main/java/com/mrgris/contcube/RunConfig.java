package com.mrgris.contcube;

import java.io.Serializable;

import com.google.common.base.Preconditions;

/** Settings of the stages after imaging. */
public class RunConfig implements Serializable {

	private static final long serialVersionUID = 1L;

	public final String outputDir;
	public final String cacheDir;
	public final boolean purge;
	public final FailurePolicy failurePolicy;
	// beams with a larger native major axis (arcsec) are left out of the common beam; 0 for none
	public final double cutoffArcsec;
	public final double fluxScale;

	public RunConfig(String outputDir, String cacheDir, boolean purge, FailurePolicy failurePolicy,
			double cutoffArcsec, double fluxScale) {
		Preconditions.checkNotNull(outputDir, "output directory");
		Preconditions.checkArgument(cutoffArcsec >= 0, "cutoff must not be negative");
		this.outputDir = outputDir;
		this.cacheDir = (cacheDir != null ? cacheDir : outputDir);
		this.purge = purge;
		this.failurePolicy = Preconditions.checkNotNull(failurePolicy);
		this.cutoffArcsec = cutoffArcsec;
		this.fluxScale = fluxScale;
	}
}
