package com.mrgris.contcube;

/** Raised in place of a {@link QualityWarning} when noisy images are configured to be rejected. */
public class NoisyImageRejected extends PipelineStageException {

	private static final long serialVersionUID = 1L;

	public NoisyImageRejected(QualityWarning warning) {
		super(warning.toString());
	}
}
