package com.mrgris.contcube;

import com.mrgris.contcube.image.BeamShape;

/** The common beam is smaller than an image's own beam along some axis. */
public class BeamMismatchError extends PipelineStageException {

	private static final long serialVersionUID = 1L;

	public final String image;

	public BeamMismatchError(String image, BeamShape nativeBeam, BeamShape common) {
		super(String.format("%s: common beam %s does not cover native beam %s", image, common, nativeBeam));
		this.image = image;
	}
}
