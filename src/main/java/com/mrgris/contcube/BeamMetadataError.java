package com.mrgris.contcube;

/** An image's resolution keywords are missing or unusable. Aborts the run. */
public class BeamMetadataError extends PipelineStageException {

	private static final long serialVersionUID = 1L;

	public final String image;

	public BeamMetadataError(String image, String problem) {
		super(String.format("bad beam metadata in %s: %s", image, problem));
		this.image = image;
	}
}
