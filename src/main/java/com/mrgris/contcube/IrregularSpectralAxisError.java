package com.mrgris.contcube;

/** Channel frequencies of a cube are not evenly spaced. */
public class IrregularSpectralAxisError extends PipelineStageException {

	private static final long serialVersionUID = 1L;

	public IrregularSpectralAxisError(String message) {
		super(message);
	}
}
