package com.mrgris.contcube;

/**
 * Failure of one stage for one unit of work. Caught at the stage boundary and turned into a
 * {@link StageFailure} so the remaining beams keep going.
 */
public abstract class PipelineStageException extends Exception {

	private static final long serialVersionUID = 1L;

	public PipelineStageException(String message) {
		super(message);
	}

	public PipelineStageException(String message, Throwable cause) {
		super(message, cause);
	}

	/** captured output of an external process, if one was involved */
	public String toolOutput() {
		return null;
	}
}
