package com.mrgris.contcube;

/** What the common-beam barrier does when some beams failed to image. */
public enum FailurePolicy {
	/** compute the common beam over the beams that survived */
	EXCLUDE_FAILED,
	/** stop the run */
	ABORT_RUN
}
