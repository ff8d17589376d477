package com.mrgris.contcube;

/** Raised from the barrier when the whole run has to stop. */
public class RunAbortedException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public RunAbortedException(String message) {
		super(message);
	}

	public RunAbortedException(String message, Throwable cause) {
		super(message, cause);
	}
}
