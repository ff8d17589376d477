package com.mrgris.contcube.engine;

public class EngineResult {

	public final int exitCode;
	// stdout and stderr, interleaved
	public final String output;

	public EngineResult(int exitCode, String output) {
		this.exitCode = exitCode;
		this.output = output;
	}

	public boolean succeeded() {
		return exitCode == 0;
	}
}
