package com.mrgris.contcube;

import java.util.List;

import com.google.common.base.Joiner;

/** The imaging engine exited non-zero, or exited zero without producing its outputs. */
public class ExternalToolFailure extends PipelineStageException {

	private static final long serialVersionUID = 1L;

	public final String beamId;
	public final List<String> command;
	public final int exitCode;
	public final String output;

	public ExternalToolFailure(String beamId, List<String> command, int exitCode, String output) {
		this(beamId, command, exitCode, output,
				String.format("%s: imaging engine exited with %d", beamId, exitCode));
	}

	public ExternalToolFailure(String beamId, List<String> command, int exitCode, String output, String message) {
		super(message);
		this.beamId = beamId;
		this.command = command;
		this.exitCode = exitCode;
		this.output = output;
	}

	public String commandLine() {
		return Joiner.on(' ').join(command);
	}

	@Override
	public String toolOutput() {
		return output;
	}
}
