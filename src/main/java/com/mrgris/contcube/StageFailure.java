package com.mrgris.contcube;

import org.apache.avro.reflect.Nullable;
import org.apache.beam.sdk.coders.DefaultCoder;
import org.apache.beam.sdk.extensions.avro.coders.AvroCoder;

/** Which beam failed, at which stage, and why. */
@DefaultCoder(AvroCoder.class)
public class StageFailure {
	public String sourceId;
	public String stage;
	@Nullable public String polarization;
	public String error;
	public String message;
	@Nullable public String toolOutput;

	// for deserialization
	public StageFailure() {}

	public StageFailure(String sourceId, Stage stage, Polarization pol, Exception e) {
		this.sourceId = sourceId;
		this.stage = stage.name();
		this.polarization = (pol != null ? pol.name() : null);
		this.error = e.getClass().getSimpleName();
		this.message = String.valueOf(e.getMessage());
		if (e instanceof PipelineStageException) {
			this.toolOutput = ((PipelineStageException)e).toolOutput();
		}
	}

	public Stage stage() {
		return Stage.valueOf(stage);
	}

	@Override
	public String toString() {
		return String.format("%s failed at %s%s: %s: %s", sourceId, stage,
				polarization != null ? " (" + polarization + ")" : "", error, message);
	}
}
