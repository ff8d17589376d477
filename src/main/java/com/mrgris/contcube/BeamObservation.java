package com.mrgris.contcube;

import org.apache.beam.sdk.coders.DefaultCoder;
import org.apache.beam.sdk.extensions.avro.coders.AvroCoder;

/** One antenna beam's measurement set and where its images go. */
@DefaultCoder(AvroCoder.class)
public class BeamObservation {
	public String beamId;
	public int beamNumber;
	public String measurementSet;
	public String outputPrefix;
	public int fieldIndex;

	// for deserialization
	public BeamObservation() {}

	public BeamObservation(int beamNumber, String measurementSet, String outputPrefix, int fieldIndex) {
		this.beamId = String.format("beam%02d", beamNumber);
		this.beamNumber = beamNumber;
		this.measurementSet = measurementSet;
		this.outputPrefix = outputPrefix;
		this.fieldIndex = fieldIndex;
	}

	@Override
	public String toString() {
		return beamId + " " + measurementSet;
	}
}
