package com.mrgris.contcube;

import org.apache.beam.sdk.coders.DefaultCoder;
import org.apache.beam.sdk.extensions.avro.coders.AvroCoder;

/** (source, produced path) pair for the metadata store's caller to persist. */
@DefaultCoder(AvroCoder.class)
public class ArtifactRecord {
	public String sourceId;
	public String kind;
	public String path;

	// for deserialization
	public ArtifactRecord() {}

	public ArtifactRecord(String sourceId, String kind, String path) {
		this.sourceId = sourceId;
		this.kind = kind;
		this.path = path;
	}

	@Override
	public String toString() {
		return sourceId + " " + kind + " " + path;
	}
}
