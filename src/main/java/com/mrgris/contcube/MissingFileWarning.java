package com.mrgris.contcube;

import org.apache.beam.sdk.coders.DefaultCoder;
import org.apache.beam.sdk.extensions.avro.coders.AvroCoder;

/** A cleanup target was already gone. */
@DefaultCoder(AvroCoder.class)
public class MissingFileWarning {
	public String path;

	// for deserialization
	public MissingFileWarning() {}

	public MissingFileWarning(String path) {
		this.path = path;
	}

	@Override
	public String toString() {
		return "already removed: " + path;
	}
}
