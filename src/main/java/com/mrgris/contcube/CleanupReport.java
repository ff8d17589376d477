package com.mrgris.contcube;

import java.util.ArrayList;
import java.util.List;

import org.apache.avro.reflect.Nullable;
import org.apache.beam.sdk.coders.DefaultCoder;
import org.apache.beam.sdk.extensions.avro.coders.AvroCoder;

@DefaultCoder(AvroCoder.class)
public class CleanupReport {
	public String sourceId;
	public boolean purged;
	public int deleted;
	public List<MissingFileWarning> missing = new ArrayList<>();
	// set when the files were kept on purpose
	@Nullable public String keptBecause;

	// for deserialization
	public CleanupReport() {}

	public CleanupReport(String sourceId) {
		this.sourceId = sourceId;
	}

	public static CleanupReport kept(String sourceId, String reason) {
		CleanupReport r = new CleanupReport(sourceId);
		r.keptBecause = reason;
		return r;
	}

	@Override
	public String toString() {
		if (!purged) {
			return sourceId + ": kept (" + keptBecause + ")";
		}
		return String.format("%s: deleted %d files, %d already gone", sourceId, deleted, missing.size());
	}
}
