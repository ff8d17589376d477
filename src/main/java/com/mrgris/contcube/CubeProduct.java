package com.mrgris.contcube;

import org.apache.beam.sdk.coders.DefaultCoder;
import org.apache.beam.sdk.extensions.avro.coders.AvroCoder;

/** A written cube and its noise vector. Cleanup of the source images waits on these. */
@DefaultCoder(AvroCoder.class)
public class CubeProduct {
	public String sourceId;
	public String polarization;
	public String cubePath;
	public String noisePath;
	public int channels;

	// for deserialization
	public CubeProduct() {}

	public CubeProduct(String sourceId, Polarization pol, String cubePath, String noisePath, int channels) {
		this.sourceId = sourceId;
		this.polarization = pol.name();
		this.cubePath = cubePath;
		this.noisePath = noisePath;
		this.channels = channels;
	}

	@Override
	public String toString() {
		return String.format("%s %s: %s (%d chans)", sourceId, polarization, cubePath, channels);
	}
}
