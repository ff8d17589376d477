package com.mrgris.contcube;

import org.apache.beam.sdk.coders.DefaultCoder;
import org.apache.beam.sdk.extensions.avro.coders.AvroCoder;

/** Wideband noise over the configured ceiling. Reported, never fatal by default. */
@DefaultCoder(AvroCoder.class)
public class QualityWarning {
	public String sourceId;
	public String polarization;
	public String image;
	public double rms;
	public double ceiling;

	// for deserialization
	public QualityWarning() {}

	public QualityWarning(String sourceId, Polarization pol, String image, double rms, double ceiling) {
		this.sourceId = sourceId;
		this.polarization = pol.name();
		this.image = image;
		this.rms = rms;
		this.ceiling = ceiling;
	}

	@Override
	public String toString() {
		return String.format("%s pol %s: rms %.4g of %s exceeds %.4g", sourceId, polarization, rms, image, ceiling);
	}
}
