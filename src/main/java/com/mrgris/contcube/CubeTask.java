package com.mrgris.contcube;

import org.apache.beam.sdk.coders.DefaultCoder;
import org.apache.beam.sdk.extensions.avro.coders.AvroCoder;

@DefaultCoder(AvroCoder.class)
public class CubeTask {
	public ImageSet imageSet;
	public String polarization;

	// for deserialization
	public CubeTask() {}

	public CubeTask(ImageSet imageSet, Polarization pol) {
		this.imageSet = imageSet;
		this.polarization = pol.name();
	}

	public Polarization pol() {
		return Polarization.valueOf(polarization);
	}
}
