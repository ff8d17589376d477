package com.mrgris.contcube;

import org.apache.beam.sdk.coders.DefaultCoder;
import org.apache.beam.sdk.extensions.avro.coders.AvroCoder;

import com.mrgris.contcube.image.BeamShape;

/**
 * The resolution every image of a run is brought to, together with the fingerprint of the
 * image set it was computed over.
 */
@DefaultCoder(AvroCoder.class)
public class CommonBeam {
	public String fingerprint;
	public double major;
	public double minor;
	public double pa;
	public int imageCount;

	// for deserialization
	public CommonBeam() {}

	public CommonBeam(String fingerprint, BeamShape beam, int imageCount) {
		this.fingerprint = fingerprint;
		this.major = beam.major;
		this.minor = beam.minor;
		this.pa = beam.pa;
		this.imageCount = imageCount;
	}

	public BeamShape shape() {
		return new BeamShape(major, minor, pa);
	}

	@Override
	public boolean equals(Object o) {
		if (o instanceof CommonBeam) {
			CommonBeam cb = (CommonBeam)o;
			return fingerprint.equals(cb.fingerprint) && major == cb.major && minor == cb.minor
					&& pa == cb.pa && imageCount == cb.imageCount;
		} else {
			return false;
		}
	}

	@Override
	public int hashCode() {
		return fingerprint.hashCode();
	}

	@Override
	public String toString() {
		return String.format("CommonBeam[%s over %d images, %s]", shape(), imageCount, fingerprint.substring(0, 12));
	}
}
