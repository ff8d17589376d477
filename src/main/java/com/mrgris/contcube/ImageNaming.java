package com.mrgris.contcube;

/**
 * File names written by the imaging engine:
 * {@code {prefix}-{channel:04d}[-{pol}]-{kind}.fits} per channel and
 * {@code {prefix}-MFS[-{pol}]-image.fits} for the wideband image.
 *
 * The polarization tag is only present when the engine imaged several polarizations in one
 * run. The point spread function is shared by all polarizations of a run and never tagged.
 */
public class ImageNaming {

	public static final String FITS = ".fits";
	public static final String HOMOGENIZED_SUFFIX = ".conv.fits";

	public static String channelImage(String prefix, int channel, Polarization pol, boolean tagged) {
		return channelFile(prefix, channel, tagged ? pol : null, "image");
	}

	public static String auxiliary(String prefix, int channel, Polarization pol, boolean tagged, AuxiliaryKind kind) {
		boolean tag = tagged && kind != AuxiliaryKind.PSF;
		return channelFile(prefix, channel, tag ? pol : null, kind.token);
	}

	public static String widebandImage(String prefix, Polarization pol, boolean tagged) {
		return tagged ? String.format("%s-MFS-%s-image%s", prefix, pol.name(), FITS)
				: String.format("%s-MFS-image%s", prefix, FITS);
	}

	static String channelFile(String prefix, int channel, Polarization pol, String kind) {
		if (pol == null) {
			return String.format("%s-%04d-%s%s", prefix, channel, kind, FITS);
		}
		return String.format("%s-%04d-%s-%s%s", prefix, channel, pol.name(), kind, FITS);
	}

	public static String homogenized(String image) {
		if (!image.endsWith(FITS)) {
			throw new IllegalArgumentException("not a fits file: " + image);
		}
		return image.substring(0, image.length() - FITS.length()) + HOMOGENIZED_SUFFIX;
	}

	/**
	 * Cube for one polarization, next to the prefix: "image.X.contcube.beam00" becomes
	 * "image.restored.q.X.contcube.beam00.fits".
	 */
	public static String cube(String prefix, Polarization pol) {
		return sibling(prefix, "image.restored." + pol.label(), FITS);
	}

	/** per-channel noise of a cube, "weights.q.X.contcube.beam00.txt" */
	public static String noiseVector(String prefix, Polarization pol) {
		return sibling(prefix, "weights." + pol.label(), ".txt");
	}

	static String sibling(String prefix, String lead, String ext) {
		int slash = prefix.lastIndexOf('/');
		String dir = prefix.substring(0, slash + 1);
		String base = prefix.substring(slash + 1);
		if (base.startsWith("image.")) {
			base = base.substring("image.".length());
		}
		return dir + lead + "." + base + ext;
	}
}
