package com.mrgris.contcube;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.beam.sdk.coders.DefaultCoder;
import org.apache.beam.sdk.extensions.avro.coders.AvroCoder;

/**
 * Manifest of the files one beam's imaging produced: channel images per polarization, in
 * channel order, and auxiliary products per (polarization, kind).
 *
 * Never modified in place. Homogenization produces a new manifest whose image lists point
 * at the derived files, with the files they replace listed as superseded so cleanup still
 * sees them.
 */
@DefaultCoder(AvroCoder.class)
public class ImageSet {

	@DefaultCoder(AvroCoder.class)
	public static class ImageList {
		public String polarization;
		public List<String> paths = new ArrayList<>();

		public ImageList() {}

		public ImageList(String polarization, List<String> paths) {
			this.polarization = polarization;
			this.paths = new ArrayList<>(paths);
		}
	}

	@DefaultCoder(AvroCoder.class)
	public static class AuxiliaryList {
		public String polarization;
		public String kind;
		public List<String> paths = new ArrayList<>();

		public AuxiliaryList() {}

		public AuxiliaryList(String polarization, String kind, List<String> paths) {
			this.polarization = polarization;
			this.kind = kind;
			this.paths = new ArrayList<>(paths);
		}
	}

	public String sourceId;
	public String measurementSet;
	public String outputPrefix;
	public int channels;
	public boolean homogenized = false;
	public List<ImageList> images = new ArrayList<>();
	public List<AuxiliaryList> auxiliary = new ArrayList<>();
	public List<String> superseded = new ArrayList<>();
	public List<QualityWarning> warnings = new ArrayList<>();

	// for deserialization
	public ImageSet() {}

	public ImageSet(String sourceId, String measurementSet, String outputPrefix, int channels) {
		this.sourceId = sourceId;
		this.measurementSet = measurementSet;
		this.outputPrefix = outputPrefix;
		this.channels = channels;
	}

	ImageSet copy() {
		ImageSet is = new ImageSet(sourceId, measurementSet, outputPrefix, channels);
		is.homogenized = homogenized;
		for (ImageList il : images) {
			is.images.add(new ImageList(il.polarization, il.paths));
		}
		for (AuxiliaryList al : auxiliary) {
			is.auxiliary.add(new AuxiliaryList(al.polarization, al.kind, al.paths));
		}
		is.superseded.addAll(superseded);
		is.warnings.addAll(warnings);
		return is;
	}

	public void addImages(Polarization pol, List<String> paths) {
		if (paths.size() != channels) {
			throw new IllegalArgumentException(String.format("%s: %d images for %s, expected %d",
					sourceId, paths.size(), pol, channels));
		}
		images.add(new ImageList(pol.name(), paths));
	}

	public void addAuxiliary(Polarization pol, AuxiliaryKind kind, List<String> paths) {
		auxiliary.add(new AuxiliaryList(pol.name(), kind.name(), paths));
	}

	public List<Polarization> polarizations() {
		List<Polarization> pols = new ArrayList<>();
		for (ImageList il : images) {
			pols.add(Polarization.valueOf(il.polarization));
		}
		return pols;
	}

	public List<String> images(Polarization pol) {
		for (ImageList il : images) {
			if (il.polarization.equals(pol.name())) {
				return Collections.unmodifiableList(il.paths);
			}
		}
		throw new IllegalArgumentException(sourceId + " has no images for " + pol);
	}

	public List<String> auxiliary(Polarization pol, AuxiliaryKind kind) {
		for (AuxiliaryList al : auxiliary) {
			if (al.polarization.equals(pol.name()) && al.kind.equals(kind.name())) {
				return Collections.unmodifiableList(al.paths);
			}
		}
		return Collections.emptyList();
	}

	/** every image of every polarization */
	public List<String> allImages() {
		List<String> all = new ArrayList<>();
		for (ImageList il : images) {
			all.addAll(il.paths);
		}
		return all;
	}

	/** every file this unit owns on disk, each once */
	public Set<String> ownedFiles() {
		Set<String> files = new LinkedHashSet<>();
		files.addAll(allImages());
		for (AuxiliaryList al : auxiliary) {
			files.addAll(al.paths);
		}
		files.addAll(superseded);
		return files;
	}

	/**
	 * @param replacements original path to homogenized path, for every image and every
	 *        point spread function that was homogenized
	 */
	public ImageSet withHomogenized(Map<String, String> replacements) {
		ImageSet is = copy();
		is.homogenized = true;
		for (ImageList il : is.images) {
			il.paths = replace(il.paths, replacements, is.superseded);
		}
		for (AuxiliaryList al : is.auxiliary) {
			if (al.kind.equals(AuxiliaryKind.PSF.name())) {
				al.paths = replace(al.paths, replacements, is.superseded);
			}
		}
		return is;
	}

	static List<String> replace(List<String> paths, Map<String, String> replacements, List<String> superseded) {
		List<String> out = new ArrayList<>();
		for (String p : paths) {
			String r = replacements.get(p);
			if (r == null) {
				out.add(p);
			} else {
				out.add(r);
				if (!superseded.contains(p)) {
					superseded.add(p);
				}
			}
		}
		return out;
	}

	@Override
	public String toString() {
		return String.format("ImageSet[%s, %s, %d chans, pols %s%s]", sourceId, outputPrefix, channels,
				Polarization.join(polarizations()), homogenized ? ", homogenized" : "");
	}
}
