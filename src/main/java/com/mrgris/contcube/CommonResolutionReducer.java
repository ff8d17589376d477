package com.mrgris.contcube;

import java.io.IOException;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;
import com.google.common.hash.Hashing;
import com.mrgris.contcube.image.BeamShape;
import com.mrgris.contcube.image.CommonBeamSolver;
import com.mrgris.contcube.image.FitsImage;

/**
 * Computes the run's common beam over every image of every surviving beam, reusing the
 * cached result for an unchanged set of inputs. Inputs are identified by path, size and
 * modification time.
 */
public class CommonResolutionReducer implements Serializable {

	private static final long serialVersionUID = 1L;

	private static final Logger LOG = LoggerFactory.getLogger(CommonResolutionReducer.class);

	final CommonBeamCache cache;
	final double cutoffArcsec;

	public CommonResolutionReducer(RunConfig conf) {
		this(new CommonBeamCache(conf.cacheDir), conf.cutoffArcsec);
	}

	CommonResolutionReducer(CommonBeamCache cache, double cutoffArcsec) {
		this.cache = cache;
		this.cutoffArcsec = cutoffArcsec;
	}

	public CommonBeam reduce(List<ImageSet> imageSets) throws PipelineStageException, IOException {
		List<String> images = sortedImages(imageSets);
		if (images.isEmpty()) {
			throw new RunAbortedException("no images to compute a common beam over");
		}
		String fp = fingerprintOfImages(images, cutoffArcsec);
		return cache.getOrCompute(fp, () -> compute(fp, images));
	}

	CommonBeam compute(String fp, List<String> images) throws BeamMetadataError {
		List<BeamShape> beams = new ArrayList<>();
		for (String image : images) {
			BeamShape b = FitsImage.readBeam(image);
			if (cutoffArcsec > 0 && b.major > cutoffArcsec) {
				LOG.warn("{}: beam {} is over the {}\" cutoff, left out of the common beam", image, b, cutoffArcsec);
				continue;
			}
			beams.add(b);
		}
		if (beams.isEmpty()) {
			throw new RunAbortedException(String.format("all %d images are over the %s\" cutoff", images.size(), cutoffArcsec));
		}
		BeamShape common = CommonBeamSolver.commonBeam(beams);
		LOG.info("common beam over {} images: {}", beams.size(), common);
		return new CommonBeam(fp, common, beams.size());
	}

	static List<String> sortedImages(List<ImageSet> imageSets) {
		List<String> images = new ArrayList<>();
		for (ImageSet is : imageSets) {
			images.addAll(is.allImages());
		}
		Collections.sort(images);
		return images;
	}

	public static String fingerprint(List<ImageSet> imageSets, double cutoffArcsec) throws IOException {
		return fingerprintOfImages(sortedImages(imageSets), cutoffArcsec);
	}

	// an image rewritten in place, e.g. by a forced reimage, changes the key
	static String fingerprintOfImages(List<String> sortedImages, double cutoffArcsec) throws IOException {
		List<String> identities = new ArrayList<>();
		for (String image : sortedImages) {
			Path p = Paths.get(image);
			identities.add(image + "\t" + Files.size(p) + "\t" + Files.getLastModifiedTime(p).toMillis());
		}
		String key = Joiner.on('\n').join(identities);
		if (cutoffArcsec > 0) {
			key += "\ncutoff=" + cutoffArcsec;
		}
		return Hashing.sha256().hashString(key, StandardCharsets.UTF_8).toString();
	}
}
