package com.mrgris.contcube;

import java.io.IOException;
import java.io.Serializable;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mrgris.contcube.image.BeamShape;
import com.mrgris.contcube.image.FitsImage;
import com.mrgris.contcube.image.GaussianConvolver;

/** Brings every image of a beam, and its point spread functions, to the common beam. */
public class Homogenizer implements Serializable {

	private static final long serialVersionUID = 1L;

	private static final Logger LOG = LoggerFactory.getLogger(Homogenizer.class);

	public enum Outcome {
		// native beam already matched, pixels copied as is
		PASSED,
		CONVOLVED,
		// native beam over the cutoff, written as all NaN
		BLANKED
	}

	final double cutoffArcsec;

	public Homogenizer(RunConfig conf) {
		this(conf.cutoffArcsec);
	}

	Homogenizer(double cutoffArcsec) {
		this.cutoffArcsec = cutoffArcsec;
	}

	public ImageSet homogenize(ImageSet is, CommonBeam common) throws PipelineStageException, IOException {
		Set<String> sources = new LinkedHashSet<>(is.allImages());
		for (Polarization pol : is.polarizations()) {
			sources.addAll(is.auxiliary(pol, AuxiliaryKind.PSF));
		}

		Map<String, String> replacements = new LinkedHashMap<>();
		int convolved = 0;
		for (String src : sources) {
			String dst = ImageNaming.homogenized(src);
			if (homogenizeImage(src, dst, common.shape()) == Outcome.CONVOLVED) {
				convolved++;
			}
			replacements.put(src, dst);
		}
		LOG.info("{}: homogenized {} files to {}, {} convolved", is.sourceId, sources.size(), common.shape(), convolved);
		return is.withHomogenized(replacements);
	}

	public Outcome homogenizeImage(String src, String dst, BeamShape common) throws PipelineStageException, IOException {
		FitsImage img = FitsImage.read(src);
		BeamShape nativeBeam = img.beam();

		Outcome outcome;
		float[] out;
		if (cutoffArcsec > 0 && nativeBeam.major > cutoffArcsec) {
			LOG.warn("{}: beam {} over the {}\" cutoff, blanking", src, nativeBeam, cutoffArcsec);
			out = new float[img.data.length];
			Arrays.fill(out, Float.NaN);
			outcome = Outcome.BLANKED;
		} else {
			GaussianConvolver conv = GaussianConvolver.between(nativeBeam, common, src);
			if (conv == null) {
				out = img.data;
				outcome = Outcome.PASSED;
			} else {
				out = new float[img.data.length];
				int plane = img.planeSize();
				double[] scale = img.pixelScale();
				for (int off = 0; off < img.data.length; off += plane) {
					float[] result = conv.convolve(Arrays.copyOfRange(img.data, off, off + plane),
							img.width(), img.height(), scale);
					System.arraycopy(result, 0, out, off, plane);
				}
				outcome = Outcome.CONVOLVED;
			}
		}

		FitsImage result = img.withData(out);
		result.setBeam(common);
		result.write(dst);
		LOG.debug("{} -> {} ({})", src, dst, outcome);
		return outcome;
	}
}
