package com.mrgris.contcube;

import java.io.File;
import java.io.IOException;
import java.io.Serializable;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.io.Files;
import com.mrgris.contcube.image.FitsImage;
import com.mrgris.contcube.util.RobustStats;

/**
 * Stacks one polarization's homogenized channel images into a frequency cube, with a sidecar
 * file of per-channel noise.
 */
public class CubeAssembler implements Serializable {

	private static final long serialVersionUID = 1L;

	private static final Logger LOG = LoggerFactory.getLogger(CubeAssembler.class);

	// absolute floor on the allowed deviation of a channel spacing from the mean, Hz
	static final double SPACING_TOLERANCE_HZ = 1e-6;
	static final double SPACING_TOLERANCE_REL = 1e-6;

	final double fluxScale;

	public CubeAssembler(RunConfig conf) {
		this(conf.fluxScale);
	}

	CubeAssembler(double fluxScale) {
		this.fluxScale = fluxScale;
	}

	public CubeProduct assemble(ImageSet is, Polarization pol, CommonBeam common) throws PipelineStageException, IOException {
		List<String> channels = is.images(pol);
		int n = channels.size();

		FitsImage first = null;
		int[] cubeShape = null;
		float[] cube = null;
		int freqAxis = 0;
		int inner = 0, outer = 0;
		double[] freqs = new double[n];
		List<Double> noise = new ArrayList<>();

		for (int c = 0; c < n; c++) {
			FitsImage img = FitsImage.read(channels.get(c));
			if (c == 0) {
				first = img;
				freqAxis = img.spectralAxis();
				if (freqAxis == 0) {
					throw new IrregularSpectralAxisError(img.path + " has no frequency axis");
				}
				if (img.axisLength(freqAxis) != 1) {
					throw new IrregularSpectralAxisError(String.format("%s holds %d channels, expected 1",
							img.path, img.axisLength(freqAxis)));
				}
				cubeShape = img.shape.clone();
				cubeShape[freqAxis - 1] = n;
				inner = product(img.shape, 0, freqAxis - 1);
				outer = product(img.shape, freqAxis, img.shape.length);
				cube = new float[cubeLength(img.path, inner, n, outer)];
			} else if (!Arrays.equals(img.shape, first.shape)) {
				throw new IOException(String.format("%s has shape %s, %s has %s", img.path, Arrays.toString(img.shape),
						first.path, Arrays.toString(first.shape)));
			}

			float[] plane = new float[img.data.length];
			for (int i = 0; i < plane.length; i++) {
				plane[i] = (float)(img.data[i] * fluxScale);
			}
			for (int o = 0; o < outer; o++) {
				System.arraycopy(plane, o * inner, cube, (o * n + c) * inner, inner);
			}
			noise.add(RobustStats.madStd(plane));
			freqs[c] = img.world(freqAxis, 0);
		}

		double spacing = checkSpacing(is.sourceId, pol, freqs);
		if (n == 1) {
			spacing = first.header.getDoubleValue("CDELT" + freqAxis, 1.);
		}

		FitsImage out = FitsImage.derive(first, cubeShape, cube);
		out.set("CRPIX" + freqAxis, 1., "reference channel");
		out.set("CRVAL" + freqAxis, freqs[0], "[Hz] first channel");
		out.set("CDELT" + freqAxis, spacing, "[Hz] channel spacing");
		out.set("CUNIT" + freqAxis, "Hz", "");
		out.setBeam(common.shape());

		String cubePath = ImageNaming.cube(is.outputPrefix, pol);
		String noisePath = ImageNaming.noiseVector(is.outputPrefix, pol);
		out.write(cubePath);
		writeNoise(noisePath, noise);
		LOG.info("{} {}: wrote {} ({} channels from {} Hz, step {} Hz)", is.sourceId, pol, cubePath, n, freqs[0], spacing);
		return new CubeProduct(is.sourceId, pol, cubePath, noisePath, n);
	}

	/**
	 * @return mean channel spacing, 0 for a single channel
	 * @throws IrregularSpectralAxisError if any spacing strays from the mean by more than tolerance
	 */
	static double checkSpacing(String sourceId, Polarization pol, double[] freqs) throws IrregularSpectralAxisError {
		if (freqs.length < 2) {
			return 0.;
		}
		double mean = (freqs[freqs.length - 1] - freqs[0]) / (freqs.length - 1);
		double tol = Math.max(SPACING_TOLERANCE_HZ, SPACING_TOLERANCE_REL * Math.abs(mean));
		for (int i = 1; i < freqs.length; i++) {
			double d = freqs[i] - freqs[i - 1];
			if (Math.abs(d - mean) > tol) {
				throw new IrregularSpectralAxisError(String.format(
						"%s %s: channel %d is %s Hz after channel %d, mean spacing is %s Hz",
						sourceId, pol, i, d, i - 1, mean));
			}
		}
		return mean;
	}

	static void writeNoise(String path, List<Double> noise) throws IOException {
		List<String> lines = new ArrayList<>();
		for (double v : noise) {
			lines.add(String.valueOf(v));
		}
		Files.asCharSink(new File(path), StandardCharsets.UTF_8).writeLines(lines);
	}

	static int product(int[] shape, int from, int to) {
		int p = 1;
		for (int i = from; i < to; i++) {
			p = Math.multiplyExact(p, shape[i]);
		}
		return p;
	}

	/** @throws IOException if the cube would not fit in one array */
	static int cubeLength(String image, int inner, int channels, int outer) throws IOException {
		try {
			return Math.multiplyExact(Math.multiplyExact(inner, channels), outer);
		} catch (ArithmeticException e) {
			throw new IOException(String.format("%s: a cube of %d channels of %d pixels is too large",
					image, channels, (long)inner * outer), e);
		}
	}
}
