package com.mrgris.contcube;

import java.io.File;
import java.io.IOException;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mrgris.contcube.engine.EngineResult;
import com.mrgris.contcube.engine.ImagingCommand;
import com.mrgris.contcube.engine.ImagingEngine;
import com.mrgris.contcube.image.FitsImage;
import com.mrgris.contcube.util.RobustStats;

/**
 * Images one beam: one engine run per polarization group, then a manifest of the files the
 * engine is known to write, checked against the disk.
 */
public class ImagingUnitRunner implements Serializable {

	private static final long serialVersionUID = 1L;

	private static final Logger LOG = LoggerFactory.getLogger(ImagingUnitRunner.class);

	final ImagingConfig conf;
	final ImagingEngine engine;
	final RetryPolicy retry;

	public ImagingUnitRunner(ImagingConfig conf, ImagingEngine engine, RetryPolicy retry) {
		this.conf = conf;
		this.engine = engine;
		this.retry = retry;
	}

	public ImageSet run(BeamObservation obs) throws PipelineStageException, IOException, InterruptedException {
		File parent = new File(obs.outputPrefix).getAbsoluteFile().getParentFile();
		if (parent != null && !parent.isDirectory() && !parent.mkdirs()) {
			throw new IOException("cannot create " + parent);
		}

		ImageSet is = new ImageSet(obs.beamId, obs.measurementSet, obs.outputPrefix, conf.channels);
		for (List<Polarization> group : conf.runGroups()) {
			List<String> command = ImagingCommand.build(conf, obs, group);
			String output = "";
			if (!conf.forceReimage && imaged(obs.outputPrefix, group)) {
				LOG.info("{}: images for {} already present, not reimaging", obs.beamId, Polarization.join(group));
			} else {
				output = invoke(obs, group, command);
			}
			collect(is, group, command, output);
		}

		for (Polarization pol : is.polarizations()) {
			checkNoise(is, pol);
		}
		LOG.info("{}: imaged {}", obs.beamId, is);
		return is;
	}

	String invoke(BeamObservation obs, List<Polarization> group, List<String> command)
			throws ExternalToolFailure, IOException, InterruptedException {
		String label = obs.beamId + "/" + Polarization.join(group);
		EngineResult result = retry.run(label, () -> engine.run(label, command), r -> !r.succeeded());
		if (!result.succeeded()) {
			ExternalToolFailure f = new ExternalToolFailure(obs.beamId, command, result.exitCode, result.output);
			LOG.error("{}: {}", f.getMessage(), f.commandLine());
			throw f;
		}
		return result.output;
	}

	boolean imaged(String prefix, List<Polarization> group) {
		boolean tagged = group.size() > 1;
		for (Polarization pol : group) {
			for (int c = 0; c < conf.channels; c++) {
				if (!new File(ImageNaming.channelImage(prefix, c, pol, tagged)).exists()) {
					return false;
				}
			}
			if (!new File(wideband(prefix, pol, tagged)).exists()) {
				return false;
			}
		}
		return true;
	}

	// the engine skips the wideband image when there is only one channel
	String wideband(String prefix, Polarization pol, boolean tagged) {
		return conf.channels > 1 ? ImageNaming.widebandImage(prefix, pol, tagged)
				: ImageNaming.channelImage(prefix, 0, pol, tagged);
	}

	void collect(ImageSet is, List<Polarization> group, List<String> command, String output) throws ExternalToolFailure {
		boolean tagged = group.size() > 1;
		for (Polarization pol : group) {
			List<String> images = new ArrayList<>();
			for (int c = 0; c < conf.channels; c++) {
				String path = ImageNaming.channelImage(is.outputPrefix, c, pol, tagged);
				if (!new File(path).exists()) {
					throw new ExternalToolFailure(is.sourceId, command, 0, output,
							String.format("%s: imaging engine did not write %s", is.sourceId, path));
				}
				images.add(path);
			}
			is.addImages(pol, images);

			for (AuxiliaryKind kind : AuxiliaryKind.values()) {
				List<String> aux = new ArrayList<>();
				for (int c = 0; c < conf.channels; c++) {
					String path = ImageNaming.auxiliary(is.outputPrefix, c, pol, tagged, kind);
					if (new File(path).exists()) {
						aux.add(path);
					}
				}
				if (!aux.isEmpty()) {
					is.addAuxiliary(pol, kind, aux);
				}
			}
		}
	}

	void checkNoise(ImageSet is, Polarization pol) throws IOException, NoisyImageRejected {
		boolean tagged = isTagged(pol);
		String mfs = wideband(is.outputPrefix, pol, tagged);
		FitsImage img = FitsImage.read(mfs);
		double rms = RobustStats.madStd(img.data);
		// no finite pixel at all means the deconvolution diverged
		if (!Double.isFinite(rms) || rms > conf.noiseCeiling) {
			QualityWarning w = new QualityWarning(is.sourceId, pol, mfs, rms, conf.noiseCeiling);
			if (conf.rejectNoisyImages) {
				throw new NoisyImageRejected(w);
			}
			LOG.warn("{}, try imaging with a lower mgain than {}", w, conf.mgain);
			is.warnings.add(w);
		}
	}

	boolean isTagged(Polarization pol) {
		for (List<Polarization> group : conf.runGroups()) {
			if (group.contains(pol)) {
				return group.size() > 1;
			}
		}
		throw new IllegalArgumentException(pol + " not imaged");
	}
}
