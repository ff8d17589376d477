package com.mrgris.contcube.engine;

import java.util.ArrayList;
import java.util.List;

import com.mrgris.contcube.BeamObservation;
import com.mrgris.contcube.ImagingConfig;
import com.mrgris.contcube.Polarization;

/** Argument list for one engine run over a group of polarizations. */
public class ImagingCommand {

	public static List<String> build(ImagingConfig conf, BeamObservation obs, List<Polarization> group) {
		boolean intensity = group.contains(Polarization.I);
		boolean squared = !intensity && conf.squaredChannelJoining;

		List<String> args = new ArrayList<>(conf.engineCommand);
		add(args, "-name", obs.outputPrefix);
		add(args, "-pol", Polarization.join(group));
		add(args, "-channels-out", conf.channels);
		add(args, "-scale", num(conf.pixelScaleArcsec) + "asec");
		add(args, "-size", conf.imageSize, conf.imageSize);
		if (!intensity && conf.joinPolarizations && group.size() > 1) {
			args.add("-join-polarizations");
		}
		if (conf.joinChannels) {
			args.add("-join-channels");
		}
		if (squared) {
			args.add("-squared-channel-joining");
		}
		add(args, "-mgain", conf.mgain);
		add(args, "-niter", conf.niter);
		add(args, "-auto-mask", squared ? reducedMask(conf.autoMask) : conf.autoMask);
		if (conf.forceMaskRounds != null) {
			add(args, "-force-mask-rounds", conf.forceMaskRounds);
		}
		add(args, "-auto-threshold", conf.autoThreshold);
		if (conf.gridder != null) {
			add(args, "-gridder", conf.gridder);
		}
		add(args, "-weight", "briggs", conf.robust);
		add(args, "-mem", conf.memPercent);
		if (conf.absMemGb != null) {
			add(args, "-abs-mem", conf.absMemGb);
		}
		if (conf.taperArcsec != null) {
			add(args, "-taper-gaussian", num(conf.taperArcsec) + "asec");
		}
		add(args, "-field", obs.fieldIndex);
		if (conf.parallelDeconvolution != null) {
			add(args, "-parallel-deconvolution", conf.parallelDeconvolution);
		}
		add(args, "-minuv-l", conf.minUvLambda);
		if (conf.majorIterations != null) {
			add(args, "-nmiter", conf.majorIterations);
		}
		if (conf.localRms) {
			args.add("-local-rms");
			if (conf.localRmsWindow != null) {
				add(args, "-local-rms-window", conf.localRmsWindow);
			}
		}
		if (conf.multiscale) {
			args.add("-multiscale");
		}
		args.add(obs.measurementSet);
		return args;
	}

	// squaring the joined channels raises the peak over noise by about sqrt(2)
	static double reducedMask(double autoMask) {
		return Math.round(autoMask / Math.sqrt(2.) * 100.) / 100.;
	}

	static void add(List<String> args, String flag, Object... values) {
		args.add(flag);
		for (Object v : values) {
			args.add(v instanceof Double ? num((Double)v) : String.valueOf(v));
		}
	}

	static String num(double d) {
		if (d == Math.rint(d) && !Double.isInfinite(d)) {
			return String.valueOf((long)d);
		}
		return String.valueOf(d);
	}
}
