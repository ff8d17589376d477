package com.mrgris.contcube;

import java.io.Serializable;
import java.util.List;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/** Parameters of one beam's imaging run. */
public class ImagingConfig implements Serializable {

	private static final long serialVersionUID = 1L;

	public final List<String> engineCommand;
	public final List<Polarization> polarizations;
	public final int channels;
	public final double pixelScaleArcsec;
	public final int imageSize;
	public final boolean joinPolarizations;
	public final boolean joinChannels;
	public final boolean squaredChannelJoining;
	public final double mgain;
	public final int niter;
	public final double autoMask;
	public final Integer forceMaskRounds;
	public final double autoThreshold;
	public final String gridder;
	public final double robust;
	public final double memPercent;
	public final Double absMemGb;
	public final Double taperArcsec;
	public final double minUvLambda;
	public final Integer parallelDeconvolution;
	public final Integer majorIterations;
	public final boolean localRms;
	public final Double localRmsWindow;
	public final boolean multiscale;
	public final boolean forceReimage;
	public final double noiseCeiling;
	public final boolean rejectNoisyImages;

	ImagingConfig(Builder b) {
		Preconditions.checkArgument(b.channels > 0, "channel count must be positive, got %s", b.channels);
		Preconditions.checkArgument(b.pixelScaleArcsec > 0, "pixel scale must be positive, got %s", b.pixelScaleArcsec);
		Preconditions.checkArgument(b.imageSize > 0, "image size must be positive, got %s", b.imageSize);
		Preconditions.checkArgument(!b.engineCommand.isEmpty(), "no imaging engine command");
		List<Polarization> pols = Polarization.parse(b.polarizations);
		// a lone non-intensity polarization imaged next to I would be written under I's names
		Preconditions.checkArgument(!(pols.contains(Polarization.I) && pols.size() == 2),
				"cannot image I with a single other polarization (%s): file names would collide", b.polarizations);

		this.engineCommand = ImmutableList.copyOf(b.engineCommand);
		this.polarizations = ImmutableList.copyOf(pols);
		this.channels = b.channels;
		this.pixelScaleArcsec = b.pixelScaleArcsec;
		this.imageSize = b.imageSize;
		this.joinPolarizations = b.joinPolarizations;
		this.joinChannels = b.joinChannels;
		this.squaredChannelJoining = b.squaredChannelJoining;
		this.mgain = b.mgain;
		this.niter = b.niter;
		this.autoMask = b.autoMask;
		this.forceMaskRounds = b.forceMaskRounds;
		this.autoThreshold = b.autoThreshold;
		this.gridder = b.gridder;
		this.robust = b.robust;
		this.memPercent = b.memPercent;
		this.absMemGb = b.absMemGb;
		this.taperArcsec = b.taperArcsec;
		this.minUvLambda = b.minUvLambda;
		this.parallelDeconvolution = b.parallelDeconvolution;
		this.majorIterations = b.majorIterations;
		this.localRms = b.localRms;
		this.localRmsWindow = b.localRmsWindow;
		this.multiscale = b.multiscale;
		this.forceReimage = b.forceReimage;
		this.noiseCeiling = b.noiseCeiling;
		this.rejectNoisyImages = b.rejectNoisyImages;
	}

	/**
	 * Engine runs for one beam. Intensity is cleaned on its own since its channels are not
	 * joined squared; the remaining polarizations are cleaned together.
	 */
	public List<List<Polarization>> runGroups() {
		ImmutableList.Builder<List<Polarization>> groups = ImmutableList.builder();
		ImmutableList.Builder<Polarization> rest = ImmutableList.builder();
		for (Polarization p : polarizations) {
			if (p == Polarization.I) {
				groups.add(ImmutableList.of(p));
			} else {
				rest.add(p);
			}
		}
		List<Polarization> joined = rest.build();
		if (!joined.isEmpty()) {
			groups.add(joined);
		}
		return groups.build();
	}

	public static Builder builder() {
		return new Builder();
	}

	public static class Builder {
		List<String> engineCommand = ImmutableList.of("wsclean");
		String polarizations = "IQU";
		int channels = 36;
		double pixelScaleArcsec = 2.5;
		int imageSize = 4096;
		boolean joinPolarizations = true;
		boolean joinChannels = true;
		boolean squaredChannelJoining = true;
		double mgain = 0.7;
		int niter = 100000;
		double autoMask = 3.;
		Integer forceMaskRounds;
		double autoThreshold = 1.;
		String gridder;
		double robust = -0.5;
		double memPercent = 90.;
		Double absMemGb;
		Double taperArcsec;
		double minUvLambda = 0.;
		Integer parallelDeconvolution;
		Integer majorIterations;
		boolean localRms = false;
		Double localRmsWindow;
		boolean multiscale = false;
		boolean forceReimage = false;
		double noiseCeiling = 1.;
		boolean rejectNoisyImages = false;

		public Builder engineCommand(List<String> v) { engineCommand = v; return this; }
		public Builder polarizations(String v) { polarizations = v; return this; }
		public Builder channels(int v) { channels = v; return this; }
		public Builder pixelScaleArcsec(double v) { pixelScaleArcsec = v; return this; }
		public Builder imageSize(int v) { imageSize = v; return this; }
		public Builder joinPolarizations(boolean v) { joinPolarizations = v; return this; }
		public Builder joinChannels(boolean v) { joinChannels = v; return this; }
		public Builder squaredChannelJoining(boolean v) { squaredChannelJoining = v; return this; }
		public Builder mgain(double v) { mgain = v; return this; }
		public Builder niter(int v) { niter = v; return this; }
		public Builder autoMask(double v) { autoMask = v; return this; }
		public Builder forceMaskRounds(Integer v) { forceMaskRounds = v; return this; }
		public Builder autoThreshold(double v) { autoThreshold = v; return this; }
		public Builder gridder(String v) { gridder = v; return this; }
		public Builder robust(double v) { robust = v; return this; }
		public Builder memPercent(double v) { memPercent = v; return this; }
		public Builder absMemGb(Double v) { absMemGb = v; return this; }
		public Builder taperArcsec(Double v) { taperArcsec = v; return this; }
		public Builder minUvLambda(double v) { minUvLambda = v; return this; }
		public Builder parallelDeconvolution(Integer v) { parallelDeconvolution = v; return this; }
		public Builder majorIterations(Integer v) { majorIterations = v; return this; }
		public Builder localRms(boolean v) { localRms = v; return this; }
		public Builder localRmsWindow(Double v) { localRmsWindow = v; return this; }
		public Builder multiscale(boolean v) { multiscale = v; return this; }
		public Builder forceReimage(boolean v) { forceReimage = v; return this; }
		public Builder noiseCeiling(double v) { noiseCeiling = v; return this; }
		public Builder rejectNoisyImages(boolean v) { rejectNoisyImages = v; return this; }

		public ImagingConfig build() {
			return new ImagingConfig(this);
		}
	}
}
