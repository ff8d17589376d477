package com.mrgris.contcube;

import java.io.IOException;
import java.util.List;

import org.apache.beam.runners.direct.DirectOptions;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.PipelineResult;
import org.apache.beam.sdk.options.PipelineOptionsFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Splitter;
import com.mrgris.contcube.engine.ProcessImagingEngine;

public class ImagingPipelineMain {

	private static final Logger LOG = LoggerFactory.getLogger(ImagingPipelineMain.class);

	public static ImagingConfig imagingConfig(ImagingPipelineOptions o) {
		return ImagingConfig.builder()
				.engineCommand(Splitter.on(' ').omitEmptyStrings().splitToList(o.getEngine()))
				.polarizations(o.getPols())
				.channels(o.getChannels())
				.pixelScaleArcsec(o.getPixelScale())
				.imageSize(o.getImageSize())
				.joinPolarizations(o.getJoinPolarizations())
				.joinChannels(o.getJoinChannels())
				.squaredChannelJoining(o.getSquaredChannelJoining())
				.mgain(o.getMgain())
				.niter(o.getNiter())
				.autoMask(o.getAutoMask())
				.forceMaskRounds(o.getForceMaskRounds())
				.autoThreshold(o.getAutoThreshold())
				.gridder(o.getGridder())
				.robust(o.getRobust())
				.memPercent(o.getMem())
				.absMemGb(o.getAbsMem())
				.taperArcsec(o.getTaper())
				.minUvLambda(o.getMinUvLambda())
				.parallelDeconvolution(o.getParallelDeconvolution())
				.majorIterations(o.getMajorIterations())
				.localRms(o.getLocalRms())
				.localRmsWindow(o.getLocalRmsWindow())
				.multiscale(o.getMultiscale())
				.forceReimage(o.getForceReimage())
				.noiseCeiling(o.getNoiseCeiling())
				.rejectNoisyImages(o.getRejectNoisyImages())
				.build();
	}

	public static RunConfig runConfig(ImagingPipelineOptions o) {
		return new RunConfig(o.getOutputDir(), o.getCacheDir(), o.getPurge(), o.getFailurePolicy(),
				o.getCutoff(), o.getFluxScale());
	}

	public static RetryPolicy retryPolicy(ImagingPipelineOptions o) {
		return o.getRetryAttempts() > 1 ? RetryPolicy.bounded(o.getRetryAttempts(), o.getRetryDelayMillis())
				: RetryPolicy.none();
	}

	public static void main(String[] args) throws IOException {
		PipelineOptionsFactory.register(ImagingPipelineOptions.class);
		ImagingPipelineOptions options = PipelineOptionsFactory.fromArgs(args)
				.withValidation()
				.as(ImagingPipelineOptions.class);
		if (options.getWorkers() != null) {
			options.as(DirectOptions.class).setTargetParallelism(options.getWorkers());
		}

		ImagingConfig imaging = imagingConfig(options);
		RunConfig run = runConfig(options);
		List<BeamObservation> obs = new ObservationPlanner(options.getMsDir(), options.getMsGlob(),
				options.getOutputDir(), options.getField(), options.getFieldIndex()).plan(options.getExpectedBeams());
		LOG.info("imaging {} beams, pols {}, {} channels", obs.size(), Polarization.join(imaging.polarizations), imaging.channels);

		Pipeline p = Pipeline.create(options);
		ImagingPipeline ip = new ImagingPipeline(p, obs, imaging, run, new ProcessImagingEngine(), retryPolicy(options));
		ip.build();
		ip.writeReports();
		PipelineResult.State state = p.run().waitUntilFinish();
		LOG.info("run finished: {}; see failures.jsonl in {} for failed beams", state, run.outputDir);
	}
}
