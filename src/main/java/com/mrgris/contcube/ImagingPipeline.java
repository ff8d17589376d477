/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.mrgris.contcube;

import java.io.IOException;
import java.io.Serializable;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.extensions.avro.coders.AvroCoder;
import org.apache.beam.sdk.io.TextIO;
import org.apache.beam.sdk.transforms.Create;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.Flatten;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.transforms.Reshuffle;
import org.apache.beam.sdk.transforms.Values;
import org.apache.beam.sdk.transforms.View;
import org.apache.beam.sdk.transforms.WithKeys;
import org.apache.beam.sdk.transforms.join.CoGbkResult;
import org.apache.beam.sdk.transforms.join.CoGroupByKey;
import org.apache.beam.sdk.transforms.join.KeyedPCollectionTuple;
import org.apache.beam.sdk.values.KV;
import org.apache.beam.sdk.values.PCollection;
import org.apache.beam.sdk.values.PCollectionList;
import org.apache.beam.sdk.values.PCollectionTuple;
import org.apache.beam.sdk.values.PCollectionView;
import org.apache.beam.sdk.values.TupleTag;
import org.apache.beam.sdk.values.TupleTagList;
import org.apache.beam.sdk.values.TypeDescriptors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Iterables;
import com.google.gson.Gson;
import com.mrgris.contcube.engine.ImagingEngine;

/**
 * Beams are imaged independently; the common beam is computed once every imaging task has
 * finished; each beam is then homogenized and stacked into one cube per polarization; a
 * beam's files are cleaned up only after all of its cubes exist.
 *
 * A beam that fails at any stage is dropped from everything downstream of that stage and
 * reported in failures.jsonl under the output directory.
 */
public class ImagingPipeline implements Serializable {
	private static final long serialVersionUID = 1L;

	private static final Logger LOG = LoggerFactory.getLogger(ImagingPipeline.class);

	static final TupleTag<ImageSet> IMAGE_SETS = new TupleTag<ImageSet>() {};
	static final TupleTag<ImageSet> HOMOGENIZED = new TupleTag<ImageSet>() {};
	static final TupleTag<KV<String, CubeProduct>> CUBES = new TupleTag<KV<String, CubeProduct>>() {};
	static final TupleTag<CubeProduct> CUBES_BY_BEAM = new TupleTag<CubeProduct>() {};
	static final TupleTag<CleanupReport> CLEANUPS = new TupleTag<CleanupReport>() {};
	static final TupleTag<StageFailure> FAILURES = new TupleTag<StageFailure>() {};

	transient Pipeline p;
	transient List<BeamObservation> observations;

	final ImagingConfig imaging;
	final RunConfig run;
	final ImagingEngine engine;
	final RetryPolicy retry;

	transient PCollection<ImageSet> imageSets;
	transient PCollection<StageFailure> imagingFailures;
	transient PCollection<CommonBeam> commonBeam;
	transient PCollectionView<CommonBeam> commonBeamView;
	transient PCollection<ImageSet> homogenized;
	transient PCollection<CubeProduct> cubes;
	transient PCollection<CleanupReport> cleanups;
	transient PCollection<StageFailure> failures;

	public ImagingPipeline(Pipeline p, List<BeamObservation> observations, ImagingConfig imaging, RunConfig run,
			ImagingEngine engine, RetryPolicy retry) {
		this.p = p;
		this.observations = observations;
		this.imaging = imaging;
		this.run = run;
		this.engine = engine;
		this.retry = retry;
	}

	public void build() {
		PCollectionTuple imaged = p.apply("Observations", Create.of(observations).withCoder(AvroCoder.of(BeamObservation.class)))
				.apply("SpreadBeams", Reshuffle.viaRandomKey())
				.apply("ImageBeams", ParDo.of(new ImageBeamFn(new ImagingUnitRunner(imaging, engine, retry)))
						.withOutputTags(IMAGE_SETS, TupleTagList.of(FAILURES)));
		imageSets = imaged.get(IMAGE_SETS);
		imagingFailures = imaged.get(FAILURES);

		// side inputs are only available once every imaging task has finished, which makes
		// this the barrier
		PCollectionView<List<ImageSet>> allSets = imageSets.apply("AllImageSets", View.asList());
		PCollectionView<List<StageFailure>> allImagingFailures = imagingFailures.apply("AllImagingFailures", View.asList());
		commonBeam = p.apply("Barrier", Create.of("common-beam"))
				.apply("ComputeCommonBeam", ParDo.of(new ComputeCommonBeamFn(
						new CommonResolutionReducer(run), run.failurePolicy, allSets, allImagingFailures))
						.withSideInputs(allSets, allImagingFailures));
		commonBeamView = commonBeam.apply("CommonBeamView", View.asSingleton());

		PCollectionTuple homog = imageSets.apply("Homogenize",
				ParDo.of(new HomogenizeFn(new Homogenizer(run), commonBeamView))
				.withSideInputs(commonBeamView)
				.withOutputTags(HOMOGENIZED, TupleTagList.of(FAILURES)));
		homogenized = homog.get(HOMOGENIZED);

		PCollectionTuple assembled = homogenized
				.apply("CubeTasks", ParDo.of(new DoFn<ImageSet, CubeTask>() {
					@ProcessElement
					public void processElement(ProcessContext c) {
						for (Polarization pol : c.element().polarizations()) {
							c.output(new CubeTask(c.element(), pol));
						}
					}
				}))
				.apply("SpreadCubes", Reshuffle.viaRandomKey())
				.apply("AssembleCubes", ParDo.of(new AssembleCubeFn(new CubeAssembler(run), commonBeamView))
						.withSideInputs(commonBeamView)
						.withOutputTags(CUBES, TupleTagList.of(FAILURES)));
		PCollection<KV<String, CubeProduct>> cubesByBeam = assembled.get(CUBES);
		cubes = cubesByBeam.apply("CubeProducts", Values.create());

		// a beam's files go only once every one of its cubes has been written
		PCollection<KV<String, ImageSet>> setsByBeam = homogenized.apply("KeyByBeam",
				WithKeys.of((ImageSet is) -> is.sourceId).withKeyType(TypeDescriptors.strings()));
		PCollectionTuple cleaned = KeyedPCollectionTuple.of(HOMOGENIZED, setsByBeam)
				.and(CUBES_BY_BEAM, cubesByBeam)
				.apply("JoinCubes", CoGroupByKey.create())
				.apply("Cleanup", ParDo.of(new CleanupFn(new RetentionManager(run)))
						.withOutputTags(CLEANUPS, TupleTagList.of(FAILURES)));
		cleanups = cleaned.get(CLEANUPS);

		failures = PCollectionList.of(imagingFailures)
				.and(homog.get(FAILURES))
				.and(assembled.get(FAILURES))
				.and(cleaned.get(FAILURES))
				.apply("AllFailures", Flatten.pCollections());
	}

	public void writeReports() {
		String dir = run.outputDir;
		cubes.apply("ArtifactRecords", ParDo.of(new DoFn<CubeProduct, ArtifactRecord>() {
			@ProcessElement
			public void processElement(ProcessContext c) {
				CubeProduct cp = c.element();
				c.output(new ArtifactRecord(cp.sourceId, "cube." + cp.polarization, cp.cubePath));
				c.output(new ArtifactRecord(cp.sourceId, "noise." + cp.polarization, cp.noisePath));
			}
		}))
		.apply("ArtifactsToJson", ParDo.of(new ToJsonFn<ArtifactRecord>()))
		.apply("WriteArtifacts", TextIO.write().to(report(dir, "artifacts")).withSuffix(".jsonl").withoutSharding());

		failures.apply("LogFailures", ParDo.of(new DoFn<StageFailure, StageFailure>() {
			@ProcessElement
			public void processElement(ProcessContext c) {
				StageFailure f = c.element();
				LOG.error("FAILED {}", f);
				if (f.toolOutput != null) {
					LOG.error("{} tool output:\n{}", f.sourceId, f.toolOutput);
				}
				c.output(f);
			}
		}))
		.apply("FailuresToJson", ParDo.of(new ToJsonFn<StageFailure>()))
		.apply("WriteFailures", TextIO.write().to(report(dir, "failures")).withSuffix(".jsonl").withoutSharding());

		cleanups.apply("CleanupsToJson", ParDo.of(new ToJsonFn<CleanupReport>()))
		.apply("WriteCleanups", TextIO.write().to(report(dir, "cleanup")).withSuffix(".jsonl").withoutSharding());
	}

	static String report(String dir, String name) {
		return Paths.get(dir, name).toAbsolutePath().toString();
	}

	static class ImageBeamFn extends DoFn<BeamObservation, ImageSet> {
		final ImagingUnitRunner runner;

		ImageBeamFn(ImagingUnitRunner runner) {
			this.runner = runner;
		}

		@ProcessElement
		public void processElement(ProcessContext c) throws InterruptedException {
			BeamObservation obs = c.element();
			try {
				c.output(runner.run(obs));
			} catch (PipelineStageException | IOException e) {
				LOG.error(obs.beamId + ": imaging failed", e);
				c.output(FAILURES, new StageFailure(obs.beamId, Stage.IMAGING, null, e));
			}
		}
	}

	static class ComputeCommonBeamFn extends DoFn<String, CommonBeam> {
		final CommonResolutionReducer reducer;
		final FailurePolicy policy;
		final PCollectionView<List<ImageSet>> imageSets;
		final PCollectionView<List<StageFailure>> imagingFailures;

		ComputeCommonBeamFn(CommonResolutionReducer reducer, FailurePolicy policy,
				PCollectionView<List<ImageSet>> imageSets, PCollectionView<List<StageFailure>> imagingFailures) {
			this.reducer = reducer;
			this.policy = policy;
			this.imageSets = imageSets;
			this.imagingFailures = imagingFailures;
		}

		@ProcessElement
		public void processElement(ProcessContext c) {
			List<StageFailure> failed = c.sideInput(imagingFailures);
			List<String> failedBeams = new ArrayList<>();
			for (StageFailure f : failed) {
				failedBeams.add(f.sourceId);
			}
			if (!failed.isEmpty()) {
				if (policy == FailurePolicy.ABORT_RUN) {
					throw new RunAbortedException("imaging failed for " + failedBeams);
				}
				LOG.warn("computing the common beam without failed beams {}", failedBeams);
			}

			List<ImageSet> sets = c.sideInput(imageSets);
			if (sets.isEmpty()) {
				throw new RunAbortedException("no beam was imaged");
			}
			try {
				c.output(reducer.reduce(new ArrayList<>(sets)));
			} catch (PipelineStageException | IOException e) {
				throw new RunAbortedException("cannot compute the common beam", e);
			}
		}
	}

	static class HomogenizeFn extends DoFn<ImageSet, ImageSet> {
		final Homogenizer homogenizer;
		final PCollectionView<CommonBeam> commonBeam;

		HomogenizeFn(Homogenizer homogenizer, PCollectionView<CommonBeam> commonBeam) {
			this.homogenizer = homogenizer;
			this.commonBeam = commonBeam;
		}

		@ProcessElement
		public void processElement(ProcessContext c) {
			ImageSet is = c.element();
			try {
				c.output(homogenizer.homogenize(is, c.sideInput(commonBeam)));
			} catch (PipelineStageException | IOException e) {
				LOG.error(is.sourceId + ": homogenization failed", e);
				c.output(FAILURES, new StageFailure(is.sourceId, Stage.HOMOGENIZE, null, e));
			}
		}
	}

	static class AssembleCubeFn extends DoFn<CubeTask, KV<String, CubeProduct>> {
		final CubeAssembler assembler;
		final PCollectionView<CommonBeam> commonBeam;

		AssembleCubeFn(CubeAssembler assembler, PCollectionView<CommonBeam> commonBeam) {
			this.assembler = assembler;
			this.commonBeam = commonBeam;
		}

		@ProcessElement
		public void processElement(ProcessContext c) {
			CubeTask task = c.element();
			String beam = task.imageSet.sourceId;
			try {
				c.output(KV.of(beam, assembler.assemble(task.imageSet, task.pol(), c.sideInput(commonBeam))));
			} catch (PipelineStageException | IOException e) {
				LOG.error(beam + " " + task.polarization + ": cube failed", e);
				c.output(FAILURES, new StageFailure(beam, Stage.CUBE, task.pol(), e));
			}
		}
	}

	static class CleanupFn extends DoFn<KV<String, CoGbkResult>, CleanupReport> {
		final RetentionManager retention;

		CleanupFn(RetentionManager retention) {
			this.retention = retention;
		}

		@ProcessElement
		public void processElement(ProcessContext c) {
			String beam = c.element().getKey();
			ImageSet is = Iterables.getOnlyElement(c.element().getValue().getAll(HOMOGENIZED));
			int written = Iterables.size(c.element().getValue().getAll(CUBES_BY_BEAM));
			int needed = is.polarizations().size();
			if (written < needed) {
				LOG.warn("{}: only {} of {} cubes written, keeping its files", beam, written, needed);
				c.output(CleanupReport.kept(beam, String.format("%d of %d cubes written", written, needed)));
				return;
			}
			try {
				c.output(retention.cleanup(is));
			} catch (IOException e) {
				LOG.error(beam + ": cleanup failed", e);
				c.output(FAILURES, new StageFailure(beam, Stage.CLEANUP, null, e));
			}
		}
	}

	static class ToJsonFn<T> extends DoFn<T, String> {
		transient Gson gson;

		@Setup
		public void setup() {
			gson = new Gson();
		}

		@ProcessElement
		public void processElement(ProcessContext c) {
			c.output(gson.toJson(c.element()));
		}
	}
}
