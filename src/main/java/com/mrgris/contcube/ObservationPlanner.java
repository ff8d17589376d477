package com.mrgris.contcube;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.collect.Ordering;

/** Finds the measurement sets of a run and assigns each beam its output prefix. */
public class ObservationPlanner {

	private static final Logger LOG = LoggerFactory.getLogger(ObservationPlanner.class);

	public static final String DEFAULT_GLOB = "scienceData*.ms";

	static final Pattern BEAM_NUMBER = Pattern.compile("beam(\\d+)", Pattern.CASE_INSENSITIVE);

	final String msDir;
	final String glob;
	final String outputDir;
	final String field;
	final int fieldIndex;

	public ObservationPlanner(String msDir, String glob, String outputDir, String field, int fieldIndex) {
		this.msDir = msDir;
		this.glob = (glob != null ? glob : DEFAULT_GLOB);
		this.outputDir = outputDir;
		this.field = field;
		this.fieldIndex = fieldIndex;
	}

	/**
	 * @param expected number of beams the run must find, or null to accept any number
	 */
	public List<BeamObservation> plan(Integer expected) throws IOException {
		List<Path> sets = new ArrayList<>();
		try (DirectoryStream<Path> ds = Files.newDirectoryStream(Paths.get(msDir), glob)) {
			for (Path p : ds) {
				sets.add(p);
			}
		}
		sets = Ordering.natural().sortedCopy(sets);
		if (sets.isEmpty()) {
			throw new IOException(String.format("no measurement sets matching %s in %s", glob, msDir));
		}
		if (expected != null && sets.size() != expected) {
			throw new IOException(String.format("found %d measurement sets in %s, expected %d",
					sets.size(), msDir, expected));
		}

		List<BeamObservation> obs = new ArrayList<>();
		Set<String> prefixes = new HashSet<>();
		for (int i = 0; i < sets.size(); i++) {
			Path ms = sets.get(i);
			int beam = beamNumber(ms.getFileName().toString(), i);
			String prefix = prefix(beam);
			if (!prefixes.add(prefix)) {
				throw new IllegalStateException(String.format("%s would reuse output prefix %s", ms, prefix));
			}
			BeamObservation o = new BeamObservation(beam, ms.toString(), prefix, fieldIndex);
			LOG.info("planned {} -> {}", o, prefix);
			obs.add(o);
		}
		return obs;
	}

	String prefix(int beam) {
		return Paths.get(outputDir, String.format("image.%s.contcube.beam%02d", field, beam)).toString();
	}

	static int beamNumber(String name, int fallback) {
		Matcher m = BEAM_NUMBER.matcher(name);
		return m.find() ? Integer.parseInt(m.group(1)) : fallback;
	}
}
