package com.mrgris.contcube.engine;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Joiner;

/** Runs the engine as a local subprocess, streaming its output into the log. */
public class ProcessImagingEngine implements ImagingEngine {

	private static final long serialVersionUID = 1L;

	private static final Logger LOG = LoggerFactory.getLogger(ProcessImagingEngine.class);

	// captured output kept for failure reports, in characters
	static final int MAX_CAPTURE = 1 << 20;

	@Override
	public EngineResult run(String label, List<String> command) throws IOException, InterruptedException {
		ProcessBuilder pb = new ProcessBuilder(command);
		pb.redirectErrorStream(true);
		LOG.info("{}: subprocess start: {}", label, Joiner.on(' ').join(command));

		Process p = pb.start();
		StringBuilder captured = new StringBuilder();
		int exit;
		boolean finished = false;
		try {
			try (BufferedReader output = new BufferedReader(
					new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
				String line;
				while ((line = output.readLine()) != null) {
					LOG.info("{}: {}", label, line);
					if (captured.length() < MAX_CAPTURE) {
						captured.append(line).append('\n');
					}
				}
			}
			exit = p.waitFor();
			finished = true;
		} finally {
			// interrupted or failed while reading: the engine must not outlive the task
			if (!finished) {
				LOG.warn("{}: killing subprocess", label);
				p.destroyForcibly();
			}
		}
		LOG.info("{}: subprocess end, exit {}", label, exit);
		return new EngineResult(exit, captured.toString());
	}
}
