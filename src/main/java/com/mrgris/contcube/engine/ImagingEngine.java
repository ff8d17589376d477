package com.mrgris.contcube.engine;

import java.io.IOException;
import java.io.Serializable;
import java.util.List;

/**
 * The external imaging program. Implementations are handed to pipeline workers, so they
 * must be serializable.
 */
public interface ImagingEngine extends Serializable {

	/**
	 * Runs one engine invocation to completion.
	 *
	 * @param label who the run is for, used in log lines
	 * @throws IOException if the program could not be started at all
	 */
	EngineResult run(String label, List<String> command) throws IOException, InterruptedException;

}
