package com.mrgris.contcube;

import java.io.IOException;
import java.io.Serializable;
import java.nio.file.Files;
import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deletes the files a beam owns. Only ever handed a beam whose cubes are all written; it
 * does not check that itself.
 */
public class RetentionManager implements Serializable {

	private static final long serialVersionUID = 1L;

	private static final Logger LOG = LoggerFactory.getLogger(RetentionManager.class);

	final boolean purge;

	public RetentionManager(RunConfig conf) {
		this(conf.purge);
	}

	RetentionManager(boolean purge) {
		this.purge = purge;
	}

	public CleanupReport cleanup(ImageSet is) throws IOException {
		if (!purge) {
			LOG.info("{}: not purging intermediate files", is.sourceId);
			return CleanupReport.kept(is.sourceId, "purge disabled");
		}

		CleanupReport report = new CleanupReport(is.sourceId);
		report.purged = true;
		for (String f : is.ownedFiles()) {
			if (Files.deleteIfExists(Paths.get(f))) {
				LOG.debug("removed {}", f);
				report.deleted++;
			} else {
				MissingFileWarning w = new MissingFileWarning(f);
				LOG.warn("{}: {}", is.sourceId, w);
				report.missing.add(w);
			}
		}
		LOG.info("{}", report);
		return report;
	}
}
