package com.mrgris.contcube;

import java.io.IOException;
import java.io.Reader;
import java.io.Serializable;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.locks.Lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.Striped;
import com.google.gson.Gson;
import com.google.gson.JsonParseException;

/**
 * Write-once store of common beams addressed by input fingerprint. An entry is published by
 * hard-linking a fully written temp file into place, so readers never see a partial entry and
 * the first writer wins; a later writer reads back the winner's value.
 */
public class CommonBeamCache implements Serializable {

	private static final long serialVersionUID = 1L;

	private static final Logger LOG = LoggerFactory.getLogger(CommonBeamCache.class);

	// writers in this JVM wait on each other rather than all computing
	static final Striped<Lock> LOCKS = Striped.lock(64);

	public interface Computation {
		CommonBeam compute() throws PipelineStageException;
	}

	final String dir;

	public CommonBeamCache(String dir) {
		this.dir = dir;
	}

	public Path entry(String fingerprint) {
		return Paths.get(dir, "beam_" + fingerprint + ".json");
	}

	/** @return the stored beam, or null if there is none */
	public CommonBeam load(String fingerprint) throws IOException {
		Path p = entry(fingerprint);
		if (!Files.exists(p)) {
			return null;
		}
		try (Reader r = Files.newBufferedReader(p, StandardCharsets.UTF_8)) {
			CommonBeam cb = new Gson().fromJson(r, CommonBeam.class);
			if (cb == null || !fingerprint.equals(cb.fingerprint)) {
				throw new IOException("corrupt cache entry " + p);
			}
			return cb;
		} catch (JsonParseException e) {
			throw new IOException("corrupt cache entry " + p, e);
		}
	}

	/** @return the beam now stored under the fingerprint, which is another writer's if it got there first */
	public CommonBeam store(CommonBeam cb) throws IOException {
		Path target = entry(cb.fingerprint);
		Files.createDirectories(target.getParent());
		Path tmp = Files.createTempFile(target.getParent(), "beam_", ".tmp");
		try {
			try (Writer w = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8)) {
				new Gson().toJson(cb, w);
			}
			Files.createLink(target, tmp);
			LOG.info("cached {} at {}", cb, target);
			return cb;
		} catch (FileAlreadyExistsException e) {
			LOG.info("{} already cached by another run", cb.fingerprint);
			return load(cb.fingerprint);
		} finally {
			Files.deleteIfExists(tmp);
		}
	}

	public CommonBeam getOrCompute(String fingerprint, Computation computation) throws PipelineStageException, IOException {
		Lock lock = LOCKS.get(fingerprint);
		lock.lock();
		try {
			CommonBeam cached = load(fingerprint);
			if (cached != null) {
				LOG.info("cache hit for {}: {}", fingerprint, cached);
				return cached;
			}
			return store(computation.compute());
		} finally {
			lock.unlock();
		}
	}
}
