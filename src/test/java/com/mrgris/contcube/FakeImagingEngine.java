package com.mrgris.contcube;

import java.io.IOException;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import com.mrgris.contcube.engine.EngineResult;
import com.mrgris.contcube.engine.ImagingEngine;
import com.mrgris.contcube.image.BeamShape;
import com.mrgris.contcube.image.FitsFixtures;

/**
 * Stands in for the imaging program: writes every file the real engine would, with the beam
 * configured for the prefix. Pipeline workers get serialized copies, so invocation counts are
 * kept in a static table under the fake's own key.
 */
public class FakeImagingEngine implements ImagingEngine {

	private static final long serialVersionUID = 1L;

	static final Map<String, AtomicInteger> INVOCATIONS = new ConcurrentHashMap<>();

	final String key;
	final HashMap<String, double[]> beams = new HashMap<>();
	final HashSet<String> failing = new HashSet<>();
	double noise = 0.01;
	int failFirst = 0;

	public FakeImagingEngine(String key) {
		this.key = key;
		INVOCATIONS.put(key, new AtomicInteger());
	}

	/** images whose prefix contains the token get this beam */
	public FakeImagingEngine beam(String token, double major, double minor, double pa) {
		beams.put(token, new double[] {major, minor, pa});
		return this;
	}

	/** runs for prefixes containing the token write one image and exit 1 */
	public FakeImagingEngine failFor(String token) {
		failing.add(token);
		return this;
	}

	/** the first n invocations exit 1 without writing anything */
	public FakeImagingEngine failFirst(int n) {
		failFirst = n;
		return this;
	}

	public FakeImagingEngine noise(double sigma) {
		noise = sigma;
		return this;
	}

	public int invocations() {
		return INVOCATIONS.get(key).get();
	}

	@Override
	public EngineResult run(String label, List<String> command) throws IOException {
		int n = INVOCATIONS.get(key).incrementAndGet();
		if (n <= failFirst) {
			return new EngineResult(1, "transient failure " + n);
		}

		String prefix = arg(command, "-name");
		List<Polarization> pols = Polarization.parse(arg(command, "-pol"));
		int channels = Integer.parseInt(arg(command, "-channels-out"));
		BeamShape beam = beamFor(prefix);
		boolean tagged = pols.size() > 1;

		for (String token : failing) {
			if (prefix.contains(token)) {
				FitsFixtures.writeChannel(ImageNaming.channelImage(prefix, 0, pols.get(0), tagged), beam, 0, 1L);
				return new EngineResult(1, "fake engine: cannot read " + command.get(command.size() - 1));
			}
		}

		long seed = prefix.hashCode();
		for (Polarization pol : pols) {
			for (int c = 0; c < channels; c++) {
				long s = seed + 31 * c + pol.ordinal();
				FitsFixtures.write(ImageNaming.channelImage(prefix, c, pol, tagged), beam,
						FitsFixtures.FREQ0 + c * FitsFixtures.CHANNEL_WIDTH, FitsFixtures.noise(s, noise));
				for (AuxiliaryKind kind : AuxiliaryKind.values()) {
					FitsFixtures.writeChannel(ImageNaming.auxiliary(prefix, c, pol, tagged, kind), beam, c, s + 7);
				}
			}
			if (channels > 1) {
				FitsFixtures.write(ImageNaming.widebandImage(prefix, pol, tagged), beam,
						FitsFixtures.FREQ0, FitsFixtures.noise(seed - 1, noise));
			}
		}
		return new EngineResult(0, "fake engine: imaged " + Polarization.join(pols));
	}

	BeamShape beamFor(String prefix) {
		for (Map.Entry<String, double[]> e : beams.entrySet()) {
			if (prefix.contains(e.getKey())) {
				double[] b = e.getValue();
				return new BeamShape(b[0], b[1], b[2]);
			}
		}
		return new BeamShape(1, 1, 0);
	}

	static String arg(List<String> command, String flag) {
		int i = command.indexOf(flag);
		if (i < 0) {
			throw new IllegalArgumentException("no " + flag + " in " + command);
		}
		return command.get(i + 1);
	}
}
