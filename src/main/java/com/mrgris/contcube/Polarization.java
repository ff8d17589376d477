package com.mrgris.contcube;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

public enum Polarization {
	I, Q, U, V;

	/** "IQU" -> [I, Q, U], rejecting letters outside the alphabet and repeats */
	public static List<Polarization> parse(String pols) {
		if (pols == null || pols.isEmpty()) {
			throw new IllegalArgumentException("no polarizations requested");
		}
		EnumSet<Polarization> seen = EnumSet.noneOf(Polarization.class);
		List<Polarization> out = new ArrayList<>();
		for (char c : pols.toCharArray()) {
			Polarization p;
			try {
				p = valueOf(String.valueOf(Character.toUpperCase(c)));
			} catch (IllegalArgumentException e) {
				throw new IllegalArgumentException(String.format("unsupported polarization '%c' in %s", c, pols));
			}
			if (!seen.add(p)) {
				throw new IllegalArgumentException(String.format("polarization %s repeated in %s", p, pols));
			}
			out.add(p);
		}
		return out;
	}

	public static String join(List<Polarization> pols) {
		StringBuilder sb = new StringBuilder();
		for (Polarization p : pols) {
			sb.append(p.name());
		}
		return sb.toString();
	}

	public String label() {
		return name().toLowerCase();
	}
}
