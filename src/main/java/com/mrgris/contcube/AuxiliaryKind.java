package com.mrgris.contcube;

/** Byproducts the imaging engine writes next to each channel image. */
public enum AuxiliaryKind {
	MODEL("model"),
	PSF("psf"),
	RESIDUAL("residual"),
	DIRTY("dirty");

	public final String token;

	AuxiliaryKind(String token) {
		this.token = token;
	}
}
