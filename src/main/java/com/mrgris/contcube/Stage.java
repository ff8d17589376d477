package com.mrgris.contcube;

public enum Stage {
	IMAGING,
	HOMOGENIZE,
	CUBE,
	CLEANUP
}
