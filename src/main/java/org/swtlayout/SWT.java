package org.swtlayout;

/** Constants shared by the layout managers and their containers */
public final class SWT {
	/** Passed as a width or height hint to mean "no hint", i.e. the natural size in that dimension */
	public static final int DEFAULT = -1;

	private SWT() {
	}
}
