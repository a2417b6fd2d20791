package org.swtlayout.layout;

/** Argument checks and margin arithmetic shared by the layouts in this package */
class LayoutUtils {
	private LayoutUtils() {
	}

	static int checkNonNegative(String property, int value) {
		if (value < 0)
			throw new IllegalArgumentException(property + " may not be negative: " + value);
		return value;
	}

	/**
	 * @param margin The margin specific to one edge
	 * @param common The margin shared by both edges of the dimension
	 * @return The edge-specific margin if it is set (non-zero), otherwise the shared one
	 */
	static int effectiveMargin(int margin, int common) {
		return margin != 0 ? margin : common;
	}
}
