package org.swtlayout.layout;

import org.swtlayout.SWT;
import org.swtlayout.graphics.Point;

/** Layout data for a child of a container using a {@link RowLayout} */
public class RowData {
	private int theWidth;
	private int theHeight;
	private boolean isExcluded;

	/** Creates row data using the child's natural size */
	public RowData() {
		this(SWT.DEFAULT, SWT.DEFAULT);
	}

	/**
	 * @param width The width hint for the child, or {@link SWT#DEFAULT}
	 * @param height The height hint for the child, or {@link SWT#DEFAULT}
	 */
	public RowData(int width, int height) {
		theWidth = width;
		theHeight = height;
	}

	/** @param size The width and height hints for the child */
	public RowData(Point size) {
		this(size.x, size.y);
	}

	/** @return The width hint for the child, or {@link SWT#DEFAULT} */
	public int getWidth() {
		return theWidth;
	}

	/**
	 * @param width The width hint for the child, or {@link SWT#DEFAULT}
	 * @return This row data
	 */
	public RowData setWidth(int width) {
		theWidth = width;
		return this;
	}

	/** @return The height hint for the child, or {@link SWT#DEFAULT} */
	public int getHeight() {
		return theHeight;
	}

	/**
	 * @param height The height hint for the child, or {@link SWT#DEFAULT}
	 * @return This row data
	 */
	public RowData setHeight(int height) {
		theHeight = height;
		return this;
	}

	/** @return Whether the child is skipped by the layout, with no space reserved for it */
	public boolean isExcluded() {
		return isExcluded;
	}

	/**
	 * @param exclude Whether the layout should skip the child
	 * @return This row data
	 */
	public RowData setExcluded(boolean exclude) {
		isExcluded = exclude;
		return this;
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder("RowData{");
		str.append(theWidth == SWT.DEFAULT ? "default" : String.valueOf(theWidth)).append('x');
		str.append(theHeight == SWT.DEFAULT ? "default" : String.valueOf(theHeight));
		if (isExcluded)
			str.append(", excluded");
		return str.append('}').toString();
	}
}
