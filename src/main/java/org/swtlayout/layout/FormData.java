package org.swtlayout.layout;

import org.swtlayout.SWT;

/**
 * Layout data for a child of a container using a {@link FormLayout}: an optional {@link FormAttachment} for each of the four sides, plus
 * width and height hints used for a dimension in which at most one side is attached
 */
public class FormData {
	private int theWidth;
	private int theHeight;
	private FormAttachment theLeft;
	private FormAttachment theRight;
	private FormAttachment theTop;
	private FormAttachment theBottom;

	/** Creates form data with no attachments, using the child's natural size */
	public FormData() {
		this(SWT.DEFAULT, SWT.DEFAULT);
	}

	/**
	 * @param width The width hint, or {@link SWT#DEFAULT}
	 * @param height The height hint, or {@link SWT#DEFAULT}
	 */
	public FormData(int width, int height) {
		theWidth = width;
		theHeight = height;
	}

	/** @return The width hint, or {@link SWT#DEFAULT} */
	public int getWidth() {
		return theWidth;
	}

	/**
	 * @param width The width hint, or {@link SWT#DEFAULT}
	 * @return This form data
	 */
	public FormData setWidth(int width) {
		theWidth = width;
		return this;
	}

	/** @return The height hint, or {@link SWT#DEFAULT} */
	public int getHeight() {
		return theHeight;
	}

	/**
	 * @param height The height hint, or {@link SWT#DEFAULT}
	 * @return This form data
	 */
	public FormData setHeight(int height) {
		theHeight = height;
		return this;
	}

	/** @return The attachment for the left side, or null */
	public FormAttachment getLeft() {
		return theLeft;
	}

	/**
	 * @param left The attachment for the left side, or null
	 * @return This form data
	 */
	public FormData setLeft(FormAttachment left) {
		theLeft = left;
		return this;
	}

	/** @return The attachment for the right side, or null */
	public FormAttachment getRight() {
		return theRight;
	}

	/**
	 * @param right The attachment for the right side, or null
	 * @return This form data
	 */
	public FormData setRight(FormAttachment right) {
		theRight = right;
		return this;
	}

	/** @return The attachment for the top side, or null */
	public FormAttachment getTop() {
		return theTop;
	}

	/**
	 * @param top The attachment for the top side, or null
	 * @return This form data
	 */
	public FormData setTop(FormAttachment top) {
		theTop = top;
		return this;
	}

	/** @return The attachment for the bottom side, or null */
	public FormAttachment getBottom() {
		return theBottom;
	}

	/**
	 * @param bottom The attachment for the bottom side, or null
	 * @return This form data
	 */
	public FormData setBottom(FormAttachment bottom) {
		theBottom = bottom;
		return this;
	}

	FormAttachment getLeading(boolean vertical) {
		return vertical ? theTop : theLeft;
	}

	FormAttachment getTrailing(boolean vertical) {
		return vertical ? theBottom : theRight;
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder("FormData{");
		int len = str.length();
		append(str, len, "left", theLeft);
		append(str, len, "right", theRight);
		append(str, len, "top", theTop);
		append(str, len, "bottom", theBottom);
		if (theWidth != SWT.DEFAULT)
			append(str, len, "width", theWidth);
		if (theHeight != SWT.DEFAULT)
			append(str, len, "height", theHeight);
		return str.append('}').toString();
	}

	private static void append(StringBuilder str, int start, String label, Object value) {
		if (value == null)
			return;
		if (str.length() > start)
			str.append(", ");
		str.append(label).append('=').append(value);
	}
}
