package org.swtlayout.layout;

import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.swtlayout.SWT;

/**
 * <p>
 * Layout data for a child of a container using a {@link GridLayout}.
 * </p>
 * <p>
 * Spans are clamped to at least 1 and minimum sizes to at least 0. The layout further clamps the horizontal span so that the child fits in
 * the columns available to it.
 * </p>
 */
public class GridData {
	/** How a child is placed within its cell along one axis */
	public enum Alignment {
		/** At the leading (left or top) edge of the cell, at the child's preferred size */
		BEGINNING,
		/** Centered in the cell, at the child's preferred size */
		CENTER,
		/** At the trailing (right or bottom) edge of the cell, at the child's preferred size */
		END,
		/** Filling the cell */
		FILL;

		static Alignment parse(String text) {
			switch (text.toLowerCase(Locale.ROOT)) {
			case "beginning":
			case "begin":
			case "left":
			case "top":
				return BEGINNING;
			case "center":
				return CENTER;
			case "end":
			case "right":
			case "bottom":
				return END;
			case "fill":
				return FILL;
			default:
				throw new IllegalArgumentException("Unrecognized alignment: \"" + text + "\"");
			}
		}
	}

	private int theHorizontalSpan;
	private int theVerticalSpan;
	private Alignment theHorizontalAlignment;
	private Alignment theVerticalAlignment;
	private boolean isGrabExcessHorizontalSpace;
	private boolean isGrabExcessVerticalSpace;
	private int theWidthHint;
	private int theHeightHint;
	private int theMinimumWidth;
	private int theMinimumHeight;
	private int theHorizontalIndent;
	private int theVerticalIndent;
	private boolean isExcluded;

	/** Creates grid data with all default values */
	public GridData() {
		theHorizontalSpan = theVerticalSpan = 1;
		theHorizontalAlignment = Alignment.BEGINNING;
		theVerticalAlignment = Alignment.CENTER;
		theWidthHint = theHeightHint = SWT.DEFAULT;
	}

	/**
	 * @param horizontalAlignment The horizontal alignment of the child in its cell
	 * @param verticalAlignment The vertical alignment of the child in its cell
	 * @param grabExcessHorizontalSpace Whether the child's column(s) should receive surplus horizontal space
	 * @param grabExcessVerticalSpace Whether the child's row(s) should receive surplus vertical space
	 */
	public GridData(Alignment horizontalAlignment, Alignment verticalAlignment, boolean grabExcessHorizontalSpace,
		boolean grabExcessVerticalSpace) {
		this();
		setHorizontalAlignment(horizontalAlignment);
		setVerticalAlignment(verticalAlignment);
		isGrabExcessHorizontalSpace = grabExcessHorizontalSpace;
		isGrabExcessVerticalSpace = grabExcessVerticalSpace;
	}

	/**
	 * @param horizontalAlignment The horizontal alignment of the child in its cell
	 * @param verticalAlignment The vertical alignment of the child in its cell
	 * @param grabExcessHorizontalSpace Whether the child's column(s) should receive surplus horizontal space
	 * @param grabExcessVerticalSpace Whether the child's row(s) should receive surplus vertical space
	 * @param horizontalSpan The number of columns the child should span
	 * @param verticalSpan The number of rows the child should span
	 */
	public GridData(Alignment horizontalAlignment, Alignment verticalAlignment, boolean grabExcessHorizontalSpace,
		boolean grabExcessVerticalSpace, int horizontalSpan, int verticalSpan) {
		this(horizontalAlignment, verticalAlignment, grabExcessHorizontalSpace, grabExcessVerticalSpace);
		setHorizontalSpan(horizontalSpan);
		setVerticalSpan(verticalSpan);
	}

	/** @return Grid data that fills its cell horizontally and grabs excess horizontal space */
	public static GridData fillHorizontal() {
		return new GridData(Alignment.FILL, Alignment.CENTER, true, false);
	}

	/** @return Grid data that fills its cell vertically and grabs excess vertical space */
	public static GridData fillVertical() {
		return new GridData(Alignment.BEGINNING, Alignment.FILL, false, true);
	}

	/** @return Grid data that fills its cell and grabs excess space in both directions */
	public static GridData fillBoth() {
		return new GridData(Alignment.FILL, Alignment.FILL, true, true);
	}

	/** @return The number of columns the child spans */
	public int getHorizontalSpan() {
		return theHorizontalSpan;
	}

	/**
	 * @param horizontalSpan The number of columns the child should span. Values below 1 are treated as 1.
	 * @return This grid data
	 */
	public GridData setHorizontalSpan(int horizontalSpan) {
		theHorizontalSpan = Math.max(1, horizontalSpan);
		return this;
	}

	/** @return The number of rows the child spans */
	public int getVerticalSpan() {
		return theVerticalSpan;
	}

	/**
	 * @param verticalSpan The number of rows the child should span. Values below 1 are treated as 1.
	 * @return This grid data
	 */
	public GridData setVerticalSpan(int verticalSpan) {
		theVerticalSpan = Math.max(1, verticalSpan);
		return this;
	}

	/** @return The horizontal alignment of the child in its cell */
	public Alignment getHorizontalAlignment() {
		return theHorizontalAlignment;
	}

	/**
	 * @param horizontalAlignment The horizontal alignment of the child in its cell
	 * @return This grid data
	 */
	public GridData setHorizontalAlignment(Alignment horizontalAlignment) {
		if (horizontalAlignment == null)
			throw new NullPointerException("Alignment may not be null");
		theHorizontalAlignment = horizontalAlignment;
		return this;
	}

	/** @return The vertical alignment of the child in its cell */
	public Alignment getVerticalAlignment() {
		return theVerticalAlignment;
	}

	/**
	 * @param verticalAlignment The vertical alignment of the child in its cell
	 * @return This grid data
	 */
	public GridData setVerticalAlignment(Alignment verticalAlignment) {
		if (verticalAlignment == null)
			throw new NullPointerException("Alignment may not be null");
		theVerticalAlignment = verticalAlignment;
		return this;
	}

	/** @return Whether the child's column(s) receive a share of surplus horizontal space */
	public boolean isGrabExcessHorizontalSpace() {
		return isGrabExcessHorizontalSpace;
	}

	/**
	 * @param grab Whether the child's column(s) should receive a share of surplus horizontal space
	 * @return This grid data
	 */
	public GridData setGrabExcessHorizontalSpace(boolean grab) {
		isGrabExcessHorizontalSpace = grab;
		return this;
	}

	/** @return Whether the child's row(s) receive a share of surplus vertical space */
	public boolean isGrabExcessVerticalSpace() {
		return isGrabExcessVerticalSpace;
	}

	/**
	 * @param grab Whether the child's row(s) should receive a share of surplus vertical space
	 * @return This grid data
	 */
	public GridData setGrabExcessVerticalSpace(boolean grab) {
		isGrabExcessVerticalSpace = grab;
		return this;
	}

	/** @return The width for the child, overriding both its preferred width and its alignment, or {@link SWT#DEFAULT} */
	public int getWidthHint() {
		return theWidthHint;
	}

	/**
	 * @param widthHint The width for the child, or {@link SWT#DEFAULT}
	 * @return This grid data
	 */
	public GridData setWidthHint(int widthHint) {
		theWidthHint = widthHint;
		return this;
	}

	/** @return The height for the child, overriding both its preferred height and its alignment, or {@link SWT#DEFAULT} */
	public int getHeightHint() {
		return theHeightHint;
	}

	/**
	 * @param heightHint The height for the child, or {@link SWT#DEFAULT}
	 * @return This grid data
	 */
	public GridData setHeightHint(int heightHint) {
		theHeightHint = heightHint;
		return this;
	}

	/** @return The smallest width the child may be given */
	public int getMinimumWidth() {
		return theMinimumWidth;
	}

	/**
	 * @param minimumWidth The smallest width the child may be given
	 * @return This grid data
	 */
	public GridData setMinimumWidth(int minimumWidth) {
		theMinimumWidth = Math.max(0, minimumWidth);
		return this;
	}

	/** @return The smallest height the child may be given */
	public int getMinimumHeight() {
		return theMinimumHeight;
	}

	/**
	 * @param minimumHeight The smallest height the child may be given
	 * @return This grid data
	 */
	public GridData setMinimumHeight(int minimumHeight) {
		theMinimumHeight = Math.max(0, minimumHeight);
		return this;
	}

	/** @return The space left between the leading edge of the cell and the child */
	public int getHorizontalIndent() {
		return theHorizontalIndent;
	}

	/**
	 * @param horizontalIndent The space to leave between the left edge of the cell and the child
	 * @return This grid data
	 */
	public GridData setHorizontalIndent(int horizontalIndent) {
		theHorizontalIndent = horizontalIndent;
		return this;
	}

	/** @return The space left between the top edge of the cell and the child */
	public int getVerticalIndent() {
		return theVerticalIndent;
	}

	/**
	 * @param verticalIndent The space to leave between the top edge of the cell and the child
	 * @return This grid data
	 */
	public GridData setVerticalIndent(int verticalIndent) {
		theVerticalIndent = verticalIndent;
		return this;
	}

	/** @return Whether the layout skips the child, giving it no cell */
	public boolean isExcluded() {
		return isExcluded;
	}

	/**
	 * @param exclude Whether the layout should skip the child
	 * @return This grid data
	 */
	public GridData setExcluded(boolean exclude) {
		isExcluded = exclude;
		return this;
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder("GridData{");
		str.append("span=").append(theHorizontalSpan).append('x').append(theVerticalSpan);
		str.append(", align=").append(theHorizontalAlignment).append('/').append(theVerticalAlignment);
		if (isGrabExcessHorizontalSpace)
			str.append(", grab-h");
		if (isGrabExcessVerticalSpace)
			str.append(", grab-v");
		if (theWidthHint != SWT.DEFAULT)
			str.append(", width=").append(theWidthHint);
		if (theHeightHint != SWT.DEFAULT)
			str.append(", height=").append(theHeightHint);
		if (isExcluded)
			str.append(", excluded");
		return str.append('}').toString();
	}

	private static final Pattern CONSTRAINT_PATTERN = Pattern.compile("(?<type>[a-zA-Z-]+)([=:](?<value>.+))?");

	/**
	 * Parses grid data from text, e.g. <code>"h-span=2 h-align=fill grab-h"</code>. Each whitespace-separated token is
	 * <code>type=value</code> or <code>type:value</code>. The boolean types (<code>grab-h</code>, <code>grab-v</code> and
	 * <code>exclude</code>) may be given without a value to mean <code>true</code>.
	 *
	 * @param constraints The text to parse
	 * @return The parsed grid data
	 * @throws IllegalArgumentException If the text could not be parsed
	 */
	public static GridData parse(String constraints) throws IllegalArgumentException {
		GridData data = new GridData();
		String trimmed = constraints.trim();
		if (trimmed.isEmpty())
			return data;
		Set<String> specified = new HashSet<>();
		for (String c : trimmed.split("\\s+")) {
			Matcher m = CONSTRAINT_PATTERN.matcher(c);
			if (!m.matches())
				throw new IllegalArgumentException("Unrecognized constraint: \"" + c + "\"--expecting \"type[=:]value\"");
			String type = m.group("type").toLowerCase(Locale.ROOT);
			String value = m.group("value");
			switch (type) {
			case "horizontal-span":
				type = "h-span";
				break;
			case "vertical-span":
				type = "v-span";
				break;
			case "w":
				type = "width";
				break;
			case "h":
				type = "height";
				break;
			case "min-w":
				type = "min-width";
				break;
			case "min-h":
				type = "min-height";
				break;
			default:
				break;
			}
			if (!specified.add(type))
				throw new IllegalArgumentException(type + " specified twice");
			switch (type) {
			case "h-span":
				data.setHorizontalSpan(parseInt(type, value));
				break;
			case "v-span":
				data.setVerticalSpan(parseInt(type, value));
				break;
			case "h-align":
				data.setHorizontalAlignment(Alignment.parse(requireValue(type, value)));
				break;
			case "v-align":
				data.setVerticalAlignment(Alignment.parse(requireValue(type, value)));
				break;
			case "grab-h":
				data.setGrabExcessHorizontalSpace(parseBoolean(type, value));
				break;
			case "grab-v":
				data.setGrabExcessVerticalSpace(parseBoolean(type, value));
				break;
			case "width":
				data.setWidthHint(parseInt(type, value));
				break;
			case "height":
				data.setHeightHint(parseInt(type, value));
				break;
			case "min-width":
				data.setMinimumWidth(parseInt(type, value));
				break;
			case "min-height":
				data.setMinimumHeight(parseInt(type, value));
				break;
			case "h-indent":
				data.setHorizontalIndent(parseInt(type, value));
				break;
			case "v-indent":
				data.setVerticalIndent(parseInt(type, value));
				break;
			case "exclude":
				data.setExcluded(parseBoolean(type, value));
				break;
			default:
				throw new IllegalArgumentException("Unrecognized constraint type: " + type);
			}
		}
		return data;
	}

	private static String requireValue(String type, String value) {
		if (value == null)
			throw new IllegalArgumentException(type + " requires a value");
		return value;
	}

	private static int parseInt(String type, String value) {
		requireValue(type, value);
		if ("default".equalsIgnoreCase(value))
			return SWT.DEFAULT;
		try {
			return Integer.parseInt(value.endsWith("px") ? value.substring(0, value.length() - 2) : value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Bad value for " + type + ": \"" + value + "\"", e);
		}
	}

	private static boolean parseBoolean(String type, String value) {
		if (value == null)
			return true;
		switch (value.toLowerCase(Locale.ROOT)) {
		case "true":
			return true;
		case "false":
			return false;
		default:
			throw new IllegalArgumentException("Bad value for " + type + ": \"" + value + "\"--expecting true or false");
		}
	}
}
