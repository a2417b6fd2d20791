package org.swtlayout.layout;

import java.util.ArrayList;
import java.util.List;

import org.swtlayout.SWT;
import org.swtlayout.graphics.Point;
import org.swtlayout.graphics.Rectangle;
import org.swtlayout.widgets.Composite;
import org.swtlayout.widgets.Control;
import org.swtlayout.widgets.Layout;

/**
 * <p>
 * Places children one after another at their preferred size along the flow axis, wrapping to a new row (or column, for a
 * {@link Orientation#VERTICAL vertical} layout) when the next child would overflow the available space.
 * </p>
 * <p>
 * Each child's size comes from its {@link RowData} hints, if any, and otherwise from the child itself. Children whose row data is
 * {@link RowData#isExcluded() excluded} are skipped.
 * </p>
 * <p>
 * Along the cross axis, each row is as thick as its thickest child. Children are stretched to that thickness if {@link #isFill() fill} is
 * set, centered in it if {@link #isCenter() center} is set, and otherwise placed at its leading edge.
 * </p>
 */
public class RowLayout implements Layout {
	private Orientation theOrientation;
	private int theMarginWidth;
	private int theMarginHeight;
	private int theMarginLeft;
	private int theMarginTop;
	private int theMarginRight;
	private int theMarginBottom;
	private int theSpacing;
	private boolean isWrap;
	private boolean isPack;
	private boolean isFill;
	private boolean isCenter;
	private boolean isJustify;

	/** Creates a horizontal row layout */
	public RowLayout() {
		this(Orientation.HORIZONTAL);
	}

	/** @param orientation The direction in which to place children */
	public RowLayout(Orientation orientation) {
		if (orientation == null)
			throw new NullPointerException("Orientation may not be null");
		theOrientation = orientation;
		theMarginLeft = theMarginTop = theMarginRight = theMarginBottom = 3;
		theSpacing = 3;
		isWrap = true;
		isPack = true;
	}

	/** @return The direction in which children are placed */
	public Orientation getOrientation() {
		return theOrientation;
	}

	/**
	 * @param orientation The direction in which to place children
	 * @return This layout
	 */
	public RowLayout setOrientation(Orientation orientation) {
		if (orientation == null)
			throw new NullPointerException("Orientation may not be null");
		theOrientation = orientation;
		return this;
	}

	/** @return Space added to both the left and right margins */
	public int getMarginWidth() {
		return theMarginWidth;
	}

	/**
	 * @param marginWidth Space to add to both the left and right margins
	 * @return This layout
	 */
	public RowLayout setMarginWidth(int marginWidth) {
		theMarginWidth = LayoutUtils.checkNonNegative("margin width", marginWidth);
		return this;
	}

	/** @return Space added to both the top and bottom margins */
	public int getMarginHeight() {
		return theMarginHeight;
	}

	/**
	 * @param marginHeight Space to add to both the top and bottom margins
	 * @return This layout
	 */
	public RowLayout setMarginHeight(int marginHeight) {
		theMarginHeight = LayoutUtils.checkNonNegative("margin height", marginHeight);
		return this;
	}

	/** @return The space left at the left edge, in addition to the {@link #getMarginWidth() margin width} */
	public int getMarginLeft() {
		return theMarginLeft;
	}

	/**
	 * @param marginLeft The space to leave at the left edge
	 * @return This layout
	 */
	public RowLayout setMarginLeft(int marginLeft) {
		theMarginLeft = LayoutUtils.checkNonNegative("margin left", marginLeft);
		return this;
	}

	/** @return The space left at the top edge, in addition to the {@link #getMarginHeight() margin height} */
	public int getMarginTop() {
		return theMarginTop;
	}

	/**
	 * @param marginTop The space to leave at the top edge
	 * @return This layout
	 */
	public RowLayout setMarginTop(int marginTop) {
		theMarginTop = LayoutUtils.checkNonNegative("margin top", marginTop);
		return this;
	}

	/** @return The space left at the right edge, in addition to the {@link #getMarginWidth() margin width} */
	public int getMarginRight() {
		return theMarginRight;
	}

	/**
	 * @param marginRight The space to leave at the right edge
	 * @return This layout
	 */
	public RowLayout setMarginRight(int marginRight) {
		theMarginRight = LayoutUtils.checkNonNegative("margin right", marginRight);
		return this;
	}

	/** @return The space left at the bottom edge, in addition to the {@link #getMarginHeight() margin height} */
	public int getMarginBottom() {
		return theMarginBottom;
	}

	/**
	 * @param marginBottom The space to leave at the bottom edge
	 * @return This layout
	 */
	public RowLayout setMarginBottom(int marginBottom) {
		theMarginBottom = LayoutUtils.checkNonNegative("margin bottom", marginBottom);
		return this;
	}

	/**
	 * Sets all four edge margins and clears the margin width and height
	 *
	 * @param margin The space to leave at each edge
	 * @return This layout
	 */
	public RowLayout setMargins(int margin) {
		LayoutUtils.checkNonNegative("margin", margin);
		theMarginWidth = theMarginHeight = 0;
		theMarginLeft = theMarginTop = theMarginRight = theMarginBottom = margin;
		return this;
	}

	/** @return The space between adjacent children and between adjacent rows */
	public int getSpacing() {
		return theSpacing;
	}

	/**
	 * @param spacing The space to leave between adjacent children and between adjacent rows
	 * @return This layout
	 */
	public RowLayout setSpacing(int spacing) {
		theSpacing = LayoutUtils.checkNonNegative("spacing", spacing);
		return this;
	}

	/** @return Whether children wrap to a new row when the current one is full */
	public boolean isWrap() {
		return isWrap;
	}

	/**
	 * @param wrap Whether children should wrap to a new row when the current one is full
	 * @return This layout
	 */
	public RowLayout setWrap(boolean wrap) {
		isWrap = wrap;
		return this;
	}

	/** @return Whether each child gets its own preferred size, as opposed to all children getting the largest size */
	public boolean isPack() {
		return isPack;
	}

	/**
	 * @param pack Whether each child should get its own preferred size, as opposed to all children getting the largest size
	 * @return This layout
	 */
	public RowLayout setPack(boolean pack) {
		isPack = pack;
		return this;
	}

	/** @return Whether children are stretched across the cross axis to the thickness of their row */
	public boolean isFill() {
		return isFill;
	}

	/**
	 * @param fill Whether children should be stretched across the cross axis to the thickness of their row
	 * @return This layout
	 */
	public RowLayout setFill(boolean fill) {
		isFill = fill;
		return this;
	}

	/** @return Whether children are centered on the cross axis within their row. Ignored if {@link #isFill() fill} is set. */
	public boolean isCenter() {
		return isCenter;
	}

	/**
	 * @param center Whether children should be centered on the cross axis within their row
	 * @return This layout
	 */
	public RowLayout setCenter(boolean center) {
		isCenter = center;
		return this;
	}

	/** @return Whether leftover space in each row is spread evenly around and between its children */
	public boolean isJustify() {
		return isJustify;
	}

	/**
	 * @param justify Whether leftover space in each row should be spread evenly around and between its children
	 * @return This layout
	 */
	public RowLayout setJustify(boolean justify) {
		isJustify = justify;
		return this;
	}

	int getLeadingMargin(boolean vertical) {
		return vertical ? theMarginTop + theMarginHeight : theMarginLeft + theMarginWidth;
	}

	int getTrailingMargin(boolean vertical) {
		return vertical ? theMarginBottom + theMarginHeight : theMarginRight + theMarginWidth;
	}

	@Override
	public Point computeSize(Composite composite, int wHint, int hHint, boolean flushCache) {
		boolean vertical = theOrientation.vertical;
		int mainHint = vertical ? hHint : wHint;
		int available = -1;
		if (mainHint != SWT.DEFAULT)
			available = Math.max(0, mainHint - getLeadingMargin(vertical) - getTrailingMargin(vertical));
		List<Line> lines = wrap(getItems(composite, flushCache), available);
		int main = 0, cross = 0;
		for (int i = 0; i < lines.size(); i++) {
			Line line = lines.get(i);
			main = Math.max(main, line.main);
			if (i > 0)
				cross += theSpacing;
			cross += line.cross;
		}
		main += getLeadingMargin(vertical) + getTrailingMargin(vertical);
		cross += getLeadingMargin(!vertical) + getTrailingMargin(!vertical);
		return vertical ? new Point(cross, main) : new Point(main, cross);
	}

	@Override
	public boolean layout(Composite composite, boolean flushCache) {
		boolean vertical = theOrientation.vertical;
		Rectangle area = composite.getClientArea();
		int mainStart = (vertical ? area.y : area.x) + getLeadingMargin(vertical);
		int available = (vertical ? area.height : area.width) - getLeadingMargin(vertical) - getTrailingMargin(vertical);
		int crossPos = (vertical ? area.x : area.y) + getLeadingMargin(!vertical);
		for (Line line : wrap(getItems(composite, flushCache), Math.max(0, available))) {
			int lead = 0, gap = theSpacing;
			int extra = available - line.main;
			if (isJustify && extra > 0) {
				int share = extra / (line.items.size() + 1);
				lead = share;
				gap += share;
			}
			int mainPos = mainStart + lead;
			for (Item item : line.items) {
				int mainSize = item.size.get(vertical);
				int crossSize = isFill ? line.cross : item.size.get(!vertical);
				int crossOffset = 0;
				if (isCenter && !isFill)
					crossOffset = (line.cross - crossSize) / 2;
				if (vertical)
					item.control.setBounds(crossPos + crossOffset, mainPos, crossSize, mainSize);
				else
					item.control.setBounds(mainPos, crossPos + crossOffset, mainSize, crossSize);
				mainPos += mainSize + gap;
			}
			crossPos += line.cross + theSpacing;
		}
		return true;
	}

	private List<Item> getItems(Composite composite, boolean flushCache) {
		List<Item> items = new ArrayList<>();
		int maxW = 0, maxH = 0;
		for (Control child : Layout.layoutChildren(composite)) {
			RowData data = Layout.getLayoutData(child, RowData.class);
			if (data != null && data.isExcluded())
				continue;
			Point size;
			if (data == null)
				size = child.computeSize(SWT.DEFAULT, SWT.DEFAULT, flushCache);
			else
				size = child.computeSize(data.getWidth(), data.getHeight(), flushCache);
			maxW = Math.max(maxW, size.x);
			maxH = Math.max(maxH, size.y);
			items.add(new Item(child, size));
		}
		if (!isPack) {
			Point max = new Point(maxW, maxH);
			for (Item item : items)
				item.size = max;
		}
		return items;
	}

	/**
	 * @param items The items to place
	 * @param available The space available along the flow axis, or &lt;0 if unbounded
	 * @return The rows (or columns) to place the items in
	 */
	private List<Line> wrap(List<Item> items, int available) {
		boolean vertical = theOrientation.vertical;
		List<Line> lines = new ArrayList<>();
		Line line = null;
		for (Item item : items) {
			int main = item.size.get(vertical);
			if (line == null || (isWrap && available >= 0 && line.main + theSpacing + main > available)) {
				line = new Line();
				lines.add(line);
			}
			line.add(item, main, item.size.get(!vertical), theSpacing);
		}
		return lines;
	}

	@Override
	public String toString() {
		StringBuilder str = new StringBuilder("RowLayout(").append(theOrientation);
		if (isWrap)
			str.append(", wrap");
		if (!isPack)
			str.append(", uniform");
		if (isFill)
			str.append(", fill");
		else if (isCenter)
			str.append(", center");
		if (isJustify)
			str.append(", justify");
		return str.append(')').toString();
	}

	private static class Item {
		final Control control;
		Point size;

		Item(Control control, Point size) {
			this.control = control;
			this.size = size;
		}
	}

	/** A row, or a column for a vertical layout */
	private static class Line {
		final List<Item> items = new ArrayList<>();
		int main;
		int cross;

		void add(Item item, int itemMain, int itemCross, int spacing) {
			if (!items.isEmpty())
				main += spacing;
			main += itemMain;
			cross = Math.max(cross, itemCross);
			items.add(item);
		}
	}
}
