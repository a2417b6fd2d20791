package org.swtlayout.layout;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.swtlayout.SWT;
import org.swtlayout.graphics.Point;
import org.swtlayout.graphics.Rectangle;
import org.swtlayout.widgets.Composite;
import org.swtlayout.widgets.Control;
import org.swtlayout.widgets.Layout;

/**
 * <p>
 * Arranges children in a grid with a fixed number of columns, filling cells left-to-right and top-to-bottom in child order. Each child's
 * {@link GridData} controls how many columns and rows it spans, how it is aligned within the spanned cells, and whether its columns and
 * rows grab surplus space.
 * </p>
 * <p>
 * Each column is as wide as the widest child spanning only that column (children spanning several columns do not size columns), and each
 * row is as tall as the tallest child spanning only that row. Surplus space in the container is divided equally among the columns (or
 * rows) containing a child that grabs excess space in that direction. The remainder of that division is not distributed.
 * </p>
 * <p>
 * The column widths, row heights and total size computed with no hints are cached until {@link #flushCache(Control) flushed}, a layout
 * or size computation requests a flush, or a property of this layout changes.
 * </p>
 */
public class GridLayout implements Layout {
	private int theNumColumns;
	private boolean isMakeColumnsEqualWidth;
	private int theMarginWidth;
	private int theMarginHeight;
	private int theMarginLeft;
	private int theMarginTop;
	private int theMarginRight;
	private int theMarginBottom;
	private int theHorizontalSpacing;
	private int theVerticalSpacing;

	private SizeCache theCache;

	/** Creates a single-column grid layout */
	public GridLayout() {
		this(1, false);
	}

	/** @param numColumns The number of columns in the grid */
	public GridLayout(int numColumns) {
		this(numColumns, false);
	}

	/**
	 * @param numColumns The number of columns in the grid
	 * @param makeColumnsEqualWidth Whether all columns should be as wide as the widest one
	 */
	public GridLayout(int numColumns, boolean makeColumnsEqualWidth) {
		setNumColumns(numColumns);
		isMakeColumnsEqualWidth = makeColumnsEqualWidth;
		theMarginWidth = theMarginHeight = 5;
		theHorizontalSpacing = theVerticalSpacing = 5;
	}

	/** @return The number of columns in the grid */
	public int getNumColumns() {
		return theNumColumns;
	}

	/**
	 * @param numColumns The number of columns in the grid
	 * @return This layout
	 * @throws IllegalArgumentException If <code>numColumns&lt;1</code>
	 */
	public GridLayout setNumColumns(int numColumns) throws IllegalArgumentException {
		if (numColumns < 1)
			throw new IllegalArgumentException("Number of columns must be at least 1, not " + numColumns);
		theNumColumns = numColumns;
		theCache = null;
		return this;
	}

	/** @return Whether all columns are made as wide as the widest one */
	public boolean isMakeColumnsEqualWidth() {
		return isMakeColumnsEqualWidth;
	}

	/**
	 * @param equalWidth Whether all columns should be made as wide as the widest one
	 * @return This layout
	 */
	public GridLayout setMakeColumnsEqualWidth(boolean equalWidth) {
		isMakeColumnsEqualWidth = equalWidth;
		theCache = null;
		return this;
	}

	/** @return The space left at the left and right edges, unless overridden by {@link #getMarginLeft()}/{@link #getMarginRight()} */
	public int getMarginWidth() {
		return theMarginWidth;
	}

	/**
	 * @param marginWidth The space to leave at the left and right edges
	 * @return This layout
	 */
	public GridLayout setMarginWidth(int marginWidth) {
		theMarginWidth = LayoutUtils.checkNonNegative("margin width", marginWidth);
		theCache = null;
		return this;
	}

	/** @return The space left at the top and bottom edges, unless overridden by {@link #getMarginTop()}/{@link #getMarginBottom()} */
	public int getMarginHeight() {
		return theMarginHeight;
	}

	/**
	 * @param marginHeight The space to leave at the top and bottom edges
	 * @return This layout
	 */
	public GridLayout setMarginHeight(int marginHeight) {
		theMarginHeight = LayoutUtils.checkNonNegative("margin height", marginHeight);
		theCache = null;
		return this;
	}

	/** @return The space left at the left edge, or 0 to use the {@link #getMarginWidth() margin width} */
	public int getMarginLeft() {
		return theMarginLeft;
	}

	/**
	 * @param marginLeft The space to leave at the left edge, or 0 to use the {@link #getMarginWidth() margin width}
	 * @return This layout
	 */
	public GridLayout setMarginLeft(int marginLeft) {
		theMarginLeft = LayoutUtils.checkNonNegative("margin left", marginLeft);
		theCache = null;
		return this;
	}

	/** @return The space left at the top edge, or 0 to use the {@link #getMarginHeight() margin height} */
	public int getMarginTop() {
		return theMarginTop;
	}

	/**
	 * @param marginTop The space to leave at the top edge, or 0 to use the {@link #getMarginHeight() margin height}
	 * @return This layout
	 */
	public GridLayout setMarginTop(int marginTop) {
		theMarginTop = LayoutUtils.checkNonNegative("margin top", marginTop);
		theCache = null;
		return this;
	}

	/** @return The space left at the right edge, or 0 to use the {@link #getMarginWidth() margin width} */
	public int getMarginRight() {
		return theMarginRight;
	}

	/**
	 * @param marginRight The space to leave at the right edge, or 0 to use the {@link #getMarginWidth() margin width}
	 * @return This layout
	 */
	public GridLayout setMarginRight(int marginRight) {
		theMarginRight = LayoutUtils.checkNonNegative("margin right", marginRight);
		theCache = null;
		return this;
	}

	/** @return The space left at the bottom edge, or 0 to use the {@link #getMarginHeight() margin height} */
	public int getMarginBottom() {
		return theMarginBottom;
	}

	/**
	 * @param marginBottom The space to leave at the bottom edge, or 0 to use the {@link #getMarginHeight() margin height}
	 * @return This layout
	 */
	public GridLayout setMarginBottom(int marginBottom) {
		theMarginBottom = LayoutUtils.checkNonNegative("margin bottom", marginBottom);
		theCache = null;
		return this;
	}

	/** @return The space between adjacent columns */
	public int getHorizontalSpacing() {
		return theHorizontalSpacing;
	}

	/**
	 * @param spacing The space to leave between adjacent columns
	 * @return This layout
	 */
	public GridLayout setHorizontalSpacing(int spacing) {
		theHorizontalSpacing = LayoutUtils.checkNonNegative("horizontal spacing", spacing);
		theCache = null;
		return this;
	}

	/** @return The space between adjacent rows */
	public int getVerticalSpacing() {
		return theVerticalSpacing;
	}

	/**
	 * @param spacing The space to leave between adjacent rows
	 * @return This layout
	 */
	public GridLayout setVerticalSpacing(int spacing) {
		theVerticalSpacing = LayoutUtils.checkNonNegative("vertical spacing", spacing);
		theCache = null;
		return this;
	}

	/**
	 * Sets all margins and spacings to zero
	 *
	 * @return This layout
	 */
	public GridLayout tight() {
		theMarginWidth = theMarginHeight = 0;
		theMarginLeft = theMarginTop = theMarginRight = theMarginBottom = 0;
		theHorizontalSpacing = theVerticalSpacing = 0;
		theCache = null;
		return this;
	}

	int getLeadingMargin(boolean vertical) {
		return vertical ? LayoutUtils.effectiveMargin(theMarginTop, theMarginHeight)
			: LayoutUtils.effectiveMargin(theMarginLeft, theMarginWidth);
	}

	int getTrailingMargin(boolean vertical) {
		return vertical ? LayoutUtils.effectiveMargin(theMarginBottom, theMarginHeight)
			: LayoutUtils.effectiveMargin(theMarginRight, theMarginWidth);
	}

	@Override
	public boolean flushCache(Control control) {
		boolean flushed = theCache != null;
		theCache = null;
		return flushed;
	}

	@Override
	public Point computeSize(Composite composite, int wHint, int hHint, boolean flushCache) {
		if (flushCache)
			theCache = null;
		boolean unhinted = wHint == SWT.DEFAULT && hHint == SWT.DEFAULT;
		if (unhinted && theCache != null && theCache.size != null)
			return theCache.size;
		Grid grid = buildGrid(composite, flushCache);
		int marginW = getLeadingMargin(false) + getTrailingMargin(false);
		int marginH = getLeadingMargin(true) + getTrailingMargin(true);
		if (grid.children.isEmpty())
			return new Point(marginW, marginH);
		int[] widths = computeColumnWidths(grid);
		int[] heights = computeRowHeights(grid);
		Point size = new Point(//
			sum(widths) + theHorizontalSpacing * (widths.length - 1) + marginW, //
			sum(heights) + theVerticalSpacing * (heights.length - 1) + marginH);
		if (unhinted)
			theCache = new SizeCache(widths, heights, size);
		return size;
	}

	@Override
	public boolean layout(Composite composite, boolean flushCache) {
		if (flushCache)
			theCache = null;
		Grid grid = buildGrid(composite, flushCache);
		if (grid.children.isEmpty())
			return true;
		int[] widths, heights;
		if (theCache != null && theCache.columnWidths.length == theNumColumns && theCache.rowHeights.length == grid.getRowCount()) {
			widths = theCache.columnWidths.clone();
			heights = theCache.rowHeights.clone();
		} else {
			widths = computeColumnWidths(grid);
			heights = computeRowHeights(grid);
			theCache = new SizeCache(widths.clone(), heights.clone(), null);
		}

		Rectangle area = composite.getClientArea();
		int availableW = area.width - getLeadingMargin(false) - getTrailingMargin(false);
		int availableH = area.height - getLeadingMargin(true) - getTrailingMargin(true);
		distribute(widths, availableW - sum(widths) - theHorizontalSpacing * (widths.length - 1), getGrabbing(grid, false));
		distribute(heights, availableH - sum(heights) - theVerticalSpacing * (heights.length - 1), getGrabbing(grid, true));

		int[] xs = positions(widths, area.x + getLeadingMargin(false), theHorizontalSpacing);
		int[] ys = positions(heights, area.y + getLeadingMargin(true), theVerticalSpacing);
		int[] bounds = new int[4];
		for (GridChild child : grid.children) {
			int cellW = spannedSize(widths, child.column, child.hSpan, theHorizontalSpacing);
			int cellH = spannedSize(heights, child.row, child.vSpan, theVerticalSpacing);
			align(false, child.data.getHorizontalAlignment(), xs[child.column], cellW, child.data.getHorizontalIndent(), child.size.x,
				child.data.getWidthHint(), child.data.getMinimumWidth(), bounds);
			align(true, child.data.getVerticalAlignment(), ys[child.row], cellH, child.data.getVerticalIndent(), child.size.y,
				child.data.getHeightHint(), child.data.getMinimumHeight(), bounds);
			child.control.setBounds(bounds[0], bounds[1], bounds[2], bounds[3]);
		}
		return true;
	}

	Grid buildGrid(Composite composite, boolean flushCache) {
		Grid grid = new Grid(theNumColumns);
		int row = 0, col = 0;
		for (Control child : Layout.layoutChildren(composite)) {
			GridData data = Layout.getLayoutData(child, GridData.class);
			if (data == null)
				data = new GridData();
			else if (data.isExcluded())
				continue;
			// Find the next free cell
			while (true) {
				if (col >= theNumColumns) {
					row++;
					col = 0;
				}
				grid.ensureRows(row + 1);
				if (grid.get(row, col) < 0)
					break;
				col++;
			}
			int maxSpan = Math.min(data.getHorizontalSpan(), theNumColumns - col);
			int hSpan = 1;
			while (hSpan < maxSpan && grid.get(row, col + hSpan) < 0)
				hSpan++;
			int vSpan = data.getVerticalSpan();
			grid.ensureRows(row + vSpan);

			Point size = child.computeSize(data.getWidthHint(), data.getHeightHint(), flushCache);
			size = new Point(Math.max(size.x, data.getMinimumWidth()), Math.max(size.y, data.getMinimumHeight()));
			grid.place(new GridChild(child, data, row, col, hSpan, vSpan, size));
			col += hSpan;
		}
		return grid;
	}

	int[] computeColumnWidths(Grid grid) {
		int[] widths = new int[theNumColumns];
		for (GridChild child : grid.children) {
			if (child.hSpan == 1)
				widths[child.column] = Math.max(widths[child.column], child.size.x + child.data.getHorizontalIndent());
		}
		if (isMakeColumnsEqualWidth)
			Arrays.fill(widths, Arrays.stream(widths).max().orElse(0));
		return widths;
	}

	int[] computeRowHeights(Grid grid) {
		int[] heights = new int[grid.getRowCount()];
		for (GridChild child : grid.children) {
			if (child.vSpan == 1)
				heights[child.row] = Math.max(heights[child.row], child.size.y + child.data.getVerticalIndent());
		}
		return heights;
	}

	private static boolean[] getGrabbing(Grid grid, boolean vertical) {
		boolean[] grabbing = new boolean[vertical ? grid.getRowCount() : grid.numColumns];
		for (GridChild child : grid.children) {
			if (vertical ? child.data.isGrabExcessVerticalSpace() : child.data.isGrabExcessHorizontalSpace()) {
				int start = vertical ? child.row : child.column;
				int span = vertical ? child.vSpan : child.hSpan;
				for (int i = start; i < start + span && i < grabbing.length; i++)
					grabbing[i] = true;
			}
		}
		return grabbing;
	}

	/**
	 * Adds an equal share of surplus space to each grabbing column or row. The remainder of the division is dropped.
	 *
	 * @param sizes The column widths or row heights to modify
	 * @param extra The surplus space
	 * @param grabbing Whether each column or row grabs excess space
	 */
	static void distribute(int[] sizes, int extra, boolean[] grabbing) {
		if (extra <= 0)
			return;
		int grabCount = 0;
		for (boolean grab : grabbing) {
			if (grab)
				grabCount++;
		}
		if (grabCount == 0)
			return;
		int share = extra / grabCount;
		for (int i = 0; i < sizes.length; i++) {
			if (grabbing[i])
				sizes[i] += share;
		}
	}

	private static int[] positions(int[] sizes, int start, int spacing) {
		int[] positions = new int[sizes.length];
		int pos = start;
		for (int i = 0; i < sizes.length; i++) {
			positions[i] = pos;
			pos += sizes[i] + spacing;
		}
		return positions;
	}

	private static int spannedSize(int[] sizes, int start, int span, int spacing) {
		int size = 0;
		for (int i = start; i < start + span && i < sizes.length; i++) {
			if (i > start)
				size += spacing;
			size += sizes[i];
		}
		return size;
	}

	private static void align(boolean vertical, GridData.Alignment alignment, int cellPos, int cellSize, int indent, int preferred,
		int hint, int minimum, int[] bounds) {
		int available = cellSize - indent;
		int pos, size;
		switch (alignment) {
		case BEGINNING:
			size = Math.min(preferred, available);
			pos = cellPos + indent;
			break;
		case CENTER:
			size = Math.min(preferred, available);
			pos = cellPos + indent + (available - size) / 2;
			break;
		case END:
			size = Math.min(preferred, available);
			pos = cellPos + cellSize - size;
			break;
		case FILL:
			size = available;
			pos = cellPos + indent;
			break;
		default:
			throw new IllegalStateException("Unrecognized alignment: " + alignment);
		}
		if (hint != SWT.DEFAULT)
			size = hint;
		size = Math.max(size, minimum);
		bounds[vertical ? 1 : 0] = pos;
		bounds[vertical ? 3 : 2] = size;
	}

	private static int sum(int[] values) {
		int sum = 0;
		for (int v : values)
			sum += v;
		return sum;
	}

	@Override
	public String toString() {
		return "GridLayout(" + theNumColumns + (isMakeColumnsEqualWidth ? " equal columns)" : " columns)");
	}

	/** A child placed in the grid, with its origin cell, its clamped spans and its preferred size */
	static class GridChild {
		final Control control;
		final GridData data;
		final int row;
		final int column;
		final int hSpan;
		final int vSpan;
		final Point size;

		GridChild(Control control, GridData data, int row, int column, int hSpan, int vSpan, Point size) {
			this.control = control;
			this.data = data;
			this.row = row;
			this.column = column;
			this.hSpan = hSpan;
			this.vSpan = vSpan;
			this.size = size;
		}

		@Override
		public String toString() {
			return control + "@(" + row + ", " + column + ")";
		}
	}

	/**
	 * The cell occupancy table. Each cell holds the index of the {@link GridChild} occupying it in {@link #children}, or -1 if the cell is
	 * empty. Cells are never overwritten: the first child to claim a cell keeps it.
	 */
	static class Grid {
		final int numColumns;
		final List<int[]> cells;
		final List<GridChild> children;

		Grid(int numColumns) {
			this.numColumns = numColumns;
			cells = new ArrayList<>();
			children = new ArrayList<>();
		}

		int getRowCount() {
			return cells.size();
		}

		int get(int row, int column) {
			return cells.get(row)[column];
		}

		void ensureRows(int rowCount) {
			while (cells.size() < rowCount) {
				int[] row = new int[numColumns];
				Arrays.fill(row, -1);
				cells.add(row);
			}
		}

		void place(GridChild child) {
			int index = children.size();
			children.add(child);
			for (int r = child.row; r < child.row + child.vSpan; r++) {
				int[] row = cells.get(r);
				for (int c = child.column; c < child.column + child.hSpan; c++) {
					if (row[c] < 0)
						row[c] = index;
				}
			}
		}

		GridChild getChildAt(int row, int column) {
			int index = get(row, column);
			return index < 0 ? null : children.get(index);
		}
	}

	private static class SizeCache {
		final int[] columnWidths;
		final int[] rowHeights;
		final Point size;

		SizeCache(int[] columnWidths, int[] rowHeights, Point size) {
			this.columnWidths = columnWidths;
			this.rowHeights = rowHeights;
			this.size = size;
		}
	}
}
