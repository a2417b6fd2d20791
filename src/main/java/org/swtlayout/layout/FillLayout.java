package org.swtlayout.layout;

import java.util.List;

import org.swtlayout.SWT;
import org.swtlayout.graphics.Point;
import org.swtlayout.graphics.Rectangle;
import org.swtlayout.widgets.Composite;
import org.swtlayout.widgets.Control;
import org.swtlayout.widgets.Layout;

/**
 * <p>
 * Lays out all visible children in a single row or column, giving each the same size.
 * </p>
 * <p>
 * Space along the flow axis is divided evenly using integer division, so up to <code>n-1</code> pixels at the trailing edge may be left
 * uncovered when the available space is not a multiple of the number of children.
 * </p>
 * <p>
 * This layout recognizes no layout data.
 * </p>
 */
public class FillLayout implements Layout {
	private Orientation theOrientation;
	private int theMarginWidth;
	private int theMarginHeight;
	private int theSpacing;

	/** Creates a horizontal fill layout */
	public FillLayout() {
		this(Orientation.HORIZONTAL);
	}

	/** @param orientation The direction in which to lay out children */
	public FillLayout(Orientation orientation) {
		if (orientation == null)
			throw new NullPointerException("Orientation may not be null");
		theOrientation = orientation;
	}

	/** @return The direction in which children are laid out */
	public Orientation getOrientation() {
		return theOrientation;
	}

	/**
	 * @param orientation The direction in which to lay out children
	 * @return This layout
	 */
	public FillLayout setOrientation(Orientation orientation) {
		if (orientation == null)
			throw new NullPointerException("Orientation may not be null");
		theOrientation = orientation;
		return this;
	}

	/** @return The space left at the left and right edges of the container */
	public int getMarginWidth() {
		return theMarginWidth;
	}

	/**
	 * @param marginWidth The space to leave at the left and right edges of the container
	 * @return This layout
	 */
	public FillLayout setMarginWidth(int marginWidth) {
		theMarginWidth = LayoutUtils.checkNonNegative("margin width", marginWidth);
		return this;
	}

	/** @return The space left at the top and bottom edges of the container */
	public int getMarginHeight() {
		return theMarginHeight;
	}

	/**
	 * @param marginHeight The space to leave at the top and bottom edges of the container
	 * @return This layout
	 */
	public FillLayout setMarginHeight(int marginHeight) {
		theMarginHeight = LayoutUtils.checkNonNegative("margin height", marginHeight);
		return this;
	}

	/** @return The space between adjacent children */
	public int getSpacing() {
		return theSpacing;
	}

	/**
	 * @param spacing The space to leave between adjacent children
	 * @return This layout
	 */
	public FillLayout setSpacing(int spacing) {
		theSpacing = LayoutUtils.checkNonNegative("spacing", spacing);
		return this;
	}

	@Override
	public Point computeSize(Composite composite, int wHint, int hHint, boolean flushCache) {
		List<Control> children = Layout.layoutChildren(composite);
		if (children.isEmpty())
			return new Point(2 * theMarginWidth, 2 * theMarginHeight);
		int maxW = 0, maxH = 0;
		for (Control child : children) {
			Point size = child.computeSize(SWT.DEFAULT, SWT.DEFAULT, flushCache);
			maxW = Math.max(maxW, size.x);
			maxH = Math.max(maxH, size.y);
		}
		int count = children.size();
		if (theOrientation.vertical)
			return new Point(maxW + 2 * theMarginWidth, maxH * count + theSpacing * (count - 1) + 2 * theMarginHeight);
		else
			return new Point(maxW * count + theSpacing * (count - 1) + 2 * theMarginWidth, maxH + 2 * theMarginHeight);
	}

	@Override
	public boolean layout(Composite composite, boolean flushCache) {
		List<Control> children = Layout.layoutChildren(composite);
		if (children.isEmpty())
			return true;
		Rectangle area = composite.getClientArea();
		int count = children.size();
		int availableW = area.width - 2 * theMarginWidth;
		int availableH = area.height - 2 * theMarginHeight;
		int x = area.x + theMarginWidth;
		int y = area.y + theMarginHeight;
		if (theOrientation.vertical) {
			int childH = (availableH - theSpacing * (count - 1)) / count;
			for (Control child : children) {
				child.setBounds(x, y, availableW, childH);
				y += childH + theSpacing;
			}
		} else {
			int childW = (availableW - theSpacing * (count - 1)) / count;
			for (Control child : children) {
				child.setBounds(x, y, childW, availableH);
				x += childW + theSpacing;
			}
		}
		return true;
	}

	@Override
	public String toString() {
		return "FillLayout(" + theOrientation + ")";
	}
}
