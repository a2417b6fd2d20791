package org.swtlayout.widgets;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.swtlayout.SWT;
import org.swtlayout.graphics.Point;
import org.swtlayout.graphics.Rectangle;

import com.google.common.collect.ImmutableList;

/**
 * <p>
 * A control that contains other controls and delegates their sizing and positioning to a {@link Layout}.
 * </p>
 * <p>
 * The order of the children is the order in which they were created, which is significant to most layouts (e.g. the order in which cells
 * of a grid are filled). The composite keeps each child's layout data and bounds in side tables keyed by the child.
 * </p>
 * <p>
 * This class is not thread-safe. Children, layout data and the layout must not be modified while a layout pass is in progress.
 * </p>
 */
public class Composite extends Control {
	/** The size in each dimension reported for a composite with no layout, or for which the layout reports zero */
	public static final int DEFAULT_SIZE = 64;

	private final List<Control> theChildren = new ArrayList<>();
	private final Map<Control, Object> theLayoutData = new HashMap<>();
	private final Map<Control, Rectangle> theChildBounds = new HashMap<>();
	private Layout theLayout;

	/** @param parent The composite to add this composite to, or null for a root (shell-like) composite */
	public Composite(Composite parent) {
		super(parent);
	}

	/** @return The layout managing this composite's children, or null if there is none */
	public Layout getLayout() {
		return theLayout;
	}

	/**
	 * Sets the layout for this composite's children and lays them out immediately
	 *
	 * @param layout The layout to manage this composite's children
	 */
	public void setLayout(Layout layout) {
		theLayout = layout;
		layout(true);
	}

	/** @return A snapshot of this composite's children, in order */
	public List<Control> getChildren() {
		return ImmutableList.copyOf(theChildren);
	}

	/** @return The interior rectangle available for children, relative to this composite */
	public Rectangle getClientArea() {
		Rectangle bounds = getBounds();
		return new Rectangle(0, 0, bounds.width, bounds.height);
	}

	/**
	 * Removes a child from this composite and re-lays out the remaining children
	 *
	 * @param child The child to remove
	 * @return Whether the control was a child of this composite
	 */
	public boolean removeChild(Control child) {
		if (!theChildren.remove(child))
			return false;
		theLayoutData.remove(child);
		Rectangle bounds = theChildBounds.remove(child);
		child.detached(bounds == null ? Rectangle.EMPTY : bounds);
		layout(true);
		return true;
	}

	/** Lays out this composite's children, discarding any cached layout information */
	public void layout() {
		layout(true);
	}

	/** @param changed Whether cached layout information must be discarded */
	public void layout(boolean changed) {
		layout(changed, false);
	}

	/**
	 * @param changed Whether cached layout information must be discarded
	 * @param all Whether to also lay out all descendant composites after this one
	 */
	public void layout(boolean changed, boolean all) {
		if (theLayout == null)
			return;
		theLayout.layout(this, changed);
		if (all) {
			for (Control child : getChildren()) {
				if (child instanceof Composite)
					((Composite) child).layout(changed, true);
			}
		}
	}

	@Override
	public Point computeSize(int wHint, int hHint, boolean changed) {
		Point size;
		if (theLayout == null)
			size = new Point(DEFAULT_SIZE, DEFAULT_SIZE);
		else {
			size = theLayout.computeSize(this, wHint, hHint, changed);
			if (size.x == 0)
				size = size.withX(DEFAULT_SIZE);
			if (size.y == 0)
				size = size.withY(DEFAULT_SIZE);
		}
		if (wHint != SWT.DEFAULT)
			size = size.withX(wHint);
		if (hHint != SWT.DEFAULT)
			size = size.withY(hHint);
		return size;
	}

	@Override
	protected void resized() {
		layout(false);
	}

	void addChild(Control child) {
		if (theChildren.contains(child))
			return;
		theChildren.add(child);
		layout(true);
	}

	void childChanged(Control child) {
		if (theLayout != null)
			theLayout.flushCache(child);
	}

	Object getChildLayoutData(Control child) {
		return theLayoutData.get(child);
	}

	void setChildLayoutData(Control child, Object layoutData) {
		if (layoutData == null)
			theLayoutData.remove(child);
		else
			theLayoutData.put(child, layoutData);
		childChanged(child);
	}

	Rectangle getChildBounds(Control child) {
		Rectangle bounds = theChildBounds.get(child);
		return bounds == null ? Rectangle.EMPTY : bounds;
	}

	void setChildBounds(Control child, Rectangle bounds) {
		theChildBounds.put(child, bounds);
	}
}
