package org.swtlayout.widgets;

import org.swtlayout.SWT;
import org.swtlayout.graphics.Point;
import org.swtlayout.graphics.Rectangle;

/**
 * <p>
 * A child of a {@link Composite}, as seen by a {@link Layout}: something with a visibility flag, a preferred size and bounds that the
 * layout sets.
 * </p>
 * <p>
 * A control's bounds and layout data are held by its parent, not by the control itself. Only a control without a parent stores its own
 * bounds.
 * </p>
 * <p>
 * The constructor adds the control to its parent, which lays the parent out at once. At that point a subclass's own fields are not yet
 * initialized, so a subclass overriding {@link #computeSize(int, int, boolean)} must tolerate being called with them unset, and should
 * call {@link Composite#layout()} on the parent (or change its preferred size) once it is fully constructed.
 * </p>
 */
public class Control {
	/** The preferred width of a control whose preferred size has not been set */
	public static final int DEFAULT_WIDTH = 64;
	/** The preferred height of a control whose preferred size has not been set */
	public static final int DEFAULT_HEIGHT = 24;

	private Composite theParent;
	private String theName;
	private boolean isVisible;
	private Point thePreferredSize;
	private Rectangle theBounds;

	/**
	 * Creates the control and appends it to its parent's children, laying out the parent before any subclass initialization has run
	 *
	 * @param parent The composite to add the control to, or null for a root control
	 */
	public Control(Composite parent) {
		theParent = parent;
		isVisible = true;
		thePreferredSize = new Point(DEFAULT_WIDTH, DEFAULT_HEIGHT);
		theBounds = Rectangle.EMPTY;
		if (parent != null)
			parent.addChild(this);
	}

	/** @return The composite this control is a child of, or null if it has none */
	public Composite getParent() {
		return theParent;
	}

	/** @return The name of this control, for debugging */
	public String getName() {
		return theName;
	}

	/**
	 * @param name The name for this control, for debugging
	 * @return This control
	 */
	public Control setName(String name) {
		theName = name;
		return this;
	}

	/** @return Whether this control is visible. Layouts allocate no space to invisible controls. */
	public boolean isVisible() {
		return isVisible;
	}

	/** @param visible Whether this control should be visible */
	public void setVisible(boolean visible) {
		if (isVisible == visible)
			return;
		isVisible = visible;
		if (theParent != null)
			theParent.childChanged(this);
	}

	/** @return The size this control would like to have when no hint is given */
	public Point getPreferredSize() {
		return thePreferredSize;
	}

	/**
	 * @param width The preferred width for this control
	 * @param height The preferred height for this control
	 * @return This control
	 */
	public Control setPreferredSize(int width, int height) {
		thePreferredSize = new Point(Math.max(0, width), Math.max(0, height));
		if (theParent != null)
			theParent.childChanged(this);
		return this;
	}

	/**
	 * @param wHint The width hint, or {@link SWT#DEFAULT}
	 * @param hHint The height hint, or {@link SWT#DEFAULT}
	 * @return The preferred size of this control
	 */
	public Point computeSize(int wHint, int hHint) {
		return computeSize(wHint, hHint, true);
	}

	/**
	 * @param wHint The width hint, or {@link SWT#DEFAULT}
	 * @param hHint The height hint, or {@link SWT#DEFAULT}
	 * @param changed Whether any cached sizing information must be discarded first
	 * @return The preferred size of this control, with each given hint in place of the corresponding preferred dimension
	 */
	public Point computeSize(int wHint, int hHint, boolean changed) {
		Point size = thePreferredSize;
		if (wHint != SWT.DEFAULT)
			size = size.withX(wHint);
		if (hHint != SWT.DEFAULT)
			size = size.withY(hHint);
		return size;
	}

	/** @return The layout data for this control, or null if it has none */
	public Object getLayoutData() {
		return theParent == null ? null : theParent.getChildLayoutData(this);
	}

	/**
	 * @param layoutData The constraints for the parent's layout to use for this control
	 * @throws IllegalStateException If this control has no parent
	 */
	public void setLayoutData(Object layoutData) throws IllegalStateException {
		if (theParent == null)
			throw new IllegalStateException("Layout data cannot be set on a control with no parent: " + this);
		theParent.setChildLayoutData(this, layoutData);
	}

	/** @return The bounds of this control, relative to its parent */
	public Rectangle getBounds() {
		return theParent == null ? theBounds : theParent.getChildBounds(this);
	}

	/**
	 * @param x The x coordinate for this control
	 * @param y The y coordinate for this control
	 * @param width The width for this control. Negative values are treated as zero.
	 * @param height The height for this control. Negative values are treated as zero.
	 */
	public void setBounds(int x, int y, int width, int height) {
		Rectangle old = getBounds();
		Rectangle bounds = new Rectangle(x, y, Math.max(0, width), Math.max(0, height));
		if (theParent == null)
			theBounds = bounds;
		else
			theParent.setChildBounds(this, bounds);
		if (old.width != bounds.width || old.height != bounds.height)
			resized();
	}

	/** @param bounds The bounds for this control */
	public void setBounds(Rectangle bounds) {
		setBounds(bounds.x, bounds.y, bounds.width, bounds.height);
	}

	/** @return The width and height of this control */
	public Point getSize() {
		return getBounds().getSize();
	}

	/**
	 * @param width The width for this control
	 * @param height The height for this control
	 */
	public void setSize(int width, int height) {
		Rectangle bounds = getBounds();
		setBounds(bounds.x, bounds.y, width, height);
	}

	/** Called after the width or height of this control changes */
	protected void resized() {
	}

	void detached(Rectangle lastBounds) {
		theParent = null;
		theBounds = lastBounds;
	}

	@Override
	public String toString() {
		if (theName != null)
			return theName;
		return getClass().getSimpleName() + "@" + Integer.toHexString(System.identityHashCode(this));
	}
}
