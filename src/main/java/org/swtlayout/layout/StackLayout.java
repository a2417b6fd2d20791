package org.swtlayout.layout;

import org.swtlayout.graphics.Point;
import org.swtlayout.graphics.Rectangle;
import org.swtlayout.widgets.Composite;
import org.swtlayout.widgets.Control;
import org.swtlayout.widgets.Layout;

/**
 * <p>
 * Shows a single child, the {@link #getTopControl() top control}, filling the client area inside the margins. Every other child is hidden
 * by giving it {@link #HIDDEN_BOUNDS zero size outside the container}.
 * </p>
 * <p>
 * An invisible top control is hidden like the other children, and contributes nothing to the preferred size.
 * </p>
 * <p>
 * Changing the top control does not lay out the container. The caller must call {@link Composite#layout()} afterward.
 * </p>
 */
public class StackLayout implements Layout {
	/** The bounds given to every child but the top control */
	public static final Rectangle HIDDEN_BOUNDS = new Rectangle(-1, -1, 0, 0);

	private int theMarginWidth;
	private int theMarginHeight;
	private Control theTopControl;

	/** @return The space left at the left and right edges */
	public int getMarginWidth() {
		return theMarginWidth;
	}

	/**
	 * @param marginWidth The space to leave at the left and right edges
	 * @return This layout
	 */
	public StackLayout setMarginWidth(int marginWidth) {
		theMarginWidth = LayoutUtils.checkNonNegative("margin width", marginWidth);
		return this;
	}

	/** @return The space left at the top and bottom edges */
	public int getMarginHeight() {
		return theMarginHeight;
	}

	/**
	 * @param marginHeight The space to leave at the top and bottom edges
	 * @return This layout
	 */
	public StackLayout setMarginHeight(int marginHeight) {
		theMarginHeight = LayoutUtils.checkNonNegative("margin height", marginHeight);
		return this;
	}

	/** @return The child to show, or null to show none */
	public Control getTopControl() {
		return theTopControl;
	}

	/**
	 * @param topControl The child to show, or null to show none
	 * @return This layout
	 */
	public StackLayout setTopControl(Control topControl) {
		theTopControl = topControl;
		return this;
	}

	@Override
	public Point computeSize(Composite composite, int wHint, int hHint, boolean flushCache) {
		int marginW = 2 * theMarginWidth, marginH = 2 * theMarginHeight;
		if (theTopControl == null || !theTopControl.isVisible() || !composite.getChildren().contains(theTopControl))
			return new Point(marginW, marginH);
		Point size = theTopControl.computeSize(wHint, hHint, flushCache);
		return new Point(size.x + marginW, size.y + marginH);
	}

	@Override
	public boolean layout(Composite composite, boolean flushCache) {
		Rectangle area = composite.getClientArea();
		int width = Math.max(0, area.width - 2 * theMarginWidth);
		int height = Math.max(0, area.height - 2 * theMarginHeight);
		for (Control child : composite.getChildren()) {
			if (child == theTopControl && child.isVisible())
				child.setBounds(area.x + theMarginWidth, area.y + theMarginHeight, width, height);
			else
				child.setBounds(HIDDEN_BOUNDS);
		}
		return true;
	}

	@Override
	public String toString() {
		return "StackLayout(" + theTopControl + ")";
	}
}
