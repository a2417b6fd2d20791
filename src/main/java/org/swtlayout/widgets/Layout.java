package org.swtlayout.widgets;

import java.util.ArrayList;
import java.util.List;

import org.swtlayout.SWT;
import org.swtlayout.graphics.Point;

/**
 * <p>
 * A layout manager: an algorithm that sizes and positions the children of a {@link Composite}.
 * </p>
 * <p>
 * A layout instance belongs to a single composite. It reads only the children, the client area and each child's layout data, so it may
 * hold no state other than its own configuration and, optionally, a cache that {@link #flushCache(Control)} discards.
 * </p>
 */
public interface Layout {
	/**
	 * Computes the preferred size of the composite. This must not change the bounds of any child.
	 *
	 * @param composite The composite to compute the size of
	 * @param wHint The width hint, or {@link SWT#DEFAULT} for the natural width
	 * @param hHint The height hint, or {@link SWT#DEFAULT} for the natural height
	 * @param flushCache Whether any cached sizing information must be discarded first
	 * @return The preferred width and height of the composite
	 */
	Point computeSize(Composite composite, int wHint, int hHint, boolean flushCache);

	/**
	 * Sets the bounds of each of the composite's children
	 *
	 * @param composite The composite to lay out
	 * @param flushCache Whether any cached sizing information must be discarded first
	 * @return Whether the layout was performed
	 */
	boolean layout(Composite composite, boolean flushCache);

	/**
	 * Called when something about a child that may affect the layout (its layout data or visibility) has changed
	 *
	 * @param control The child that changed
	 * @return Whether this layout held any cached information that was discarded
	 */
	default boolean flushCache(Control control) {
		return false;
	}

	/**
	 * @param composite The composite whose children to lay out
	 * @return All visible children of the composite, in order
	 */
	static List<Control> layoutChildren(Composite composite) {
		List<Control> children = composite.getChildren();
		List<Control> visible = new ArrayList<>(children.size());
		for (Control child : children) {
			if (child.isVisible())
				visible.add(child);
		}
		return visible;
	}

	/**
	 * @param <D> The type of layout data expected
	 * @param control The child to get the layout data of
	 * @param type The type of layout data expected by the layout
	 * @return The control's layout data, or null if it has none or if it is not of the expected type
	 */
	static <D> D getLayoutData(Control control, Class<D> type) {
		Object data = control.getLayoutData();
		if (data == null)
			return null;
		else if (type.isInstance(data))
			return type.cast(data);
		System.err.println("WARNING: Layout data " + data + " of " + control + " is not a " + type.getSimpleName() + ", ignored");
		return null;
	}
}
