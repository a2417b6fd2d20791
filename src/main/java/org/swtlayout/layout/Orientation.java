package org.swtlayout.layout;

/** The direction in which a {@link FillLayout} or {@link RowLayout} places its children */
public enum Orientation {
	/** Children are placed left-to-right */
	HORIZONTAL(false),
	/** Children are placed top-to-bottom */
	VERTICAL(true);

	/** Whether the flow axis of this orientation is the vertical one */
	public final boolean vertical;

	private Orientation(boolean vertical) {
		this.vertical = vertical;
	}
}
