package org.swtlayout.graphics;

/** Immutable integer bounds: the client area of a container or the computed bounds of a child */
public final class Rectangle {
	/** A zero-size rectangle at the origin */
	public static final Rectangle EMPTY = new Rectangle(0, 0, 0, 0);

	/** The x coordinate of the upper-left corner */
	public final int x;
	/** The y coordinate of the upper-left corner */
	public final int y;
	/** The horizontal extent */
	public final int width;
	/** The vertical extent */
	public final int height;

	/**
	 * @param x The x coordinate of the upper-left corner
	 * @param y The y coordinate of the upper-left corner
	 * @param width The horizontal extent
	 * @param height The vertical extent
	 */
	public Rectangle(int x, int y, int width, int height) {
		this.x = x;
		this.y = y;
		this.width = width;
		this.height = height;
	}

	/** @return The x coordinate just past the right edge */
	public int getRight() {
		return x + width;
	}

	/** @return The y coordinate just past the bottom edge */
	public int getBottom() {
		return y + height;
	}

	/** @return The location of the upper-left corner */
	public Point getLocation() {
		return new Point(x, y);
	}

	/** @return The width and height of this rectangle */
	public Point getSize() {
		return new Point(width, height);
	}

	/** @return Whether this rectangle covers no area */
	public boolean isEmpty() {
		return width <= 0 || height <= 0;
	}

	/**
	 * @param px The x coordinate to test
	 * @param py The y coordinate to test
	 * @return Whether the given point lies inside this rectangle
	 */
	public boolean contains(int px, int py) {
		return px >= x && py >= y && px < x + width && py < y + height;
	}

	@Override
	public int hashCode() {
		int hash = x;
		hash = hash * 31 + y;
		hash = hash * 31 + width;
		hash = hash * 31 + height;
		return hash;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this)
			return true;
		else if (!(obj instanceof Rectangle))
			return false;
		Rectangle other = (Rectangle) obj;
		return x == other.x && y == other.y && width == other.width && height == other.height;
	}

	@Override
	public String toString() {
		return "[" + x + ", " + y + ", " + width + "x" + height + "]";
	}
}
