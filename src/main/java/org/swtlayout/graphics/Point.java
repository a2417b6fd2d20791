package org.swtlayout.graphics;

/** An immutable pair of integers, used both as a position (x, y) and as a size (width, height) */
public final class Point {
	/** The x coordinate, or the width when this point represents a size */
	public final int x;
	/** The y coordinate, or the height when this point represents a size */
	public final int y;

	/**
	 * @param x The x coordinate or width
	 * @param y The y coordinate or height
	 */
	public Point(int x, int y) {
		this.x = x;
		this.y = y;
	}

	/**
	 * @param width The width for the new point
	 * @return A point with the given width and this point's height
	 */
	public Point withX(int width) {
		return width == x ? this : new Point(width, y);
	}

	/**
	 * @param height The height for the new point
	 * @return A point with this point's width and the given height
	 */
	public Point withY(int height) {
		return height == y ? this : new Point(x, height);
	}

	/**
	 * @param vertical Whether to get the vertical component
	 * @return {@link #y} if <code>vertical</code>, otherwise {@link #x}
	 */
	public int get(boolean vertical) {
		return vertical ? y : x;
	}

	@Override
	public int hashCode() {
		return x * 31 + y;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this)
			return true;
		else if (!(obj instanceof Point))
			return false;
		return x == ((Point) obj).x && y == ((Point) obj).y;
	}

	@Override
	public String toString() {
		return "(" + x + ", " + y + ")";
	}
}
