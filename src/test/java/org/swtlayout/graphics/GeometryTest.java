package org.swtlayout.graphics;

import org.junit.Assert;
import org.junit.Test;

/** Tests for {@link Point} and {@link Rectangle} */
public class GeometryTest {
	/** Point value semantics */
	@Test
	public void testPoint() {
		Point p = new Point(3, 4);
		Assert.assertEquals(new Point(3, 4), p);
		Assert.assertEquals(new Point(3, 4).hashCode(), p.hashCode());
		Assert.assertNotEquals(new Point(4, 3), p);
		Assert.assertEquals(new Point(7, 4), p.withX(7));
		Assert.assertEquals(new Point(3, 7), p.withY(7));
		Assert.assertEquals(3, p.get(false));
		Assert.assertEquals(4, p.get(true));
		Assert.assertEquals("(3, 4)", p.toString());
	}

	/** Rectangle edges, containment and value semantics */
	@Test
	public void testRectangle() {
		Rectangle r = new Rectangle(10, 20, 30, 40);
		Assert.assertEquals(40, r.getRight());
		Assert.assertEquals(60, r.getBottom());
		Assert.assertEquals(new Point(10, 20), r.getLocation());
		Assert.assertEquals(new Point(30, 40), r.getSize());
		Assert.assertTrue(r.contains(10, 20));
		Assert.assertTrue(r.contains(39, 59));
		Assert.assertFalse(r.contains(40, 59));
		Assert.assertFalse(r.contains(9, 30));
		Assert.assertFalse(r.isEmpty());
		Assert.assertTrue(Rectangle.EMPTY.isEmpty());
		Assert.assertTrue(new Rectangle(-1, -1, 0, 0).isEmpty());
		Assert.assertEquals(new Rectangle(10, 20, 30, 40), r);
		Assert.assertNotEquals(new Rectangle(10, 20, 30, 41), r);
		Assert.assertEquals("[10, 20, 30x40]", r.toString());
	}
}
