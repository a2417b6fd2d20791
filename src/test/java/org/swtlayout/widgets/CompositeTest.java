package org.swtlayout.widgets;

import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.swtlayout.SWT;
import org.swtlayout.graphics.Point;
import org.swtlayout.graphics.Rectangle;
import org.swtlayout.layout.FillLayout;
import org.swtlayout.layout.GridData;
import org.swtlayout.layout.GridLayout;
import org.swtlayout.layout.RowData;
import org.swtlayout.layout.RowLayout;

/** Tests for {@link Composite} and {@link Control} */
public class CompositeTest {
	/** Children are kept in creation order, and the list given out is a snapshot */
	@Test
	public void testChildren() {
		Composite shell = new Composite(null);
		Control a = new Control(shell);
		Composite b = new Composite(shell);
		Control c = new Control(b);

		Assert.assertEquals(Arrays.asList(a, b), shell.getChildren());
		Assert.assertEquals(Arrays.asList(c), b.getChildren());
		Assert.assertSame(b, c.getParent());
		Assert.assertNull(shell.getParent());
		List<Control> children = shell.getChildren();
		try {
			children.add(new Control(null));
			Assert.fail("Children snapshot should not be modifiable");
		} catch (UnsupportedOperationException e) {
			// Expected
		}
	}

	/** Layout data is stored by the parent */
	@Test
	public void testLayoutData() {
		Composite shell = new Composite(null);
		Control a = new Control(shell);
		Assert.assertNull(a.getLayoutData());
		RowData data = new RowData(1, 2);
		a.setLayoutData(data);
		Assert.assertSame(data, a.getLayoutData());
		Assert.assertSame(data, Layout.getLayoutData(a, RowData.class));
		Assert.assertNull(Layout.getLayoutData(a, GridData.class));
		a.setLayoutData(null);
		Assert.assertNull(a.getLayoutData());
	}

	/** A control with no parent has nowhere to keep layout data */
	@Test(expected = IllegalStateException.class)
	public void testRootLayoutData() {
		new Composite(null).setLayoutData(new RowData());
	}

	/** Negative sizes are treated as zero */
	@Test
	public void testNegativeBounds() {
		Composite shell = new Composite(null);
		Control a = new Control(shell);
		a.setBounds(1, 2, -5, -6);
		Assert.assertEquals(new Rectangle(1, 2, 0, 0), a.getBounds());
		shell.setBounds(new Rectangle(5, 5, -1, 10));
		Assert.assertEquals(new Rectangle(0, 0, 0, 10), shell.getClientArea());
	}

	/** Setting the layout lays out immediately, and so does resizing */
	@Test
	public void testLayoutTriggers() {
		Composite shell = new Composite(null);
		shell.setBounds(0, 0, 100, 50);
		Control a = new Control(shell);
		shell.setLayout(new FillLayout());
		Assert.assertEquals(new Rectangle(0, 0, 100, 50), a.getBounds());

		shell.setSize(60, 20);
		Assert.assertEquals(new Rectangle(0, 0, 60, 20), a.getBounds());

		// Moving without resizing does not lay out
		a.setBounds(1, 1, 1, 1);
		shell.setBounds(10, 10, 60, 20);
		Assert.assertEquals(new Rectangle(1, 1, 1, 1), a.getBounds());

		Control b = new Control(shell);
		Assert.assertEquals(new Rectangle(0, 0, 30, 20), a.getBounds());
		Assert.assertEquals(new Rectangle(30, 0, 30, 20), b.getBounds());
	}

	/** Removing a child lays out the rest and detaches it with its last bounds */
	@Test
	public void testRemoveChild() {
		Composite shell = new Composite(null);
		shell.setBounds(0, 0, 200, 50);
		shell.setLayout(new FillLayout());
		Control a = new Control(shell);
		Control b = new Control(shell);
		a.setLayoutData(new RowData());

		Assert.assertTrue(shell.removeChild(a));
		Assert.assertEquals(Arrays.asList(b), shell.getChildren());
		Assert.assertEquals(new Rectangle(0, 0, 200, 50), b.getBounds());
		Assert.assertNull(a.getParent());
		Assert.assertNull(a.getLayoutData());
		Assert.assertEquals(new Rectangle(0, 0, 100, 50), a.getBounds());
		Assert.assertFalse(shell.removeChild(a));
	}

	/** Preferred sizes of composites */
	@Test
	public void testComputeSize() {
		Composite shell = new Composite(null);
		Assert.assertEquals(new Point(Composite.DEFAULT_SIZE, Composite.DEFAULT_SIZE), shell.computeSize(SWT.DEFAULT, SWT.DEFAULT));

		shell.setLayout(new FillLayout());
		// An empty layout reports zero, which is replaced
		Assert.assertEquals(new Point(64, 64), shell.computeSize(SWT.DEFAULT, SWT.DEFAULT));

		new Control(shell);
		new Control(shell);
		Assert.assertEquals(new Point(128, 24), shell.computeSize(SWT.DEFAULT, SWT.DEFAULT));
		Assert.assertEquals(new Point(300, 24), shell.computeSize(300, SWT.DEFAULT));
		Assert.assertEquals(new Point(128, 7), shell.computeSize(SWT.DEFAULT, 7));

		Control leaf = new Control(null);
		Assert.assertEquals(new Point(Control.DEFAULT_WIDTH, Control.DEFAULT_HEIGHT), leaf.computeSize(SWT.DEFAULT, SWT.DEFAULT));
		Assert.assertEquals(new Point(10, Control.DEFAULT_HEIGHT), leaf.computeSize(10, SWT.DEFAULT));
	}

	/** A nested composite's preferred size comes from its own layout */
	@Test
	public void testNestedComputeSize() {
		Composite shell = new Composite(null);
		GridLayout layout = new GridLayout().tight();
		shell.setLayout(layout);
		Composite inner = new Composite(shell);
		inner.setLayout(new FillLayout().setSpacing(2));
		new Control(inner);
		new Control(inner);

		Assert.assertEquals(new Point(130, 24), layout.computeSize(shell, SWT.DEFAULT, SWT.DEFAULT, true));
	}

	/** Laying out with <code>all</code> set recurses into child composites even when they were not resized */
	@Test
	public void testLayoutAll() {
		Composite shell = new Composite(null);
		shell.setBounds(0, 0, 200, 100);
		shell.setLayout(new FillLayout());
		Composite inner = new Composite(shell);
		FillLayout innerLayout = new FillLayout();
		inner.setLayout(innerLayout);
		Control a = new Control(inner);
		Control b = new Control(inner);
		shell.layout(true);
		Assert.assertEquals(new Rectangle(100, 0, 100, 100), b.getBounds());

		innerLayout.setSpacing(10);
		shell.layout(true);
		Assert.assertEquals(new Rectangle(100, 0, 100, 100), b.getBounds());

		shell.layout(true, true);
		Assert.assertEquals(new Rectangle(0, 0, 95, 100), a.getBounds());
		Assert.assertEquals(new Rectangle(105, 0, 95, 100), b.getBounds());
	}

	/** A subclass sized from its own fields is measured before they are set, and correctly once its parent is laid out again */
	@Test
	public void testSubclassSizedFromFields() {
		Composite shell = new Composite(null);
		shell.setBounds(0, 0, 200, 100);
		shell.setLayout(new RowLayout().setMargins(0));
		TextControl label = new TextControl(shell, "hello");
		Assert.assertEquals(new Rectangle(0, 0, 0, 16), label.getBounds());

		shell.layout();
		Assert.assertEquals(new Rectangle(0, 0, 40, 16), label.getBounds());
	}

	/** Names are used for debugging output */
	@Test
	public void testToString() {
		Control a = new Control(null).setName("button");
		Assert.assertEquals("button", a.toString());
		Assert.assertTrue(new Control(null).toString().startsWith("Control@"));
	}

	static class TextControl extends Control {
		private final String theText;

		TextControl(Composite parent, String text) {
			super(parent);
			theText = text;
		}

		@Override
		public Point computeSize(int wHint, int hHint, boolean changed) {
			// Called from the superclass constructor before the text is set
			int width = theText == null ? 0 : theText.length() * 8;
			return new Point(wHint == SWT.DEFAULT ? width : wHint, hHint == SWT.DEFAULT ? 16 : hHint);
		}
	}
}
