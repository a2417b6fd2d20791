package org.swtlayout.layout;

import org.junit.Assert;
import org.junit.Test;
import org.swtlayout.SWT;
import org.swtlayout.graphics.Point;
import org.swtlayout.graphics.Rectangle;
import org.swtlayout.widgets.Composite;
import org.swtlayout.widgets.Control;

/** Tests for {@link RowLayout} */
public class RowLayoutTest {
	private static Composite shell(int width, int height, RowLayout layout) {
		Composite shell = new Composite(null);
		shell.setBounds(0, 0, width, height);
		shell.setLayout(layout);
		return shell;
	}

	private static RowLayout tight() {
		return new RowLayout().setMargins(0).setSpacing(0);
	}

	/** A child that would overflow the row wraps to the next one */
	@Test
	public void testWrap() {
		Composite shell = shell(100, 200, tight());
		Control a = new Control(shell).setPreferredSize(60, 24);
		Control b = new Control(shell).setPreferredSize(60, 24);
		shell.layout(true);

		Assert.assertEquals(new Rectangle(0, 0, 60, 24), a.getBounds());
		Assert.assertEquals(new Rectangle(0, 24, 60, 24), b.getBounds());
	}

	/** Without wrapping, children overflow the row */
	@Test
	public void testNoWrap() {
		Composite shell = shell(100, 200, tight().setWrap(false));
		Control a = new Control(shell).setPreferredSize(60, 24);
		Control b = new Control(shell).setPreferredSize(60, 24);
		shell.layout(true);

		Assert.assertEquals(new Rectangle(0, 0, 60, 24), a.getBounds());
		Assert.assertEquals(new Rectangle(60, 0, 60, 24), b.getBounds());
	}

	/** Margins and spacing offset every child, and every row starts at the leading margin */
	@Test
	public void testMarginsAndSpacing() {
		Composite shell = shell(100, 200, new RowLayout());
		Control a = new Control(shell).setPreferredSize(40, 20);
		Control b = new Control(shell).setPreferredSize(40, 30);
		Control c = new Control(shell).setPreferredSize(40, 10);
		shell.layout(true);

		// Available width is 94: 40 + 3 + 40 fits, the third does not
		Assert.assertEquals(new Rectangle(3, 3, 40, 20), a.getBounds());
		Assert.assertEquals(new Rectangle(46, 3, 40, 30), b.getBounds());
		Assert.assertEquals(new Rectangle(3, 36, 40, 10), c.getBounds());
	}

	/** Fill stretches children to the row thickness, center centers them in it */
	@Test
	public void testFillAndCenter() {
		RowLayout layout = tight();
		Composite shell = shell(200, 200, layout);
		Control small = new Control(shell).setPreferredSize(30, 20);
		Control big = new Control(shell).setPreferredSize(30, 40);

		shell.layout(true);
		Assert.assertEquals(new Rectangle(0, 0, 30, 20), small.getBounds());

		layout.setCenter(true);
		shell.layout(true);
		Assert.assertEquals(new Rectangle(0, 10, 30, 20), small.getBounds());

		layout.setFill(true);
		shell.layout(true);
		Assert.assertEquals(new Rectangle(0, 0, 30, 40), small.getBounds());
		Assert.assertEquals(new Rectangle(30, 0, 30, 40), big.getBounds());
	}

	/** Row data hints size the child, and excluded children take no space */
	@Test
	public void testRowData() {
		Composite shell = new Composite(null);
		shell.setBounds(0, 0, 200, 200);
		Control a = new Control(shell);
		a.setLayoutData(new RowData(50, 10));
		Control excluded = new Control(shell);
		excluded.setLayoutData(new RowData().setExcluded(true));
		Control c = new Control(shell);
		shell.setLayout(tight());

		Assert.assertEquals(new Rectangle(0, 0, 50, 10), a.getBounds());
		Assert.assertEquals(Rectangle.EMPTY, excluded.getBounds());
		Assert.assertEquals(new Rectangle(50, 0, Control.DEFAULT_WIDTH, Control.DEFAULT_HEIGHT), c.getBounds());
	}

	/** Without packing, every child gets the largest child size */
	@Test
	public void testUniformSize() {
		Composite shell = shell(200, 200, tight().setPack(false));
		Control a = new Control(shell).setPreferredSize(30, 10);
		Control b = new Control(shell).setPreferredSize(50, 20);
		shell.layout(true);

		Assert.assertEquals(new Rectangle(0, 0, 50, 20), a.getBounds());
		Assert.assertEquals(new Rectangle(50, 0, 50, 20), b.getBounds());
	}

	/** Justify spreads leftover space evenly before, between and after the children of a row */
	@Test
	public void testJustify() {
		Composite shell = shell(100, 50, tight().setJustify(true));
		Control a = new Control(shell).setPreferredSize(30, 10);
		Control b = new Control(shell).setPreferredSize(30, 10);
		shell.layout(true);

		// 40 leftover pixels over 3 gaps
		Assert.assertEquals(new Rectangle(13, 0, 30, 10), a.getBounds());
		Assert.assertEquals(new Rectangle(56, 0, 30, 10), b.getBounds());
	}

	/** A vertical layout wraps into a new column */
	@Test
	public void testVerticalWrap() {
		Composite shell = shell(200, 60, tight().setOrientation(Orientation.VERTICAL));
		Control a = new Control(shell).setPreferredSize(20, 40);
		Control b = new Control(shell).setPreferredSize(25, 40);
		Control c = new Control(shell).setPreferredSize(10, 15);
		shell.layout(true);

		Assert.assertEquals(new Rectangle(0, 0, 20, 40), a.getBounds());
		Assert.assertEquals(new Rectangle(20, 0, 25, 40), b.getBounds());
		Assert.assertEquals(new Rectangle(20, 40, 10, 15), c.getBounds());
	}

	/** The preferred size only wraps against a width hint */
	@Test
	public void testComputeSize() {
		Composite shell = new Composite(null);
		RowLayout layout = new RowLayout();
		shell.setLayout(layout);
		new Control(shell);
		new Control(shell);

		Assert.assertEquals(new Point(3 + 64 + 3 + 64 + 3, 3 + 24 + 3), layout.computeSize(shell, SWT.DEFAULT, SWT.DEFAULT, true));
		Assert.assertEquals(new Point(3 + 64 + 3, 3 + 24 + 3 + 24 + 3), layout.computeSize(shell, 100, SWT.DEFAULT, true));
	}

	/** Layout data of another layout's type is ignored */
	@Test
	public void testMismatchedLayoutData() {
		Composite shell = shell(200, 200, tight());
		Control a = new Control(shell);
		a.setLayoutData(new GridData().setWidthHint(10));
		shell.layout(true);

		Assert.assertEquals(new Rectangle(0, 0, Control.DEFAULT_WIDTH, Control.DEFAULT_HEIGHT), a.getBounds());
	}
}
