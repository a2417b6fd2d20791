package org.swtlayout.layout;

import org.junit.Assert;
import org.junit.Test;
import org.swtlayout.SWT;
import org.swtlayout.graphics.Point;
import org.swtlayout.graphics.Rectangle;
import org.swtlayout.widgets.Composite;
import org.swtlayout.widgets.Control;

/** Tests for {@link StackLayout} */
public class StackLayoutTest {
	/** Only the top control is shown, filling the client area */
	@Test
	public void testTopControlExclusive() {
		Composite shell = new Composite(null);
		shell.setBounds(0, 0, 200, 100);
		StackLayout layout = new StackLayout();
		shell.setLayout(layout);
		Control a = new Control(shell);
		Control b = new Control(shell);
		Control c = new Control(shell);

		layout.setTopControl(b);
		shell.layout();
		Assert.assertEquals(StackLayout.HIDDEN_BOUNDS, a.getBounds());
		Assert.assertEquals(new Rectangle(0, 0, 200, 100), b.getBounds());
		Assert.assertEquals(StackLayout.HIDDEN_BOUNDS, c.getBounds());

		// Changing the top control takes effect on the next layout
		layout.setTopControl(c);
		Assert.assertEquals(new Rectangle(0, 0, 200, 100), b.getBounds());
		shell.layout();
		Assert.assertEquals(StackLayout.HIDDEN_BOUNDS, b.getBounds());
		Assert.assertEquals(new Rectangle(0, 0, 200, 100), c.getBounds());
	}

	/** The top control is inset by the margins */
	@Test
	public void testMargins() {
		Composite shell = new Composite(null);
		shell.setBounds(0, 0, 200, 100);
		Control a = new Control(shell);
		shell.setLayout(new StackLayout().setMarginWidth(5).setMarginHeight(10).setTopControl(a));

		Assert.assertEquals(new Rectangle(5, 10, 190, 80), a.getBounds());
	}

	/** With no top control, or an invisible one, every child is hidden */
	@Test
	public void testNoTopControl() {
		Composite shell = new Composite(null);
		shell.setBounds(0, 0, 200, 100);
		StackLayout layout = new StackLayout();
		shell.setLayout(layout);
		Control a = new Control(shell);
		Control b = new Control(shell);
		shell.layout();
		Assert.assertEquals(StackLayout.HIDDEN_BOUNDS, a.getBounds());
		Assert.assertEquals(StackLayout.HIDDEN_BOUNDS, b.getBounds());

		layout.setTopControl(b);
		b.setVisible(false);
		shell.layout();
		Assert.assertEquals(StackLayout.HIDDEN_BOUNDS, b.getBounds());
	}

	/** The preferred size is the top control's, plus the margins */
	@Test
	public void testComputeSize() {
		Composite shell = new Composite(null);
		StackLayout layout = new StackLayout().setMarginWidth(5).setMarginHeight(10);
		shell.setLayout(layout);
		Control a = new Control(shell).setPreferredSize(100, 10);
		Control b = new Control(shell);

		Assert.assertEquals(new Point(10, 20), layout.computeSize(shell, SWT.DEFAULT, SWT.DEFAULT, true));
		layout.setTopControl(b);
		Assert.assertEquals(new Point(74, 44), layout.computeSize(shell, SWT.DEFAULT, SWT.DEFAULT, true));
		layout.setTopControl(a);
		Assert.assertEquals(new Point(110, 50), layout.computeSize(shell, SWT.DEFAULT, 30, true));

		a.setVisible(false);
		Assert.assertEquals(new Point(10, 20), layout.computeSize(shell, SWT.DEFAULT, SWT.DEFAULT, true));

		layout.setTopControl(new Control(null));
		Assert.assertEquals(new Point(10, 20), layout.computeSize(shell, SWT.DEFAULT, SWT.DEFAULT, true));
	}
}
