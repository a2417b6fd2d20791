package org.swtlayout.layout;

import java.util.Locale;

import org.junit.Assert;
import org.junit.Test;
import org.swtlayout.SWT;
import org.swtlayout.layout.GridData.Alignment;

/** Tests for {@link GridData} */
public class GridDataTest {
	/** Defaults of new grid data */
	@Test
	public void testDefaults() {
		GridData data = new GridData();
		Assert.assertEquals(1, data.getHorizontalSpan());
		Assert.assertEquals(1, data.getVerticalSpan());
		Assert.assertEquals(Alignment.BEGINNING, data.getHorizontalAlignment());
		Assert.assertEquals(Alignment.CENTER, data.getVerticalAlignment());
		Assert.assertFalse(data.isGrabExcessHorizontalSpace());
		Assert.assertEquals(SWT.DEFAULT, data.getWidthHint());
		Assert.assertEquals(SWT.DEFAULT, data.getHeightHint());
		Assert.assertEquals(0, data.getMinimumWidth());
		Assert.assertFalse(data.isExcluded());
	}

	/** Spans are clamped to at least 1 and minimums to at least 0 */
	@Test
	public void testClamping() {
		GridData data = new GridData().setHorizontalSpan(0).setVerticalSpan(-3).setMinimumWidth(-1).setMinimumHeight(-10);
		Assert.assertEquals(1, data.getHorizontalSpan());
		Assert.assertEquals(1, data.getVerticalSpan());
		Assert.assertEquals(0, data.getMinimumWidth());
		Assert.assertEquals(0, data.getMinimumHeight());
	}

	/** Parsing the text form */
	@Test
	public void testParse() {
		GridData data = GridData.parse("h-span=2 v-span:3 h-align=fill v-align=END grab-h width=100px min-h=5 h-indent=4 exclude=false");
		Assert.assertEquals(2, data.getHorizontalSpan());
		Assert.assertEquals(3, data.getVerticalSpan());
		Assert.assertEquals(Alignment.FILL, data.getHorizontalAlignment());
		Assert.assertEquals(Alignment.END, data.getVerticalAlignment());
		Assert.assertTrue(data.isGrabExcessHorizontalSpace());
		Assert.assertFalse(data.isGrabExcessVerticalSpace());
		Assert.assertEquals(100, data.getWidthHint());
		Assert.assertEquals(SWT.DEFAULT, data.getHeightHint());
		Assert.assertEquals(5, data.getMinimumHeight());
		Assert.assertEquals(4, data.getHorizontalIndent());
		Assert.assertFalse(data.isExcluded());

		data = GridData.parse("  horizontal-span=4 h=default grab-v=true exclude ");
		Assert.assertEquals(4, data.getHorizontalSpan());
		Assert.assertEquals(SWT.DEFAULT, data.getHeightHint());
		Assert.assertTrue(data.isGrabExcessVerticalSpace());
		Assert.assertTrue(data.isExcluded());

		Assert.assertEquals(1, GridData.parse("").getHorizontalSpan());
	}

	/** Parsing does not depend on the default locale's case rules */
	@Test
	public void testParseIndependentOfLocale() {
		Locale defaultLocale = Locale.getDefault();
		Locale.setDefault(new Locale("tr", "TR"));
		try {
			GridData data = GridData.parse("H-ALIGN=FILL V-ALIGN=BEGINNING MIN-WIDTH=3 GRAB-H=TRUE H-INDENT=2");
			Assert.assertEquals(Alignment.FILL, data.getHorizontalAlignment());
			Assert.assertEquals(Alignment.BEGINNING, data.getVerticalAlignment());
			Assert.assertEquals(3, data.getMinimumWidth());
			Assert.assertTrue(data.isGrabExcessHorizontalSpace());
			Assert.assertEquals(2, data.getHorizontalIndent());
		} finally {
			Locale.setDefault(defaultLocale);
		}
	}

	/** Text that cannot be parsed is rejected */
	@Test
	public void testParseErrors() {
		assertBadConstraints("bogus=1");
		assertBadConstraints("h-span=2 h-span=3");
		assertBadConstraints("h-span=2 horizontal-span=3");
		assertBadConstraints("h-span=two");
		assertBadConstraints("h-align");
		assertBadConstraints("h-align=middle");
		assertBadConstraints("grab-h=maybe");
		assertBadConstraints("width");
		assertBadConstraints("=5");
	}

	private static void assertBadConstraints(String constraints) {
		try {
			GridData.parse(constraints);
			Assert.fail("Should not have parsed \"" + constraints + "\"");
		} catch (IllegalArgumentException e) {
			// Expected
		}
	}
}
