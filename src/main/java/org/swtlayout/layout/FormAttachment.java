package org.swtlayout.layout;

import org.swtlayout.widgets.Control;

/**
 * <p>
 * The constraint on one side of a child of a container using a {@link FormLayout}. The side is attached either to a fraction of the
 * container's extent ({@link Percentage}) or to an edge of a sibling control ({@link ControlEdge}), in either case displaced by a pixel
 * offset.
 * </p>
 * <p>
 * Attachments are immutable. Create them with the static factory methods.
 * </p>
 */
public abstract class FormAttachment {
	/** Which edge of the target control a {@link ControlEdge} attachment refers to */
	public enum Alignment {
		/**
		 * The edge of the target facing the attached side: an attachment on a leading side (left or top) goes just past the target's far
		 * edge, one on a trailing side (right or bottom) just before its near edge, in both cases separated by the layout's spacing.
		 */
		DEFAULT,
		/** The target's left edge (its near edge, for a vertical side) */
		LEFT,
		/** The target's right edge (its far edge, for a vertical side) */
		RIGHT,
		/** The target's top edge (its near edge, for a horizontal side) */
		TOP,
		/** The target's bottom edge (its far edge, for a horizontal side) */
		BOTTOM,
		/** The target's center */
		CENTER;

		/** @return Whether this alignment refers to the near (left or top) edge of the target */
		public boolean isNear() {
			return this == LEFT || this == TOP;
		}

		/** @return Whether this alignment refers to the far (right or bottom) edge of the target */
		public boolean isFar() {
			return this == RIGHT || this == BOTTOM;
		}
	}

	private final int theOffset;

	FormAttachment(int offset) {
		theOffset = offset;
	}

	/** @return The pixel offset added to the attachment's position */
	public int getOffset() {
		return theOffset;
	}

	/** @return The control this attachment depends on, or null if it does not depend on any */
	public abstract Control getTarget();

	/**
	 * @param numerator The percentage of the container's extent
	 * @return An attachment to the given percentage of the container's extent
	 */
	public static Percentage percent(int numerator) {
		return new Percentage(numerator, 100, 0);
	}

	/**
	 * @param numerator The percentage of the container's extent
	 * @param offset The pixel offset from that position
	 * @return An attachment to the given percentage of the container's extent
	 */
	public static Percentage percent(int numerator, int offset) {
		return new Percentage(numerator, 100, offset);
	}

	/**
	 * @param numerator The numerator of the fraction of the container's extent
	 * @param denominator The denominator of the fraction of the container's extent
	 * @param offset The pixel offset from that position
	 * @return An attachment to the given fraction of the container's extent
	 * @throws IllegalArgumentException If the denominator is not positive
	 */
	public static Percentage percent(int numerator, int denominator, int offset) throws IllegalArgumentException {
		return new Percentage(numerator, denominator, offset);
	}

	/**
	 * @param target The sibling to attach to
	 * @return An attachment to the facing edge of the target
	 */
	public static ControlEdge to(Control target) {
		return new ControlEdge(target, 0, Alignment.DEFAULT);
	}

	/**
	 * @param target The sibling to attach to
	 * @param offset The pixel offset from the target's edge
	 * @return An attachment to the facing edge of the target
	 */
	public static ControlEdge to(Control target, int offset) {
		return new ControlEdge(target, offset, Alignment.DEFAULT);
	}

	/**
	 * @param target The sibling to attach to
	 * @param offset The pixel offset from the target's edge
	 * @param alignment The edge of the target to attach to
	 * @return An attachment to the given edge of the target
	 */
	public static ControlEdge to(Control target, int offset, Alignment alignment) {
		return new ControlEdge(target, offset, alignment);
	}

	/** An attachment to <code>numerator/denominator</code> of the container's extent */
	public static final class Percentage extends FormAttachment {
		private final int theNumerator;
		private final int theDenominator;

		Percentage(int numerator, int denominator, int offset) {
			super(offset);
			if (denominator <= 0)
				throw new IllegalArgumentException("Denominator must be positive, not " + denominator);
			theNumerator = numerator;
			theDenominator = denominator;
		}

		/** @return The numerator of the fraction of the container's extent */
		public int getNumerator() {
			return theNumerator;
		}

		/** @return The denominator of the fraction of the container's extent */
		public int getDenominator() {
			return theDenominator;
		}

		@Override
		public Control getTarget() {
			return null;
		}

		/**
		 * @param extent The container's extent along the attached axis
		 * @return The position of this attachment, including the offset
		 */
		public int resolve(int extent) {
			return (int) ((long) extent * theNumerator / theDenominator) + getOffset();
		}

		@Override
		public int hashCode() {
			return (theNumerator * 31 + theDenominator) * 31 + getOffset();
		}

		@Override
		public boolean equals(Object obj) {
			if (obj == this)
				return true;
			else if (!(obj instanceof Percentage))
				return false;
			Percentage other = (Percentage) obj;
			return theNumerator == other.theNumerator && theDenominator == other.theDenominator && getOffset() == other.getOffset();
		}

		@Override
		public String toString() {
			StringBuilder str = new StringBuilder();
			if (theDenominator == 100)
				str.append(theNumerator).append('%');
			else
				str.append(theNumerator).append('/').append(theDenominator);
			if (getOffset() != 0)
				str.append(getOffset() > 0 ? "+" : "").append(getOffset());
			return str.toString();
		}
	}

	/** An attachment to an edge of a sibling control */
	public static final class ControlEdge extends FormAttachment {
		private final Control theTarget;
		private final Alignment theAlignment;

		ControlEdge(Control target, int offset, Alignment alignment) {
			super(offset);
			if (target == null)
				throw new NullPointerException("Target control may not be null");
			else if (alignment == null)
				throw new NullPointerException("Alignment may not be null");
			theTarget = target;
			theAlignment = alignment;
		}

		@Override
		public Control getTarget() {
			return theTarget;
		}

		/** @return The edge of the target to attach to */
		public Alignment getAlignment() {
			return theAlignment;
		}

		@Override
		public int hashCode() {
			return (System.identityHashCode(theTarget) * 31 + theAlignment.hashCode()) * 31 + getOffset();
		}

		@Override
		public boolean equals(Object obj) {
			if (obj == this)
				return true;
			else if (!(obj instanceof ControlEdge))
				return false;
			ControlEdge other = (ControlEdge) obj;
			return theTarget == other.theTarget && theAlignment == other.theAlignment && getOffset() == other.getOffset();
		}

		@Override
		public String toString() {
			StringBuilder str = new StringBuilder().append(theTarget);
			if (theAlignment != Alignment.DEFAULT)
				str.append('.').append(theAlignment.name().toLowerCase());
			if (getOffset() != 0)
				str.append(getOffset() > 0 ? "+" : "").append(getOffset());
			return str.toString();
		}
	}
}
