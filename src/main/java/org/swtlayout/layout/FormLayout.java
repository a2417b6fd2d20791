package org.swtlayout.layout;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.swtlayout.SWT;
import org.swtlayout.graphics.Point;
import org.swtlayout.graphics.Rectangle;
import org.swtlayout.widgets.Composite;
import org.swtlayout.widgets.Control;
import org.swtlayout.widgets.Layout;

import com.google.common.graph.ElementOrder;
import com.google.common.graph.Graph;
import com.google.common.graph.GraphBuilder;
import com.google.common.graph.MutableGraph;

/**
 * <p>
 * Positions each child by attaching each of its four sides independently, either to a fraction of the container's extent or to an edge of
 * a sibling. See {@link FormData} and {@link FormAttachment}.
 * </p>
 * <p>
 * In each dimension, a child with both sides attached spans the space between them. A child with one side attached gets its
 * {@link FormData#getWidth() width}/{@link FormData#getHeight() height} hint, or its preferred size, extending away from that side. A child
 * with neither side attached sits at the leading margin at that size.
 * </p>
 * <p>
 * Children are positioned in dependency order, so that a control attachment always reads the already-resolved bounds of its target.
 * Attachments forming a cycle cannot be resolved in any order, and cause a {@link CircularAttachmentException} from both
 * {@link #layout(Composite, boolean)} and {@link #computeSize(Composite, int, int, boolean)}.
 * </p>
 * <p>
 * Attachments to controls that are not visible children of the same container are not dependencies. They resolve as if the target were an
 * empty rectangle at the leading margins.
 * </p>
 */
public class FormLayout implements Layout {
	/** The extent assumed for percentage attachments when the preferred size is computed without a hint */
	public static final int ESTIMATE_EXTENT = 100;

	private int theMarginWidth;
	private int theMarginHeight;
	private int theMarginLeft;
	private int theMarginTop;
	private int theMarginRight;
	private int theMarginBottom;
	private int theSpacing;

	/** @return The space left at the left and right edges, unless overridden by {@link #getMarginLeft()}/{@link #getMarginRight()} */
	public int getMarginWidth() {
		return theMarginWidth;
	}

	/**
	 * @param marginWidth The space to leave at the left and right edges
	 * @return This layout
	 */
	public FormLayout setMarginWidth(int marginWidth) {
		theMarginWidth = LayoutUtils.checkNonNegative("margin width", marginWidth);
		return this;
	}

	/** @return The space left at the top and bottom edges, unless overridden by {@link #getMarginTop()}/{@link #getMarginBottom()} */
	public int getMarginHeight() {
		return theMarginHeight;
	}

	/**
	 * @param marginHeight The space to leave at the top and bottom edges
	 * @return This layout
	 */
	public FormLayout setMarginHeight(int marginHeight) {
		theMarginHeight = LayoutUtils.checkNonNegative("margin height", marginHeight);
		return this;
	}

	/** @return The space left at the left edge, or 0 to use the {@link #getMarginWidth() margin width} */
	public int getMarginLeft() {
		return theMarginLeft;
	}

	/**
	 * @param marginLeft The space to leave at the left edge, or 0 to use the {@link #getMarginWidth() margin width}
	 * @return This layout
	 */
	public FormLayout setMarginLeft(int marginLeft) {
		theMarginLeft = LayoutUtils.checkNonNegative("margin left", marginLeft);
		return this;
	}

	/** @return The space left at the top edge, or 0 to use the {@link #getMarginHeight() margin height} */
	public int getMarginTop() {
		return theMarginTop;
	}

	/**
	 * @param marginTop The space to leave at the top edge, or 0 to use the {@link #getMarginHeight() margin height}
	 * @return This layout
	 */
	public FormLayout setMarginTop(int marginTop) {
		theMarginTop = LayoutUtils.checkNonNegative("margin top", marginTop);
		return this;
	}

	/** @return The space left at the right edge, or 0 to use the {@link #getMarginWidth() margin width} */
	public int getMarginRight() {
		return theMarginRight;
	}

	/**
	 * @param marginRight The space to leave at the right edge, or 0 to use the {@link #getMarginWidth() margin width}
	 * @return This layout
	 */
	public FormLayout setMarginRight(int marginRight) {
		theMarginRight = LayoutUtils.checkNonNegative("margin right", marginRight);
		return this;
	}

	/** @return The space left at the bottom edge, or 0 to use the {@link #getMarginHeight() margin height} */
	public int getMarginBottom() {
		return theMarginBottom;
	}

	/**
	 * @param marginBottom The space to leave at the bottom edge, or 0 to use the {@link #getMarginHeight() margin height}
	 * @return This layout
	 */
	public FormLayout setMarginBottom(int marginBottom) {
		theMarginBottom = LayoutUtils.checkNonNegative("margin bottom", marginBottom);
		return this;
	}

	/** @return The space between a side attached to a sibling with {@link FormAttachment.Alignment#DEFAULT} and that sibling */
	public int getSpacing() {
		return theSpacing;
	}

	/**
	 * @param spacing The space between a side attached to a sibling with {@link FormAttachment.Alignment#DEFAULT} and that sibling
	 * @return This layout
	 */
	public FormLayout setSpacing(int spacing) {
		theSpacing = LayoutUtils.checkNonNegative("spacing", spacing);
		return this;
	}

	int getLeadingMargin(boolean vertical) {
		return vertical ? LayoutUtils.effectiveMargin(theMarginTop, theMarginHeight)
			: LayoutUtils.effectiveMargin(theMarginLeft, theMarginWidth);
	}

	int getTrailingMargin(boolean vertical) {
		return vertical ? LayoutUtils.effectiveMargin(theMarginBottom, theMarginHeight)
			: LayoutUtils.effectiveMargin(theMarginRight, theMarginWidth);
	}

	/**
	 * Estimates the container's preferred size in a single pass. Percentage attachments on the leading sides are evaluated against the
	 * hint (or {@link #ESTIMATE_EXTENT} without one) and control attachments contribute only their offset. This is an approximation: it
	 * does not resolve attachments the way {@link #layout(Composite, boolean)} does.
	 */
	@Override
	public Point computeSize(Composite composite, int wHint, int hHint, boolean flushCache) {
		List<Control> children = Layout.layoutChildren(composite);
		int marginW = getLeadingMargin(false) + getTrailingMargin(false);
		int marginH = getLeadingMargin(true) + getTrailingMargin(true);
		if (children.isEmpty())
			return new Point(marginW, marginH);
		getLayoutOrder(buildDependencies(children));

		int maxW = 0, maxH = 0;
		for (Control child : children) {
			FormData data = getFormData(child);
			Point size = child.computeSize(data.getWidth(), data.getHeight(), flushCache);
			maxW = Math.max(maxW, estimate(data.getLeft(), wHint) + size.x);
			maxH = Math.max(maxH, estimate(data.getTop(), hHint) + size.y);
		}
		return new Point(maxW + marginW, maxH + marginH);
	}

	@Override
	public boolean layout(Composite composite, boolean flushCache) {
		List<Control> children = Layout.layoutChildren(composite);
		if (children.isEmpty())
			return true;
		List<Control> order = getLayoutOrder(buildDependencies(children));

		Rectangle area = composite.getClientArea();
		// Resolved bounds are relative to the client area
		Map<Control, Rectangle> resolved = new HashMap<>();
		int[] bounds = new int[4];
		for (Control child : order) {
			FormData data = getFormData(child);
			Point size = child.computeSize(data.getWidth(), data.getHeight(), flushCache);
			resolve(false, data, size.x, area.width, resolved, bounds);
			resolve(true, data, size.y, area.height, resolved, bounds);
			Rectangle childBounds = new Rectangle(bounds[0], bounds[1], bounds[2], bounds[3]);
			resolved.put(child, childBounds);
			child.setBounds(area.x + childBounds.x, area.y + childBounds.y, childBounds.width, childBounds.height);
		}
		return true;
	}

	/**
	 * @param children The visible children of the container
	 * @return A graph with an edge from each child to each sibling one of its sides is attached to
	 */
	Graph<Control> buildDependencies(List<Control> children) {
		MutableGraph<Control> graph = GraphBuilder.directed().allowsSelfLoops(true)//
			.nodeOrder(ElementOrder.insertion()).incidentEdgeOrder(ElementOrder.stable())//
			.expectedNodeCount(children.size()).build();
		for (Control child : children)
			graph.addNode(child);
		for (Control child : children) {
			FormData data = getFormData(child);
			addDependency(graph, child, data.getLeft());
			addDependency(graph, child, data.getRight());
			addDependency(graph, child, data.getTop());
			addDependency(graph, child, data.getBottom());
		}
		return graph;
	}

	private static void addDependency(MutableGraph<Control> graph, Control child, FormAttachment attachment) {
		Control target = attachment == null ? null : attachment.getTarget();
		if (target == null)
			return;
		else if (graph.nodes().contains(target))
			graph.putEdge(child, target);
		else
			System.err.println("WARNING: " + child + " is attached to " + target + ", which is not a visible sibling");
	}

	/**
	 * @param dependencies The dependency graph of the container's children
	 * @return The children ordered so that each comes after every sibling it depends on
	 * @throws CircularAttachmentException If the dependencies contain a cycle
	 */
	static List<Control> getLayoutOrder(Graph<Control> dependencies) throws CircularAttachmentException {
		List<Control> order = new ArrayList<>(dependencies.nodes().size());
		Set<Control> done = new HashSet<>();
		Set<Control> path = new LinkedHashSet<>();
		Deque<VisitFrame> stack = new ArrayDeque<>();
		for (Control root : dependencies.nodes()) {
			if (done.contains(root))
				continue;
			path.add(root);
			stack.push(new VisitFrame(root, dependencies.successors(root).iterator()));
			while (!stack.isEmpty()) {
				VisitFrame frame = stack.peek();
				if (frame.successors.hasNext()) {
					Control target = frame.successors.next();
					if (done.contains(target))
						continue;
					else if (!path.add(target))
						throw new CircularAttachmentException(getCycle(path, target));
					stack.push(new VisitFrame(target, dependencies.successors(target).iterator()));
				} else {
					stack.pop();
					path.remove(frame.node);
					done.add(frame.node);
					order.add(frame.node);
				}
			}
		}
		return order;
	}

	private static List<Control> getCycle(Set<Control> path, Control repeated) {
		List<Control> cycle = new ArrayList<>();
		boolean inCycle = false;
		for (Control c : path) {
			if (c == repeated)
				inCycle = true;
			if (inCycle)
				cycle.add(c);
		}
		return cycle;
	}

	private void resolve(boolean vertical, FormData data, int preferred, int containerExtent, Map<Control, Rectangle> resolved,
		int[] bounds) {
		int margin = getLeadingMargin(vertical);
		int extent = containerExtent - margin - getTrailingMargin(vertical);
		FormAttachment leading = data.getLeading(vertical);
		FormAttachment trailing = data.getTrailing(vertical);
		int pos, size = preferred;
		if (leading != null) {
			pos = getPosition(leading, vertical, true, margin, extent, resolved);
			if (trailing != null)
				size = getPosition(trailing, vertical, false, margin, extent, resolved) - pos;
		} else if (trailing != null)
			pos = getPosition(trailing, vertical, false, margin, extent, resolved) - size;
		else
			pos = margin;
		bounds[vertical ? 1 : 0] = pos;
		bounds[vertical ? 3 : 2] = Math.max(0, size);
	}

	private int getPosition(FormAttachment attachment, boolean vertical, boolean leadingSide, int margin, int extent,
		Map<Control, Rectangle> resolved) {
		if (attachment instanceof FormAttachment.Percentage)
			return margin + ((FormAttachment.Percentage) attachment).resolve(extent);
		FormAttachment.ControlEdge edge = (FormAttachment.ControlEdge) attachment;
		Rectangle target = resolved.get(edge.getTarget());
		int targetPos, targetSize;
		if (target != null) {
			targetPos = vertical ? target.y : target.x;
			targetSize = vertical ? target.height : target.width;
		} else {
			targetPos = margin;
			targetSize = 0;
		}
		int pos;
		if (edge.getAlignment().isNear())
			pos = targetPos;
		else if (edge.getAlignment().isFar())
			pos = targetPos + targetSize;
		else if (edge.getAlignment() == FormAttachment.Alignment.CENTER)
			pos = targetPos + targetSize / 2;
		else if (leadingSide)
			pos = targetPos + targetSize + theSpacing;
		else
			pos = targetPos - theSpacing;
		return pos + edge.getOffset();
	}

	private static int estimate(FormAttachment attachment, int hint) {
		if (attachment == null)
			return 0;
		else if (attachment instanceof FormAttachment.Percentage)
			return ((FormAttachment.Percentage) attachment).resolve(hint != SWT.DEFAULT ? hint : ESTIMATE_EXTENT);
		else
			return attachment.getOffset();
	}

	private static FormData getFormData(Control child) {
		FormData data = Layout.getLayoutData(child, FormData.class);
		return data != null ? data : new FormData();
	}

	@Override
	public String toString() {
		return "FormLayout";
	}

	/** A control being visited in the dependency walk, with the dependencies not yet walked */
	private static class VisitFrame {
		final Control node;
		final Iterator<Control> successors;

		VisitFrame(Control node, Iterator<Control> successors) {
			this.node = node;
			this.successors = successors;
		}
	}
}
