package org.swtlayout.layout;

import java.util.List;

import org.swtlayout.widgets.Control;

import com.google.common.collect.ImmutableList;

/** Thrown by a {@link FormLayout} whose children's control attachments depend on each other in a cycle */
public class CircularAttachmentException extends IllegalStateException {
	private final List<Control> theCycle;

	/**
	 * @param cycle The controls in the cycle, each attached to the next, with the last attached to the first
	 */
	public CircularAttachmentException(List<? extends Control> cycle) {
		super(describe(cycle));
		theCycle = ImmutableList.copyOf(cycle);
	}

	/** @return The controls in the cycle, each attached to the next, with the last attached to the first */
	public List<Control> getCycle() {
		return theCycle;
	}

	private static String describe(List<? extends Control> cycle) {
		StringBuilder str = new StringBuilder("Circular attachment among form children: ");
		for (Control c : cycle)
			str.append(c).append(" -> ");
		str.append(cycle.get(0));
		return str.toString();
	}
}
