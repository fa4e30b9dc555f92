package org.metricshub.timewarp.jrt;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Time Warp
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.ArrayDeque;
import java.util.Deque;
import org.metricshub.timewarp.ExecutionEvent;

/**
 * Ordered event queue between an interpreter and its host.
 * <p>
 * Interpreters append {@code Output}, {@code Draw} and at most one
 * {@code InputRequested}; the engine hands them out one at a time. Once an
 * input request is queued the channel refuses further events until
 * {@link #inputSupplied()} is called, which keeps every output emitted
 * before the request ahead of the value that answers it.
 */
public class IOChannel {

	private final Deque<ExecutionEvent> queue = new ArrayDeque<ExecutionEvent>();

	private ExecutionEvent.InputRequested pendingRequest;

	private boolean requestDelivered;

	/**
	 * Queues a text fragment.
	 *
	 * @param text the text, without line terminator
	 * @param lineEnd whether a new line follows the text
	 */
	public void output(String text, boolean lineEnd) {
		checkOpen();
		queue.add(new ExecutionEvent.Output(text, lineEnd));
	}

	public void draw(DrawPrimitive primitive) {
		checkOpen();
		queue.add(new ExecutionEvent.Draw(primitive));
	}

	/**
	 * Queues an input request and suspends the channel.
	 *
	 * @param prompt optional prompt text
	 */
	public void requestInput(String prompt) {
		checkOpen();
		pendingRequest = new ExecutionEvent.InputRequested(prompt);
		requestDelivered = false;
		queue.add(pendingRequest);
	}

	private void checkOpen() {
		if (pendingRequest != null) {
			throw new IllegalStateException("An input request is outstanding; no event may be emitted");
		}
	}

	public boolean hasEvents() {
		return !queue.isEmpty();
	}

	/**
	 * Removes the next event, remembering when the outstanding input request
	 * has reached the host.
	 *
	 * @return the next event, or {@code null} when the queue is empty
	 */
	public ExecutionEvent poll() {
		ExecutionEvent event = queue.poll();
		if (event != null && event == pendingRequest) {
			requestDelivered = true;
		}
		return event;
	}

	public boolean isAwaitingInput() {
		return pendingRequest != null;
	}

	/**
	 * @return {@code true} when an input request was handed to the host and
	 *         not yet answered
	 */
	public boolean isInputRequestDelivered() {
		return pendingRequest != null && requestDelivered;
	}

	/**
	 * @return the outstanding request, or {@code null}
	 */
	public ExecutionEvent.InputRequested getPendingRequest() {
		return pendingRequest;
	}

	/**
	 * Clears the outstanding request so that execution can continue.
	 */
	public void inputSupplied() {
		pendingRequest = null;
		requestDelivered = false;
	}

	/**
	 * Drops everything queued, used when the host aborts the run.
	 */
	public void discard() {
		queue.clear();
		pendingRequest = null;
		requestDelivered = false;
	}
}
