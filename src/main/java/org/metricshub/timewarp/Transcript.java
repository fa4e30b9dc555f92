package org.metricshub.timewarp;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.timewarp.jrt.DrawPrimitive;

/**
 * Every event of a run, in emission order, ending with its terminal event.
 */
public class Transcript {

	private final List<ExecutionEvent> events;

	Transcript(List<ExecutionEvent> events) {
		this.events = Collections.unmodifiableList(new ArrayList<ExecutionEvent>(events));
	}

	public List<ExecutionEvent> getEvents() {
		return events;
	}

	/**
	 * @return the {@code Completed} or {@code RuntimeError} event ending the run
	 */
	public ExecutionEvent getTerminalEvent() {
		return events.get(events.size() - 1);
	}

	/**
	 * @return {@code true} when the run ended with a {@code Completed} event
	 */
	public boolean isCompleted() {
		return getTerminalEvent() instanceof ExecutionEvent.Completed;
	}

	/**
	 * Output text as a terminal would show it: events joined, a line break
	 * after each event that ends its line.
	 *
	 * @return the text
	 */
	public String getOutput() {
		StringBuilder sb = new StringBuilder();
		for (ExecutionEvent event : events) {
			if (event instanceof ExecutionEvent.Output) {
				ExecutionEvent.Output output = (ExecutionEvent.Output) event;
				sb.append(output.getText());
				if (output.isLineEnd()) {
					sb.append('\n');
				}
			}
		}
		return sb.toString();
	}

	/**
	 * @return the text of each output event
	 */
	public List<String> getOutputTexts() {
		List<String> texts = new ArrayList<String>();
		for (ExecutionEvent event : events) {
			if (event instanceof ExecutionEvent.Output) {
				texts.add(((ExecutionEvent.Output) event).getText());
			}
		}
		return texts;
	}

	public List<DrawPrimitive> getDrawPrimitives() {
		List<DrawPrimitive> primitives = new ArrayList<DrawPrimitive>();
		for (ExecutionEvent event : events) {
			if (event instanceof ExecutionEvent.Draw) {
				primitives.add(((ExecutionEvent.Draw) event).getPrimitive());
			}
		}
		return primitives;
	}

	/**
	 * @return number of input requests, repeated ones included
	 */
	public int getInputRequestCount() {
		int count = 0;
		for (ExecutionEvent event : events) {
			if (event instanceof ExecutionEvent.InputRequested) {
				count++;
			}
		}
		return count;
	}
}
