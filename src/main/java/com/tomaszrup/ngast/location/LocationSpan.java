////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.ngast.location;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;

import com.tomaszrup.lsp.utils.Ranges;

/**
 * A half-open {@code [start, end)} range of offsets into a {@link SourceFile}.
 *
 * <p>Spans are mutable. The move operations only change the recorded offsets;
 * {@link #replaceText(String)} also rewrites the underlying buffer, after
 * which every span located after this one is off by the length difference
 * until it is moved.</p>
 */
public class LocationSpan {
	private final SourceFile file;
	private int start;
	private int end;

	public LocationSpan(SourceFile file, int start, int end) {
		if (start < 0 || end < start) {
			throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ") in " + file);
		}
		this.file = file;
		this.start = start;
		this.end = end;
	}

	public SourceFile getFile() {
		return file;
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	public int getLength() {
		return end - start;
	}

	public boolean isEmpty() {
		return start == end;
	}

	public boolean containsOffset(int offset) {
		return start <= offset && offset < end;
	}

	public boolean contains(LocationSpan other) {
		return start <= other.start && other.end <= end;
	}

	public boolean contains(Position position) {
		return Ranges.contains(toRange(), position);
	}

	public LocationSpan clone() {
		return new LocationSpan(file, start, end);
	}

	public LocationSpan moveBy(int delta) {
		start += delta;
		end += delta;
		return this;
	}

	public LocationSpan moveStartBy(int delta) {
		start += delta;
		return this;
	}

	public LocationSpan moveEndBy(int delta) {
		end += delta;
		return this;
	}

	/**
	 * Replaces the text covered by this span in the source file. The span
	 * keeps its start and ends right after the new text.
	 */
	public LocationSpan replaceText(String newText) {
		file.replace(start, end, newText);
		end = start + newText.length();
		return this;
	}

	public String getText() {
		return file.getText(start, end);
	}

	public Range toRange() {
		return Ranges.toRange(file.getText(), start, end);
	}

	/**
	 * Human readable start position, {@code name:line:column} with one-based
	 * line and column.
	 */
	public String printLong() {
		Position position = file.getPosition(start);
		return file.getName() + ":" + (position.getLine() + 1) + ":" + (position.getCharacter() + 1);
	}

	@Override
	public String toString() {
		return "[" + start + ", " + end + ")";
	}
}
