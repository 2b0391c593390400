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
package com.tomaszrup.ngast.template.ast;

/**
 * Effective {@code [start, end)} extent of a node for position queries.
 */
public final class NodeSpan {
	private final int start;
	private final int end;

	public NodeSpan(int start, int end) {
		this.start = start;
		this.end = end;
	}

	public int getStart() {
		return start;
	}

	public int getEnd() {
		return end;
	}

	public boolean contains(int position) {
		return start <= position && position < end;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof NodeSpan)) return false;
		NodeSpan other = (NodeSpan) o;
		return start == other.start && end == other.end;
	}

	@Override
	public int hashCode() {
		return 31 * start + end;
	}

	@Override
	public String toString() {
		return "[" + start + ", " + end + ")";
	}
}
