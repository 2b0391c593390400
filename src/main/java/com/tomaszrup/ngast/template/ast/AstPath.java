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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The chain of nodes containing a position, outermost first.
 */
public class AstPath<T> {
	private final List<T> nodes;
	private final int position;

	public AstPath(List<T> nodes, int position) {
		this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
		this.position = position;
	}

	public List<T> getNodes() {
		return nodes;
	}

	public int getPosition() {
		return position;
	}

	public boolean isEmpty() {
		return nodes.isEmpty();
	}

	/** Outermost node. */
	public Optional<T> getHead() {
		return nodes.isEmpty() ? Optional.empty() : Optional.of(nodes.get(0));
	}

	/** Innermost node. */
	public Optional<T> getTail() {
		return nodes.isEmpty() ? Optional.empty() : Optional.of(nodes.get(nodes.size() - 1));
	}

	public Optional<T> parentOf(T node) {
		int index = indexOf(node);
		return index > 0 ? Optional.of(nodes.get(index - 1)) : Optional.empty();
	}

	public Optional<T> childOf(T node) {
		int index = indexOf(node);
		return index >= 0 && index + 1 < nodes.size() ? Optional.of(nodes.get(index + 1)) : Optional.empty();
	}

	/** Outermost node of the given kind. */
	public <N extends T> Optional<N> first(Class<N> kind) {
		for (T node : nodes) {
			if (kind.isInstance(node)) {
				return Optional.of(kind.cast(node));
			}
		}
		return Optional.empty();
	}

	private int indexOf(T node) {
		for (int i = 0; i < nodes.size(); i++) {
			if (nodes.get(i) == node) {
				return i;
			}
		}
		return -1;
	}

	@Override
	public String toString() {
		return "AstPath{position=" + position + ", depth=" + nodes.size() + "}";
	}
}
