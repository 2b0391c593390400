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
import java.util.List;

/**
 * Traversal helpers over the raw parse tree.
 */
public final class HtmlAst {

	private HtmlAst() {
		// utility class
	}

	/**
	 * Visits each node, running the visitor's pre-visit hook first. Only
	 * non-null results other than {@link Boolean#FALSE} are collected.
	 */
	public static <R, C> List<R> visitAll(Visitor<R, C> visitor, List<? extends Node> nodes, C context) {
		List<R> result = new ArrayList<>();
		for (Node node : nodes) {
			R nodeResult = visitor.visit(node, context);
			if (!isTruthy(nodeResult)) {
				nodeResult = node.visit(visitor, context);
			}
			if (isTruthy(nodeResult)) {
				result.add(nodeResult);
			}
		}
		return result;
	}

	public static <R, C> List<R> visitAll(Visitor<R, C> visitor, List<? extends Node> nodes) {
		return visitAll(visitor, nodes, null);
	}

	private static boolean isTruthy(Object value) {
		return value != null && !Boolean.FALSE.equals(value);
	}

	public static NodeSpan spanOf(Node node) {
		return spanOf(node, SpanMode.RENDERED);
	}

	/**
	 * Extent of a node for position lookups. An element ends where its end tag
	 * starts, or where its last child ends when it has no end tag. See
	 * {@link SpanMode} for leaves and for childless elements without an end
	 * tag.
	 */
	public static NodeSpan spanOf(Node node, SpanMode mode) {
		int start = node.getLocationSpan().getStart();
		int end;
		if (node instanceof Element) {
			Element element = (Element) node;
			List<Node> children = element.getChildren();
			if (element.getEndSourceSpan() != null) {
				end = element.getEndSourceSpan().getStart();
			} else if (!children.isEmpty()) {
				end = spanOf(children.get(children.size() - 1), mode).getEnd();
			} else if (mode == SpanMode.RENDERED) {
				end = element.getStartSourceSpan() != null
						? element.getStartSourceSpan().getEnd()
						: element.getLocationSpan().getEnd();
			} else {
				end = start;
			}
		} else {
			end = mode == SpanMode.RENDERED ? node.getLocationSpan().getEnd() : start;
		}
		return new NodeSpan(start, end);
	}

	public static AstPath<Node> findNode(List<? extends Node> nodes, int position) {
		return findNode(nodes, position, SpanMode.RENDERED);
	}

	/**
	 * Returns the nodes whose span contains {@code position}, outermost first.
	 * Subtrees of nodes not containing the position are not entered.
	 */
	public static AstPath<Node> findNode(List<? extends Node> nodes, int position, SpanMode mode) {
		List<Node> path = new ArrayList<>();
		RecursiveVisitor<Object, Void> visitor = new RecursiveVisitor<Object, Void>() {
			@Override
			public Object visit(Node node, Void context) {
				if (spanOf(node, mode).contains(position)) {
					path.add(node);
					return null;
				}
				return Boolean.TRUE;
			}
		};
		visitAll(visitor, nodes);
		return new AstPath<>(path, position);
	}
}
