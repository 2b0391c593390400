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
 * Visits the raw parse tree, one method per node kind.
 *
 * @param <R> result of visiting a node
 * @param <C> caller-supplied context, passed through unchanged
 */
public interface Visitor<R, C> {

	/**
	 * Runs before the kind-specific method when nodes are visited through
	 * {@link HtmlAst#visitAll}. A non-null result other than
	 * {@link Boolean#FALSE} becomes the node's result and the kind-specific
	 * method is not called, which is how a traversal prunes a subtree.
	 */
	default R visit(Node node, C context) {
		return null;
	}

	R visitElement(Element element, C context);

	R visitAttribute(Attribute attribute, C context);

	R visitText(Text text, C context);

	R visitComment(Comment comment, C context);

	R visitExpansion(Expansion expansion, C context);

	R visitExpansionCase(ExpansionCase expansionCase, C context);
}
