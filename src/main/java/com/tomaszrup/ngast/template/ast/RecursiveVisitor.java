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
 * Walks the whole raw tree: elements visit their attributes and then their
 * children, expansions visit their cases and cases visit their expression
 * nodes. Leaves do nothing. Children are visited through
 * {@link HtmlAst#visitAll}, so a subclass overriding
 * {@link #visit(Node, Object)} decides which subtrees are entered.
 */
public class RecursiveVisitor<R, C> implements Visitor<R, C> {

	@Override
	public R visitElement(Element element, C context) {
		HtmlAst.visitAll(this, element.getAttrs(), context);
		HtmlAst.visitAll(this, element.getChildren(), context);
		return null;
	}

	@Override
	public R visitAttribute(Attribute attribute, C context) {
		return null;
	}

	@Override
	public R visitText(Text text, C context) {
		return null;
	}

	@Override
	public R visitComment(Comment comment, C context) {
		return null;
	}

	@Override
	public R visitExpansion(Expansion expansion, C context) {
		HtmlAst.visitAll(this, expansion.getCases(), context);
		return null;
	}

	@Override
	public R visitExpansionCase(ExpansionCase expansionCase, C context) {
		HtmlAst.visitAll(this, expansionCase.getExpression(), context);
		return null;
	}
}
