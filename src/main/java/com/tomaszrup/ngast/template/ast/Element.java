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

import java.util.Collections;
import java.util.List;

import com.tomaszrup.ngast.location.LocationSpan;
import com.tomaszrup.ngast.template.tokenizer.Token;

public class Element implements Node {
	private final List<Token> tokens;
	private final String name;
	private final List<Attribute> attrs;
	private final List<Node> children;
	private final LocationSpan locationSpan;
	private final LocationSpan startSourceSpan;
	private final LocationSpan endSourceSpan;

	/**
	 * @param tokens          the tokens of the start and end tag; the tokens of
	 *                        children belong to the children
	 * @param startSourceSpan span of the start tag, may be {@code null}
	 * @param endSourceSpan   span of the end tag, {@code null} for void and
	 *                        self-closing elements
	 */
	public Element(List<Token> tokens, String name, List<Attribute> attrs, List<Node> children,
			LocationSpan locationSpan, LocationSpan startSourceSpan, LocationSpan endSourceSpan) {
		this.tokens = Collections.unmodifiableList(tokens);
		this.name = name;
		this.attrs = Collections.unmodifiableList(attrs);
		this.children = Collections.unmodifiableList(children);
		this.locationSpan = locationSpan;
		this.startSourceSpan = startSourceSpan;
		this.endSourceSpan = endSourceSpan;
	}

	@Override
	public List<Token> getTokens() {
		return tokens;
	}

	public String getName() {
		return name;
	}

	public List<Attribute> getAttrs() {
		return attrs;
	}

	public List<Node> getChildren() {
		return children;
	}

	@Override
	public LocationSpan getLocationSpan() {
		return locationSpan;
	}

	public LocationSpan getStartSourceSpan() {
		return startSourceSpan;
	}

	public LocationSpan getEndSourceSpan() {
		return endSourceSpan;
	}

	@Override
	public <R, C> R visit(Visitor<R, C> visitor, C context) {
		return visitor.visitElement(this, context);
	}
}
