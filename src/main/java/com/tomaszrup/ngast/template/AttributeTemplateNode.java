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
package com.tomaszrup.ngast.template;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import com.tomaszrup.ngast.template.tokenizer.Token;
import com.tomaszrup.ngast.template.tokenizer.TokenType;

/**
 * Base of the five attribute kinds. Names and values are read from the
 * tokens on every call; {@link #getName()} strips the binding syntax, so
 * {@code [(ngModel)]} is named {@code ngModel}.
 */
public abstract class AttributeTemplateNode extends TemplateNode {

	protected AttributeTemplateNode(List<Token> tokens, Template template) {
		super(tokens, template);
	}

	public Token getNameToken() {
		return getFirstTokenOfTypeOrThrow(TokenType.ATTR_NAME);
	}

	public Optional<Token> getValueToken() {
		return getFirstTokenOfType(TokenType.ATTR_VALUE);
	}

	/** The name as written, binding syntax included. */
	public String getRawName() {
		return getNameToken().toString();
	}

	public AttributeSyntax getSyntax() {
		return AttributeSyntax.of(getRawName());
	}

	public String getName() {
		String rawName = getRawName();
		return AttributeSyntax.of(rawName).nameOf(rawName);
	}

	public boolean hasValue() {
		return getValueToken().isPresent();
	}

	/** The value without quotes; empty for an attribute written without one. */
	public String getValue() {
		return getValueToken().map(Token::toString).orElse("");
	}

	/**
	 * Renames the attribute, keeping its binding syntax:
	 * {@code [(ngModel)]} renamed to {@code value} becomes {@code [(value)]}.
	 */
	public AttributeTemplateNode changeName(String newName) {
		String newText = getSyntax().wrap(newName);
		replaceTextByTokens(Collections.singletonList(TextReplaceConfig.of(getNameToken(), newText)));
		return this;
	}

	public AttributeTemplateNode changeValue(String newValue) {
		Token valueToken = getValueToken().orElseThrow(() -> new TemplateInvariantException(
				"Expected " + describe() + " (" + getRawName() + ") to have a value."));
		replaceTextByTokens(Collections.singletonList(TextReplaceConfig.of(valueToken, newValue)));
		return this;
	}

	@Override
	public List<TemplateNode> getTemplateChildren() {
		return Collections.emptyList();
	}

	/** Target and value nodes of a binding; empty for other attributes. */
	protected List<TemplateNode> getParts() {
		return Collections.emptyList();
	}

	@Override
	public List<TemplateNode> getNestedNodes() {
		return getParts();
	}

	@Override
	protected List<? extends TemplateNode> getSiblingsOf(TemplateNode child) {
		return getParts();
	}
}
