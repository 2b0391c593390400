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

import com.tomaszrup.ngast.template.tokenizer.Token;

/**
 * The name part of a binding attribute. Its only token is the attribute's
 * name token.
 */
public abstract class BindingTargetTemplateNode extends TemplateNode {

	protected BindingTargetTemplateNode(List<Token> tokens, Template template) {
		super(tokens, template);
	}

	/** The target as written, e.g. {@code [value]}. */
	public String getText() {
		return getTokens().get(0).toString();
	}

	/** The bare identifier, e.g. {@code value}. */
	public String getName() {
		String text = getText();
		return AttributeSyntax.of(text).nameOf(text);
	}

	@Override
	public List<TemplateNode> getTemplateChildren() {
		return Collections.emptyList();
	}
}
