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
import com.tomaszrup.ngast.template.tokenizer.TokenType;

/**
 * A leaf whose content lives in one {@link TokenType#TEXT} token.
 */
public abstract class TextualTemplateNode extends TemplateNode {

	protected TextualTemplateNode(List<Token> tokens, Template template) {
		super(tokens, template);
	}

	public Token getTextToken() {
		return getFirstTokenOfTypeOrThrow(TokenType.TEXT);
	}

	/** Current text, read from the token rather than cached. */
	public String getText() {
		return getTextToken().toString();
	}

	@Override
	public List<TemplateNode> getTemplateChildren() {
		return Collections.emptyList();
	}

	public TextualTemplateNode changeText(String newText) {
		replaceTextByTokens(Collections.singletonList(TextReplaceConfig.of(getTextToken(), newText)));
		return this;
	}

	public TextualTemplateNode trimText() {
		return changeText(getText().trim());
	}
}
