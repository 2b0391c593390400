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

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.tomaszrup.ngast.template.tokenizer.Token;

public class ElementTemplateNode extends ElementLikeTemplateNode {

	public ElementTemplateNode(List<Token> tokens, Template template,
			List<? extends AttributeTemplateNode> allAttributes, List<? extends TemplateNode> children) {
		super(tokens, template, allAttributes, children);
	}

	/** The tag name as currently written in the open tag. */
	@Override
	public String getTagName() {
		return getStartTagNameLocationSpan().getText();
	}

	public boolean hasTagName(String tagName) {
		return getTagName().equals(tagName);
	}

	/**
	 * Rewrites the open tag to {@code <newTagName} and then the end tag, if
	 * there is one, to {@code </newTagName>}.
	 */
	public ElementTemplateNode changeTagName(String newTagName) {
		List<TextReplaceConfig> edits = new ArrayList<>();
		edits.add(TextReplaceConfig.of(getTagOpenStartToken(), "<" + newTagName));
		Optional<Token> endToken = getTagEndToken();
		endToken.ifPresent(token -> edits.add(TextReplaceConfig.of(token, "</" + newTagName + ">")));
		replaceTextByTokens(edits);
		return this;
	}
}
