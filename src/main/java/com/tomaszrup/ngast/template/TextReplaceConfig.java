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

import com.tomaszrup.ngast.template.tokenizer.Token;

/**
 * One edit of the mutation protocol: the token whose text is replaced and
 * its new text.
 */
public final class TextReplaceConfig {
	private final Token token;
	private final String newText;

	public TextReplaceConfig(Token token, String newText) {
		this.token = token;
		this.newText = newText;
	}

	public static TextReplaceConfig of(Token token, String newText) {
		return new TextReplaceConfig(token, newText);
	}

	public Token getToken() {
		return token;
	}

	public String getNewText() {
		return newText;
	}
}
