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
package com.tomaszrup.ngast.template.tokenizer;

import com.tomaszrup.ngast.location.LocationSpan;

/**
 * A lexical unit of a template. Tokens compare by identity: two tokens with
 * the same type and text at different places are different tokens.
 */
public final class Token {
	private final TokenType type;
	private final LocationSpan locationSpan;

	public Token(TokenType type, LocationSpan locationSpan) {
		this.type = type;
		this.locationSpan = locationSpan;
	}

	public TokenType getType() {
		return type;
	}

	public String getTypeName() {
		return type.getTypeName();
	}

	public boolean is(TokenType type) {
		return this.type == type;
	}

	public LocationSpan getLocationSpan() {
		return locationSpan;
	}

	/** Current text of the token; reflects edits made through its span. */
	@Override
	public String toString() {
		return locationSpan.getText();
	}
}
