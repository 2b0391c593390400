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

public class Text implements Node {
	private final List<Token> tokens;
	private final String value;
	private final LocationSpan locationSpan;

	public Text(List<Token> tokens, String value, LocationSpan locationSpan) {
		this.tokens = Collections.unmodifiableList(tokens);
		this.value = value;
		this.locationSpan = locationSpan;
	}

	@Override
	public List<Token> getTokens() {
		return tokens;
	}

	public String getValue() {
		return value;
	}

	@Override
	public LocationSpan getLocationSpan() {
		return locationSpan;
	}

	@Override
	public <R, C> R visit(Visitor<R, C> visitor, C context) {
		return visitor.visitText(this, context);
	}
}
