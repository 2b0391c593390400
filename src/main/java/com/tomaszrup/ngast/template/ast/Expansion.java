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

/**
 * An ICU message block such as {@code {count, plural, =0 {none} other {many}}}.
 */
public class Expansion implements Node {
	private final List<Token> tokens;
	private final String switchValue;
	private final String type;
	private final List<ExpansionCase> cases;
	private final LocationSpan locationSpan;
	private final LocationSpan switchValueSourceSpan;

	public Expansion(List<Token> tokens, String switchValue, String type, List<ExpansionCase> cases,
			LocationSpan locationSpan, LocationSpan switchValueSourceSpan) {
		this.tokens = Collections.unmodifiableList(tokens);
		this.switchValue = switchValue;
		this.type = type;
		this.cases = Collections.unmodifiableList(cases);
		this.locationSpan = locationSpan;
		this.switchValueSourceSpan = switchValueSourceSpan;
	}

	@Override
	public List<Token> getTokens() {
		return tokens;
	}

	public String getSwitchValue() {
		return switchValue;
	}

	/** {@code plural} or {@code select}. */
	public String getType() {
		return type;
	}

	public List<ExpansionCase> getCases() {
		return cases;
	}

	@Override
	public LocationSpan getLocationSpan() {
		return locationSpan;
	}

	public LocationSpan getSwitchValueSourceSpan() {
		return switchValueSourceSpan;
	}

	@Override
	public <R, C> R visit(Visitor<R, C> visitor, C context) {
		return visitor.visitExpansion(this, context);
	}
}
