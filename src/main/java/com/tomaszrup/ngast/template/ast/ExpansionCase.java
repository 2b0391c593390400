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

public class ExpansionCase implements Node {
	private final List<Token> tokens;
	private final String value;
	private final List<Node> expression;
	private final LocationSpan locationSpan;
	private final LocationSpan valueSourceSpan;
	private final LocationSpan expSourceSpan;

	public ExpansionCase(List<Token> tokens, String value, List<Node> expression, LocationSpan locationSpan,
			LocationSpan valueSourceSpan, LocationSpan expSourceSpan) {
		this.tokens = Collections.unmodifiableList(tokens);
		this.value = value;
		this.expression = Collections.unmodifiableList(expression);
		this.locationSpan = locationSpan;
		this.valueSourceSpan = valueSourceSpan;
		this.expSourceSpan = expSourceSpan;
	}

	@Override
	public List<Token> getTokens() {
		return tokens;
	}

	/** Case selector, e.g. {@code =0} or {@code other}. */
	public String getValue() {
		return value;
	}

	public List<Node> getExpression() {
		return expression;
	}

	@Override
	public LocationSpan getLocationSpan() {
		return locationSpan;
	}

	public LocationSpan getValueSourceSpan() {
		return valueSourceSpan;
	}

	public LocationSpan getExpSourceSpan() {
		return expSourceSpan;
	}

	@Override
	public <R, C> R visit(Visitor<R, C> visitor, C context) {
		return visitor.visitExpansionCase(this, context);
	}
}
