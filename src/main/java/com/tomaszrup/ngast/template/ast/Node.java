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

import java.util.List;

import com.tomaszrup.ngast.location.LocationSpan;
import com.tomaszrup.ngast.template.tokenizer.Token;

/**
 * A node of the raw parse tree. The set of kinds is closed: {@link Text},
 * {@link Expansion}, {@link ExpansionCase}, {@link Attribute},
 * {@link Element} and {@link Comment}. Adding a kind means adding a method
 * to {@link Visitor}, which makes every traversal fail to compile until it
 * handles the new kind.
 */
public interface Node {
	List<Token> getTokens();

	LocationSpan getLocationSpan();

	/**
	 * Calls the one {@link Visitor} method matching this node's kind, passing
	 * {@code context} through unchanged.
	 */
	<R, C> R visit(Visitor<R, C> visitor, C context);
}
