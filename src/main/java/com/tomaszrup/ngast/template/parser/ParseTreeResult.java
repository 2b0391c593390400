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
package com.tomaszrup.ngast.template.parser;

import java.util.Collections;
import java.util.List;

import com.tomaszrup.ngast.template.ast.Node;
import com.tomaszrup.ngast.template.tokenizer.Token;

/**
 * The token sequence of a file together with the raw tree parsed from it.
 */
public class ParseTreeResult {
	private final List<Token> tokens;
	private final List<Node> rootNodes;

	public ParseTreeResult(List<Token> tokens, List<Node> rootNodes) {
		this.tokens = Collections.unmodifiableList(tokens);
		this.rootNodes = Collections.unmodifiableList(rootNodes);
	}

	public List<Token> getTokens() {
		return tokens;
	}

	public List<Node> getRootNodes() {
		return rootNodes;
	}
}
