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
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import org.eclipse.lsp4j.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lsp.utils.Positions;
import com.tomaszrup.ngast.location.SourceFile;
import com.tomaszrup.ngast.template.ast.AstPath;
import com.tomaszrup.ngast.template.tokenizer.Token;

/**
 * The parsed form of one template file. Owns the ordered token sequence and
 * the root nodes; nodes only hold references into both.
 *
 * <p>Tokens are indexed by identity when the template is created, so looking
 * up a token's place in the sequence does not depend on its current text or
 * offsets. Not thread-safe: one writer at a time.</p>
 */
public class Template {
	private static final Logger logger = LoggerFactory.getLogger(Template.class);

	private final SourceFile sourceFile;
	private final List<Token> tokens;
	private final Map<Token, Integer> tokenIndices = new IdentityHashMap<>();
	private List<TemplateNode> roots;

	public Template(SourceFile sourceFile, List<Token> tokens) {
		this.sourceFile = sourceFile;
		this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
		for (int i = 0; i < this.tokens.size(); i++) {
			Integer previous = tokenIndices.put(this.tokens.get(i), i);
			if (previous != null) {
				throw new TemplateInvariantException("Token " + this.tokens.get(i).getTypeName()
						+ " appears twice in the token sequence of " + sourceFile.getName()
						+ " (at " + previous + " and " + i + ").");
			}
		}
	}

	public SourceFile getSourceFile() {
		return sourceFile;
	}

	/** Current text of the whole file, including all edits made so far. */
	public String getText() {
		return sourceFile.getText();
	}

	public List<Token> getTokens() {
		return tokens;
	}

	public List<TemplateNode> getRoots() {
		if (roots == null) {
			throw new TemplateInvariantException("Roots of " + sourceFile.getName() + " have not been set.");
		}
		return roots;
	}

	/**
	 * Sets the top-level nodes. Called once by the code that builds the tree.
	 */
	public void setRoots(List<TemplateNode> roots) {
		if (this.roots != null) {
			throw new TemplateInvariantException("Roots of " + sourceFile.getName() + " have already been set.");
		}
		this.roots = Collections.unmodifiableList(new ArrayList<>(roots));
	}

	public int getTokenIndex(Token token) {
		Integer index = tokenIndices.get(token);
		if (index == null) {
			throw new TemplateInvariantException("Token " + token.getTypeName() + " at "
					+ token.getLocationSpan().printLong() + " does not belong to this template.");
		}
		return index;
	}

	/**
	 * Calls {@code fn} for every token after {@code token} in document order,
	 * and for {@code token} itself first when {@code inclusive}.
	 */
	public void forEachTokenAfter(Token token, Consumer<Token> fn, boolean inclusive) {
		int from = getTokenIndex(token) + (inclusive ? 0 : 1);
		for (int i = from; i < tokens.size(); i++) {
			fn.accept(tokens.get(i));
		}
	}

	/**
	 * Calls {@code fn} for every token between {@code start} and {@code end},
	 * each end included or not as requested. Nothing happens when {@code end}
	 * comes before {@code start}.
	 */
	public void forEachTokenBetween(Token start, Token end, Consumer<Token> fn,
			boolean inclusiveStart, boolean inclusiveEnd) {
		int from = getTokenIndex(start) + (inclusiveStart ? 0 : 1);
		int to = getTokenIndex(end) - (inclusiveEnd ? 0 : 1);
		for (int i = from; i <= to; i++) {
			fn.accept(tokens.get(i));
		}
	}

	/**
	 * Moves every token strictly after {@code token} by {@code delta}. The
	 * token itself and everything before it are left alone.
	 */
	public void shiftTokensAfter(Token token, int delta) {
		if (delta == 0) {
			return;
		}
		int index = getTokenIndex(token);
		for (int i = index + 1; i < tokens.size(); i++) {
			tokens.get(i).getLocationSpan().moveBy(delta);
		}
		logger.trace("Shifted {} tokens after index {} by {}", tokens.size() - index - 1, index, delta);
	}

	/**
	 * Returns the nodes containing {@code offset}, outermost first. Attributes
	 * and binding parts are included, so an offset inside an attribute value
	 * ends on the attribute's expression.
	 */
	public AstPath<TemplateNode> findPath(int offset) {
		List<TemplateNode> path = new ArrayList<>();
		List<TemplateNode> candidates = getRoots();
		boolean descended = true;
		while (descended) {
			descended = false;
			for (TemplateNode candidate : candidates) {
				if (candidate.getLocationSpan().containsOffset(offset)) {
					path.add(candidate);
					candidates = candidate.getNestedNodes();
					descended = true;
					break;
				}
			}
		}
		return new AstPath<>(path, offset);
	}

	public AstPath<TemplateNode> findPath(Position position) {
		int offset = Positions.getOffset(getText(), position);
		if (offset < 0) {
			return new AstPath<>(Collections.emptyList(), offset);
		}
		return findPath(offset);
	}

	@Override
	public String toString() {
		return "Template{" + sourceFile.getName() + ", tokens=" + tokens.size() + "}";
	}
}
