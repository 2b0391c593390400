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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.ngast.location.LocationSpan;
import com.tomaszrup.ngast.template.tokenizer.Token;
import com.tomaszrup.ngast.template.tokenizer.TokenType;

/**
 * Base of the mutable template tree.
 *
 * <p>A node holds the tokens it was built from, a reference to the owning
 * {@link Template} and a parent link that is assigned exactly once, after
 * construction, by the code linking the node into its parent. Root nodes have
 * no parent and are found in {@link Template#getRoots()}.</p>
 *
 * <p>The location span is computed from the first and last token on every
 * call, so it stays accurate after edits anywhere in the file.</p>
 */
public abstract class TemplateNode {
	private static final Logger logger = LoggerFactory.getLogger(TemplateNode.class);

	private final Template template;
	private final List<Token> tokens;
	private TemplateNode parentTemplateNode;

	protected TemplateNode(List<Token> tokens, Template template) {
		if (tokens.isEmpty()) {
			throw new TemplateInvariantException("A " + getClass().getSimpleName() + " needs at least one token.");
		}
		this.tokens = Collections.unmodifiableList(new ArrayList<>(tokens));
		this.template = template;
	}

	/** Structural children in document order; empty for leaves. */
	public abstract List<TemplateNode> getTemplateChildren();

	/**
	 * Every node nested directly in this one: the structural children plus,
	 * for elements, the attributes and, for bindings, their target and value.
	 */
	public List<TemplateNode> getNestedNodes() {
		return getTemplateChildren();
	}

	/**
	 * The list of this node's nested nodes that contains {@code child}.
	 */
	protected List<? extends TemplateNode> getSiblingsOf(TemplateNode child) {
		return getTemplateChildren();
	}

	public Template getTemplate() {
		return template;
	}

	public LocationSpan getLocationSpan() {
		LocationSpan first = tokens.get(0).getLocationSpan();
		LocationSpan last = tokens.get(tokens.size() - 1).getLocationSpan();
		return new LocationSpan(first.getFile(), first.getStart(), last.getEnd());
	}

	public void setTemplateParent(TemplateNode templateParent) {
		if (templateParent == this) {
			throw new TemplateInvariantException(describe() + " cannot be its own parent.");
		}
		if (parentTemplateNode != null) {
			throw new TemplateInvariantException(describe() + " already has a parent ("
					+ parentTemplateNode.describe() + ").");
		}
		parentTemplateNode = templateParent;
	}

	public Optional<TemplateNode> getTemplateParent() {
		return Optional.ofNullable(parentTemplateNode);
	}

	public boolean isRoot() {
		return parentTemplateNode == null;
	}

	public Optional<TemplateNode> getNextTemplateSibling() {
		List<? extends TemplateNode> siblings;
		if (parentTemplateNode != null) {
			siblings = parentTemplateNode.getSiblingsOf(this);
		} else {
			siblings = template.getRoots();
		}
		int index = indexOfSelf(siblings);
		if (index == -1) {
			throw new TemplateInvariantException(parentTemplateNode != null
					? "Expected to have found " + describe() + " in its parent's children."
					: "Expected to have found " + describe() + " (root) in the template's roots.");
		}
		int nextIndex = index + 1;
		return nextIndex < siblings.size() ? Optional.of(siblings.get(nextIndex)) : Optional.empty();
	}

	public TemplateNode getNextTemplateSiblingOrThrow() {
		return getNextTemplateSibling().orElseThrow(() -> new TemplateInvariantException(
				"Expected " + describe() + " to have a next sibling."));
	}

	private int indexOfSelf(List<? extends TemplateNode> nodes) {
		for (int i = 0; i < nodes.size(); i++) {
			if (nodes.get(i) == this) {
				return i;
			}
		}
		return -1;
	}

	// ── Descendants (breadth-first, self excluded) ───────────────────────────

	public List<TemplateNode> getDescendants() {
		return getDescendants(node -> true);
	}

	public List<TemplateNode> getDescendants(Predicate<? super TemplateNode> predicate) {
		List<TemplateNode> result = new ArrayList<>();
		Deque<TemplateNode> queue = new ArrayDeque<>(getTemplateChildren());
		while (!queue.isEmpty()) {
			TemplateNode node = queue.removeFirst();
			queue.addAll(node.getTemplateChildren());
			if (predicate.test(node)) {
				result.add(node);
			}
		}
		return result;
	}

	public <T extends TemplateNode> List<T> getDescendantsOfType(Class<T> kind) {
		return getDescendants(kind::isInstance).stream().map(kind::cast).collect(Collectors.toList());
	}

	public Optional<TemplateNode> getDescendant() {
		return getDescendant(node -> true);
	}

	public Optional<TemplateNode> getDescendant(Predicate<? super TemplateNode> predicate) {
		Deque<TemplateNode> queue = new ArrayDeque<>(getTemplateChildren());
		while (!queue.isEmpty()) {
			TemplateNode node = queue.removeFirst();
			queue.addAll(node.getTemplateChildren());
			if (predicate.test(node)) {
				return Optional.of(node);
			}
		}
		return Optional.empty();
	}

	public <T extends TemplateNode> Optional<T> getDescendantOfType(Class<T> kind) {
		return getDescendant(kind::isInstance).map(kind::cast);
	}

	public TemplateNode getDescendantOrThrow(Predicate<? super TemplateNode> predicate) {
		return getDescendant(predicate).orElseThrow(() -> new TemplateInvariantException(
				"Expected " + describe() + " to have a matching descendant."));
	}

	public <T extends TemplateNode> T getDescendantOfTypeOrThrow(Class<T> kind) {
		return getDescendantOfType(kind).orElseThrow(() -> new TemplateInvariantException(
				"Expected " + describe() + " to have a descendant of kind " + kind.getSimpleName() + "."));
	}

	// ── Tokens ───────────────────────────────────────────────────────────────

	protected List<Token> getTokens() {
		return tokens;
	}

	protected List<Token> getTokens(Predicate<? super Token> predicate) {
		return tokens.stream().filter(predicate).collect(Collectors.toList());
	}

	protected Optional<Token> getFirstTokenOfType(TokenType type) {
		for (Token token : tokens) {
			if (token.is(type)) {
				return Optional.of(token);
			}
		}
		return Optional.empty();
	}

	protected Token getFirstTokenOfTypeOrThrow(TokenType type) {
		return getFirstTokenOfType(type).orElseThrow(() -> {
			String found = tokens.stream().map(Token::getTypeName).collect(Collectors.joining(", "));
			return new TemplateInvariantException("Expected to find " + type.getTypeName()
					+ " among tokens for " + getClass().getSimpleName() + ": " + found + ".");
		});
	}

	protected int getFirstTokenIndex() {
		return template.getTokenIndex(tokens.get(0));
	}

	/** Every token of the file after this node's last token. */
	protected void forEachTokenAfterHere(Consumer<Token> fn) {
		template.forEachTokenAfter(tokens.get(tokens.size() - 1), fn, false);
	}

	/** Every token from this node's first token to its last one, both included. */
	protected void forEachTokenHere(Consumer<Token> fn) {
		template.forEachTokenBetween(tokens.get(0), tokens.get(tokens.size() - 1), fn, true, true);
	}

	protected void forEachTokenHereAndAfterHere(Consumer<Token> fn) {
		forEachTokenHere(fn);
		forEachTokenAfterHere(fn);
	}

	// ── Mutation ─────────────────────────────────────────────────────────────

	/**
	 * Applies the edits in order. Each edit replaces the token's text and then
	 * moves every later token by the length difference before the next edit
	 * starts, so several edits of one node add up correctly.
	 */
	protected void replaceTextByTokens(Iterable<TextReplaceConfig> textReplaceConfigs) {
		for (TextReplaceConfig config : textReplaceConfigs) {
			Token token = config.getToken();
			String newText = config.getNewText();
			int delta = newText.length() - token.getLocationSpan().getLength();
			if (logger.isDebugEnabled()) {
				logger.debug("Replacing {} '{}' at {} with '{}' (delta {})", token.getTypeName(), token,
						token.getLocationSpan().printLong(), newText, delta);
			}
			token.getLocationSpan().replaceText(newText);
			template.shiftTokensAfter(token, delta);
		}
	}

	protected String describe() {
		return getClass().getSimpleName() + " at " + getLocationSpan().printLong();
	}

	@Override
	public String toString() {
		return describe();
	}
}
