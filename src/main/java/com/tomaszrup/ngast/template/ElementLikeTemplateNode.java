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
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import com.tomaszrup.ngast.location.LocationSpan;
import com.tomaszrup.ngast.template.tokenizer.Token;
import com.tomaszrup.ngast.template.tokenizer.TokenType;

/**
 * A node with a tag: an ordinary element, {@code <ng-template>} or
 * {@code <ng-container>}.
 *
 * <p>Attributes are not structural children. They are partitioned into five
 * buckets when the node is created; an attribute of any other kind is a
 * construction error.</p>
 */
public abstract class ElementLikeTemplateNode extends TemplateNode {

	private final List<AttributeTemplateNode> allAttributes;
	private final List<TemplateNode> children;

	private final List<TextAttributeTemplateNode> textAttributes = new ArrayList<>();
	private final List<BoundAttributeTemplateNode> boundAttributes = new ArrayList<>();
	private final List<BoundEventTemplateNode> boundEvents = new ArrayList<>();
	private final List<TwoWayBindingTemplateNode> twoWayBindings = new ArrayList<>();
	private final List<ReferenceTemplateNode> references = new ArrayList<>();

	private final List<TemplateNode> nestedNodes;

	/**
	 * @param tokens the tokens of the start tag and of the end tag, if any
	 */
	protected ElementLikeTemplateNode(List<Token> tokens, Template template,
			List<? extends AttributeTemplateNode> allAttributes, List<? extends TemplateNode> children) {
		super(tokens, template);
		this.allAttributes = Collections.unmodifiableList(new ArrayList<>(allAttributes));
		this.children = Collections.unmodifiableList(new ArrayList<>(children));

		for (AttributeTemplateNode attribute : allAttributes) {
			if (attribute instanceof TextAttributeTemplateNode) {
				textAttributes.add((TextAttributeTemplateNode) attribute);
			} else if (attribute instanceof BoundAttributeTemplateNode) {
				boundAttributes.add((BoundAttributeTemplateNode) attribute);
			} else if (attribute instanceof BoundEventTemplateNode) {
				boundEvents.add((BoundEventTemplateNode) attribute);
			} else if (attribute instanceof TwoWayBindingTemplateNode) {
				twoWayBindings.add((TwoWayBindingTemplateNode) attribute);
			} else if (attribute instanceof ReferenceTemplateNode) {
				references.add((ReferenceTemplateNode) attribute);
			} else {
				throw new TemplateInvariantException("Unexpected type of attribute "
						+ attribute.getClass().getSimpleName() + " on element at " + getLocationSpan().printLong() + ".");
			}
		}

		List<TemplateNode> nested = new ArrayList<>(this.allAttributes);
		nested.addAll(this.children);
		this.nestedNodes = Collections.unmodifiableList(nested);
	}

	@Override
	public List<TemplateNode> getTemplateChildren() {
		return children;
	}

	@Override
	public List<TemplateNode> getNestedNodes() {
		return nestedNodes;
	}

	@Override
	protected List<? extends TemplateNode> getSiblingsOf(TemplateNode child) {
		return child instanceof AttributeTemplateNode ? allAttributes : children;
	}

	public abstract String getTagName();

	public Token getTagOpenStartToken() {
		return getFirstTokenOfTypeOrThrow(TokenType.TAG_OPEN_START);
	}

	/** The end tag token; empty for void and self-closing elements. */
	public Optional<Token> getTagEndToken() {
		return getFirstTokenOfType(TokenType.TAG_CLOSE);
	}

	/** The open tag token without its leading {@code <}. */
	public LocationSpan getStartTagNameLocationSpan() {
		return getTagOpenStartToken().getLocationSpan().clone().moveStartBy(1);
	}

	/** The end tag token without {@code </} and the trailing {@code >}. */
	public Optional<LocationSpan> getEndTagNameLocationSpan() {
		return getTagEndToken().map(token -> {
			LocationSpan span = token.getLocationSpan();
			String text = span.getText();
			String name = text.substring(2, text.length() - 1).stripTrailing();
			return new LocationSpan(span.getFile(), span.getStart() + 2, span.getStart() + 2 + name.length());
		});
	}

	// ── Attributes ───────────────────────────────────────────────────────────

	public List<AttributeTemplateNode> getAttributes() {
		return allAttributes;
	}

	public List<AttributeTemplateNode> getAttributes(Predicate<? super AttributeTemplateNode> predicate) {
		return allAttributes.stream().filter(predicate).collect(Collectors.toList());
	}

	public <T extends AttributeTemplateNode> List<T> getAttributesOfType(Class<T> kind) {
		return allAttributes.stream().filter(kind::isInstance).map(kind::cast).collect(Collectors.toList());
	}

	public Optional<AttributeTemplateNode> getFirstAttribute() {
		return allAttributes.isEmpty() ? Optional.empty() : Optional.of(allAttributes.get(0));
	}

	public Optional<AttributeTemplateNode> getFirstAttribute(Predicate<? super AttributeTemplateNode> predicate) {
		return allAttributes.stream().filter(predicate).findFirst();
	}

	public AttributeTemplateNode getFirstAttributeOrThrow(Predicate<? super AttributeTemplateNode> predicate) {
		return getFirstAttribute(predicate).orElseThrow(() -> new TemplateInvariantException(
				"Expected " + describe() + " to have a matching attribute. Attributes found: "
						+ describeAttributes() + "."));
	}

	public Optional<AttributeTemplateNode> getAttributeNamed(String name) {
		return getFirstAttribute(attribute -> attribute.getName().equals(name));
	}

	public List<TextAttributeTemplateNode> getTextAttributes() {
		return Collections.unmodifiableList(textAttributes);
	}

	public List<BoundAttributeTemplateNode> getBoundAttributes() {
		return Collections.unmodifiableList(boundAttributes);
	}

	public List<BoundEventTemplateNode> getBoundEvents() {
		return Collections.unmodifiableList(boundEvents);
	}

	public List<TwoWayBindingTemplateNode> getTwoWayBindings() {
		return Collections.unmodifiableList(twoWayBindings);
	}

	public List<ReferenceTemplateNode> getReferences() {
		return Collections.unmodifiableList(references);
	}

	public Optional<ReferenceTemplateNode> getReferenceNamed(String referenceName) {
		return references.stream().filter(reference -> reference.getName().equals(referenceName)).findFirst();
	}

	public ReferenceTemplateNode getReferenceNamedOrThrow(String referenceName) {
		return getReferenceNamed(referenceName).orElseThrow(() -> {
			String knownReferences = references.stream()
					.map(ReferenceTemplateNode::getName)
					.collect(Collectors.joining(", "));
			return new TemplateInvariantException("Expected element-like node at "
					+ getLocationSpan().printLong() + " to have a reference named \"" + referenceName + "\". "
					+ "These references were found: " + (knownReferences.isEmpty() ? "(none)" : knownReferences) + ".");
		});
	}

	public boolean hasReferenceNamed(String referenceName) {
		return getReferenceNamed(referenceName).isPresent();
	}

	private String describeAttributes() {
		String names = allAttributes.stream().map(AttributeTemplateNode::getRawName).collect(Collectors.joining(", "));
		return names.isEmpty() ? "(none)" : names;
	}
}
