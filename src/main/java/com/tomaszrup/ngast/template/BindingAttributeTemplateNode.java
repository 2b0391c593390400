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

import com.tomaszrup.ngast.template.tokenizer.Token;

/**
 * An attribute binding a target to a value: property bindings, event
 * bindings and two-way bindings. The target shares the attribute's name token
 * and the value node shares its value token.
 *
 * @param <T> kind of binding target
 * @param <V> kind of value node
 */
public abstract class BindingAttributeTemplateNode<T extends BindingTargetTemplateNode, V extends TemplateNode>
		extends AttributeTemplateNode {
	private final T target;
	private final V valueNode;
	private final List<TemplateNode> parts;

	/**
	 * @param valueNode {@code null} when the attribute has no value
	 */
	protected BindingAttributeTemplateNode(List<Token> tokens, Template template, T target, V valueNode) {
		super(tokens, template);
		this.target = target;
		this.valueNode = valueNode;
		List<TemplateNode> list = new ArrayList<>();
		list.add(target);
		if (valueNode != null) {
			list.add(valueNode);
		}
		this.parts = Collections.unmodifiableList(list);
	}

	public T getTarget() {
		return target;
	}

	protected Optional<V> getValueNode() {
		return Optional.ofNullable(valueNode);
	}

	@Override
	protected List<TemplateNode> getParts() {
		return parts;
	}
}
