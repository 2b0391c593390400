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

import java.util.List;
import java.util.Optional;

import com.tomaszrup.ngast.template.tokenizer.Token;

/**
 * A property binding, {@code [value]="expr"} or {@code bind-value="expr"}.
 */
public class BoundAttributeTemplateNode
		extends BindingAttributeTemplateNode<PropertyBindingTargetTemplateNode, ExpressionTemplateNode> {

	public BoundAttributeTemplateNode(List<Token> tokens, Template template,
			PropertyBindingTargetTemplateNode target, ExpressionTemplateNode expression) {
		super(tokens, template, target, expression);
	}

	public Optional<ExpressionTemplateNode> getExpression() {
		return getValueNode();
	}
}
