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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.ngast.location.SourceFile;
import com.tomaszrup.ngast.template.AttributeSyntax;
import com.tomaszrup.ngast.template.AttributeTemplateNode;
import com.tomaszrup.ngast.template.BoundAttributeTemplateNode;
import com.tomaszrup.ngast.template.BoundEventTemplateNode;
import com.tomaszrup.ngast.template.CommentTemplateNode;
import com.tomaszrup.ngast.template.ElementLikeTemplateNode;
import com.tomaszrup.ngast.template.ElementTemplateNode;
import com.tomaszrup.ngast.template.EventBindingTargetTemplateNode;
import com.tomaszrup.ngast.template.ExpressionTemplateNode;
import com.tomaszrup.ngast.template.InterpolationTemplateNode;
import com.tomaszrup.ngast.template.NgContainerTemplateNode;
import com.tomaszrup.ngast.template.NgTemplateTemplateNode;
import com.tomaszrup.ngast.template.PropertyBindingTargetTemplateNode;
import com.tomaszrup.ngast.template.ReferenceTemplateNode;
import com.tomaszrup.ngast.template.StatementTemplateNode;
import com.tomaszrup.ngast.template.Template;
import com.tomaszrup.ngast.template.TemplateNode;
import com.tomaszrup.ngast.template.TemplateParseException;
import com.tomaszrup.ngast.template.TextAttributeTemplateNode;
import com.tomaszrup.ngast.template.TextTemplateNode;
import com.tomaszrup.ngast.template.TwoWayBindingTemplateNode;
import com.tomaszrup.ngast.template.ast.Attribute;
import com.tomaszrup.ngast.template.ast.Comment;
import com.tomaszrup.ngast.template.ast.Element;
import com.tomaszrup.ngast.template.ast.Expansion;
import com.tomaszrup.ngast.template.ast.ExpansionCase;
import com.tomaszrup.ngast.template.ast.HtmlAst;
import com.tomaszrup.ngast.template.ast.Text;
import com.tomaszrup.ngast.template.ast.Visitor;
import com.tomaszrup.ngast.template.tokenizer.Token;
import com.tomaszrup.ngast.template.tokenizer.TokenType;

/**
 * Turns a raw tree into the mutable tree of a new {@link Template}, sharing
 * the raw tree's tokens, and links every node to its parent. The raw tree is
 * not referenced by the result.
 */
public class TemplateNodeBuilder implements Visitor<TemplateNode, Template> {
	private static final Logger logger = LoggerFactory.getLogger(TemplateNodeBuilder.class);

	public static Template build(ParseTreeResult parseTree, SourceFile sourceFile) {
		Template template = new Template(sourceFile, parseTree.getTokens());
		List<TemplateNode> roots = HtmlAst.visitAll(new TemplateNodeBuilder(), parseTree.getRootNodes(), template);
		template.setRoots(roots);
		logger.debug("Built template tree for {} with {} roots", sourceFile.getName(), roots.size());
		return template;
	}

	@Override
	public TemplateNode visitElement(Element element, Template template) {
		List<AttributeTemplateNode> attributes = new ArrayList<>();
		for (TemplateNode attribute : HtmlAst.visitAll(this, element.getAttrs(), template)) {
			attributes.add((AttributeTemplateNode) attribute);
		}
		List<TemplateNode> children = HtmlAst.visitAll(this, element.getChildren(), template);

		ElementLikeTemplateNode node;
		if (NgTemplateTemplateNode.TAG_NAME.equals(element.getName())) {
			node = new NgTemplateTemplateNode(element.getTokens(), template, attributes, children);
		} else if (NgContainerTemplateNode.TAG_NAME.equals(element.getName())) {
			node = new NgContainerTemplateNode(element.getTokens(), template, attributes, children);
		} else {
			node = new ElementTemplateNode(element.getTokens(), template, attributes, children);
		}
		link(node, attributes);
		link(node, children);
		return node;
	}

	@Override
	public TemplateNode visitAttribute(Attribute attribute, Template template) {
		List<Token> tokens = attribute.getTokens();
		Token nameToken = firstOfType(tokens, TokenType.ATTR_NAME);
		Token valueToken = firstOfType(tokens, TokenType.ATTR_VALUE);
		AttributeSyntax syntax = AttributeSyntax.of(attribute.getName());
		switch (syntax.getKind()) {
			case PROPERTY: {
				PropertyBindingTargetTemplateNode target = new PropertyBindingTargetTemplateNode(
						Collections.singletonList(nameToken), template);
				ExpressionTemplateNode expression = valueToken != null
						? new ExpressionTemplateNode(Collections.singletonList(valueToken), template)
						: null;
				return linkParts(new BoundAttributeTemplateNode(tokens, template, target, expression),
						target, expression);
			}
			case TWO_WAY: {
				PropertyBindingTargetTemplateNode target = new PropertyBindingTargetTemplateNode(
						Collections.singletonList(nameToken), template);
				ExpressionTemplateNode expression = valueToken != null
						? new ExpressionTemplateNode(Collections.singletonList(valueToken), template)
						: null;
				return linkParts(new TwoWayBindingTemplateNode(tokens, template, target, expression),
						target, expression);
			}
			case EVENT: {
				EventBindingTargetTemplateNode target = new EventBindingTargetTemplateNode(
						Collections.singletonList(nameToken), template);
				StatementTemplateNode handler = valueToken != null
						? new StatementTemplateNode(Collections.singletonList(valueToken), template)
						: null;
				return linkParts(new BoundEventTemplateNode(tokens, template, target, handler),
						target, handler);
			}
			case REFERENCE:
				return new ReferenceTemplateNode(tokens, template);
			default:
				return new TextAttributeTemplateNode(tokens, template);
		}
	}

	@Override
	public TemplateNode visitText(Text text, Template template) {
		if (text.getTokens().get(0).is(TokenType.INTERPOLATION_START)) {
			return new InterpolationTemplateNode(text.getTokens(), template);
		}
		return new TextTemplateNode(text.getTokens(), template);
	}

	@Override
	public TemplateNode visitComment(Comment comment, Template template) {
		return new CommentTemplateNode(comment.getTokens(), template, comment.getValue());
	}

	@Override
	public TemplateNode visitExpansion(Expansion expansion, Template template) {
		throw new TemplateParseException("ICU expansions have no template node kind", expansion.getLocationSpan());
	}

	@Override
	public TemplateNode visitExpansionCase(ExpansionCase expansionCase, Template template) {
		throw new TemplateParseException("ICU expansion cases have no template node kind",
				expansionCase.getLocationSpan());
	}

	private static void link(TemplateNode parent, List<? extends TemplateNode> children) {
		for (TemplateNode child : children) {
			child.setTemplateParent(parent);
		}
	}

	private static AttributeTemplateNode linkParts(AttributeTemplateNode attribute, TemplateNode target,
			TemplateNode value) {
		target.setTemplateParent(attribute);
		if (value != null) {
			value.setTemplateParent(attribute);
		}
		return attribute;
	}

	private static Token firstOfType(List<Token> tokens, TokenType type) {
		for (Token token : tokens) {
			if (token.is(type)) {
				return token;
			}
		}
		return null;
	}
}
