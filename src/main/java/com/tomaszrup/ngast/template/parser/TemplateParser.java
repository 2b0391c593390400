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
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.ngast.location.LocationSpan;
import com.tomaszrup.ngast.template.TemplateParseException;
import com.tomaszrup.ngast.template.ast.Attribute;
import com.tomaszrup.ngast.template.ast.Comment;
import com.tomaszrup.ngast.template.ast.Element;
import com.tomaszrup.ngast.template.ast.Node;
import com.tomaszrup.ngast.template.ast.Text;
import com.tomaszrup.ngast.template.tokenizer.Token;
import com.tomaszrup.ngast.template.tokenizer.TokenType;

/**
 * Builds the raw tree from a token stream produced by
 * {@link com.tomaszrup.ngast.template.tokenizer.TemplateLexer}.
 *
 * <p>Every text run and every interpolation becomes its own {@link Text}
 * node. Void elements such as {@code <input>} and elements closed with
 * {@code />} have no children and no end tag; every other element must be
 * closed by a matching end tag.</p>
 */
public class TemplateParser {
	private static final Logger logger = LoggerFactory.getLogger(TemplateParser.class);

	static final Set<String> VOID_ELEMENTS = Collections.unmodifiableSet(new HashSet<>(Arrays.asList(
			"area", "base", "br", "col", "embed", "hr", "img", "input", "link", "meta", "param",
			"source", "track", "wbr")));

	private final List<Token> tokens;
	private int index;

	private TemplateParser(List<Token> tokens) {
		if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenType.EOF)) {
			throw new IllegalArgumentException("Token stream must end with " + TokenType.EOF.getTypeName());
		}
		this.tokens = tokens;
	}

	public static ParseTreeResult parse(List<Token> tokens) {
		List<Node> roots = new TemplateParser(tokens).parseChildren(null);
		logger.debug("Parsed {} root nodes from {} tokens", roots.size(), tokens.size());
		return new ParseTreeResult(tokens, roots);
	}

	/**
	 * Parses nodes up to the end tag matching {@code parentOpen}, which is
	 * left for the caller, or up to the end of input for the top level.
	 */
	private List<Node> parseChildren(Token parentOpen) {
		String parentName = parentOpen != null ? tagName(parentOpen) : null;
		List<Node> children = new ArrayList<>();
		while (true) {
			Token token = peek();
			switch (token.getType()) {
				case EOF:
					if (parentOpen != null) {
						throw new TemplateParseException("Unclosed element <" + parentName + ">",
								parentOpen.getLocationSpan());
					}
					return children;
				case TAG_CLOSE:
					String closingName = closingTagName(token);
					if (parentName == null) {
						throw new TemplateParseException("Unexpected closing tag </" + closingName + ">",
								token.getLocationSpan());
					}
					if (!closingName.equals(parentName)) {
						throw new TemplateParseException("Unexpected closing tag </" + closingName
								+ ">, expected </" + parentName + ">", token.getLocationSpan());
					}
					return children;
				case TEXT:
					Token text = advance();
					children.add(new Text(Collections.singletonList(text), text.toString(),
							text.getLocationSpan().clone()));
					break;
				case INTERPOLATION_START:
					children.add(parseInterpolation());
					break;
				case COMMENT_START:
					children.add(parseComment());
					break;
				case DOC_TYPE:
					advance();
					break;
				case TAG_OPEN_START:
					children.add(parseElement());
					break;
				default:
					throw unexpected(token);
			}
		}
	}

	private Text parseInterpolation() {
		Token start = advance();
		Token text = expect(TokenType.TEXT);
		Token end = expect(TokenType.INTERPOLATION_END);
		String value = start.toString() + text + end;
		return new Text(Arrays.asList(start, text, end), value, spanBetween(start, end));
	}

	private Comment parseComment() {
		Token start = advance();
		List<Token> commentTokens = new ArrayList<>();
		commentTokens.add(start);
		String value = null;
		if (peek().is(TokenType.RAW_TEXT)) {
			Token content = advance();
			commentTokens.add(content);
			value = content.toString().trim();
		}
		Token end = expect(TokenType.COMMENT_END);
		commentTokens.add(end);
		return new Comment(commentTokens, value, spanBetween(start, end));
	}

	private Element parseElement() {
		Token open = advance();
		String name = tagName(open);
		List<Token> elementTokens = new ArrayList<>();
		elementTokens.add(open);
		List<Attribute> attrs = new ArrayList<>();

		Token startTagEnd = null;
		while (startTagEnd == null) {
			Token token = peek();
			switch (token.getType()) {
				case WHITESPACE:
					elementTokens.add(advance());
					break;
				case ATTR_NAME:
					Attribute attribute = parseAttribute();
					attrs.add(attribute);
					elementTokens.addAll(attribute.getTokens());
					break;
				case TAG_OPEN_END:
				case TAG_OPEN_END_VOID:
					startTagEnd = advance();
					elementTokens.add(startTagEnd);
					break;
				default:
					throw unexpected(token);
			}
		}

		LocationSpan startSourceSpan = spanBetween(open, startTagEnd);
		if (startTagEnd.is(TokenType.TAG_OPEN_END_VOID) || VOID_ELEMENTS.contains(name.toLowerCase(Locale.ROOT))) {
			return new Element(elementTokens, name, attrs, Collections.emptyList(),
					startSourceSpan.clone(), startSourceSpan, null);
		}

		List<Node> children = parseChildren(open);
		Token close = advance();
		elementTokens.add(close);
		return new Element(elementTokens, name, attrs, children, spanBetween(open, close),
				startSourceSpan, close.getLocationSpan().clone());
	}

	private Attribute parseAttribute() {
		Token nameToken = advance();
		List<Token> attributeTokens = new ArrayList<>();
		attributeTokens.add(nameToken);
		if (peek().is(TokenType.WHITESPACE) && peek(1).is(TokenType.ATTR_EQUALS)) {
			attributeTokens.add(advance());
		}
		if (!peek().is(TokenType.ATTR_EQUALS)) {
			return new Attribute(attributeTokens, nameToken.toString(), "",
					nameToken.getLocationSpan().clone(), null);
		}
		attributeTokens.add(advance());
		if (peek().is(TokenType.WHITESPACE)) {
			attributeTokens.add(advance());
		}
		boolean quoted = peek().is(TokenType.ATTR_QUOTE);
		if (quoted) {
			attributeTokens.add(advance());
		}
		Token value = expect(TokenType.ATTR_VALUE);
		attributeTokens.add(value);
		if (quoted) {
			attributeTokens.add(expect(TokenType.ATTR_QUOTE));
		}
		Token last = attributeTokens.get(attributeTokens.size() - 1);
		return new Attribute(attributeTokens, nameToken.toString(), value.toString(),
				spanBetween(nameToken, last), value.getLocationSpan().clone());
	}

	private Token peek() {
		return peek(0);
	}

	private Token peek(int offset) {
		return tokens.get(Math.min(index + offset, tokens.size() - 1));
	}

	private Token advance() {
		Token token = peek();
		if (index < tokens.size() - 1) {
			index++;
		}
		return token;
	}

	private Token expect(TokenType type) {
		Token token = peek();
		if (!token.is(type)) {
			throw new TemplateParseException("Expected " + type.getTypeName() + " but found "
					+ token.getTypeName(), token.getLocationSpan());
		}
		return advance();
	}

	private static TemplateParseException unexpected(Token token) {
		return new TemplateParseException("Unexpected " + token.getTypeName() + " '" + token + "'",
				token.getLocationSpan());
	}

	private static LocationSpan spanBetween(Token first, Token last) {
		return new LocationSpan(first.getLocationSpan().getFile(), first.getLocationSpan().getStart(),
				last.getLocationSpan().getEnd());
	}

	private static String tagName(Token openToken) {
		return openToken.toString().substring(1);
	}

	private static String closingTagName(Token closeToken) {
		String text = closeToken.toString();
		return text.substring(2, text.length() - 1).trim();
	}
}
