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
package com.tomaszrup.ngast.template.tokenizer;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.ngast.config.TemplateOptions;
import com.tomaszrup.ngast.location.SourceFile;
import com.tomaszrup.ngast.template.TemplateParseException;
import com.tomaszrup.ngast.template.ast.SpanMode;

class TemplateLexerTests {

	private static List<Token> tokenize(String text) {
		return TemplateLexer.tokenize(new SourceFile("test.html", text));
	}

	private static List<TokenType> types(List<Token> tokens) {
		return tokens.stream().map(Token::getType).collect(Collectors.toList());
	}

	private static String concat(List<Token> tokens) {
		StringBuilder builder = new StringBuilder();
		for (Token token : tokens) {
			builder.append(token);
		}
		return builder.toString();
	}

	// ------------------------------------------------------------------
	// Token stream shape
	// ------------------------------------------------------------------

	@Test
	void testElementWithAttributeAndInterpolation() {
		List<Token> tokens = tokenize("<div class=\"a\">hi {{x}}</div>");
		List<TokenType> expected = new ArrayList<>();
		expected.add(TokenType.TAG_OPEN_START);
		expected.add(TokenType.WHITESPACE);
		expected.add(TokenType.ATTR_NAME);
		expected.add(TokenType.ATTR_EQUALS);
		expected.add(TokenType.ATTR_QUOTE);
		expected.add(TokenType.ATTR_VALUE);
		expected.add(TokenType.ATTR_QUOTE);
		expected.add(TokenType.TAG_OPEN_END);
		expected.add(TokenType.TEXT);
		expected.add(TokenType.INTERPOLATION_START);
		expected.add(TokenType.TEXT);
		expected.add(TokenType.INTERPOLATION_END);
		expected.add(TokenType.TAG_CLOSE);
		expected.add(TokenType.EOF);
		Assertions.assertEquals(expected, types(tokens));

		Assertions.assertEquals("<div", tokens.get(0).toString());
		Assertions.assertEquals("class", tokens.get(2).toString());
		Assertions.assertEquals("a", tokens.get(5).toString());
		Assertions.assertEquals("hi ", tokens.get(8).toString());
		Assertions.assertEquals("x", tokens.get(10).toString());
		Assertions.assertEquals("</div>", tokens.get(12).toString());
	}

	@Test
	void testTokensAreContiguous() {
		List<Token> tokens = tokenize("<ul>\n  <li *ngFor=\"let i of items\">{{ i }}</li>\n</ul>");
		int expectedStart = 0;
		for (Token token : tokens) {
			Assertions.assertEquals(expectedStart, token.getLocationSpan().getStart(), token.getTypeName());
			expectedStart = token.getLocationSpan().getEnd();
		}
	}

	@Test
	void testConcatenationReproducesSource() {
		String source = "<!DOCTYPE html>\n<!-- header -->\n<input [(ngModel)]=\"name\" #ref disabled/>"
				+ "<p (click)='go()'>a < b {{ c }}</p>";
		Assertions.assertEquals(source, concat(tokenize(source)));
	}

	@Test
	void testEmptySourceGivesOnlyEof() {
		List<Token> tokens = tokenize("");
		Assertions.assertEquals(1, tokens.size());
		Assertions.assertTrue(tokens.get(0).is(TokenType.EOF));
		Assertions.assertTrue(tokens.get(0).getLocationSpan().isEmpty());
	}

	@Test
	void testEofIsZeroWidthAtEnd() {
		List<Token> tokens = tokenize("abc");
		Token eof = tokens.get(tokens.size() - 1);
		Assertions.assertEquals(TokenType.EOF, eof.getType());
		Assertions.assertEquals(3, eof.getLocationSpan().getStart());
		Assertions.assertEquals(3, eof.getLocationSpan().getEnd());
	}

	@Test
	void testLessThanNotStartingTagIsText() {
		List<Token> tokens = tokenize("a < b");
		Assertions.assertEquals(2, tokens.size());
		Assertions.assertEquals(TokenType.TEXT, tokens.get(0).getType());
		Assertions.assertEquals("a < b", tokens.get(0).toString());
	}

	@Test
	void testCommentTokens() {
		List<Token> tokens = tokenize("<!-- note -->");
		Assertions.assertEquals(TokenType.COMMENT_START, tokens.get(0).getType());
		Assertions.assertEquals(TokenType.RAW_TEXT, tokens.get(1).getType());
		Assertions.assertEquals(" note ", tokens.get(1).toString());
		Assertions.assertEquals(TokenType.COMMENT_END, tokens.get(2).getType());
	}

	@Test
	void testEmptyCommentHasNoRawText() {
		List<Token> tokens = tokenize("<!---->");
		Assertions.assertEquals(TokenType.COMMENT_START, tokens.get(0).getType());
		Assertions.assertEquals(TokenType.COMMENT_END, tokens.get(1).getType());
		Assertions.assertEquals(TokenType.EOF, tokens.get(2).getType());
	}

	@Test
	void testDocType() {
		List<Token> tokens = tokenize("<!DOCTYPE html>");
		Assertions.assertEquals(TokenType.DOC_TYPE, tokens.get(0).getType());
		Assertions.assertEquals("<!DOCTYPE html>", tokens.get(0).toString());
	}

	@Test
	void testSelfClosingTag() {
		List<Token> tokens = tokenize("<br/>");
		Assertions.assertEquals(TokenType.TAG_OPEN_START, tokens.get(0).getType());
		Assertions.assertEquals(TokenType.TAG_OPEN_END_VOID, tokens.get(1).getType());
		Assertions.assertEquals("/>", tokens.get(1).toString());
	}

	@Test
	void testUnquotedAndValuelessAttributes() {
		List<Token> tokens = tokenize("<a href=x hidden>");
		Assertions.assertEquals(TokenType.ATTR_NAME, tokens.get(2).getType());
		Assertions.assertEquals(TokenType.ATTR_EQUALS, tokens.get(3).getType());
		Assertions.assertEquals(TokenType.ATTR_VALUE, tokens.get(4).getType());
		Assertions.assertEquals("x", tokens.get(4).toString());
		Assertions.assertEquals(TokenType.WHITESPACE, tokens.get(5).getType());
		Assertions.assertEquals(TokenType.ATTR_NAME, tokens.get(6).getType());
		Assertions.assertEquals("hidden", tokens.get(6).toString());
		Assertions.assertEquals(TokenType.TAG_OPEN_END, tokens.get(7).getType());
	}

	@Test
	void testWhitespaceAroundEquals() {
		List<Token> tokens = tokenize("<a b = \"c\">");
		Assertions.assertEquals("b", tokens.get(2).toString());
		Assertions.assertEquals(TokenType.WHITESPACE, tokens.get(3).getType());
		Assertions.assertEquals(TokenType.ATTR_EQUALS, tokens.get(4).getType());
		Assertions.assertEquals(TokenType.WHITESPACE, tokens.get(5).getType());
		Assertions.assertEquals(TokenType.ATTR_QUOTE, tokens.get(6).getType());
	}

	@Test
	void testBracesOutsideInterpolationAreText() {
		List<Token> tokens = tokenize("{count, plural, =0 {none}}");
		Assertions.assertEquals(TokenType.TEXT, tokens.get(0).getType());
		Assertions.assertEquals(2, tokens.size());
	}

	@Test
	void testCustomInterpolationDelimiters() {
		TemplateOptions options = new TemplateOptions("[[", "]]", SpanMode.RENDERED, null);
		List<Token> tokens = TemplateLexer.tokenize(new SourceFile("test.html", "{{a}}[[b]]"), options);
		Assertions.assertEquals(TokenType.TEXT, tokens.get(0).getType());
		Assertions.assertEquals("{{a}}", tokens.get(0).toString());
		Assertions.assertEquals(TokenType.INTERPOLATION_START, tokens.get(1).getType());
		Assertions.assertEquals("[[", tokens.get(1).toString());
		Assertions.assertEquals("b", tokens.get(2).toString());
		Assertions.assertEquals("]]", tokens.get(3).toString());
	}

	@Test
	void testTypeNames() {
		Assertions.assertEquals("TagOpenStart", TokenType.TAG_OPEN_START.getTypeName());
		Assertions.assertEquals("Eof", TokenType.EOF.getTypeName());
	}

	// ------------------------------------------------------------------
	// Errors
	// ------------------------------------------------------------------

	@Test
	void testUnterminatedInterpolation() {
		TemplateParseException e = Assertions.assertThrows(TemplateParseException.class,
				() -> tokenize("ab{{x"));
		Assertions.assertEquals(2, e.getLocationSpan().getStart());
		Assertions.assertTrue(e.getMessage().contains("test.html:1:3"), e.getMessage());
	}

	@Test
	void testUnterminatedComment() {
		Assertions.assertThrows(TemplateParseException.class, () -> tokenize("<!-- x"));
	}

	@Test
	void testUnterminatedStartTag() {
		Assertions.assertThrows(TemplateParseException.class, () -> tokenize("<div class=\"a\""));
	}

	@Test
	void testUnterminatedAttributeValue() {
		Assertions.assertThrows(TemplateParseException.class, () -> tokenize("<a b=\"x>"));
	}

	@Test
	void testUnterminatedEndTag() {
		Assertions.assertThrows(TemplateParseException.class, () -> tokenize("<a></a"));
	}

	@Test
	void testMissingAttributeName() {
		Assertions.assertThrows(TemplateParseException.class, () -> tokenize("<a =x>"));
	}

	@Test
	void testTokensCompareByIdentity() {
		List<Token> tokens = tokenize("a<b></b>a");
		Token first = tokens.get(0);
		Token last = tokens.get(4);
		Assertions.assertEquals(first.toString(), last.toString());
		Assertions.assertNotEquals(first, last);
	}
}
