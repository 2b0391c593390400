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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.ngast.config.TemplateOptions;
import com.tomaszrup.ngast.location.LocationSpan;
import com.tomaszrup.ngast.location.SourceFile;
import com.tomaszrup.ngast.template.TemplateParseException;

/**
 * Splits template source into tokens. The tokens cover the source without
 * gaps or overlaps, so concatenating their texts gives back the input; the
 * stream always ends with a zero-width {@link TokenType#EOF}.
 *
 * <p>ICU expansion forms are not recognized: braces outside of
 * interpolations are plain text.</p>
 */
public class TemplateLexer {
	private static final Logger logger = LoggerFactory.getLogger(TemplateLexer.class);

	private static final String COMMENT_START = "<!--";
	private static final String COMMENT_END = "-->";

	private final SourceFile file;
	private final String input;
	private final String interpolationStart;
	private final String interpolationEnd;
	private final List<Token> tokens = new ArrayList<>();
	private int index;

	private TemplateLexer(SourceFile file, TemplateOptions options) {
		this.file = file;
		this.input = file.getText();
		this.interpolationStart = options.getInterpolationStart();
		this.interpolationEnd = options.getInterpolationEnd();
	}

	public static List<Token> tokenize(SourceFile file) {
		return tokenize(file, TemplateOptions.DEFAULTS);
	}

	public static List<Token> tokenize(SourceFile file, TemplateOptions options) {
		List<Token> result = new TemplateLexer(file, options).run();
		logger.debug("Tokenized {} into {} tokens", file.getName(), result.size());
		return result;
	}

	private List<Token> run() {
		while (index < input.length()) {
			if (input.startsWith(COMMENT_START, index)) {
				consumeComment();
			} else if (input.startsWith("<!", index)) {
				consumeDocType();
			} else if (input.startsWith("</", index) && isNameStart(peek(2))) {
				consumeTagClose();
			} else if (peek(0) == '<' && isNameStart(peek(1))) {
				consumeTagOpen();
			} else if (input.startsWith(interpolationStart, index)) {
				consumeInterpolation();
			} else {
				consumeText();
			}
		}
		emit(TokenType.EOF, index);
		return tokens;
	}

	private void consumeText() {
		int start = index;
		index++;
		while (index < input.length() && !isAtTextBoundary()) {
			index++;
		}
		emitFrom(TokenType.TEXT, start);
	}

	private boolean isAtTextBoundary() {
		if (input.startsWith(interpolationStart, index)) {
			return true;
		}
		if (peek(0) != '<') {
			return false;
		}
		char next = peek(1);
		return next == '!' || isNameStart(next) || (next == '/' && isNameStart(peek(2)));
	}

	private void consumeInterpolation() {
		int start = index;
		emit(TokenType.INTERPOLATION_START, index + interpolationStart.length());
		int end = input.indexOf(interpolationEnd, index);
		if (end < 0) {
			throw error("Unterminated interpolation, missing " + interpolationEnd, start);
		}
		emit(TokenType.TEXT, end);
		emit(TokenType.INTERPOLATION_END, end + interpolationEnd.length());
	}

	private void consumeComment() {
		int start = index;
		emit(TokenType.COMMENT_START, index + COMMENT_START.length());
		int end = input.indexOf(COMMENT_END, index);
		if (end < 0) {
			throw error("Unterminated comment", start);
		}
		if (end > index) {
			emit(TokenType.RAW_TEXT, end);
		}
		emit(TokenType.COMMENT_END, end + COMMENT_END.length());
	}

	private void consumeDocType() {
		int end = input.indexOf('>', index);
		if (end < 0) {
			throw error("Unterminated doctype", index);
		}
		emit(TokenType.DOC_TYPE, end + 1);
	}

	private void consumeTagClose() {
		int end = input.indexOf('>', index);
		if (end < 0) {
			throw error("Unterminated end tag", index);
		}
		emit(TokenType.TAG_CLOSE, end + 1);
	}

	private void consumeTagOpen() {
		int start = index;
		index++;
		while (index < input.length() && isNameChar(peek(0))) {
			index++;
		}
		emitFrom(TokenType.TAG_OPEN_START, start);
		while (true) {
			if (index >= input.length()) {
				throw error("Unterminated start tag", start);
			}
			char c = peek(0);
			if (Character.isWhitespace(c)) {
				consumeWhitespace();
			} else if (input.startsWith("/>", index)) {
				emit(TokenType.TAG_OPEN_END_VOID, index + 2);
				return;
			} else if (c == '>') {
				emit(TokenType.TAG_OPEN_END, index + 1);
				return;
			} else {
				consumeAttribute();
			}
		}
	}

	private void consumeAttribute() {
		int nameStart = index;
		while (index < input.length() && !isAttributeNameEnd()) {
			index++;
		}
		if (index == nameStart) {
			throw error("Expected an attribute name", nameStart);
		}
		emitFrom(TokenType.ATTR_NAME, nameStart);

		int afterWhitespace = index;
		while (afterWhitespace < input.length() && Character.isWhitespace(input.charAt(afterWhitespace))) {
			afterWhitespace++;
		}
		if (afterWhitespace >= input.length() || input.charAt(afterWhitespace) != '=') {
			return;
		}
		if (afterWhitespace > index) {
			emit(TokenType.WHITESPACE, afterWhitespace);
		}
		emit(TokenType.ATTR_EQUALS, index + 1);
		consumeWhitespace();
		consumeAttributeValue();
	}

	private boolean isAttributeNameEnd() {
		char c = peek(0);
		return Character.isWhitespace(c) || c == '=' || c == '>' || input.startsWith("/>", index);
	}

	private void consumeAttributeValue() {
		char quote = peek(0);
		if (quote == '"' || quote == '\'') {
			int start = index;
			emit(TokenType.ATTR_QUOTE, index + 1);
			int end = input.indexOf(quote, index);
			if (end < 0) {
				throw error("Unterminated attribute value", start);
			}
			emit(TokenType.ATTR_VALUE, end);
			emit(TokenType.ATTR_QUOTE, end + 1);
			return;
		}
		int start = index;
		while (index < input.length() && !Character.isWhitespace(peek(0)) && peek(0) != '>'
				&& !input.startsWith("/>", index)) {
			index++;
		}
		emitFrom(TokenType.ATTR_VALUE, start);
	}

	private void consumeWhitespace() {
		int start = index;
		while (index < input.length() && Character.isWhitespace(peek(0))) {
			index++;
		}
		if (index > start) {
			emitFrom(TokenType.WHITESPACE, start);
		}
	}

	private char peek(int offset) {
		int i = index + offset;
		return i < input.length() ? input.charAt(i) : '\0';
	}

	/** Emits a token from the current index to {@code end} and moves there. */
	private void emit(TokenType type, int end) {
		tokens.add(new Token(type, new LocationSpan(file, index, end)));
		index = end;
	}

	/** Emits a token from {@code start} to the current index. */
	private void emitFrom(TokenType type, int start) {
		tokens.add(new Token(type, new LocationSpan(file, start, index)));
	}

	private TemplateParseException error(String message, int offset) {
		return new TemplateParseException(message, new LocationSpan(file, offset, offset));
	}

	private static boolean isNameStart(char c) {
		return Character.isLetter(c);
	}

	private static boolean isNameChar(char c) {
		return Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == ':' || c == '.';
	}
}
