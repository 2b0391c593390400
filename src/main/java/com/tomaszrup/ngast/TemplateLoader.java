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
package com.tomaszrup.ngast;

import java.util.Collections;
import java.util.List;

import org.eclipse.lsp4j.Position;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lsp.utils.Positions;
import com.tomaszrup.ngast.config.TemplateOptions;
import com.tomaszrup.ngast.location.SourceFile;
import com.tomaszrup.ngast.template.Template;
import com.tomaszrup.ngast.template.ast.AstPath;
import com.tomaszrup.ngast.template.ast.HtmlAst;
import com.tomaszrup.ngast.template.ast.Node;
import com.tomaszrup.ngast.template.parser.ParseTreeResult;
import com.tomaszrup.ngast.template.parser.TemplateNodeBuilder;
import com.tomaszrup.ngast.template.parser.TemplateParser;
import com.tomaszrup.ngast.template.tokenizer.TemplateLexer;
import com.tomaszrup.ngast.template.tokenizer.Token;

/**
 * Entry point: lexes, parses and builds templates with one set of
 * {@link TemplateOptions}, and answers position lookups over raw trees.
 *
 * <pre>{@code
 * TemplateLoader loader = new TemplateLoader();
 * Template template = loader.load("app.component.html", source);
 * template.getRoots().get(0)...
 * }</pre>
 */
public class TemplateLoader {
	private static final Logger logger = LoggerFactory.getLogger(TemplateLoader.class);

	private final TemplateOptions options;

	public TemplateLoader() {
		this(TemplateOptions.DEFAULTS);
	}

	public TemplateLoader(TemplateOptions options) {
		this.options = options;
	}

	public TemplateOptions getOptions() {
		return options;
	}

	public List<Token> tokenize(SourceFile sourceFile) {
		return TemplateLexer.tokenize(sourceFile, options);
	}

	public ParseTreeResult parse(SourceFile sourceFile) {
		return TemplateParser.parse(tokenize(sourceFile));
	}

	/**
	 * Builds the mutable tree of a file. The raw tree is dropped once the
	 * template exists.
	 */
	public Template load(SourceFile sourceFile) {
		Template template = TemplateNodeBuilder.build(parse(sourceFile), sourceFile);
		logger.debug("Loaded {} ({} tokens, {} roots)", sourceFile.getName(), template.getTokens().size(),
				template.getRoots().size());
		return template;
	}

	public Template load(String name, String text) {
		return load(new SourceFile(name, text));
	}

	public AstPath<Node> findNode(ParseTreeResult parseTree, int offset) {
		return HtmlAst.findNode(parseTree.getRootNodes(), offset, options.getSpanMode());
	}

	public AstPath<Node> findNode(ParseTreeResult parseTree, SourceFile sourceFile, Position position) {
		int offset = Positions.getOffset(sourceFile.getText(), position);
		if (offset < 0) {
			return new AstPath<>(Collections.emptyList(), offset);
		}
		return findNode(parseTree, offset);
	}
}
