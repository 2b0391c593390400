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
import java.util.stream.Collectors;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.ngast.TemplateLoader;
import com.tomaszrup.ngast.location.LocationSpan;
import com.tomaszrup.ngast.template.tokenizer.Token;
import com.tomaszrup.ngast.template.tokenizer.TokenType;

class TemplateNodeTests {

	private static Template load(String text) {
		return new TemplateLoader().load("test.html", text);
	}

	private static ElementTemplateNode root(Template template) {
		return (ElementTemplateNode) template.getRoots().get(0);
	}

	private static List<String> describeAll(List<? extends TemplateNode> nodes) {
		return nodes.stream().map(node -> {
			if (node instanceof ElementTemplateNode) {
				return ((ElementTemplateNode) node).getTagName();
			}
			return ((TextualTemplateNode) node).getText();
		}).collect(Collectors.toList());
	}

	// ------------------------------------------------------------------
	// Parent and siblings
	// ------------------------------------------------------------------

	@Test
	void testNextSiblingAmongChildren() {
		ElementTemplateNode ul = root(load("<ul><li>a</li><li>b</li></ul>"));
		TemplateNode first = ul.getTemplateChildren().get(0);
		TemplateNode second = ul.getTemplateChildren().get(1);
		Assertions.assertSame(second, first.getNextTemplateSibling().orElseThrow());
		Assertions.assertSame(second, first.getNextTemplateSiblingOrThrow());
		Assertions.assertFalse(second.getNextTemplateSibling().isPresent());
		Assertions.assertThrows(TemplateInvariantException.class, second::getNextTemplateSiblingOrThrow);
	}

	@Test
	void testNextSiblingAmongRoots() {
		Template template = load("<a></a><b></b>");
		TemplateNode a = template.getRoots().get(0);
		Assertions.assertSame(template.getRoots().get(1), a.getNextTemplateSibling().orElseThrow());
	}

	@Test
	void testNextSiblingAmongAttributes() {
		ElementTemplateNode element = root(load("<i x y [(z)]=\"w\"></i>"));
		AttributeTemplateNode x = element.getAttributes().get(0);
		Assertions.assertSame(element.getAttributes().get(1), x.getNextTemplateSiblingOrThrow());

		TwoWayBindingTemplateNode z = element.getTwoWayBindings().get(0);
		Assertions.assertFalse(z.getNextTemplateSibling().isPresent());
		TemplateNode target = z.getTarget();
		Assertions.assertSame(z.getExpression().orElseThrow(), target.getNextTemplateSiblingOrThrow());
		Assertions.assertFalse(z.getExpression().orElseThrow().getNextTemplateSibling().isPresent());
	}

	@Test
	void testParentIsAssignedOnce() {
		Template template = load("<a><b></b></a><c></c>");
		TemplateNode b = root(template).getTemplateChildren().get(0);
		TemplateNode c = template.getRoots().get(1);
		TemplateInvariantException e = Assertions.assertThrows(TemplateInvariantException.class,
				() -> b.setTemplateParent(c));
		Assertions.assertTrue(e.getMessage().contains("already has a parent"), e.getMessage());
		Assertions.assertThrows(TemplateInvariantException.class, () -> c.setTemplateParent(c));
		Assertions.assertTrue(c.isRoot());
		c.setTemplateParent(b);
		Assertions.assertSame(b, c.getTemplateParent().orElseThrow());

		e = Assertions.assertThrows(TemplateInvariantException.class, c::getNextTemplateSibling);
		Assertions.assertTrue(e.getMessage().contains("in its parent's children"), e.getMessage());
	}

	@Test
	void testDetachedNodeIsNotAmongRoots() {
		Template template = load("<a></a>text");
		TemplateNode detached = new TextTemplateNode(template.getTokens().subList(3, 4), template);
		Assertions.assertTrue(detached.isRoot());
		TemplateInvariantException e = Assertions.assertThrows(TemplateInvariantException.class,
				detached::getNextTemplateSibling);
		Assertions.assertTrue(e.getMessage().contains("(root) in the template's roots"), e.getMessage());
	}

	@Test
	void testNodeNeedsTokens() {
		Template template = load("x");
		Assertions.assertThrows(TemplateInvariantException.class,
				() -> new TextTemplateNode(Collections.emptyList(), template));
	}

	@Test
	void testEveryNestedNodePointsBackToItsParent() {
		Template template = load("<form #f (submit)=\"go()\"><input [(ngModel)]=\"n\" [a]=\"b\">"
				+ "<p class=\"c\">t {{ v }}<!-- x --></p></form>");
		List<TemplateNode> pending = new ArrayList<>(template.getRoots());
		int checked = 0;
		while (!pending.isEmpty()) {
			TemplateNode node = pending.remove(0);
			for (TemplateNode nested : node.getNestedNodes()) {
				Assertions.assertSame(node, nested.getTemplateParent().orElseThrow(), nested.toString());
				Assertions.assertTrue(node.getLocationSpan().contains(nested.getLocationSpan()), nested.toString());
				int occurrences = 0;
				for (TemplateNode sibling : node.getSiblingsOf(nested)) {
					occurrences += sibling == nested ? 1 : 0;
				}
				Assertions.assertEquals(1, occurrences, nested.toString());
				pending.add(nested);
				checked++;
			}
		}
		Assertions.assertEquals(16, checked);
	}

	// ------------------------------------------------------------------
	// Descendants
	// ------------------------------------------------------------------

	@Test
	void testDescendantsAreBreadthFirst() {
		ElementTemplateNode div = root(load("<div x=\"1\"><p>a<b>c</b></p>d</div>"));
		Assertions.assertEquals(List.of("p", "d", "a", "b", "c"), describeAll(div.getDescendants()));
	}

	@Test
	void testFilteredDescendants() {
		ElementTemplateNode div = root(load("<div><p>a<b>c</b></p>d</div>"));
		Assertions.assertEquals(List.of("d", "a", "c"),
				describeAll(div.getDescendants(node -> node instanceof TextTemplateNode)));
		Assertions.assertEquals(List.of("p", "b"),
				describeAll(div.getDescendantsOfType(ElementTemplateNode.class)));
	}

	@Test
	void testSingleDescendant() {
		ElementTemplateNode div = root(load("<div><p>a<b>c</b></p>d</div>"));
		Assertions.assertEquals("p", ((ElementTemplateNode) div.getDescendant().orElseThrow()).getTagName());
		Assertions.assertEquals("p", div.getDescendantOfTypeOrThrow(ElementTemplateNode.class).getTagName());
		Assertions.assertEquals("c", ((TextTemplateNode) div.getDescendantOrThrow(
				node -> node instanceof TextTemplateNode && ((TextTemplateNode) node).getText().equals("c")))
				.getText());
		Assertions.assertFalse(div.getDescendantOfType(CommentTemplateNode.class).isPresent());
		Assertions.assertThrows(TemplateInvariantException.class,
				() -> div.getDescendantOfTypeOrThrow(CommentTemplateNode.class));
		Assertions.assertThrows(TemplateInvariantException.class,
				() -> div.getDescendantOrThrow(node -> false));
	}

	@Test
	void testLeafHasNoDescendants() {
		Template template = load("text");
		Assertions.assertTrue(template.getRoots().get(0).getDescendants().isEmpty());
		Assertions.assertFalse(template.getRoots().get(0).getDescendant().isPresent());
	}

	// ------------------------------------------------------------------
	// Tokens
	// ------------------------------------------------------------------

	@Test
	void testTokenHelpers() {
		Template template = load("<p>x</p><br>");
		ElementTemplateNode p = root(template);
		Assertions.assertEquals("<p", p.getFirstTokenOfType(TokenType.TAG_OPEN_START).orElseThrow().toString());
		Assertions.assertFalse(p.getFirstTokenOfType(TokenType.TEXT).isPresent());
		TemplateInvariantException e = Assertions.assertThrows(TemplateInvariantException.class,
				() -> p.getFirstTokenOfTypeOrThrow(TokenType.TEXT));
		Assertions.assertTrue(e.getMessage().contains("TagOpenStart, TagOpenEnd, TagClose"), e.getMessage());
		Assertions.assertEquals(0, p.getFirstTokenIndex());
		Assertions.assertEquals(1, p.getTokens(token -> token.is(TokenType.TAG_CLOSE)).size());

		List<Token> here = new ArrayList<>();
		p.forEachTokenHere(here::add);
		Assertions.assertEquals(4, here.size());

		List<Token> after = new ArrayList<>();
		p.forEachTokenAfterHere(after::add);
		Assertions.assertEquals(List.of("<br", ">", ""),
				after.stream().map(Token::toString).collect(Collectors.toList()));

		List<Token> all = new ArrayList<>();
		p.forEachTokenHereAndAfterHere(all::add);
		Assertions.assertEquals(7, all.size());
	}

	@Test
	void testLocationSpanFollowsTokens() {
		Template template = load("<p>x</p>");
		ElementTemplateNode p = root(template);
		LocationSpan span = p.getLocationSpan();
		Assertions.assertEquals(0, span.getStart());
		Assertions.assertEquals(8, span.getEnd());
		Assertions.assertEquals("<p>x</p>", span.getText());
		Assertions.assertTrue(p.toString().startsWith("ElementTemplateNode at test.html:1:1"));
	}
}
