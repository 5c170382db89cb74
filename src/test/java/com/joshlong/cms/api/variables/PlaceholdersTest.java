package com.joshlong.cms.api.variables;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PlaceholdersTest {

	private final Placeholders placeholders = new Placeholders("[", "]");

	@Test
	void parse() {
		var segments = this.placeholders.parse("hello [name], it's [date:year]!");
		assertEquals(List.of(new Segment.Text("hello "), new Segment.Placeholder("name", "[name]"),
				new Segment.Text(", it's "), new Segment.Placeholder("date:year", "[date:year]"),
				new Segment.Text("!")), segments);
	}

	@Test
	void bracketsThatAreNotTagsStayText() {
		var segments = this.placeholders.parse("a [b c] and [] and [ok]");
		assertEquals(2, segments.size());
		assertEquals(new Segment.Text("a [b c] and [] and "), segments.get(0));
		assertEquals(new Segment.Placeholder("ok", "[ok]"), segments.get(1));
	}

	@Test
	void emptyContent() {
		assertTrue(this.placeholders.parse("").isEmpty());
		assertTrue(this.placeholders.parse(null).isEmpty());
	}

	@Test
	void fillLeavesUnknownTagsAlone() {
		var values = Map.of("year", "2024");
		assertEquals("(c) 2024 [company]", this.placeholders.fill("(c) [year] [company]", values::get));
	}

	@Test
	void fillIsASinglePass() {
		var values = Map.of("a", "[b]", "b", "nope");
		assertEquals("[b]", this.placeholders.fill("[a]", values::get));
	}

	@Test
	void otherDelimiters() {
		var braces = new Placeholders("{{", "}}");
		assertEquals("(c) 2025 [year]", braces.fill("(c) {{year}} [year]", Map.of("year", "2025")::get));
	}

	@Test
	void delimitersMustNotBeEmpty() {
		assertThrows(IllegalStateException.class, () -> new Placeholders("", "]"));
	}

}
