package com.joshlong.cms.api.variables;

/**
 * one piece of parsed content: literal text, a tag nobody has resolved (yet), or a tag
 * that a tier has resolved. keeping the resolved tag around lets a nearer tier override
 * it later without re-parsing.
 */
public sealed interface Segment permits Segment.Text, Segment.Placeholder, Segment.Substitution {

	String text();

	record Text(String text) implements Segment {
	}

	/**
	 * @param raw the tag with its delimiters, exactly as it appeared
	 */
	record Placeholder(String tag, String raw) implements Segment {

		@Override
		public String text() {
			return this.raw;
		}

	}

	record Substitution(String tag, String raw, String value, Tier tier) implements Segment {

		@Override
		public String text() {
			return this.value;
		}

	}

}
