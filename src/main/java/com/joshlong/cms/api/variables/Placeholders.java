package com.joshlong.cms.api.variables;

import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * finds tags like {@code [year]} or {@code [author:name]} in text. the delimiters are
 * configurable; a tag is made of word characters, {@code -}, {@code .}, {@code ,} and
 * {@code :}, and anything else between the delimiters is left alone as plain text.
 * <p>
 * replacement is a single pass: a value that itself looks like a tag is never expanded.
 */
public class Placeholders {

	private static final String TAG = "([\\w\\-.,:]+)";

	private final Pattern pattern;

	public Placeholders(String open, String close) {
		Assert.state(StringUtils.hasLength(open) && StringUtils.hasLength(close),
				"the tag delimiters must be non-empty");
		this.pattern = Pattern.compile(Pattern.quote(open) + TAG + Pattern.quote(close));
	}

	public List<Segment> parse(String content) {
		var segments = new ArrayList<Segment>();
		if (content == null || content.isEmpty())
			return segments;
		var matcher = this.pattern.matcher(content);
		var last = 0;
		while (matcher.find()) {
			if (matcher.start() > last)
				segments.add(new Segment.Text(content.substring(last, matcher.start())));
			segments.add(new Segment.Placeholder(matcher.group(1), matcher.group()));
			last = matcher.end();
		}
		if (last < content.length())
			segments.add(new Segment.Text(content.substring(last)));
		return segments;
	}

	/**
	 * replaces every tag for which {@code values} answers non-null; the others stay as
	 * they were.
	 */
	public String fill(String content, Function<String, String> values) {
		var sb = new StringBuilder();
		for (var segment : parse(content)) {
			if (segment instanceof Segment.Placeholder placeholder) {
				var value = values.apply(placeholder.tag());
				sb.append(value == null ? placeholder.raw() : value);
			} //
			else {
				sb.append(segment.text());
			}
		}
		return sb.toString();
	}

}
