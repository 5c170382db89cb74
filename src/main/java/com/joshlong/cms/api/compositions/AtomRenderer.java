package com.joshlong.cms.api.compositions;

import com.fasterxml.jackson.databind.JsonNode;
import com.joshlong.cms.api.store.Atom;
import com.joshlong.cms.api.store.AtomType;
import com.joshlong.cms.api.utils.JsonUtils;
import com.joshlong.cms.api.variables.Placeholders;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.Map;

/**
 * renders an atom's json content through its type's template.
 * <p>
 * if the type's schema declares {@code properties}, each declared field present in the
 * content is available to the template by name; otherwise the whole content is
 * available as {@code root}. nested values are reached with {@code :}, as in
 * {@code [author:name]} or {@code [items:0]}. tags the content can't answer are left
 * alone, which is how variable tags get through to substitution.
 */
class AtomRenderer {

	static final String ROOT = "root";

	private final Placeholders placeholders;

	AtomRenderer(Placeholders placeholders) {
		this.placeholders = placeholders;
	}

	String render(Atom atom, AtomType type) {
		var content = JsonUtils.readTreeOrNull(atom.content());
		// not a json document, or no template to pour it into
		if (content == null || !content.isContainerNode() || !StringUtils.hasText(type.template()))
			return atom.content();
		var fields = fields(content, JsonUtils.readTreeOrNull(type.schema()));
		return this.placeholders.fill(type.template(), tag -> lookup(fields, tag));
	}

	private static Map<String, JsonNode> fields(JsonNode content, JsonNode schema) {
		var fields = new HashMap<String, JsonNode>();
		var properties = schema == null ? null : schema.get("properties");
		if (properties == null || !properties.isObject()) {
			fields.put(ROOT, content);
			return fields;
		}
		var names = properties.fieldNames();
		while (names.hasNext()) {
			var name = names.next();
			if (content.has(name))
				fields.put(name, content.get(name));
		}
		return fields;
	}

	private static String lookup(Map<String, JsonNode> fields, String tag) {
		var path = tag.split(":");
		var node = fields.get(path[0]);
		for (var i = 1; i < path.length && node != null; i++) {
			node = node.isArray() && isIndex(path[i]) ? node.get(Integer.parseInt(path[i])) : node.get(path[i]);
		}
		if (node == null || node.isNull() || node.isMissingNode())
			return null;
		return node.isValueNode() ? node.asText() : JsonUtils.write(node);
	}

	private static boolean isIndex(String s) {
		if (s.isEmpty() || s.length() > 9)
			return false;
		for (var c : s.toCharArray())
			if (!Character.isDigit(c))
				return false;
		return true;
	}

}
