package com.joshlong.cms.api.rendering;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record VariableInput(String tag, String value) {

	/**
	 * later inputs win when a tag is repeated.
	 */
	static Map<String, String> toMap(List<VariableInput> inputs) {
		var map = new LinkedHashMap<String, String>();
		if (inputs != null)
			for (var input : inputs)
				map.put(input.tag(), input.value());
		return map;
	}

}
