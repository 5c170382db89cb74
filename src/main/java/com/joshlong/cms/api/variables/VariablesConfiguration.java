package com.joshlong.cms.api.variables;

import com.joshlong.cms.api.ApiProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
class VariablesConfiguration {

	@Bean
	Placeholders placeholders(ApiProperties properties) {
		var variables = properties.variables();
		return new Placeholders(variables.open(), variables.close());
	}

}
