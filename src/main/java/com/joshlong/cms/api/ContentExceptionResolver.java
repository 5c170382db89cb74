package com.joshlong.cms.api;

import graphql.GraphQLError;
import graphql.GraphqlErrorBuilder;
import graphql.schema.DataFetchingEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.graphql.execution.DataFetcherExceptionResolverAdapter;
import org.springframework.graphql.execution.ErrorType;
import org.springframework.stereotype.Component;

/**
 * the graphql counterpart of {@link ContentExceptionHandler}.
 */
@Component
class ContentExceptionResolver extends DataFetcherExceptionResolverAdapter {

	private final Logger log = LoggerFactory.getLogger(getClass());

	@Override
	protected GraphQLError resolveToSingleError(Throwable ex, DataFetchingEnvironment env) {
		var errorType = (ErrorType) null;
		if (ex instanceof ContentNotFoundException)
			errorType = ErrorType.NOT_FOUND;
		else if (ex instanceof IllegalArgumentException)
			errorType = ErrorType.BAD_REQUEST;
		else if (ex instanceof ContentException) {
			this.log.error("couldn't fetch [{}]: {}", env.getField().getName(), ex.getMessage());
			errorType = ErrorType.INTERNAL_ERROR;
		}
		if (errorType == null)
			return null;
		return GraphqlErrorBuilder.newError(env).errorType(errorType).message(ex.getMessage()).build();
	}

}
