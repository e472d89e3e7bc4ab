package com.sharednotes.api;

import graphql.GraphQLError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.graphql.data.method.annotation.GraphQlExceptionHandler;
import org.springframework.graphql.execution.ErrorType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.web.bind.annotation.ControllerAdvice;

import java.util.HashMap;
import java.util.Map;

/**
 * turns the domain failures into GraphQL errors with a stable {@code code} extension.
 * storage failures are logged in full but reported opaquely.
 */
@ControllerAdvice
class GraphQlExceptionAdvice {

	private final Logger log = LoggerFactory.getLogger(getClass());

	@GraphQlExceptionHandler
	GraphQLError handleValidation(ValidationException ex) {
		this.log.debug("rejected an invalid request: {}", ex.getMessage());
		return error(ErrorType.BAD_REQUEST, ex, Map.of());
	}

	@GraphQlExceptionHandler
	GraphQLError handleNotFound(NotFoundException ex) {
		this.log.debug("not found: {}", ex.getMessage());
		return error(ErrorType.NOT_FOUND, ex, Map.of());
	}

	@GraphQlExceptionHandler
	GraphQLError handleAccessDenied(NoteAccessDeniedException ex) {
		this.log.warn("access denied: {}", ex.getMessage());
		return error(ErrorType.FORBIDDEN, ex, Map.of());
	}

	@GraphQlExceptionHandler
	GraphQLError handleMissingAuthority(AccessDeniedException ex) {
		this.log.warn("denied an operation that needs more authority: {}", ex.getMessage());
		return GraphQLError.newError() //
			.errorType(ErrorType.FORBIDDEN) //
			.message("the operation is not permitted") //
			.extensions(Map.of("code", "ACCESS_DENIED")) //
			.build();
	}

	@GraphQlExceptionHandler
	GraphQLError handleUnresolvedIdentity(UnresolvedIdentityException ex) {
		this.log.warn("could not resolve the share target [{}]", ex.target());
		return error(ErrorType.BAD_REQUEST, ex, Map.of("target", ex.target()));
	}

	@GraphQlExceptionHandler
	GraphQLError handleStorage(DataAccessException ex) {
		this.log.error("the data store failed to service the request", ex);
		return GraphQLError.newError() //
			.errorType(ErrorType.INTERNAL_ERROR) //
			.message("the request could not be completed") //
			.extensions(Map.of("code", "STORAGE")) //
			.build();
	}

	private static GraphQLError error(ErrorType errorType, SharedNotesException ex, Map<String, Object> extras) {
		var extensions = new HashMap<String, Object>(extras);
		extensions.put("code", ex.code());
		return GraphQLError.newError() //
			.errorType(errorType) //
			.message(ex.getMessage()) //
			.extensions(extensions) //
			.build();
	}

}
