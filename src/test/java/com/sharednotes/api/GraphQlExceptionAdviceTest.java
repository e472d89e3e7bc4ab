package com.sharednotes.api;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.graphql.execution.ErrorType;
import org.springframework.security.access.AccessDeniedException;

class GraphQlExceptionAdviceTest {

	private final GraphQlExceptionAdvice advice = new GraphQlExceptionAdvice();

	@Test
	void validation() {
		var error = this.advice.handleValidation(new ValidationException("the title must not be empty"));
		Assertions.assertEquals(ErrorType.BAD_REQUEST, error.getErrorType());
		Assertions.assertEquals("the title must not be empty", error.getMessage());
		Assertions.assertEquals("VALIDATION", error.getExtensions().get("code"));
	}

	@Test
	void notFound() {
		var error = this.advice.handleNotFound(new NotFoundException("note", 42L));
		Assertions.assertEquals(ErrorType.NOT_FOUND, error.getErrorType());
		Assertions.assertEquals("note [42] not found", error.getMessage());
		Assertions.assertEquals("NOT_FOUND", error.getExtensions().get("code"));
	}

	@Test
	void accessDenied() {
		var error = this.advice.handleAccessDenied(new NoteAccessDeniedException(42L, "delete"));
		Assertions.assertEquals(ErrorType.FORBIDDEN, error.getErrorType());
		Assertions.assertEquals("ACCESS_DENIED", error.getExtensions().get("code"));
	}

	@Test
	void missingAuthorityIsForbidden() {
		var error = this.advice.handleMissingAuthority(new AccessDeniedException("Access Denied"));
		Assertions.assertEquals(ErrorType.FORBIDDEN, error.getErrorType());
		Assertions.assertEquals("ACCESS_DENIED", error.getExtensions().get("code"));
	}

	@Test
	void unresolvedIdentityNamesTheTarget() {
		var error = this.advice.handleUnresolvedIdentity(new UnresolvedIdentityException("nobody@example.com"));
		Assertions.assertEquals(ErrorType.BAD_REQUEST, error.getErrorType());
		Assertions.assertEquals("UNRESOLVED_IDENTITY", error.getExtensions().get("code"));
		Assertions.assertEquals("nobody@example.com", error.getExtensions().get("target"));
	}

	@Test
	void storageFailuresAreOpaque() {
		var error = this.advice
			.handleStorage(new DataAccessResourceFailureException("connection to db-7.internal:5432 refused"));
		Assertions.assertEquals(ErrorType.INTERNAL_ERROR, error.getErrorType());
		Assertions.assertEquals("STORAGE", error.getExtensions().get("code"));
		Assertions.assertFalse(error.getMessage().contains("db-7"), "internals do not leak to the client");
	}

}
