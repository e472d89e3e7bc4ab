package com.sharednotes.api.directory;

import org.jspecify.annotations.Nullable;

/**
 * resolves users known to the identity provider. the identity of a user is the subject of
 * the tokens it presents.
 */
public interface DirectoryService {

	/**
	 * @return the id of the user with exactly this email, or {@code null} if there is none
	 */
	@Nullable
	String userIdForEmail(String email);

	/**
	 * @return the email of the user, or {@code null} if the user is unknown
	 */
	@Nullable
	String emailForUserId(String userId);

}
