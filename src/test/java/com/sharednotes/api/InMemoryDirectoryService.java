package com.sharednotes.api;

import com.sharednotes.api.directory.DirectoryService;
import org.jspecify.annotations.Nullable;

import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryDirectoryService implements DirectoryService {

	private final Map<String, String> userIdsByEmail = new ConcurrentHashMap<>();

	private final Map<String, String> emailsByUserId = new ConcurrentHashMap<>();

	/**
	 * registers a user with a fresh id and an email derived from {@code name}
	 * @return the new user
	 */
	public User register(String name) {
		var id = UUID.randomUUID().toString();
		var email = name + "-" + id.substring(0, 8) + "@example.com";
		this.userIdsByEmail.put(email.toLowerCase(Locale.ROOT), id);
		this.emailsByUserId.put(id, email);
		return new User(id, email);
	}

	public void forget(User user) {
		this.userIdsByEmail.remove(user.email().toLowerCase(Locale.ROOT));
		this.emailsByUserId.remove(user.id());
	}

	@Override
	public @Nullable String userIdForEmail(String email) {
		return this.userIdsByEmail.get(email.trim().toLowerCase(Locale.ROOT));
	}

	@Override
	public @Nullable String emailForUserId(String userId) {
		return this.emailsByUserId.get(userId);
	}

	public record User(String id, String email) {
	}

}
