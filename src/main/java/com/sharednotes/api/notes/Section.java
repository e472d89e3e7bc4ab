package com.sharednotes.api.notes;

import com.sharednotes.api.ValidationException;

import java.util.Locale;

/**
 * the three disjoint views over the notes a user can observe.
 */
public enum Section {

	/**
	 * owned and not shared with anybody.
	 */
	PRIVATE("private"),

	/**
	 * owned and shared with at least one other user.
	 */
	SHARED_BY_ME("shared-by-me"),

	/**
	 * owned by somebody else and shared with this user.
	 */
	SHARED_WITH_ME("shared-with-me");

	private final String value;

	Section(String value) {
		this.value = value;
	}

	public String value() {
		return this.value;
	}

	public static Section of(String section) {
		var normalized = section == null ? "" : section.trim().toLowerCase(Locale.ROOT);
		if (normalized.equals("my-notes"))
			return PRIVATE;
		for (var s : values())
			if (s.value.equals(normalized))
				return s;
		throw new ValidationException("[" + section + "] is not a valid section");
	}

}
