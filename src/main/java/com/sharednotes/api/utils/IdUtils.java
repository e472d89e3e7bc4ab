package com.sharednotes.api.utils;

import com.sharednotes.api.ValidationException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * GraphQL hands us identifiers as opaque strings; the store keys everything by
 * {@code bigint}.
 */
public abstract class IdUtils {

	public static Long parse(String id, String type) {
		if (id == null || id.isBlank())
			throw new ValidationException("the " + type + " id is required");
		long parsed;
		try {
			parsed = Long.parseLong(id.trim());
		} //
		catch (NumberFormatException e) {
			throw new ValidationException("[" + id + "] is not a valid " + type + " id");
		}
		if (parsed <= 0)
			throw new ValidationException("[" + id + "] is not a valid " + type + " id");
		return parsed;
	}

	public static List<Long> parse(Collection<String> ids, String type) {
		var parsed = new ArrayList<Long>();
		if (ids != null)
			for (var id : ids)
				parsed.add(parse(id, type));
		return parsed;
	}

}
