package com.sharednotes.api.utils;

import org.springframework.jdbc.support.KeyHolder;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.Objects;

public abstract class JdbcUtils {

	public static Number getIdFromKeyHolder(KeyHolder kh) {
		return (Number) Objects.requireNonNull(kh.getKeys()).get("id");
	}

	/**
	 * reads a {@code timestamptz} column with its full precision, in UTC.
	 */
	public static OffsetDateTime timestamp(ResultSet resultSet, String columnName) throws SQLException {
		return resultSet.getObject(columnName, OffsetDateTime.class);
	}

	/**
	 * escapes the {@code LIKE} metacharacters so that {@code text} matches literally
	 * (assumes the default {@code \} escape character).
	 */
	public static String likeLiteral(String text) {
		return text.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
	}

}
