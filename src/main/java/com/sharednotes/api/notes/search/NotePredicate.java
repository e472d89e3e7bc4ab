package com.sharednotes.api.notes.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * a SQL boolean expression over the {@code note n} alias, together with the values for
 * its {@code ?} placeholders, in order. predicates compose; nothing is executed until a
 * {@link NoteQueries query} renders one.
 */
public final class NotePredicate {

	private static final NotePredicate NOT_DELETED = new NotePredicate("n.deleted = false", List.of());

	private final String sql;

	private final List<Object> parameters;

	NotePredicate(String sql, List<Object> parameters) {
		this.sql = sql;
		this.parameters = Collections.unmodifiableList(new ArrayList<>(parameters));
	}

	/**
	 * every candidate set is built on top of this one.
	 */
	public static NotePredicate notDeleted() {
		return NOT_DELETED;
	}

	public static NotePredicate withId(Long noteId) {
		return new NotePredicate("n.id = ?", List.of(noteId));
	}

	public static NotePredicate ownedBy(String userId) {
		return new NotePredicate("n.owner_id = ?", List.of(userId));
	}

	public static NotePredicate sharedBy(String granterId) {
		return new NotePredicate("exists (select 1 from note_share s where s.note_id = n.id and s.granter_id = ?)",
				List.of(granterId));
	}

	public static NotePredicate sharedWith(String granteeId) {
		return new NotePredicate("exists (select 1 from note_share s where s.note_id = n.id and s.grantee_id = ?)",
				List.of(granteeId));
	}

	public NotePredicate and(NotePredicate other) {
		return combine("and", other);
	}

	public NotePredicate or(NotePredicate other) {
		return combine("or", other);
	}

	public NotePredicate negate() {
		return new NotePredicate("not (" + this.sql + ")", this.parameters);
	}

	public String sql() {
		return this.sql;
	}

	public List<Object> parameters() {
		return this.parameters;
	}

	private NotePredicate combine(String operator, NotePredicate other) {
		var parameters = new ArrayList<>(this.parameters);
		parameters.addAll(other.parameters);
		return new NotePredicate("(" + this.sql + ") " + operator + " (" + other.sql + ")", parameters);
	}

	@Override
	public String toString() {
		return this.sql + " " + this.parameters;
	}

}
