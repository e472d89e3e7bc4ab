package com.sharednotes.api.notes.search;

import com.sharednotes.api.notes.Section;
import org.springframework.stereotype.Component;

import static com.sharednotes.api.notes.search.NotePredicate.notDeleted;
import static com.sharednotes.api.notes.search.NotePredicate.ownedBy;
import static com.sharednotes.api.notes.search.NotePredicate.sharedBy;
import static com.sharednotes.api.notes.search.NotePredicate.sharedWith;

/**
 * maps a user and a {@link Section section} to the candidate set of notes, expressed as a
 * {@link NotePredicate predicate}. deleted notes are never candidates.
 */
@Component
public class VisibilityResolver {

	public NotePredicate resolve(String userId, Section section) {
		var visible = switch (section) {
			case PRIVATE -> ownedBy(userId).and(sharedBy(userId).negate());
			case SHARED_BY_ME -> ownedBy(userId).and(sharedBy(userId));
			case SHARED_WITH_ME -> sharedWith(userId);
		};
		return notDeleted().and(visible);
	}

	/**
	 * every note the user may read: their own, and those shared with them.
	 */
	public NotePredicate accessible(String userId) {
		return notDeleted().and(ownedBy(userId).or(sharedWith(userId)));
	}

}
