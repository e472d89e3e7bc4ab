package com.sharednotes.api.notes.search;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

class NotePredicateTest {

	@Test
	void composition() {
		var predicate = NotePredicate.ownedBy("alice").or(NotePredicate.withId(42L)).negate();
		Assertions.assertEquals("not ((n.owner_id = ?) or (n.id = ?))", predicate.sql());
		Assertions.assertEquals(List.of("alice", 42L), predicate.parameters());
	}

	@Test
	void predicatesAreImmutable() {
		var owned = NotePredicate.ownedBy("alice");
		owned.and(NotePredicate.withId(1L));
		Assertions.assertEquals("n.owner_id = ?", owned.sql());
		Assertions.assertThrows(UnsupportedOperationException.class, () -> owned.parameters().add("bob"));
	}

}
