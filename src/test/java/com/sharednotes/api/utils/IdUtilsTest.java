package com.sharednotes.api.utils;

import com.sharednotes.api.ValidationException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

class IdUtilsTest {

	@Test
	void parse() {
		Assertions.assertEquals(42L, IdUtils.parse(" 42 ", "note"));
		Assertions.assertEquals(List.of(1L, 2L), IdUtils.parse(List.of("1", "2"), "tag"));
		Assertions.assertTrue(IdUtils.parse((List<String>) null, "tag").isEmpty());
	}

	@Test
	void invalidIds() {
		for (var id : new String[] { null, "", "  ", "abc", "0", "-3", "1.5", "99999999999999999999" })
			Assertions.assertThrows(ValidationException.class, () -> IdUtils.parse(id, "note"), "for [" + id + "]");
		Assertions.assertThrows(ValidationException.class, () -> IdUtils.parse(List.of("1", "x"), "tag"));
	}

}
