package com.sharednotes.api.notes;

import java.util.List;

public record NotePage(List<Note> notes, Pagination pagination) {
}
