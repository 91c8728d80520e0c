package com.inboxpilot.integration.local;

import com.inboxpilot.core.model.DirectoryRecord;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Naive keyword search over a record list, ranked by the number of matching query terms.
 */
class KeywordIndex {

    private static final int MAX_RESULTS = 5;

    private final CopyOnWriteArrayList<DirectoryRecord> records = new CopyOnWriteArrayList<>();

    void add(DirectoryRecord record) {
        records.add(record);
    }

    List<DirectoryRecord> search(String query) {
        Set<String> terms = tokenize(query);
        if (terms.isEmpty()) {
            return List.of();
        }
        return records.stream()
                .filter(r -> score(r, terms) > 0)
                .sorted(Comparator.comparingInt((DirectoryRecord r) -> score(r, terms)).reversed())
                .limit(MAX_RESULTS)
                .toList();
    }

    private static int score(DirectoryRecord record, Set<String> terms) {
        Set<String> words = tokenize(record.title() + " " + record.content());
        return (int) terms.stream().filter(words::contains).count();
    }

    private static Set<String> tokenize(String text) {
        if (text == null) {
            return Set.of();
        }
        return Arrays.stream(text.toLowerCase(Locale.ROOT).split("[^\\p{Alnum}@.]+"))
                .filter(word -> word.length() > 2)
                .collect(Collectors.toSet());
    }
}
