package com.inboxpilot.integration.local;

import com.inboxpilot.core.model.DirectoryRecord;
import com.inboxpilot.integration.ContactDirectory;

import java.util.List;

public class InMemoryContactDirectory implements ContactDirectory {

    private final KeywordIndex index = new KeywordIndex();

    public InMemoryContactDirectory add(String id, String name, String details) {
        index.add(new DirectoryRecord("contacts", id, name, details));
        return this;
    }

    @Override
    public List<DirectoryRecord> search(String query) {
        return index.search(query);
    }
}
