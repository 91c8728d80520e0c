package com.inboxpilot.integration;

import com.inboxpilot.core.model.DirectoryRecord;

import java.util.List;

public interface ContactDirectory {

    List<DirectoryRecord> search(String query) throws DirectoryException;
}
