package com.example.storage.error;

import java.util.UUID;

public class RecordNotFoundException extends StorageException {

    public RecordNotFoundException(String table, UUID id) {
        super("No live record " + id + " in " + table);
    }
}
