package com.example.treesync;

public enum Operation {
    PURGE,
    CREATE_DIRECTORY,
    COPY_FILE,
    REPLACE_FILE,
    HASH_FILE,
    DELETE_FILE,
    DELETE_DIRECTORY,
    SAVE_CHECKPOINT
}
