package com.docrepo.core;

public enum ErrorKind {
    /** A required option is missing or invalid. */
    CONFIGURATION,
    /** The store could not be reached. */
    CONNECTION,
    /** The store rejected or failed a write. */
    REPOSITORY,
    /** A key had to be generated for a type with no generation strategy. */
    UNSUPPORTED_KEY_TYPE
}
