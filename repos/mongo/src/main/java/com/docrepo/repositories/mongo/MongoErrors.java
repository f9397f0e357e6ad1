package com.docrepo.repositories.mongo;

import com.docrepo.core.ConfigurationException;
import com.docrepo.core.ErrorKind;
import com.docrepo.core.UnsupportedKeyTypeException;
import com.mongodb.MongoSecurityException;
import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;

final class MongoErrors {
    private MongoErrors() {
    }

    static ErrorKind classify(Throwable e) {
        if (e instanceof ConfigurationException) {
            return ErrorKind.CONFIGURATION;
        }
        if (e instanceof UnsupportedKeyTypeException) {
            return ErrorKind.UNSUPPORTED_KEY_TYPE;
        }
        if (e instanceof MongoSocketException
                || e instanceof MongoTimeoutException
                || e instanceof MongoSecurityException) {
            return ErrorKind.CONNECTION;
        }
        return ErrorKind.REPOSITORY;
    }
}
