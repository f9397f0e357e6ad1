package com.docrepo.repos.certification.model;

import com.docrepo.core.Model;

/**
 * Numeric key; the repository cannot generate one.
 */
public class Counter implements Model<Long> {
    private Long key;
    private long value;

    public Counter() {
    }

    public Counter(Long key, long value) {
        this.key = key;
        this.value = value;
    }

    @Override
    public Long getKey() {
        return key;
    }

    @Override
    public void setKey(Long key) {
        this.key = key;
    }

    public long getValue() {
        return value;
    }

    public void setValue(long value) {
        this.value = value;
    }
}
