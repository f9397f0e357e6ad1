package com.docrepo.repos.certification.model;

import com.docrepo.core.Model3;

/**
 * Keyed by carrier, tracking number and leg.
 */
public class Shipment implements Model3<String, String, Integer> {
    private String key1;
    private String key2;
    private Integer key3;
    private String status;

    public Shipment() {
    }

    public Shipment(String carrier, String trackingNumber, Integer leg, String status) {
        this.key1 = carrier;
        this.key2 = trackingNumber;
        this.key3 = leg;
        this.status = status;
    }

    @Override
    public String getKey1() {
        return key1;
    }

    public void setKey1(String key1) {
        this.key1 = key1;
    }

    @Override
    public String getKey2() {
        return key2;
    }

    public void setKey2(String key2) {
        this.key2 = key2;
    }

    @Override
    public Integer getKey3() {
        return key3;
    }

    public void setKey3(Integer key3) {
        this.key3 = key3;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }
}
