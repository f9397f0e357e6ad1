package com.docrepo.repos.certification.model;

import com.docrepo.core.Model2;

/**
 * Keyed by order id and line number.
 */
public class OrderLine implements Model2<String, Integer> {
    private String key1;
    private Integer key2;
    private String sku;
    private int quantity;

    public OrderLine() {
    }

    public OrderLine(String orderId, Integer lineNumber, String sku, int quantity) {
        this.key1 = orderId;
        this.key2 = lineNumber;
        this.sku = sku;
        this.quantity = quantity;
    }

    @Override
    public String getKey1() {
        return key1;
    }

    public void setKey1(String key1) {
        this.key1 = key1;
    }

    @Override
    public Integer getKey2() {
        return key2;
    }

    public void setKey2(Integer key2) {
        this.key2 = key2;
    }

    public String getSku() {
        return sku;
    }

    public void setSku(String sku) {
        this.sku = sku;
    }

    public int getQuantity() {
        return quantity;
    }

    public void setQuantity(int quantity) {
        this.quantity = quantity;
    }
}
