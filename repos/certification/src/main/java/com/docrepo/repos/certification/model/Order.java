package com.docrepo.repos.certification.model;

import com.docrepo.core.Model;

import java.util.UUID;

public class Order implements Model<UUID> {
    private UUID key;
    private String customer;
    private double total;

    public Order() {
    }

    public Order(UUID key, String customer, double total) {
        this.key = key;
        this.customer = customer;
        this.total = total;
    }

    @Override
    public UUID getKey() {
        return key;
    }

    @Override
    public void setKey(UUID key) {
        this.key = key;
    }

    public String getCustomer() {
        return customer;
    }

    public void setCustomer(String customer) {
        this.customer = customer;
    }

    public double getTotal() {
        return total;
    }

    public void setTotal(double total) {
        this.total = total;
    }
}
