package com.docrepo.repos.certification.model;

import com.docrepo.core.Model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

public class Appointment implements Model<String> {
    private String key;
    private String title;
    private LocalDate day;
    private Instant startsAt;

    public Appointment() {
    }

    public Appointment(String key, String title, LocalDate day, Instant startsAt) {
        this.key = key;
        this.title = title;
        this.day = day;
        this.startsAt = startsAt;
    }

    @Override
    public String getKey() {
        return key;
    }

    @Override
    public void setKey(String key) {
        this.key = key;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public LocalDate getDay() {
        return day;
    }

    public void setDay(LocalDate day) {
        this.day = day;
    }

    public Instant getStartsAt() {
        return startsAt;
    }

    public void setStartsAt(Instant startsAt) {
        this.startsAt = startsAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Appointment)) return false;
        Appointment that = (Appointment) o;
        return Objects.equals(key, that.key) && Objects.equals(title, that.title)
                && Objects.equals(day, that.day) && Objects.equals(startsAt, that.startsAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, title, day, startsAt);
    }

    @Override
    public String toString() {
        return "Appointment{key='" + key + "', title='" + title + "', day=" + day + ", startsAt=" + startsAt + "}";
    }
}
