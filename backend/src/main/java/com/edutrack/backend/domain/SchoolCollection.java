package com.edutrack.backend.domain;

/**
 * Document collections of the school domain. Collection names are the lowercase entity names.
 */
public enum SchoolCollection {
    STUDENT("student", "Student"),
    TEACHER("teacher", "Teacher"),
    CLASS("class", "Class"),
    PARENT("parent", "Parent"),
    ENROLLMENT("enrollment", "Enrollment"),
    PROGRESS("progress", "Progress entry"),
    ANNOUNCEMENT("announcement", "Announcement"),
    INVOICE("invoice", "Invoice"),
    PAYMENT("payment", "Payment"),
    WAITLIST_LEAD("waitlist_lead", "Lead");

    private final String collectionName;
    private final String label;

    SchoolCollection(String collectionName, String label) {
        this.collectionName = collectionName;
        this.label = label;
    }

    public String collectionName() {
        return collectionName;
    }

    public String label() {
        return label;
    }
}
