package com.maxsort.organizer.model;

public enum BatchType {
    INTERACTIVE,
    BACKGROUND
}
