package com.maxsort.organizer.model;

public record AddOperationResult(boolean success, Transaction transaction, String error) {

    public static AddOperationResult added(Transaction transaction) {
        return new AddOperationResult(true, transaction, null);
    }

    public static AddOperationResult rejected(String error) {
        return new AddOperationResult(false, null, error);
    }
}
