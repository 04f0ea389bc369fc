package dev.univer.gainspend.exception;

public enum EntryFailure {
    CANCEL_REQUESTED,
    MALFORMED_LINE,
    INVALID_AMOUNT,
    EMPTY_DESCRIPTION,
    UNRECOGNIZED_CATEGORY,
    INVALID_MONTH_FORMAT
}
