package dev.univer.gainspend.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum RecordKind {
    // порядок объявления = порядок в подробной статистике
    INCOME("income"),
    EXPENSE("expense");

    private final String code;

    public static RecordKind fromCode(String code) {
        for (RecordKind k : values()) {
            if (k.code.equals(code)) return k;
        }
        throw new IllegalArgumentException("Unknown record kind: " + code);
    }
}
