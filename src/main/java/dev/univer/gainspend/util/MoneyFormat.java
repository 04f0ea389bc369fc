package dev.univer.gainspend.util;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class MoneyFormat {

    private MoneyFormat() {}

    /** Ровно два знака после точки и суффикс валюты: «1500.50 ₽». */
    public static String format(BigDecimal amount, String currency) {
        BigDecimal x = amount == null ? BigDecimal.ZERO : amount;
        String plain = x.setScale(2, RoundingMode.HALF_UP).toPlainString();
        return (currency == null || currency.isBlank()) ? plain : plain + " " + currency;
    }
}
