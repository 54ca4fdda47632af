package com.ledgerlens.common;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/**
 * Chilean peso formatting: no decimals, dot as thousands separator ("15.990").
 */
public final class MoneyFormat {

    private static final Locale ES_CL = new Locale("es", "CL");

    private MoneyFormat() {
    }

    public static String clp(BigDecimal amount) {
        BigDecimal value = amount == null ? BigDecimal.ZERO : amount.setScale(0, RoundingMode.HALF_UP);
        DecimalFormatSymbols symbols = DecimalFormatSymbols.getInstance(ES_CL);
        symbols.setGroupingSeparator('.');
        DecimalFormat format = new DecimalFormat("#,##0", symbols);
        return format.format(value);
    }

    /** Formats as "CLP 15.990", or with the given ISO currency code instead of CLP. */
    public static String withCurrency(String currency, BigDecimal amount) {
        String code = currency == null || currency.isBlank() ? "CLP" : currency;
        return code + " " + clp(amount);
    }
}
