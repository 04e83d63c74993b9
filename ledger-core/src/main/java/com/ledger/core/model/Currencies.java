package com.ledger.core.model;

import java.util.List;

/**
 * Well-known currencies with their default precision.
 */
public final class Currencies {
    public static final Currency USD = new Currency("USD", 2);
    public static final Currency EUR = new Currency("EUR", 2);
    public static final Currency GBP = new Currency("GBP", 2);
    public static final Currency AUD = new Currency("AUD", 2);
    public static final Currency JPY = new Currency("JPY", 0);
    public static final Currency USDT = new Currency("USDT", 8);
    public static final Currency BTC = new Currency("BTC", 8);
    public static final Currency XBT = new Currency("XBT", 8);
    public static final Currency ETH = new Currency("ETH", 8);

    private Currencies() {}

    public static List<Currency> defaults() {
        return List.of(USD, EUR, GBP, AUD, JPY, USDT, BTC, XBT, ETH);
    }
}
