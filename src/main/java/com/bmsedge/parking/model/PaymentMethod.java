package com.bmsedge.parking.model;

import java.util.Locale;

public enum PaymentMethod {
    CASH,
    DIGITAL;

    /**
     * Parses the payment type strings sent by entry/exit terminals.
     * UPI, card and wallet payments all settle outside the cash drawer.
     */
    public static PaymentMethod fromRaw(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "cash":
                return CASH;
            case "digital":
            case "upi":
            case "card":
            case "wallet":
            case "online":
                return DIGITAL;
            default:
                throw new IllegalArgumentException("Unknown payment method: " + raw);
        }
    }
}
