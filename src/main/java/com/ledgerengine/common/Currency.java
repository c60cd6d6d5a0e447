package com.ledgerengine.common;

/**
 * Supported account currencies (ISO 4217 codes).
 * Amounts are always held in the currency's minor unit; no conversion is performed.
 */
public enum Currency {
    USD,
    EUR,
    GBP
}
