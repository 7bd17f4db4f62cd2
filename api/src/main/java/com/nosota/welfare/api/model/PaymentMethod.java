package com.nosota.welfare.api.model;

public enum PaymentMethod {
    BANK_TRANSFER,
    CHEQUE,
    CASH,
    DIGITAL_WALLET,
    UPI
}
