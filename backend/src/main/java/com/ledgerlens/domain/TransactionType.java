package com.ledgerlens.domain;

public enum TransactionType {
    INCOME,
    EXPENSE
}
