package com.poc.xlstaging.dto;

/**
 * Primary sort key used when ordering cell addresses by worksheet position.
 */
public enum AddressOrder {
    ROW,
    COLUMN
}
