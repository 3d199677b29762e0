package com.poc.xlstaging.dto;

import lombok.Value;

/**
 * Parsed absolute cell address. Column letters use base-26 encoding (A..Z, AA, AB, ...), rows are 1-based.
 */
@Value
public class CellAddress {

    String column;
    int row;

    public CellAddress(String column, int row) {
        if (column == null || !column.matches("[A-Z]+")) {
            throw new IllegalArgumentException("Column must be upper-case letters: " + column);
        }
        if (row < 1) {
            throw new IllegalArgumentException("Row must be positive: " + row);
        }
        this.column = column;
        this.row = row;
    }

    /**
     * 1-based column number: A=1, Z=26, AA=27.
     * @throws ArithmeticException when the column letters do not fit in a long
     */
    public long getColumnNumber() {
        long number = 0;
        for (int i = 0; i < column.length(); i++) {
            number = Math.addExact(Math.multiplyExact(number, 26L), column.charAt(i) - 'A' + 1);
        }
        return number;
    }

    /**
     * Orders columns as numbers would (Z before AA) without converting them, so any number of letters compares exactly.
     */
    public int compareColumn(CellAddress other) {
        int byLength = Integer.compare(column.length(), other.column.length());
        return byLength != 0 ? byLength : column.compareTo(other.column);
    }

    public CellAddress offset(int rows, int columns) {
        return new CellAddress(toColumnLetters(getColumnNumber() + columns), row + rows);
    }

    public static String toColumnLetters(long columnNumber) {
        if (columnNumber < 1) {
            throw new IllegalArgumentException("Column number must be positive: " + columnNumber);
        }
        StringBuilder letters = new StringBuilder();
        long remaining = columnNumber;
        while (remaining > 0) {
            long digit = (remaining - 1) % 26;
            letters.insert(0, (char) ('A' + digit));
            remaining = (remaining - 1) / 26;
        }
        return letters.toString();
    }

    public String toAbsolute() {
        return "$" + column + "$" + row;
    }

    @Override
    public String toString() {
        return toAbsolute();
    }
}
