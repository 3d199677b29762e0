package com.poc.xlstaging.service.excel;

import com.poc.xlstaging.dto.AddressOrder;
import com.poc.xlstaging.dto.CellAddress;
import com.poc.xlstaging.dto.ErrorKind;
import com.poc.xlstaging.dto.Result;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing and ordering of absolute spreadsheet addresses such as {@code $AA$15}.
 */
public final class CellAddressing {

    private static final Pattern ABSOLUTE_ADDRESS = Pattern.compile("^\\$([A-Z]+)\\$([1-9][0-9]*)$");

    private CellAddressing() {
    }

    /**
     * Parses a fully anchored address. Relative forms ({@code A1}, {@code $A1}, {@code A$1}), lower-case columns,
     * surrounding whitespace and row zero are rejected.
     */
    public static Result<CellAddress> parse(String address) {
        if (address == null) {
            return Result.failure(ErrorKind.MALFORMED_ADDRESS, "Cell address is missing");
        }
        Matcher matcher = ABSOLUTE_ADDRESS.matcher(address);
        if (!matcher.matches()) {
            return Result.failure(ErrorKind.MALFORMED_ADDRESS,
                    "Cell address must be absolute like $A$1: '" + address + "'");
        }
        int row;
        try {
            row = Integer.parseInt(matcher.group(2));
        } catch (NumberFormatException e) {
            return Result.failure(ErrorKind.MALFORMED_ADDRESS, "Row number out of range in '" + address + "'");
        }
        return Result.success(new CellAddress(matcher.group(1), row));
    }

    public static int compare(CellAddress a, CellAddress b, AddressOrder order) {
        int byRow = Integer.compare(a.getRow(), b.getRow());
        int byColumn = a.compareColumn(b);
        if (order == AddressOrder.ROW) {
            return byRow != 0 ? byRow : byColumn;
        }
        return byColumn != 0 ? byColumn : byRow;
    }
}
