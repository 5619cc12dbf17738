package com.marketbot.pk.parse;

/**
 * The market-watch page had no table to read. Fatal for the job that requested the listing.
 */
public class ListingParseException extends RuntimeException {
    public ListingParseException(String message) {
        super(message);
    }
}
