package com.sheetfunctions.docs.expansion;

/** Checked exception signalling that a formula could not be inlined. */
public class ExpansionException extends Exception {

    public ExpansionException(String message) {
        super(message);
    }

    public ExpansionException(String message, Throwable cause) {
        super(message, cause);
    }
}
