package com.questrail.assetcodec.api;

/**
 * The closed set of value kinds an associative resource can hold.
 */
public enum ValueKind
{
    TEXT,
    INTEGER,
    FLOAT,
    BOOL,
    BYTES
}
