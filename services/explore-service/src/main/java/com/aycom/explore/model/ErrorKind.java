package com.aycom.explore.model;

public enum ErrorKind {
    NETWORK,
    MALFORMED_RESPONSE,
    EMPTY_RESPONSE,
    UPSTREAM_TIMEOUT
}
