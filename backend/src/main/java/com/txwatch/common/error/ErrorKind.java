package com.txwatch.common.error;

/**
 * Source category of a reported error.
 */
public enum ErrorKind {
    NETWORK,
    RPC,
    API,
    VALIDATION,
    SYSTEM
}
