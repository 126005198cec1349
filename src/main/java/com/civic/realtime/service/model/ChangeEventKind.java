package com.civic.realtime.service.model;

/**
 * Kind of row change reported by the transport.
 */
public enum ChangeEventKind {
    INSERT,
    UPDATE,
    DELETE
}
