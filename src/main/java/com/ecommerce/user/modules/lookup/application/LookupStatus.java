package com.ecommerce.user.modules.lookup.application;

/**
 * Transport-neutral outcome of a lookup call. The gRPC adapter maps it onto a status code.
 */
public enum LookupStatus {
    OK,
    NOT_FOUND,
    INTERNAL
}
