package io.veraaws.server.core;

public enum HttpMethod {
    GET,
    POST,
    PUT,
    DELETE,
    HEAD
}
