package com.microblog.adapter.in.web;

/**
 * Body of every non-2xx API response. {@code error} is the stable machine-readable code.
 */
public record ErrorResponse(String error, String message, String requestId) {
}
