/*
 * Where: emoji-notifier API
 * What: Standard error body
 * Why: Every handled exception answers with the same shape
 */
package com.example.emojinotifier.api;

public record ApiErrorResponse(String code, String message) {}
