package com.sandcastle.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/sessions.
 *
 * @param name display name; nullable, defaults to the session id
 */
public record CreateSessionRequest(String name) {}
