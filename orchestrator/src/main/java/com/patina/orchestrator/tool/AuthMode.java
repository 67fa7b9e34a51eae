package com.patina.orchestrator.tool;

/**
 * How a tool server expects credentials to be managed.
 */
public enum AuthMode {
    /** The server issues a short-lived token per session; no refresh token. */
    SERVER_MANAGED,
    /** The client holds a refresh token and renews the access token itself. */
    CLIENT_MANAGED
}
