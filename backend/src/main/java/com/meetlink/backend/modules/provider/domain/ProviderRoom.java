package com.meetlink.backend.modules.provider.domain;

/**
 * Opaque handle to a provider-side room. Only the name and display URL are kept.
 */
public record ProviderRoom(String name, String url) {
}
