package io.relayindex.model;

public record RelayModel(
        String hostname
) {
}
