package me.golemcore.relay.domain.model;

/**
 * Result of a successful external create call: the ticket key or page id and
 * a browser link to it.
 */
public record CreatedArtifact(String externalId,String url){}
