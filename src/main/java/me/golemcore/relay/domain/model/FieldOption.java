package me.golemcore.relay.domain.model;

/**
 * Selectable value of a ticket category field (e.g. a pillar or a pod).
 */
public record FieldOption(String id,String value){}
