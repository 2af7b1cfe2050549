package me.golemcore.relay.domain.model;

/**
 * Outcome of starting a confirmation flow.
 */
public record InitiationResult(Status status,String requestId){

public static InitiationResult prompted(String requestId){return new InitiationResult(Status.PROMPTED,requestId);}

public static InitiationResult alreadyExists(){return new InitiationResult(Status.ALREADY_EXISTS,null);}

public enum Status {
    /** Prompt posted, request stored. */
    PROMPTED,
    /** The thread already has an artifact of this kind; nothing was stored. */
    ALREADY_EXISTS
}}
