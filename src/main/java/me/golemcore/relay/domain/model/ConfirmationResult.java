package me.golemcore.relay.domain.model;

/**
 * Outcome of a confirmation. Every status is a success from the caller's point
 * of view: duplicates are absorbed silently.
 */
public record ConfirmationResult(Status status,String actionId,CreatedArtifact artifact){

public static ConfirmationResult executed(String actionId,CreatedArtifact artifact){return new ConfirmationResult(Status.EXECUTED,actionId,artifact);}

public static ConfirmationResult alreadyProcessed(String actionId){return new ConfirmationResult(Status.ALREADY_PROCESSED,actionId,null);}

public static ConfirmationResult inProgress(String actionId){return new ConfirmationResult(Status.IN_PROGRESS,actionId,null);}

public enum Status {
    /** The external artifact was created by this call. */
    EXECUTED,
    /** The action had already run to completion. */
    ALREADY_PROCESSED,
    /** Another confirmation of the same action is executing right now. */
    IN_PROGRESS
}}
