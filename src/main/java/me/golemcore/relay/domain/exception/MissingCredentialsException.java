package me.golemcore.relay.domain.exception;

/**
 * Required external credentials are not configured. Retrying cannot help until
 * the configuration changes.
 */
public class MissingCredentialsException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public MissingCredentialsException(String credential) {
        super(credential + " is not configured");
    }
}
