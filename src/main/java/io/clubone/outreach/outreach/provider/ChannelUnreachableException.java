package io.clubone.outreach.outreach.provider;

/**
 * The channel API could not be connected to, so nothing was sent and the call is safe to repeat.
 */
public class ChannelUnreachableException extends RuntimeException {

	public ChannelUnreachableException(String message, Throwable cause) {
		super(message, cause);
	}
}
