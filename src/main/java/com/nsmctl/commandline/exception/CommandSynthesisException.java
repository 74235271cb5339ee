package com.nsmctl.commandline.exception;

/**
 * Base type for errors raised by the grammar pipeline itself (never by a target object).
 */
public class CommandSynthesisException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public CommandSynthesisException(String message) {
		super(message);
	}
}
