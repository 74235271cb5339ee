package com.nsmctl.commandline.exception;

import java.util.List;

/**
 * User input did not satisfy the grammar. Always raised before any target object is constructed.
 * Holds every problem found plus the usage text of the grammar that rejected the input.
 */
public class UsageException extends CommandSynthesisException {

	private static final long serialVersionUID = 1L;
	private final List<String> errors;
	private final String usage;

	public UsageException(List<String> errors, String usage) {
		super(String.join(System.lineSeparator(), errors));
		this.errors = List.copyOf(errors);
		this.usage = usage == null ? "" : usage;
	}

	public UsageException(String error, String usage) {
		this(List.of(error), usage);
	}

	public List<String> getErrors() {
		return errors;
	}

	public String getUsage() {
		return usage;
	}
}
