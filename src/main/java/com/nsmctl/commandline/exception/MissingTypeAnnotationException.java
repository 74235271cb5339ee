package com.nsmctl.commandline.exception;

import java.util.List;

/**
 * Raised while building an interface when a constructor parameter carries no semantic type,
 * so no flag can be derived for it.
 */
public class MissingTypeAnnotationException extends CommandSynthesisException {

	private static final long serialVersionUID = 1L;
	private final String targetName;
	private final List<String> parameterNames;

	public MissingTypeAnnotationException(String targetName, List<String> parameterNames) {
		super("Cannot derive a grammar for " + targetName + ": no type declared for parameter(s) "
				+ String.join(", ", parameterNames));
		this.targetName = targetName;
		this.parameterNames = List.copyOf(parameterNames);
	}

	public String getTargetName() {
		return targetName;
	}

	public List<String> getParameterNames() {
		return parameterNames;
	}
}
