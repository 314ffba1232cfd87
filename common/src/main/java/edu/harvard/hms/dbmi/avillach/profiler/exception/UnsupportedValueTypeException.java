package edu.harvard.hms.dbmi.avillach.profiler.exception;

import java.util.List;

public class UnsupportedValueTypeException extends IllegalArgumentException {

	private static final long serialVersionUID = 6915210437816372040L;

	private final String requestedType;

	/**
	 * Thrown when a caller names a value type outside the supported set.
	 *
	 * @param requestedType the type name that was asked for
	 * @param supportedTypes the names that would have been accepted
	 */
	public UnsupportedValueTypeException(String requestedType, List<String> supportedTypes) {
		super("Unsupported value type '" + requestedType + "'. "
				+ "Supported value types are: " + String.join(", ", supportedTypes));
		this.requestedType = requestedType;
	}

	public String getRequestedType() {
		return requestedType;
	}
}
