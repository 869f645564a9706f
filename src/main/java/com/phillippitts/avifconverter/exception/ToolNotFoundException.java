package com.phillippitts.avifconverter.exception;

/**
 * Thrown when an external codec executable cannot be launched because it is absent
 * or not executable. This is a host misconfiguration, not a stage failure.
 */
public class ToolNotFoundException extends AvifConverterException {

    private final String toolName;
    private final String executable;

    public ToolNotFoundException(String toolName, String executable) {
        super("Required tool '" + toolName + "' not found at: " + executable);
        this.toolName = toolName;
        this.executable = executable;
    }

    public ToolNotFoundException(String toolName, String executable, Throwable cause) {
        super("Required tool '" + toolName + "' not found at: " + executable, cause);
        this.toolName = toolName;
        this.executable = executable;
    }

    public String getToolName() {
        return toolName;
    }

    public String getExecutable() {
        return executable;
    }
}
