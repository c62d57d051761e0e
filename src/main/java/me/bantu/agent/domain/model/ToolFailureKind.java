package me.bantu.agent.domain.model;

/**
 * Machine-readable classification of tool execution failures.
 *
 * <p>
 * Dispatch maps each kind to the user-facing message shape instead of matching
 * on error text.
 */
public enum ToolFailureKind {

    /**
     * The requested tool is not registered.
     */
    UNKNOWN_TOOL,

    /**
     * The supplied arguments do not match the tool's declared parameters
     * (missing, unexpected, or of the wrong type).
     */
    INVALID_ARGUMENTS,

    /**
     * Tool execution failed during runtime (exceptions, timeouts, I/O errors,
     * etc.).
     */
    EXECUTION_FAILED
}
