package com.tale.script.diagnostics;

/**
 * Raised when code attempts something the sandbox does not allow: a disallowed
 * import, an introspective name, a file path escaping the workspace.
 */
public class SandboxViolationException extends TaleException {
    private static final long serialVersionUID = 1L;

    public SandboxViolationException(int line, String detail) {
        super(ErrorKind.SECURITY, line, detail);
    }

    public SandboxViolationException(String detail) {
        this(0, detail);
    }
}
