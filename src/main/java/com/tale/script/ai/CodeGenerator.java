package com.tale.script.ai;

/**
 * A text model that writes TALE programs.
 *
 * Implementations wrap whatever client the host uses. The prompt handed in is
 * already composed (system rules plus the user request); the returned text is
 * untrusted and goes through the same pipeline as anything a user types.
 */
@FunctionalInterface
public interface CodeGenerator {

    /**
     * @throws UnsafeRequestException when the model itself refused the request
     * @throws AiServiceException when the model could not be reached or failed
     */
    String generate(String prompt);
}
