package com.emailweather.oauth2;

import java.io.Console;

/**
 * Reads the authorization code typed by the user during out-of-band consent.
 */
@FunctionalInterface
public interface CodePrompt {

    /**
     * @param prompt text shown to the user
     * @return the entered code
     * @throws OAuth2Exception if no code can be read
     */
    String readCode(String prompt) throws OAuth2Exception;

    /**
     * Prompt backed by the system console, with input masked like a password.
     */
    static CodePrompt console() {
        return prompt -> {
            Console console = System.console();
            if (console == null) {
                throw new OAuth2Exception(ErrorKind.CONFIGURATION,
                        "Out-of-band consent requires an interactive console");
            }
            char[] code = console.readPassword("%s", prompt);
            if (code == null) {
                throw new OAuth2Exception(ErrorKind.IO, "End of input while reading authorization code");
            }
            return new String(code).trim();
        };
    }
}
