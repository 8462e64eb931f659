package com.scriptplatform.common.scoring;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * SHA-256 of a script with line endings normalised and outer whitespace trimmed.
 */
public final class ScriptFingerprint {

    private ScriptFingerprint() {}

    public static String of(String scriptText) {
        String normalized = scriptText == null ? "" : scriptText.replace("\r\n", "\n").replace('\r', '\n').strip();
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(normalized.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static boolean matches(String scriptText, String fingerprint) {
        return fingerprint != null && of(scriptText).equals(fingerprint);
    }
}
