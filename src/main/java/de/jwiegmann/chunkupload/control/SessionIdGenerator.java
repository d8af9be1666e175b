package de.jwiegmann.chunkupload.control;

import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Erzeugt Session-Ids: 128 Bit Zufall, hex-kodiert (32 Zeichen, klein geschrieben).
 */
@Component
public class SessionIdGenerator {

    private static final Pattern SESSION_ID = Pattern.compile("^[a-f0-9]{32}$");

    private final SecureRandom random = new SecureRandom();

    public String generate() {
        byte[] bytes = new byte[16];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    public static boolean isWellFormed(String sessionId) {
        return sessionId != null && SESSION_ID.matcher(sessionId).matches();
    }
}
