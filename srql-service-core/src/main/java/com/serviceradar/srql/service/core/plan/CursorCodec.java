package com.serviceradar.srql.service.core.plan;

import com.serviceradar.srql.service.core.error.InvalidRequestException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;

/** Opaque pagination cursors: URL-safe Base64 of the row offset. */
public final class CursorCodec {

    private CursorCodec() {}

    public static String encode(long offset) {
        return Base64.getUrlEncoder()
                .withoutPadding()
                .encodeToString(Long.toString(Math.max(0, offset)).getBytes(StandardCharsets.UTF_8));
    }

    public static long decode(String cursor) {
        if (cursor == null || cursor.isBlank()) {
            return 0;
        }
        try {
            String decoded = new String(Base64.getUrlDecoder().decode(cursor.trim()), StandardCharsets.UTF_8);
            return Math.max(0, Long.parseLong(decoded));
        } catch (IllegalArgumentException e) {
            // NumberFormatException is an IllegalArgumentException too
            throw new InvalidRequestException("invalid cursor");
        }
    }
}
