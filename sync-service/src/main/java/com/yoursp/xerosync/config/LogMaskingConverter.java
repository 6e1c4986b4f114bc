package com.yoursp.xerosync.config;

import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.pattern.CompositeConverter;

import java.util.regex.Pattern;

/**
 * Logback converter that masks OAuth material in log messages.
 * <ul>
 * <li>access_token / Bearer tokens: first 8 chars + "..."</li>
 * <li>refresh_token: "[REDACTED]"</li>
 * <li>client_secret: "[REDACTED]"</li>
 * </ul>
 * <p>
 * Registered in logback-spring.xml:
 * {@code <conversionRule conversionWord="mask" converterClass=
 * "com.yoursp.xerosync.config.LogMaskingConverter" />}
 * </p>
 */
public class LogMaskingConverter extends CompositeConverter<ILoggingEvent> {

    // Matches Bearer tokens: "Bearer <token>"
    private static final Pattern BEARER_PATTERN = Pattern
            .compile("(Bearer\\s+)([A-Za-z0-9_\\-./+=]{8})[A-Za-z0-9_\\-./+=]+");

    // Matches access_token=<value> or "access_token":"<value>"
    private static final Pattern ACCESS_TOKEN_PATTERN = Pattern
            .compile("(access_token[\"=:]+\\s*[\"']?)([A-Za-z0-9_\\-./+=]{8})[A-Za-z0-9_\\-./+=]+");

    // Refresh tokens are long-lived, never show any part of them
    private static final Pattern REFRESH_TOKEN_PATTERN = Pattern
            .compile("(refresh_token[\"=:]+\\s*[\"']?)[^\"&\\s,}]+");

    private static final Pattern CLIENT_SECRET_PATTERN = Pattern.compile("(client_secret[\"=:]+\\s*[\"']?)[^\"&\\s,}]+");

    @Override
    protected String transform(ILoggingEvent event, String formattedMessage) {
        if (formattedMessage == null || formattedMessage.isEmpty()) {
            return formattedMessage;
        }

        String masked = formattedMessage;
        masked = BEARER_PATTERN.matcher(masked).replaceAll("$1$2...");
        masked = ACCESS_TOKEN_PATTERN.matcher(masked).replaceAll("$1$2...");
        masked = REFRESH_TOKEN_PATTERN.matcher(masked).replaceAll("$1[REDACTED]");
        masked = CLIENT_SECRET_PATTERN.matcher(masked).replaceAll("$1[REDACTED]");

        return masked;
    }
}
