package com.switchboard.observability;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Redacts credentials from store locations before they reach a log line or an admin response.
 * <p>
 * JDBC URLs may carry credentials either in the authority
 * ({@code jdbc:postgresql://user:pw@host/db}) or as parameters ({@code ?user=app&password=pw}).
 * Both are masked; host, port and database stay visible.
 */
public final class SensitiveDataRedactor {

    /** The replacement string for redacted values. */
    public static final String REDACTED = "[REDACTED]";

    private static final Pattern URL_USER_INFO = Pattern.compile("(//)([^/@:]+):([^/@]*)@");
    private static final Pattern URL_PASSWORD_PARAM =
            Pattern.compile("((?:password|pwd)=)([^&;]*)", Pattern.CASE_INSENSITIVE);

    /**
     * Removes credentials from a connection URL, keeping host and database visible.
     *
     * @param url a JDBC (or any URI-shaped) connection string
     * @return the URL with passwords replaced; null stays null
     */
    public String redactUrl(String url) {
        if (url == null) {
            return null;
        }
        Matcher userInfo = URL_USER_INFO.matcher(url);
        String redacted = userInfo.replaceAll("$1$2:" + Matcher.quoteReplacement(REDACTED) + "@");
        return URL_PASSWORD_PARAM.matcher(redacted)
                .replaceAll("$1" + Matcher.quoteReplacement(REDACTED));
    }
}
