package com.aiPortfolio.secureGateway.gateway.util;

import java.util.regex.Pattern;

/**
 * Masks client identities in operational logs. Audit records keep the full identity.
 *
 * IPv4 addresses keep their first two octets ({@code 203.0.*.*}), IPv6 addresses their first
 * group ({@code 2001:*}). Anything else shows its first and last two characters.
 */
public final class ClientIdentityMasker {

    private static final Pattern IPV4 = Pattern.compile("\\d{1,3}(\\.\\d{1,3}){3}");
    private static final String MASK = "****";

    private ClientIdentityMasker() {
    }

    public static String mask(String clientIdentity) {
        if (clientIdentity == null || clientIdentity.isBlank()) {
            return MASK;
        }
        if (IPV4.matcher(clientIdentity).matches()) {
            String[] octets = clientIdentity.split("\\.");
            return octets[0] + "." + octets[1] + ".*.*";
        }
        int colon = clientIdentity.indexOf(':');
        if (colon > 0 && clientIdentity.indexOf(':', colon + 1) > 0) {
            return clientIdentity.substring(0, colon) + ":*";
        }
        if (clientIdentity.length() <= 4) {
            return MASK;
        }
        return clientIdentity.substring(0, 2) + MASK + clientIdentity.substring(clientIdentity.length() - 2);
    }
}
