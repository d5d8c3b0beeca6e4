package com.kaspaaio.core.security;

import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Boundary filter rejecting setting values that look like wallet secrets.
 * The installer never needs private keys or seed phrases; accepting one would
 * write it into the environment file in clear text.
 */
@Service
public class SecretMaterialFilter {

    private static final Pattern PEM_PRIVATE_KEY = Pattern.compile("-----BEGIN [A-Z ]*PRIVATE KEY-----");
    private static final Pattern HEX_KEY = Pattern.compile("^(0x)?[0-9a-fA-F]{64}$");
    private static final Pattern EXTENDED_KEY = Pattern.compile("^[xkt]prv[1-9A-HJ-NP-Za-km-z]{100,}$");
    private static final Pattern WORDS = Pattern.compile("^[a-z]+(\\s+[a-z]+)+$");
    private static final Set<Integer> MNEMONIC_LENGTHS = Set.of(12, 15, 18, 21, 24);

    /**
     * @param settings  key/value pairs supplied by the caller
     * @param skipKeys  keys exempt from the check (generated or user-chosen passwords)
     * @return one message per rejected key, empty when everything passes
     */
    public List<Rejection> inspect(Map<String, String> settings, Set<String> skipKeys) {
        var rejections = new ArrayList<Rejection>();
        settings.forEach((key, value) -> {
            if (value == null || skipKeys.contains(key)) return;
            String reason = reasonFor(value.trim());
            if (reason != null) {
                rejections.add(new Rejection(key, reason));
            }
        });
        rejections.sort((a, b) -> a.key().compareTo(b.key()));
        return rejections;
    }

    String reasonFor(String value) {
        if (PEM_PRIVATE_KEY.matcher(value).find()) {
            return "looks like a PEM private key";
        }
        if (HEX_KEY.matcher(value).matches()) {
            return "looks like a raw private key";
        }
        if (EXTENDED_KEY.matcher(value).matches()) {
            return "looks like an extended private key";
        }
        if (WORDS.matcher(value).matches() && MNEMONIC_LENGTHS.contains(value.split("\\s+").length)) {
            return "looks like a seed phrase";
        }
        return null;
    }

    public record Rejection(String key, String reason) {}
}
