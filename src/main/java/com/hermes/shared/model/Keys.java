package com.hermes.shared.model;

/**
 * Store keys built from several ids. Backslash and the separator are escaped
 * inside each part, so two different part lists never share a key. Parts
 * without either character come through unchanged.
 */
final class Keys {

    private Keys() {}

    static String join(char separator, String... parts) {
        var key = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) key.append(separator);
            var part = String.valueOf(parts[i]);
            for (int j = 0; j < part.length(); j++) {
                char c = part.charAt(j);
                if (c == '\\' || c == separator) key.append('\\');
                key.append(c);
            }
        }
        return key.toString();
    }
}
