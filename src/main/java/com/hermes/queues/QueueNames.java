package com.hermes.queues;

import com.hermes.shared.model.AffinityGroup;

/**
 * Queue names are a pure function of the affinity group, so nobody needs a lookup to address them.
 * <p>
 * Each id is encoded into {@code [A-Za-z0-9_]} and the parts are joined with {@code -}, which never
 * occurs inside an encoded part. Distinct groups therefore never share a queue. Letters and digits
 * pass through; {@code _} becomes {@code __} and any other character becomes {@code _<hex>_}.
 */
public final class QueueNames {

    private QueueNames() {}

    public static String input(String prefix, AffinityGroup group) {
        return name(prefix, "input", group);
    }

    public static String output(String prefix, AffinityGroup group) {
        return name(prefix, "output", group);
    }

    private static String name(String prefix, String kind, AffinityGroup group) {
        return prefix + "-" + kind + "-" + encode(group.projectId()) + "-" + encode(group.userId());
    }

    static String encode(String part) {
        var encoded = new StringBuilder(part.length());
        part.codePoints().forEach(c -> {
            if (c == '_') {
                encoded.append("__");
            } else if (c < 128 && Character.isLetterOrDigit(c)) {
                encoded.appendCodePoint(c);
            } else {
                encoded.append('_').append(Integer.toHexString(c)).append('_');
            }
        });
        return encoded.toString();
    }
}
