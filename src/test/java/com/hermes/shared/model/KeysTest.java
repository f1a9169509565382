package com.hermes.shared.model;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class KeysTest {

    @Test
    void plainIdsKeepTheirReadableKey() {
        assertThat(new AffinityGroup("siteA", "u1").key()).isEqualTo("siteA#u1");
        assertThat(Session.key("acme", "siteA", "u1", "Ab3_x-9Z")).isEqualTo("acme/siteA/u1/Ab3_x-9Z");
    }

    @Test
    void separatorInsideAnIdDoesNotMergeGroups() {
        var left = new AffinityGroup("a#b", "c");
        var right = new AffinityGroup("a", "b#c");

        assertThat(left.key()).isNotEqualTo(right.key());
    }

    @Test
    void escapeCharacterCannotForgeASeparator() {
        var left = new AffinityGroup("a\\", "b");
        var right = new AffinityGroup("a", "\\b");
        var third = new AffinityGroup("a\\#", "b");
        var fourth = new AffinityGroup("a", "#b");

        assertThat(Set.of(left.key(), right.key(), third.key(), fourth.key())).hasSize(4);
    }

    @Test
    void sessionKeysWithSlashesInIdsStayDistinct() {
        assertThat(Session.key("c", "p/u", "t", "x"))
                .isNotEqualTo(Session.key("c", "p", "u/t", "x"))
                .isNotEqualTo(Session.key("c/p", "u", "t", "x"));
    }
}
