package org.hivemind.runtime.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@Tag("unit")
class PersonalityTest {

    @ParameterizedTest
    @EnumSource(PersonalityType.class)
    void presetsStayWithinTheUnitRange(PersonalityType type) {
        Personality p = Personality.of(type);

        assertThat(p.type()).isEqualTo(type);
        assertThat(p.aggression()).isBetween(0.0, 1.0);
        assertThat(p.fear()).isBetween(0.0, 1.0);
        assertThat(p.curiosity()).isBetween(0.0, 1.0);
        assertThat(p.fleeHealthThreshold()).isBetween(0.0, 1.0);
        assertThat(p.speedMultiplier()).isPositive();
        assertThat(p.swarm()).isEqualTo(type == PersonalityType.SWARM);
    }

    @Test
    void rolesFollowTheArchetype() {
        assertThat(Personality.of(PersonalityType.SUPPORT).hasSupportRole()).isTrue();
        assertThat(Personality.of(PersonalityType.GUARDIAN).hasGuardRole()).isTrue();
        assertThat(Personality.of(PersonalityType.TACTICAL).isTactical()).isTrue();
        assertThat(Personality.of(PersonalityType.AGGRESSIVE).hasSupportRole()).isFalse();
        assertThat(Personality.of(PersonalityType.BERSERKER).fleeHealthThreshold()).isZero();
    }

    @Test
    void outOfRangeTraitsAreClamped() {
        Personality p = new Personality(PersonalityType.HUNTER, 1.5, -0.2, Double.NaN, 0.5, -3.0, 2.0, false);

        assertThat(p.aggression()).isEqualTo(1.0);
        assertThat(p.fear()).isZero();
        assertThat(p.curiosity()).isZero();
        assertThat(p.fleeHealthThreshold()).isEqualTo(1.0);
        assertThat(p.speedMultiplier()).isEqualTo(1.0);
    }

    @Test
    void typeIsRequired() {
        assertThatThrownBy(() -> new Personality(null, 0, 0, 0, 0, 1, 0, false))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
