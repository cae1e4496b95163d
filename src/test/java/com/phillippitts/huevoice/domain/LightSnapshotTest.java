package com.phillippitts.huevoice.domain;

import com.phillippitts.huevoice.testutil.FakeLight;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.OptionalInt;

import static org.assertj.core.api.Assertions.assertThat;

class LightSnapshotTest {

    @Test
    void shouldCaptureOnlySupportedFields() {
        // Arrange
        FakeLight plain = FakeLight.onOff("Porch", true);
        FakeLight colour = FakeLight.color("Desk", true, 200, new ColorPoint(0.3, 0.4));

        // Act
        LightSnapshot plainSnap = LightSnapshot.of(plain);
        LightSnapshot colourSnap = LightSnapshot.of(colour);

        // Assert
        assertThat(plainSnap.brightness()).isEmpty();
        assertThat(plainSnap.colorPoint()).isEmpty();
        assertThat(colourSnap.brightness()).hasValue(200);
        assertThat(colourSnap.colorPoint()).contains(new ColorPoint(0.3, 0.4));
    }

    @Test
    void shouldRestoreLevelsBeforeSwitchingOff() {
        // Arrange
        FakeLight light = FakeLight.dimmable("Lamp", true, 254);
        LightSnapshot snapshot = new LightSnapshot(false, OptionalInt.of(100), Optional.empty());

        // Act
        snapshot.restoreTo(light);

        // Assert
        assertThat(light.writes()).containsExactly("bri=100", "on=false");
        assertThat(light.isOn()).isFalse();
    }

    @Test
    void shouldNotTouchLevelsOfLightThatIsAlreadyOff() {
        FakeLight light = FakeLight.dimmable("Lamp", false, 50);
        LightSnapshot snapshot = new LightSnapshot(false, OptionalInt.of(100), Optional.empty());

        snapshot.restoreTo(light);

        assertThat(light.writes()).containsExactly("on=false");
    }

    @Test
    void shouldSwitchOnThenApplyLevels() {
        FakeLight light = FakeLight.color("Desk", false, 10, new ColorPoint(0.1, 0.1));
        LightSnapshot snapshot = new LightSnapshot(true, OptionalInt.of(180), Optional.of(new ColorPoint(0.5, 0.4)));

        snapshot.restoreTo(light);

        assertThat(light.writes()).containsExactly("on=true", "bri=180", "xy=0.5,0.4");
    }

    @Test
    void shouldNeverInventBrightnessForLightThatReportedNone() {
        FakeLight light = new FakeLight("1", "Strip", DeviceCapabilities.DIMMABLE, true,
                OptionalInt.empty(), Optional.empty());

        LightSnapshot snapshot = LightSnapshot.of(light);
        snapshot.restoreTo(light);

        assertThat(snapshot.brightness()).isEmpty();
        assertThat(light.writes()).containsExactly("on=true");
    }
}
