package com.phillippitts.huevoice.service.dispatch;

import com.phillippitts.huevoice.config.properties.DispatcherProperties;
import com.phillippitts.huevoice.domain.LightHandle;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * The light-changing handlers bound into the {@link ActionRegistry}.
 *
 * <p>Relative changes read a magnitude from the spoken text: "a little", "a bit", "slightly" use the
 * small step; "a lot", "much", "significantly" the large one; anything else the default.
 */
public class LightActions {

    private static final Logger LOG = LogManager.getLogger(LightActions.class);

    private static final Pattern SMALL = Pattern.compile("\\b(little|bit|slightly)\\b");
    private static final Pattern LARGE = Pattern.compile("\\b(lot|much|significantly)\\b");

    /** Assumed level of a dimmable light that reports no brightness. */
    static final int UNKNOWN_WHEN_DIMMING = LightHandle.MAX_BRIGHTNESS;
    static final int UNKNOWN_WHEN_BRIGHTENING = 128;

    private final DispatcherProperties props;

    public LightActions(DispatcherProperties props) {
        this.props = Objects.requireNonNull(props, "props");
    }

    /** @return handler per action, for {@link ActionRegistry} */
    public Map<ActionType, LightAction> handlers() {
        Map<ActionType, LightAction> m = new EnumMap<>(ActionType.class);
        m.put(ActionType.TURN_ON, (lights, text) -> turnOn(lights));
        m.put(ActionType.TURN_OFF, (lights, text) -> turnOff(lights));
        m.put(ActionType.DIM, this::dim);
        m.put(ActionType.BRIGHTEN, this::brighten);
        m.put(ActionType.MAXIMUM, (lights, text) -> setLevel(lights, LightHandle.MAX_BRIGHTNESS));
        m.put(ActionType.MINIMUM, (lights, text) -> setLevel(lights, LightHandle.MIN_BRIGHTNESS));
        return m;
    }

    public void turnOn(Collection<LightHandle> lights) {
        LOG.info("Turning {} lights on", lights.size());
        for (LightHandle light : lights) {
            light.setOn(true);
        }
    }

    public void turnOff(Collection<LightHandle> lights) {
        LOG.info("Turning {} lights off", lights.size());
        for (LightHandle light : lights) {
            light.setOn(false);
        }
    }

    /** Lowers lights that are on; lights that are off stay off. */
    public void dim(Collection<LightHandle> lights, String text) {
        int step = stepFor(text);
        LOG.info("Dimming lights by {}", step);
        for (LightHandle light : lights) {
            if (!light.isOn() || !light.capabilities().supportsBrightness()) {
                continue;
            }
            int current = light.brightness().orElse(UNKNOWN_WHEN_DIMMING);
            light.setBrightness(Math.max(current - step, LightHandle.MIN_BRIGHTNESS));
        }
    }

    /** Raises lights that are on and switches on lights that are off at the small step. */
    public void brighten(Collection<LightHandle> lights, String text) {
        int step = stepFor(text);
        LOG.info("Brightening lights by {}", step);
        for (LightHandle light : lights) {
            boolean dimmable = light.capabilities().supportsBrightness();
            if (!light.isOn()) {
                light.setOn(true);
                if (dimmable) {
                    light.setBrightness(props.getSmallStep());
                }
                continue;
            }
            if (dimmable) {
                int current = light.brightness().orElse(UNKNOWN_WHEN_BRIGHTENING);
                light.setBrightness(Math.min(current + step, LightHandle.MAX_BRIGHTNESS));
            }
        }
    }

    /** Powers lights on at an absolute brightness. */
    public void setLevel(Collection<LightHandle> lights, int brightness) {
        int level = LightHandle.clampBrightness(brightness);
        LOG.info("Setting {} lights to brightness {}", lights.size(), level);
        for (LightHandle light : lights) {
            light.setOn(true);
            if (light.capabilities().supportsBrightness()) {
                light.setBrightness(level);
            }
        }
    }

    int stepFor(String text) {
        if (SMALL.matcher(text).find()) {
            return props.getSmallStep();
        }
        if (LARGE.matcher(text).find()) {
            return props.getLargeStep();
        }
        return props.getDefaultStep();
    }
}
