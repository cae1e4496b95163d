package com.phillippitts.huevoice.service.dispatch;

import com.phillippitts.huevoice.domain.LightHandle;

import java.util.Collection;

/**
 * Handler bound to an {@link ActionType} in the {@link ActionRegistry}.
 */
@FunctionalInterface
public interface LightAction {

    /**
     * @param targets    lights to change
     * @param subCommand spoken text, for handlers that read modifiers such as "a little"
     */
    void apply(Collection<LightHandle> targets, String subCommand);
}
