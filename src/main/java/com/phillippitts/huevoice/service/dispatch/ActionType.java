package com.phillippitts.huevoice.service.dispatch;

/**
 * Canonical light actions, in the order the alias table is searched.
 */
public enum ActionType {

    TURN_ON("turn on", "Turning the lights on"),
    TURN_OFF("turn off", "Turning the lights off"),
    DIM("dim", "Dimming the lights"),
    BRIGHTEN("brighten", "Brightening the lights"),
    MAXIMUM("maximum", "Setting lights to maximum brightness"),
    MINIMUM("minimum", "Setting lights to minimum brightness");

    private final String canonical;
    private final String confirmation;

    ActionType(String canonical, String confirmation) {
        this.canonical = canonical;
        this.confirmation = confirmation;
    }

    /** @return spoken canonical phrase, also the alias table key */
    public String canonical() {
        return canonical;
    }

    /** @return sentence spoken after the action ran */
    public String confirmation() {
        return confirmation;
    }
}
