package org.scopeclient.preferences;

import org.scopeclient.units.Unit;

/**
 * Finishes optional metadata of a freshly constructed {@link Preference}.
 * The builder owns the preference until {@link #build()} hands it out; it cannot be used afterwards.
 */
public class PreferenceBuilder {
    private Preference preference;

    public PreferenceBuilder(Preference preference) {
        this.preference = preference.moveOut();
    }

    public PreferenceBuilder isVisible(boolean visible) {
        current().setVisible(visible);
        return this;
    }

    public PreferenceBuilder withUnit(Unit.UnitType type) {
        current().setUnit(new Unit(type));
        return this;
    }

    public Preference build() {
        Preference built = current();
        preference = null;
        return built;
    }

    private Preference current() {
        if (preference == null) {
            throw new IllegalStateException("Preference has already been built");
        }
        return preference;
    }
}
