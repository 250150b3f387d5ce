package org.scopeclient.preferences;

import javafx.scene.paint.Color;
import lombok.Getter;
import org.scopeclient.units.Unit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * A single named, typed configuration value with display metadata.
 *
 * <p>The payload kind is chosen at construction and never changes. Typed accessors and mutators
 * throw {@link PreferenceTypeException} when called for a different kind. A preference has exactly
 * one owner: ownership moves with {@link #moveOut()} and {@link #assignFrom(Preference)}, which leave
 * the source in the {@link PreferenceType#NONE} state. There is no copy operation.
 *
 * <p>Instances are not thread safe.
 */
public class Preference implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(Preference.class);
    static final Unit DEFAULT_UNIT = new Unit(Unit.UnitType.COUNTS);

    @Getter
    private String identifier;
    @Getter
    private String label;
    @Getter
    private String description;
    private PreferenceValue value;
    @Getter
    private boolean visible = true;
    @Getter
    private Unit unit = DEFAULT_UNIT;
    @Getter
    private boolean registered;

    public Preference(String identifier, String label, String description, boolean defaultValue) {
        this(identifier, label, description, new PreferenceValue.Bool(defaultValue));
    }

    public Preference(String identifier, String label, String description, String defaultValue) {
        this(identifier, label, description,
                new PreferenceValue.Text(Objects.requireNonNull(defaultValue, "defaultValue")));
    }

    public Preference(String identifier, String label, String description, CharSequence defaultValue) {
        this(identifier, label, description,
                new PreferenceValue.Text(Objects.requireNonNull(defaultValue, "defaultValue").toString()));
    }

    public Preference(String identifier, String label, String description, double defaultValue) {
        this(identifier, label, description, new PreferenceValue.Real(defaultValue));
    }

    public Preference(String identifier, String label, String description, Color defaultValue) {
        this(identifier, label, description,
                new PreferenceValue.Rgb(ColorValue.fromColor(Objects.requireNonNull(defaultValue, "defaultValue"))));
    }

    private Preference(String identifier, String label, String description, PreferenceValue value) {
        this.identifier = Objects.requireNonNull(identifier, "identifier");
        this.label = Objects.requireNonNull(label, "label");
        this.description = Objects.requireNonNull(description, "description");
        this.value = value;
    }

    public static PreferenceBuilder builder(String identifier, String label, String description, boolean defaultValue) {
        return new PreferenceBuilder(new Preference(identifier, label, description, defaultValue));
    }

    public static PreferenceBuilder builder(String identifier, String label, String description, double defaultValue) {
        return new PreferenceBuilder(new Preference(identifier, label, description, defaultValue));
    }

    public static PreferenceBuilder builder(String identifier, String label, String description, String defaultValue) {
        return new PreferenceBuilder(new Preference(identifier, label, description, defaultValue));
    }

    public static PreferenceBuilder builder(String identifier, String label, String description, CharSequence defaultValue) {
        return new PreferenceBuilder(new Preference(identifier, label, description, defaultValue));
    }

    public static PreferenceBuilder builder(String identifier, String label, String description, Color defaultValue) {
        return new PreferenceBuilder(new Preference(identifier, label, description, defaultValue));
    }

    /**
     * Transfers this preference into a new instance. Afterwards this instance is {@link PreferenceType#NONE}
     * and may only be closed or assigned to.
     */
    public Preference moveOut() {
        checkNotRegistered("move");
        Preference target = new Preference(identifier, label, description, PreferenceValue.None.INSTANCE);
        target.transferFrom(this);
        return target;
    }

    /**
     * Releases the current payload, then takes over metadata and payload of {@code source},
     * leaving {@code source} moved-from.
     */
    public Preference assignFrom(Preference source) {
        Objects.requireNonNull(source, "source");
        if (source == this) {
            return this;
        }
        checkNotRegistered("assign over");
        source.checkNotRegistered("move");
        release();
        transferFrom(source);
        return this;
    }

    private void transferFrom(Preference source) {
        identifier = source.identifier;
        label = source.label;
        description = source.description;
        visible = source.visible;
        unit = source.unit;
        value = source.value;
        source.value = PreferenceValue.None.INSTANCE;
        logger.debug("Moved preference {} ({})", identifier, value.type());
    }

    private void release() {
        if (value.type() != PreferenceType.NONE) {
            logger.debug("Releasing {} payload of preference {}", value.type(), identifier);
            value = PreferenceValue.None.INSTANCE;
        }
    }

    @Override
    public void close() {
        checkNotRegistered("close");
        release();
    }

    /**
     * Pins this instance to the registry that owns it. Its identifier then stays equal to the
     * registry key: moving, assigning over and closing are refused from here on.
     */
    public void markRegistered() {
        registered = true;
    }

    private void checkNotRegistered(String operation) {
        if (registered) {
            throw new IllegalStateException("Cannot " + operation + " preference '" + identifier
                    + "': it is owned by a registry");
        }
    }

    public PreferenceType getType() {
        return value.type();
    }

    public boolean getBool() {
        return expect(PreferenceValue.Bool.class, PreferenceType.BOOLEAN).value();
    }

    public double getReal() {
        return expect(PreferenceValue.Real.class, PreferenceType.REAL).value();
    }

    public String getString() {
        return expect(PreferenceValue.Text.class, PreferenceType.STRING).value();
    }

    public Color getColor() {
        return getColorRaw().toColor();
    }

    public ColorValue getColorRaw() {
        return expect(PreferenceValue.Rgb.class, PreferenceType.COLOR).value();
    }

    public void setBool(boolean value) {
        expect(PreferenceValue.Bool.class, PreferenceType.BOOLEAN);
        this.value = new PreferenceValue.Bool(value);
    }

    public void setReal(double value) {
        expect(PreferenceValue.Real.class, PreferenceType.REAL);
        this.value = new PreferenceValue.Real(value);
    }

    public void setString(String value) {
        Objects.requireNonNull(value, "value");
        expect(PreferenceValue.Text.class, PreferenceType.STRING);
        this.value = new PreferenceValue.Text(value);
    }

    public void setColor(Color value) {
        Objects.requireNonNull(value, "value");
        setColorRaw(ColorValue.fromColor(value));
    }

    public void setColorRaw(ColorValue value) {
        Objects.requireNonNull(value, "value");
        expect(PreferenceValue.Rgb.class, PreferenceType.COLOR);
        this.value = new PreferenceValue.Rgb(value);
    }

    public void setVisible(boolean visible) {
        this.visible = visible;
    }

    public void setUnit(Unit unit) {
        this.unit = Objects.requireNonNull(unit, "unit");
    }

    public boolean hasUnit() {
        return !DEFAULT_UNIT.equals(unit);
    }

    private <T extends PreferenceValue> T expect(Class<T> kind, PreferenceType requested) {
        if (!kind.isInstance(value)) {
            throw new PreferenceTypeException(identifier, requested, value.type());
        }
        return kind.cast(value);
    }

    /**
     * Textual form of the value for serialization. Unlike {@link #toString()} this fails on a
     * moved-from preference.
     */
    public String getValueString() {
        if (value.type() == PreferenceType.NONE) {
            throw new PreferenceTypeException(identifier, PreferenceType.NONE, PreferenceType.NONE);
        }
        return value.render();
    }

    @Override
    public String toString() {
        return value.render();
    }
}
