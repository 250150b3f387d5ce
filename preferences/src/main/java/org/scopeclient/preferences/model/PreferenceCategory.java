package org.scopeclient.preferences.model;

import lombok.Getter;
import org.scopeclient.preferences.Preference;
import org.scopeclient.preferences.PreferenceType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

public class PreferenceCategory {
    private static final Logger logger = LoggerFactory.getLogger(PreferenceCategory.class);
    public static final char PATH_SEPARATOR = '.';

    @Getter
    private final String name;
    private final Map<String, Preference> preferences = new LinkedHashMap<>();
    private final Map<String, PreferenceCategory> categories = new LinkedHashMap<>();

    public PreferenceCategory(String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * Takes ownership of {@code preference}. The passed handle is moved-from afterwards;
     * use the returned instance to access the registered value. The returned instance can be
     * edited through its typed setters but never moved, assigned over or closed.
     */
    public Preference addPreference(Preference preference) {
        Objects.requireNonNull(preference, "preference");
        if (preference.getType() == PreferenceType.NONE) {
            throw new IllegalArgumentException("Cannot register moved-from preference '"
                    + preference.getIdentifier() + "' in category " + name);
        }
        String identifier = checkSegment(preference.getIdentifier());
        if (preferences.containsKey(identifier)) {
            logger.warn("Rejected duplicate preference {} in category {}", identifier, name);
            throw new IllegalArgumentException("Preference '" + identifier + "' already exists in category " + name);
        }
        Preference owned = preference.moveOut();
        owned.markRegistered();
        preferences.put(identifier, owned);
        logger.debug("Registered preference {} in category {}", identifier, name);
        return owned;
    }

    public PreferenceCategory addCategory(String categoryName) {
        return categories.computeIfAbsent(checkSegment(categoryName), PreferenceCategory::new);
    }

    public Optional<Preference> getPreference(String identifier) {
        return Optional.ofNullable(preferences.get(identifier));
    }

    public Optional<PreferenceCategory> getCategory(String categoryName) {
        return Optional.ofNullable(categories.get(categoryName));
    }

    public Collection<Preference> getPreferences() {
        return Collections.unmodifiableCollection(preferences.values());
    }

    public Map<String, Preference> getPreferencesById() {
        return Collections.unmodifiableMap(preferences);
    }

    public Collection<PreferenceCategory> getCategories() {
        return Collections.unmodifiableCollection(categories.values());
    }

    public boolean isEmpty() {
        return preferences.isEmpty() && categories.isEmpty();
    }

    private static String checkSegment(String segment) {
        Objects.requireNonNull(segment, "segment");
        if (segment.isEmpty() || segment.indexOf(PATH_SEPARATOR) >= 0) {
            throw new IllegalArgumentException("Invalid path segment: '" + segment + "'");
        }
        return segment;
    }
}
