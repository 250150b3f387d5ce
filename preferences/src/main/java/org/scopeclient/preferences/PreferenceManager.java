package org.scopeclient.preferences;

import javafx.scene.paint.Color;
import org.scopeclient.preferences.model.PreferenceCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

/**
 * In-memory registry of preferences, organized as a category tree and addressed by dotted
 * path such as {@code Appearance.Cursors.cursor_color}.
 */
public class PreferenceManager {
    private static final Logger logger = LoggerFactory.getLogger(PreferenceManager.class);
    private static final String ROOT_NAME = "";

    private final PreferenceCategory root;

    public PreferenceManager() {
        logger.info("Initializing PreferenceManager");
        root = new PreferenceCategory(ROOT_NAME);
    }

    public PreferenceCategory getRoot() {
        return root;
    }

    /**
     * Returns the category at {@code path}, creating missing categories on the way.
     */
    public PreferenceCategory addCategory(String path) {
        PreferenceCategory category = root;
        for (String segment : split(path)) {
            category = category.addCategory(segment);
        }
        return category;
    }

    public Preference addPreference(String categoryPath, Preference preference) {
        Preference owned = addCategory(categoryPath).addPreference(preference);
        logger.info("Added preference {}", categoryPath == null || categoryPath.isEmpty()
                ? owned.getIdentifier()
                : categoryPath + PreferenceCategory.PATH_SEPARATOR + owned.getIdentifier());
        return owned;
    }

    public boolean hasPreference(String path) {
        return findPreference(path).isPresent();
    }

    public Preference getPreference(String path) {
        return findPreference(path)
                .orElseThrow(() -> new NoSuchElementException("No preference at path: " + path));
    }

    public boolean getBool(String path) {
        return getPreference(path).getBool();
    }

    public double getReal(String path) {
        return getPreference(path).getReal();
    }

    public String getString(String path) {
        return getPreference(path).getString();
    }

    public Color getColor(String path) {
        return getPreference(path).getColor();
    }

    /**
     * Full path of every registered preference, depth first in insertion order.
     */
    public Map<String, Preference> getAllPreferences() {
        Map<String, Preference> result = new LinkedHashMap<>();
        collect(root, "", result);
        return Collections.unmodifiableMap(result);
    }

    private Optional<Preference> findPreference(String path) {
        String[] segments = split(path);
        if (segments.length == 0) {
            return Optional.empty();
        }
        for (String segment : segments) {
            if (segment.isEmpty()) {
                return Optional.empty();
            }
        }
        PreferenceCategory category = root;
        for (int i = 0; i < segments.length - 1; i++) {
            Optional<PreferenceCategory> next = category.getCategory(segments[i]);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            category = next.get();
        }
        return category.getPreference(segments[segments.length - 1]);
    }

    private static void collect(PreferenceCategory category, String prefix, Map<String, Preference> result) {
        for (Map.Entry<String, Preference> entry : category.getPreferencesById().entrySet()) {
            result.put(prefix + entry.getKey(), entry.getValue());
        }
        for (PreferenceCategory child : category.getCategories()) {
            collect(child, prefix + child.getName() + PreferenceCategory.PATH_SEPARATOR, result);
        }
    }

    private static String[] split(String path) {
        if (path == null || path.isEmpty()) {
            return new String[0];
        }
        // keep trailing empty segments so "a.b." does not resolve to "a.b"
        return path.split("\\" + PreferenceCategory.PATH_SEPARATOR, -1);
    }
}
