package org.scopeclient.preferences.model;

import org.junit.jupiter.api.Test;
import org.scopeclient.preferences.Preference;
import org.scopeclient.preferences.PreferenceType;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PreferenceCategoryTest {

    @Test
    void addPreferenceTakesOwnership() {
        PreferenceCategory category = new PreferenceCategory("Cursors");
        Preference pref = new Preference("snap", "Snap to edges", "", true);

        Preference owned = category.addPreference(pref);

        assertEquals(PreferenceType.NONE, pref.getType());
        assertSame(owned, category.getPreference("snap").orElseThrow());
        assertTrue(owned.getBool());
    }

    @Test
    void registeredPreferenceCannotBeMovedAssignedOrClosed() {
        PreferenceCategory category = new PreferenceCategory("Cursors");
        Preference owned = category.addPreference(new Preference("snap", "Snap", "", true));

        assertTrue(owned.isRegistered());
        assertThrows(IllegalStateException.class, owned::moveOut);
        assertThrows(IllegalStateException.class, () -> owned.assignFrom(new Preference("other", "Other", "", false)));
        assertThrows(IllegalStateException.class, owned::close);
        Preference target = new Preference("target", "Target", "", 1.0);
        assertThrows(IllegalStateException.class, () -> target.assignFrom(owned));

        owned.setBool(false);
        assertEquals("snap", owned.getIdentifier());
        assertFalse(category.getPreference("snap").orElseThrow().getBool());
        assertEquals(1.0, target.getReal());
    }

    @Test
    void rejectsDuplicateAndMovedFromPreferences() {
        PreferenceCategory category = new PreferenceCategory("Cursors");
        category.addPreference(new Preference("snap", "Snap", "", true));

        Preference duplicate = new Preference("snap", "Snap again", "", false);
        assertThrows(IllegalArgumentException.class, () -> category.addPreference(duplicate));
        assertEquals(PreferenceType.BOOLEAN, duplicate.getType());

        Preference moved = new Preference("other", "Other", "", 1.0);
        moved.moveOut();
        assertThrows(IllegalArgumentException.class, () -> category.addPreference(moved));
    }

    @Test
    void rejectsIdentifiersContainingSeparator() {
        PreferenceCategory category = new PreferenceCategory("Cursors");

        assertThrows(IllegalArgumentException.class,
                () -> category.addPreference(new Preference("a.b", "A", "", true)));
        assertThrows(IllegalArgumentException.class, () -> category.addCategory(""));
    }

    @Test
    void keepsInsertionOrderAndReusesCategories() {
        PreferenceCategory category = new PreferenceCategory("Appearance");
        category.addPreference(new Preference("zeta", "Zeta", "", true));
        category.addPreference(new Preference("alpha", "Alpha", "", false));
        PreferenceCategory cursors = category.addCategory("Cursors");

        assertSame(cursors, category.addCategory("Cursors"));
        List<String> ids = category.getPreferences().stream()
                .map(Preference::getIdentifier)
                .collect(Collectors.toList());
        assertEquals(List.of("zeta", "alpha"), ids);
        assertEquals(1, category.getCategories().size());
        assertTrue(cursors.isEmpty());
        assertFalse(category.isEmpty());
        assertTrue(category.getCategory("Missing").isEmpty());
    }
}
