package org.scopeclient.preferences;

public enum PreferenceType {
    BOOLEAN,
    STRING,
    REAL,
    COLOR,
    // Only for moved-from values
    NONE
}
