// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.smelt.core;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class SmeltDebugTest {

    @AfterEach
    void reset() {
        SmeltDebug.setEnabled(false);
    }

    @Test
    void trueEnablesEverything() {
        SmeltDebug.configure("true");

        assertTrue(SmeltDebug.isBlockLoggingEnabled());
        assertTrue(SmeltDebug.isReceiptLoggingEnabled());
    }

    @Test
    void categoryListEnablesOnlyListedCategories() {
        SmeltDebug.configure(" Block , unknown");

        assertTrue(SmeltDebug.isBlockLoggingEnabled());
        assertFalse(SmeltDebug.isReceiptLoggingEnabled());
        assertTrue(SmeltDebug.isEnabled());
    }

    @Test
    void nullOrFalseDisables() {
        SmeltDebug.setEnabled(true);
        SmeltDebug.configure(null);
        assertFalse(SmeltDebug.isEnabled());

        SmeltDebug.configure("false");
        assertFalse(SmeltDebug.isEnabled());
    }
}
