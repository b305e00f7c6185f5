package me.golemcore.datapilot.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ArtifactReferenceTest {

    @Test
    void shouldParseNameAndVersion() {
        ArtifactReference reference = ArtifactReference.parse("dataset@3", null);

        assertEquals("dataset", reference.name());
        assertEquals(3, reference.version());
        assertEquals("dataset@3", reference.format());
    }

    @Test
    void shouldTreatBareNameAsLatest() {
        ArtifactReference reference = ArtifactReference.parse("model", null);

        assertTrue(reference.isLatest());
        assertNull(reference.version());
        assertEquals("model@latest", reference.toString());
    }

    @Test
    void shouldResolveBareVersionAgainstDefaultName() {
        assertEquals(ArtifactReference.of("dataset", 2), ArtifactReference.parse("v2", "dataset"));
        assertEquals(ArtifactReference.of("dataset", null), ArtifactReference.parse("LATEST", "dataset"));
    }

    @Test
    void shouldRejectBareVersionWithoutDefaultName() {
        assertThrows(IllegalArgumentException.class, () -> ArtifactReference.parse("2", null));
    }

    @Test
    void shouldRejectInvalidInput() {
        assertThrows(IllegalArgumentException.class, () -> ArtifactReference.parse(" ", "dataset"));
        assertThrows(IllegalArgumentException.class, () -> ArtifactReference.parse("dataset@0", null));
        assertThrows(IllegalArgumentException.class, () -> ArtifactReference.parse("dataset@newest", null));
        assertThrows(IllegalArgumentException.class, () -> ArtifactReference.parse("../etc@1", null));
    }

    @Test
    void shouldValidateNames() {
        assertTrue(ArtifactReference.isValidName("shap_bar.png"));
        assertFalse(ArtifactReference.isValidName(".hidden"));
        assertFalse(ArtifactReference.isValidName("a/b"));
        assertFalse(ArtifactReference.isValidName(null));
    }
}
